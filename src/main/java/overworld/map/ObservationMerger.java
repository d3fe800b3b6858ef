package overworld.map;

import overworld.domain.Coordinate;
import overworld.domain.TraversalStatus;
import overworld.planning.NavConfig;

import java.util.Set;

/**
 * Folds a windowed observation into an area map.
 *
 * Terrain is last-writer-wins for every observed tile. Traversal inference is
 * deliberately minimal: an UNKNOWN tile whose label is in the configured
 * solid set becomes BLOCKED, nothing else is inferred. Walkability is only
 * ever asserted by a movement attempt.
 */
public class ObservationMerger {

    private final NavConfig config;

    public ObservationMerger(NavConfig config) {
        this.config = config;
    }

    /**
     * Merges an observation taken with the agent at {@code agentCoord}.
     *
     * @return false if the observation does not match the configured window
     *         and was rejected; the map is then untouched
     */
    public boolean merge(AreaMap map, Observation observation, Coordinate agentCoord) {
        if (observation.rows != config.getWindowRows() || observation.cols != config.getWindowCols()
                || observation.agentRow != config.getAgentRow() || observation.agentCol != config.getAgentCol()) {
            logNormal("[Merger] Rejected observation for " + map.getAreaId() + ": window "
                    + observation.rows + "x" + observation.cols + " agent@(" + observation.agentRow + ","
                    + observation.agentCol + "), expected " + config.getWindowRows() + "x"
                    + config.getWindowCols() + " agent@(" + config.getAgentRow() + "," + config.getAgentCol() + ")");
            return false;
        }

        Set<String> solidLabels = config.getSolidLabels();
        boolean keepNegative = config.isKeepNegativeCoordinates();

        // Clear the stale marker first so the solid rule sees the covered status
        map.clearPlayer();

        Coordinate topLeft = agentCoord.offset(-observation.agentCol, -observation.agentRow);
        int written = 0;
        int blocked = 0;
        for (int row = 0; row < observation.rows; row++) {
            for (int col = 0; col < observation.cols; col++) {
                Coordinate world = topLeft.offset(col, row);
                if (!keepNegative && (world.x < 0 || world.y < 0)) {
                    continue;
                }

                String label = observation.labelAt(row, col);
                map.setTerrain(world, label);
                written++;

                if (map.getTraversal(world) == TraversalStatus.UNKNOWN && solidLabels.contains(label)) {
                    map.setTraversal(world, TraversalStatus.BLOCKED);
                    blocked++;
                }
            }
        }

        map.placePlayer(agentCoord);
        map.touch();

        logVerbose("[Merger] " + map.getAreaId() + ": wrote " + written + " tiles, " + blocked
                + " newly blocked, agent at " + agentCoord);
        return true;
    }

    private void logNormal(String msg) {
        if (NavConfig.isNormal())
            System.err.println(msg);
    }

    private void logVerbose(String msg) {
        if (NavConfig.isVerbose())
            System.err.println(msg);
    }
}
