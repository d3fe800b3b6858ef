package overworld.explore;

import overworld.domain.Coordinate;
import overworld.domain.Direction;
import overworld.domain.TraversalStatus;
import overworld.map.AreaMap;
import overworld.planning.NavConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Suggests a direction to explore from the agent's tile.
 *
 * The four neighbours are classified first, then straight lines out to
 * {@link NavConfig#ADVISOR_SCAN_RADIUS} tiles are scanned
 * for further unknown tiles and transition edges. Priority:
 * 1. nearest unexplored direction, unless stuck
 * 2. nearest known transition
 * 3. any walkable direction
 * 4. none
 *
 * Tiles beyond the mapped extent read as UNKNOWN and so count as unexplored.
 */
public class ExplorationAdvisor {

    private final PositionHistory history;
    private final int scanRadius;

    public ExplorationAdvisor(PositionHistory history) {
        this(history, NavConfig.ADVISOR_SCAN_RADIUS);
    }

    public ExplorationAdvisor(PositionHistory history, int scanRadius) {
        this.history = history;
        this.scanRadius = scanRadius;
    }

    public PositionHistory getHistory() {
        return history;
    }

    /**
     * Suggests from the map's tracked player position.
     */
    public DirectionSuggestion suggest(AreaMap map) {
        Coordinate position = map.getPlayerPosition();
        if (position == null) {
            return DirectionSuggestion.none(history.isStuck());
        }
        return suggest(map, position);
    }

    public DirectionSuggestion suggest(AreaMap map, Coordinate position) {
        boolean stuck = history.isStuck();

        List<Direction> unexplored = new ArrayList<>();
        List<DirectionSuggestion.TransitionHint> transitions = new ArrayList<>();
        List<Direction> walkable = new ArrayList<>();

        for (Direction dir : Direction.values()) {
            TraversalStatus status = map.getTraversal(position.move(dir));
            if (status == TraversalStatus.UNKNOWN) {
                unexplored.add(dir);
            } else if (status == TraversalStatus.TRANSITION_EDGE) {
                transitions.add(new DirectionSuggestion.TransitionHint(dir, 1));
            } else if (status == TraversalStatus.WALKABLE) {
                walkable.add(dir);
            }
        }

        for (int distance = 2; distance <= scanRadius; distance++) {
            for (Direction dir : Direction.values()) {
                TraversalStatus status = map.getTraversal(position.move(dir, distance));
                if (status == TraversalStatus.TRANSITION_EDGE && !hasTransition(transitions, dir)) {
                    transitions.add(new DirectionSuggestion.TransitionHint(dir, distance));
                } else if (status == TraversalStatus.UNKNOWN && !unexplored.contains(dir)) {
                    unexplored.add(dir);
                }
            }
        }

        Direction suggested = null;
        if (!unexplored.isEmpty() && !stuck) {
            suggested = unexplored.get(0);
        } else if (!transitions.isEmpty()) {
            suggested = transitions.get(0).direction;
        } else if (!walkable.isEmpty()) {
            suggested = walkable.get(0);
        }

        return new DirectionSuggestion(unexplored, transitions, walkable, suggested, stuck);
    }

    private static boolean hasTransition(List<DirectionSuggestion.TransitionHint> transitions, Direction dir) {
        for (DirectionSuggestion.TransitionHint hint : transitions) {
            if (hint.direction == dir) return true;
        }
        return false;
    }
}
