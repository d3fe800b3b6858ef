package overworld.outcome;

import overworld.domain.AgentSnapshot;
import overworld.domain.AreaId;
import overworld.domain.Coordinate;
import overworld.domain.TraversalStatus;
import overworld.graph.ConnectivityGraph;
import overworld.map.AreaMap;
import overworld.persistence.AreaMapRepository;
import overworld.persistence.ConnectionStore;
import overworld.planning.NavConfig;

/**
 * Applies one classified outcome per cycle to the current area map and the
 * connectivity graph.
 *
 * Transitions:
 * - MOVED: the vacated tile becomes WALKABLE (LEDGE after a multi-tile hop),
 *   structural markers are kept; PLAYER moves to the new tile
 * - TURNED: PLAYER re-asserted in place
 * - BLOCKED: the target becomes BLOCKED unless it is INTERACTABLE
 * - AREA_CHANGED: exit marked in the old map, old map saved, new map made
 *   current with its entry marked, reciprocal connection recorded and saved
 * - INTERACTED with dialogue, AUTO_DIALOGUE: the trigger tile becomes INTERACTABLE
 * - WAITED, UNKNOWN: nothing
 *
 * TRANSITION_EDGE tiles are never downgraded; {@link AreaMap} refuses the write.
 */
public class TraversalUpdater {

    private final ActiveArea active;
    private final AreaMapRepository maps;
    private final ConnectivityGraph graph;
    private final ConnectionStore connectionStore;

    /** Last BLOCKED target, to avoid logging the same wall every cycle */
    private AreaId lastBlockedArea;
    private Coordinate lastBlockedTarget;

    public TraversalUpdater(ActiveArea active, AreaMapRepository maps, ConnectivityGraph graph,
                            ConnectionStore connectionStore) {
        this.active = active;
        this.maps = maps;
        this.graph = graph;
        this.connectionStore = connectionStore;
    }

    public ActiveArea getActiveArea() {
        return active;
    }

    /**
     * Applies an outcome.
     *
     * @return false if the outcome carries no map information
     */
    public boolean apply(ActionOutcome outcome) {
        if (outcome == null) return false;
        AreaMap map = active.current();

        switch (outcome.type) {
            case MOVED:
                applyMove(map, outcome.from, outcome.to);
                return true;

            case TURNED:
                map.placePlayer(outcome.to);
                return true;

            case BLOCKED:
                applyBlocked(map, outcome.target);
                return true;

            case AREA_CHANGED:
                applyAreaChange(outcome);
                return true;

            case INTERACTED:
                if (!outcome.dialogue) return false;
                markInteractable(map, outcome.target);
                return true;

            case AUTO_DIALOGUE:
                applyMove(map, outcome.from, outcome.to);
                markInteractable(map, outcome.to);
                return true;

            case UNKNOWN:
                logVerbose("[Updater] No update for " + outcome);
                return false;

            case WAITED:
            default:
                return false;
        }
    }

    /**
     * Brings the active area in line with a position reading taken outside
     * the normal classify/apply flow (first cycle, or after an aborted one).
     *
     * @return true if the active area was swapped
     */
    public boolean syncTo(AgentSnapshot snapshot) {
        if (snapshot == null || snapshot.areaId == null) return false;

        AreaMap current = active.current();
        if (current.getAreaId().equals(snapshot.areaId)) {
            current.setDisplayName(snapshot.areaName);
            if (snapshot.position != null && !snapshot.position.equals(current.getPlayerPosition())) {
                current.placePlayer(snapshot.position);
            }
            return false;
        }

        current.clearPlayer();
        maps.save(current);

        AreaMap next = maps.getOrCreate(snapshot.areaId, snapshot.areaName);
        next.recordVisit();
        if (snapshot.position != null) {
            next.placePlayer(snapshot.position);
        }
        active.swap(next);
        logNormal("[Updater] Resynced to " + next.getAreaId() + " without a recorded transition");
        return true;
    }

    // ========== Transitions ==========

    private void applyMove(AreaMap map, Coordinate from, Coordinate to) {
        if (from.manhattanDistance(to) > 1) {
            // Multi-tile hop: the start tile is a one-way ledge
            map.setTraversal(from, TraversalStatus.LEDGE);
        } else if (!map.getUnderlyingTraversal(from).isStructural()) {
            map.setTraversal(from, TraversalStatus.WALKABLE);
        }
        map.placePlayer(to);
        map.touch();
    }

    private void applyBlocked(AreaMap map, Coordinate target) {
        // An NPC or sign blocks by nature; keep the more specific marker
        boolean changed = map.getTraversal(target) != TraversalStatus.INTERACTABLE
                && map.setTraversal(target, TraversalStatus.BLOCKED);
        boolean repeat = map.getAreaId().equals(lastBlockedArea) && target.equals(lastBlockedTarget);
        if (!repeat) {
            logVerbose("[Updater] " + map.getAreaId() + " blocked at " + target
                    + (changed ? "" : " (already known)"));
        }
        lastBlockedArea = map.getAreaId();
        lastBlockedTarget = target;
    }

    private void markInteractable(AreaMap map, Coordinate target) {
        if (map.setTraversal(target, TraversalStatus.INTERACTABLE)) {
            logVerbose("[Updater] " + map.getAreaId() + " interactable at " + target);
        }
    }

    private void applyAreaChange(ActionOutcome outcome) {
        AreaMap oldMap = active.current();
        if (!oldMap.getAreaId().equals(outcome.fromArea)) {
            logNormal("[Updater] Active area " + oldMap.getAreaId() + " differs from transition origin "
                    + outcome.fromArea + ", using the latter");
            oldMap.clearPlayer();
            oldMap = maps.getOrCreate(outcome.fromArea, null);
        }

        Coordinate exit = outcome.exit();
        Coordinate vacated = outcome.from;
        oldMap.setTraversal(exit, TraversalStatus.TRANSITION_EDGE);
        if (!vacated.equals(exit) && !oldMap.getUnderlyingTraversal(vacated).isStructural()) {
            oldMap.setTraversal(vacated, TraversalStatus.WALKABLE);
        }
        oldMap.clearPlayer();
        oldMap.touch();
        maps.save(oldMap);

        AreaMap newMap = maps.getOrCreate(outcome.toArea, null);
        newMap.recordVisit();
        Coordinate entry = outcome.entry();
        newMap.setTraversal(entry, TraversalStatus.TRANSITION_EDGE);
        newMap.placePlayer(entry);
        active.swap(newMap);

        boolean created = graph.addConnection(outcome.fromArea, exit, outcome.toArea, entry, outcome.direction);
        connectionStore.save(graph);

        logMinimal("[Updater] " + outcome.fromArea + exit + " -> " + outcome.toArea + entry
                + " " + outcome.direction.displayName() + (created ? " (new connection)" : ""));
    }

    private void logMinimal(String msg) {
        if (NavConfig.isMinimal())
            System.err.println(msg);
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
