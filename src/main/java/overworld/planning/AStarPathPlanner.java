package overworld.planning;

import overworld.domain.Coordinate;
import overworld.domain.Direction;
import overworld.domain.PlanStep;
import overworld.domain.TraversalStatus;
import overworld.map.AreaMap;

import java.util.*;

/**
 * A* over one area's traversal grid, aware that most of the grid is unknown.
 *
 * Step costs:
 * - 1 into any confirmed traversable tile (WALKABLE, PLAYER, TRANSITION_EDGE,
 *   LEDGE)
 * - 1 + unknownTileCost into UNKNOWN, so confirmed routes win ties but
 *   exploring through uncertainty is still allowed
 * - BLOCKED and INTERACTABLE tiles are never entered; as a goal they are
 *   approached and faced instead
 *
 * The tile path is turned into Turn/Move steps by simulating the agent's
 * facing: a Move whose direction differs from the current facing is preceded
 * by a Turn.
 */
public class AStarPathPlanner implements PathPlanner {

    private final NavConfig config;
    private final Heuristic heuristic;

    /** Nodes expanded by the last call, for diagnostics */
    private int lastExploredCount = 0;

    public AStarPathPlanner(NavConfig config) {
        this(config, new ManhattanHeuristic());
    }

    public AStarPathPlanner(NavConfig config, Heuristic heuristic) {
        this.config = config;
        this.heuristic = heuristic;
    }

    public int getLastExploredCount() {
        return lastExploredCount;
    }

    @Override
    public PathResult findPath(AreaMap map, Coordinate start, Direction facing, Coordinate goal) {
        lastExploredCount = 0;
        if (start.equals(goal)) {
            return PathResult.success(Collections.emptyList(), 0, 0);
        }

        if (!hasStandableNeighbor(map, goal)) {
            logVerbose("[A*] Goal " + goal + " in " + map.getAreaId() + " is enclosed, not searching");
            return PathResult.goalUnreachable();
        }

        boolean approach = stepCost(map.getUnderlyingTraversal(goal)) < 0;
        PathResult result = search(map, start, facing, goal, approach);
        lastExploredCount = result.exploredNodes;

        logVerbose("[A*] " + map.getAreaId() + " " + start + " -> " + goal
                + (approach ? " (approach)" : "") + ": " + result);
        return result;
    }

    // ============ Search ============

    private PathResult search(AreaMap map, Coordinate start, Direction facing, Coordinate goal,
                              boolean approach) {
        PriorityQueue<SearchNode> open = new PriorityQueue<>();
        Map<Coordinate, Double> bestG = new HashMap<>();
        Set<Coordinate> closed = new HashSet<>();

        open.add(new SearchNode(start, null, 0, estimate(start, goal, approach)));
        bestG.put(start, 0.0);

        int explored = 0;
        int maxNodes = config.getMaxSearchNodes();

        while (!open.isEmpty()) {
            SearchNode current = open.poll();
            if (!closed.add(current.position)) continue;

            if (explored >= maxNodes) {
                logNormal("[A*] Node limit " + maxNodes + " reached in " + map.getAreaId());
                return PathResult.noPath(explored);
            }
            explored++;

            if (isGoal(current.position, goal, approach)) {
                List<Coordinate> tiles = reconstructPath(current);
                List<PlanStep> steps = toSteps(tiles, facing);
                if (approach) {
                    appendFacingTurn(steps, tiles, facing, current.position.directionTo(goal));
                }
                return PathResult.success(steps, current.g, explored);
            }

            for (Direction dir : Direction.values()) {
                Coordinate next = current.position.move(dir);
                if (closed.contains(next)) continue;

                double stepCost = stepCost(map.getTraversal(next));
                if (stepCost < 0) continue;

                double newG = current.g + stepCost;
                Double existingG = bestG.get(next);
                if (existingG != null && existingG <= newG) continue;

                bestG.put(next, newG);
                open.add(new SearchNode(next, current, newG, estimate(next, goal, approach)));
            }
        }

        return PathResult.noPath(explored);
    }

    /**
     * Cost of stepping into a tile, negative if it cannot be entered.
     */
    double stepCost(TraversalStatus status) {
        switch (status) {
            case BLOCKED:
            case INTERACTABLE:
                return -1;
            case UNKNOWN:
                return 1 + config.getUnknownTileCost();
            default:
                return 1;
        }
    }

    /**
     * A goal can be reached only if some orthogonal neighbour could be stood on.
     */
    private boolean hasStandableNeighbor(AreaMap map, Coordinate goal) {
        for (Direction dir : Direction.values()) {
            TraversalStatus status = map.getTraversal(goal.move(dir));
            if (status == TraversalStatus.WALKABLE || status == TraversalStatus.UNKNOWN
                    || status == TraversalStatus.TRANSITION_EDGE || status == TraversalStatus.PLAYER) {
                return true;
            }
        }
        return false;
    }

    private boolean isGoal(Coordinate position, Coordinate goal, boolean approach) {
        return approach ? position.isCardinallyAdjacentTo(goal) : position.equals(goal);
    }

    private double estimate(Coordinate from, Coordinate goal, boolean approach) {
        double h = heuristic.estimate(from, goal);
        return approach ? Math.max(0, h - 1) : h;
    }

    // ============ Plan Construction ============

    private List<Coordinate> reconstructPath(SearchNode node) {
        List<Coordinate> path = new ArrayList<>();
        while (node != null) {
            path.add(node.position);
            node = node.parent;
        }
        Collections.reverse(path);
        return path;
    }

    /**
     * Converts consecutive tiles into steps, inserting a Turn wherever the
     * simulated facing differs from the next move.
     */
    static List<PlanStep> toSteps(List<Coordinate> tiles, Direction initialFacing) {
        List<PlanStep> steps = new ArrayList<>();
        Direction facing = initialFacing;
        for (int i = 1; i < tiles.size(); i++) {
            Direction dir = tiles.get(i - 1).directionTo(tiles.get(i));
            if (dir != facing) {
                steps.add(PlanStep.turn(dir));
                facing = dir;
            }
            steps.add(PlanStep.move(dir));
        }
        return steps;
    }

    private void appendFacingTurn(List<PlanStep> steps, List<Coordinate> tiles, Direction initialFacing,
                                  Direction towardGoal) {
        Direction facing = initialFacing;
        if (tiles.size() > 1) {
            facing = tiles.get(tiles.size() - 2).directionTo(tiles.get(tiles.size() - 1));
        }
        if (towardGoal != null && towardGoal != facing) {
            steps.add(PlanStep.turn(towardGoal));
        }
    }

    private void logNormal(String msg) {
        if (NavConfig.isNormal())
            System.err.println(msg);
    }

    private void logVerbose(String msg) {
        if (NavConfig.isVerbose())
            System.err.println(msg);
    }

    // ============ Internal Classes ============

    private static class SearchNode implements Comparable<SearchNode> {
        final Coordinate position;
        final SearchNode parent;
        final double g;
        final double f;

        SearchNode(Coordinate position, SearchNode parent, double g, double h) {
            this.position = position;
            this.parent = parent;
            this.g = g;
            this.f = g + h;
        }

        @Override
        public int compareTo(SearchNode other) {
            int fCmp = Double.compare(this.f, other.f);
            if (fCmp != 0) return fCmp;
            return Double.compare(other.g, this.g); // Prefer deeper
        }
    }
}
