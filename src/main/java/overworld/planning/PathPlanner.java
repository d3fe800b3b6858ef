package overworld.planning;

import overworld.domain.Coordinate;
import overworld.domain.Direction;
import overworld.domain.PlanStep;
import overworld.map.AreaMap;

import java.util.List;

/**
 * Interface for single-area path planning.
 *
 * Planners turn a start tile, the agent's facing and a goal tile into a
 * sequence of Turn/Move steps over an area's traversal grid.
 */
public interface PathPlanner {

    /**
     * How a planning request ended.
     */
    enum Status {
        /** A plan was produced (possibly empty when already at the goal) */
        FOUND,
        /** Search ran and found no route, or hit the node limit */
        NO_PATH,
        /** Rejected before searching: nothing around the goal can be stood on */
        GOAL_UNREACHABLE
    }

    /**
     * Result of a path planning request.
     */
    class PathResult {
        public final Status status;
        public final List<PlanStep> steps;
        public final double cost;
        public final int exploredNodes;

        private PathResult(Status status, List<PlanStep> steps, double cost, int exploredNodes) {
            this.status = status;
            this.steps = steps;
            this.cost = cost;
            this.exploredNodes = exploredNodes;
        }

        public static PathResult success(List<PlanStep> steps, double cost, int exploredNodes) {
            return new PathResult(Status.FOUND, List.copyOf(steps), cost, exploredNodes);
        }

        public static PathResult noPath(int exploredNodes) {
            return new PathResult(Status.NO_PATH, List.of(), Double.POSITIVE_INFINITY, exploredNodes);
        }

        public static PathResult goalUnreachable() {
            return new PathResult(Status.GOAL_UNREACHABLE, List.of(), Double.POSITIVE_INFINITY, 0);
        }

        public boolean isFound() {
            return status == Status.FOUND;
        }

        /**
         * Number of Move steps in the plan.
         */
        public int moveCount() {
            int moves = 0;
            for (PlanStep step : steps) {
                if (step.isMove()) moves++;
            }
            return moves;
        }

        @Override
        public String toString() {
            if (isFound()) {
                return "PathResult[cost=" + cost + ", steps=" + steps.size() + ", explored=" + exploredNodes + "]";
            }
            return "PathResult[" + status + ", explored=" + exploredNodes + "]";
        }
    }

    /**
     * Plans a route inside one area.
     *
     * @param map    the area's map
     * @param start  the agent's tile
     * @param facing the agent's current facing, null if unknown
     * @param goal   tile to reach; a BLOCKED goal is approached and faced instead
     * @return the result, never null
     */
    PathResult findPath(AreaMap map, Coordinate start, Direction facing, Coordinate goal);

    /**
     * Estimates cost to move from A to B (for ranking goals).
     * Default implementation uses Manhattan distance.
     */
    default int estimateCost(Coordinate from, Coordinate to) {
        return from.manhattanDistance(to);
    }
}
