package overworld.planning;

import overworld.domain.Coordinate;

/**
 * Interface for heuristic functions used in search algorithms.
 *
 * A heuristic provides an estimate of the cost to reach the goal from a given
 * tile. For A* search to be optimal, the heuristic must be admissible (never
 * overestimate the true cost) and ideally consistent.
 */
public interface Heuristic {

    /**
     * Estimates the cost to move from one tile to another.
     *
     * @param from the current tile
     * @param goal the goal tile
     * @return estimated cost to reach goal (lower bound)
     */
    double estimate(Coordinate from, Coordinate goal);
}
