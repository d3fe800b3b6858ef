package overworld.planning;

import overworld.domain.Coordinate;

/**
 * Manhattan distance heuristic.
 *
 * Every step costs at least 1, so the Manhattan distance never overestimates
 * on a 4-connected grid, and it is consistent. It ignores walls, so it may
 * underestimate badly in maze-like areas.
 */
public class ManhattanHeuristic implements Heuristic {

    @Override
    public double estimate(Coordinate from, Coordinate goal) {
        return from.manhattanDistance(goal);
    }
}
