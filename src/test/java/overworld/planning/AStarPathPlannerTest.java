package overworld.planning;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import overworld.domain.AreaId;
import overworld.domain.Coordinate;
import overworld.domain.Direction;
import overworld.domain.PlanStep;
import overworld.domain.TraversalStatus;
import overworld.map.AreaMap;
import overworld.planning.PathPlanner.PathResult;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AStarPathPlannerTest {

    private NavConfig config;
    private AStarPathPlanner planner;
    private AreaMap map;

    @BeforeEach
    void setUp() {
        config = NavConfig.defaults();
        planner = new AStarPathPlanner(config);
        map = new AreaMap(AreaId.of(0, 1), "Route 1");
    }

    private void fillWalkable(int width, int height) {
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                map.setTraversal(Coordinate.of(x, y), TraversalStatus.WALKABLE);
            }
        }
    }

    /**
     * Replays a plan from a start tile, checking every Move is issued while
     * already facing its direction and only enters traversable tiles.
     */
    private Coordinate replay(Coordinate start, Direction facing, List<PlanStep> steps) {
        Coordinate position = start;
        for (PlanStep step : steps) {
            if (step.isTurn()) {
                facing = step.direction;
            } else {
                assertEquals(facing, step.direction, "Move issued before turning: " + steps);
                position = position.move(step.direction);
                assertNotEquals(TraversalStatus.BLOCKED, map.getTraversal(position));
            }
        }
        return position;
    }

    @Test
    void testRoundTripOnOpenGrid() {
        fillWalkable(5, 5);
        Coordinate home = Coordinate.of(0, 0);
        Coordinate corner = Coordinate.of(4, 4);

        PathResult there = planner.findPath(map, home, Direction.UP, corner);
        assertTrue(there.isFound());
        assertEquals(8, there.moveCount());
        assertEquals(8.0, there.cost, 1e-9);
        assertEquals(corner, replay(home, Direction.UP, there.steps));

        Direction facingAfter = there.steps.get(there.steps.size() - 1).direction;
        PathResult back = planner.findPath(map, corner, facingAfter, home);
        assertTrue(back.isFound());
        assertEquals(8, back.moveCount());
        assertEquals(home, replay(corner, facingAfter, back.steps));
    }

    @Test
    void testAlreadyAtGoal() {
        PathResult result = planner.findPath(map, Coordinate.of(3, 3), Direction.DOWN, Coordinate.of(3, 3));

        assertTrue(result.isFound());
        assertTrue(result.steps.isEmpty());
        assertEquals(0.0, result.cost);
    }

    @Test
    void testConfirmedTilesWinTies() {
        map.setTraversal(Coordinate.of(0, 0), TraversalStatus.WALKABLE);
        map.setTraversal(Coordinate.of(0, 1), TraversalStatus.WALKABLE);
        map.setTraversal(Coordinate.of(1, 1), TraversalStatus.WALKABLE);

        PathResult result = planner.findPath(map, Coordinate.of(0, 0), Direction.DOWN, Coordinate.of(1, 1));

        assertEquals(List.of(PlanStep.move(Direction.DOWN), PlanStep.turn(Direction.RIGHT),
                PlanStep.move(Direction.RIGHT)), result.steps);
        assertEquals(2.0, result.cost, 1e-9);
    }

    @Test
    void testUnknownTilesAreSearchedThrough() {
        PathResult result = planner.findPath(map, Coordinate.of(0, 0), Direction.RIGHT, Coordinate.of(3, 0));

        assertTrue(result.isFound());
        assertEquals(List.of(PlanStep.move(Direction.RIGHT), PlanStep.move(Direction.RIGHT),
                PlanStep.move(Direction.RIGHT)), result.steps);
        assertEquals(3 * (1 + NavConfig.DEFAULT_UNKNOWN_TILE_COST), result.cost, 1e-9);
    }

    @Test
    void testRoutesAroundBlockedWall() {
        fillWalkable(5, 3);
        map.setTraversal(Coordinate.of(2, -1), TraversalStatus.BLOCKED);
        map.setTraversal(Coordinate.of(2, 0), TraversalStatus.BLOCKED);
        map.setTraversal(Coordinate.of(2, 1), TraversalStatus.BLOCKED);

        PathResult result = planner.findPath(map, Coordinate.of(0, 0), Direction.RIGHT, Coordinate.of(4, 0));

        // Known detour below the wall beats the longer unknown one above it
        assertTrue(result.isFound());
        assertEquals(8, result.moveCount());
        assertEquals(8.0, result.cost, 1e-9);
        assertEquals(Coordinate.of(4, 0), replay(Coordinate.of(0, 0), Direction.RIGHT, result.steps));
    }

    @Test
    void testEnclosedGoalIsRejectedWithoutSearching() {
        Coordinate goal = Coordinate.of(5, 5);
        for (Direction dir : Direction.values()) {
            map.setTraversal(goal.move(dir), TraversalStatus.BLOCKED);
        }

        PathResult result = planner.findPath(map, Coordinate.of(0, 0), Direction.DOWN, goal);

        assertEquals(PathPlanner.Status.GOAL_UNREACHABLE, result.status);
        assertEquals(0, result.exploredNodes);
        assertEquals(0, planner.getLastExploredCount());
    }

    @Test
    void testBlockedGoalIsApproachedAndFaced() {
        map.setTraversal(Coordinate.of(1, 0), TraversalStatus.BLOCKED);

        PathResult adjacent = planner.findPath(map, Coordinate.of(0, 0), Direction.UP, Coordinate.of(1, 0));
        assertTrue(adjacent.isFound());
        assertEquals(List.of(PlanStep.turn(Direction.RIGHT)), adjacent.steps);

        map.setTraversal(Coordinate.of(4, 0), TraversalStatus.BLOCKED);
        PathResult distant = planner.findPath(map, Coordinate.of(4, 2), Direction.UP, Coordinate.of(4, 0));
        assertTrue(distant.isFound());
        assertTrue(distant.exploredNodes > 0);
        assertEquals(List.of(PlanStep.move(Direction.UP)), distant.steps);
    }

    @Test
    void testEnclosedStartHasNoPath() {
        Coordinate start = Coordinate.of(0, 0);
        for (Direction dir : Direction.values()) {
            map.setTraversal(start.move(dir), TraversalStatus.BLOCKED);
        }

        PathResult result = planner.findPath(map, start, Direction.DOWN, Coordinate.of(5, 5));

        assertEquals(PathPlanner.Status.NO_PATH, result.status);
        assertEquals(1, result.exploredNodes);
        assertTrue(result.steps.isEmpty());
    }

    @Test
    void testNodeLimitStopsSearch() {
        config.setMaxSearchNodes(10);
        Coordinate start = Coordinate.of(0, 0);
        // Wall off the direct line so the search has to fan out
        for (int y = -20; y <= 20; y++) {
            map.setTraversal(Coordinate.of(1, y), TraversalStatus.BLOCKED);
        }

        PathResult result = planner.findPath(map, start, Direction.RIGHT, Coordinate.of(50, 0));

        assertEquals(PathPlanner.Status.NO_PATH, result.status);
        assertEquals(10, result.exploredNodes);
    }

    @Test
    void testStepCosts() {
        assertEquals(1.0, planner.stepCost(TraversalStatus.WALKABLE));
        assertEquals(1.0, planner.stepCost(TraversalStatus.TRANSITION_EDGE));
        assertEquals(1.0, planner.stepCost(TraversalStatus.LEDGE));
        assertEquals(1.0 + NavConfig.DEFAULT_UNKNOWN_TILE_COST, planner.stepCost(TraversalStatus.UNKNOWN), 1e-9);
        assertTrue(planner.stepCost(TraversalStatus.BLOCKED) < 0);
        assertTrue(planner.stepCost(TraversalStatus.INTERACTABLE) < 0);
    }

    @Test
    void testRoutesAroundInteractableTile() {
        fillWalkable(3, 2);
        map.setTraversal(Coordinate.of(1, 0), TraversalStatus.INTERACTABLE);

        PathResult result = planner.findPath(map, Coordinate.of(0, 0), Direction.RIGHT, Coordinate.of(2, 0));

        assertTrue(result.isFound());
        assertEquals(4, result.moveCount());
        assertEquals(Coordinate.of(2, 0), replay(Coordinate.of(0, 0), Direction.RIGHT, result.steps));
        assertEquals(TraversalStatus.INTERACTABLE, map.getTraversal(Coordinate.of(1, 0)));
    }

    @Test
    void testInteractableGoalIsApproachedAndFaced() {
        fillWalkable(3, 1);
        map.setTraversal(Coordinate.of(2, 0), TraversalStatus.INTERACTABLE);

        PathResult result = planner.findPath(map, Coordinate.of(0, 0), Direction.UP, Coordinate.of(2, 0));

        assertTrue(result.isFound());
        assertEquals(List.of(PlanStep.turn(Direction.RIGHT), PlanStep.move(Direction.RIGHT)), result.steps);
    }

    @Test
    void testToStepsInsertsTurnsOnlyWhenFacingChanges() {
        List<Coordinate> tiles = List.of(Coordinate.of(0, 0), Coordinate.of(0, 1), Coordinate.of(0, 2),
                Coordinate.of(1, 2));

        List<PlanStep> steps = AStarPathPlanner.toSteps(tiles, Direction.DOWN);

        assertEquals(List.of(PlanStep.move(Direction.DOWN), PlanStep.move(Direction.DOWN),
                PlanStep.turn(Direction.RIGHT), PlanStep.move(Direction.RIGHT)), steps);
    }
}
