package overworld.explore;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import overworld.domain.AreaId;
import overworld.domain.Coordinate;
import overworld.domain.Direction;
import overworld.domain.TraversalStatus;
import overworld.map.AreaMap;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExplorationAdvisorTest {

    private static final AreaId AREA = AreaId.of(0, 1);
    private static final Coordinate CENTER = Coordinate.of(4, 4);

    private PositionHistory history;
    private ExplorationAdvisor advisor;
    private AreaMap map;

    @BeforeEach
    void setUp() {
        history = new PositionHistory();
        advisor = new ExplorationAdvisor(history);
        map = new AreaMap(AREA, "Route 1");
    }

    /** Marks everything within scan range of the center walkable. */
    private void fillKnownSquare() {
        for (int y = 0; y <= 8; y++) {
            for (int x = 0; x <= 8; x++) {
                map.setTraversal(Coordinate.of(x, y), TraversalStatus.WALKABLE);
            }
        }
        map.placePlayer(CENTER);
    }

    private void makeStuck() {
        for (int i = 0; i < 6; i++) {
            history.record(AREA, CENTER);
        }
    }

    @Test
    void testFreshMapSuggestsFirstUnknownDirection() {
        map.placePlayer(Coordinate.of(0, 0));

        DirectionSuggestion suggestion = advisor.suggest(map);

        assertEquals(List.of(Direction.UP, Direction.DOWN, Direction.LEFT, Direction.RIGHT),
                suggestion.unexploredDirections);
        assertEquals(Direction.UP, suggestion.suggested);
        assertFalse(suggestion.stuck);
    }

    @Test
    void testDistantUnknownCountsAsUnexplored() {
        fillKnownSquare();
        // Right edge of the square is three tiles away; the fourth is unmapped
        Coordinate origin = Coordinate.of(5, 4);
        map.placePlayer(origin);

        DirectionSuggestion suggestion = advisor.suggest(map);

        assertEquals(List.of(Direction.RIGHT), suggestion.unexploredDirections);
        assertEquals(Direction.RIGHT, suggestion.suggested);
    }

    @Test
    void testTransitionPreferredWhenEverythingKnown() {
        fillKnownSquare();
        map.setTraversal(Coordinate.of(4, 5), TraversalStatus.BLOCKED);
        map.setTraversal(Coordinate.of(1, 4), TraversalStatus.TRANSITION_EDGE);

        DirectionSuggestion suggestion = advisor.suggest(map);

        assertTrue(suggestion.unexploredDirections.isEmpty());
        assertEquals(List.of(new DirectionSuggestion.TransitionHint(Direction.LEFT, 3)), suggestion.transitions);
        assertEquals(List.of(Direction.UP, Direction.LEFT, Direction.RIGHT), suggestion.walkableDirections);
        assertEquals(Direction.LEFT, suggestion.suggested);
    }

    @Test
    void testOnlyNearestTransitionPerDirection() {
        fillKnownSquare();
        map.setTraversal(Coordinate.of(6, 4), TraversalStatus.TRANSITION_EDGE);
        map.setTraversal(Coordinate.of(8, 4), TraversalStatus.TRANSITION_EDGE);

        DirectionSuggestion suggestion = advisor.suggest(map);

        assertEquals(List.of(new DirectionSuggestion.TransitionHint(Direction.RIGHT, 2)), suggestion.transitions);
    }

    @Test
    void testStuckSkipsUnexploredForTransition() {
        map.setTraversal(Coordinate.of(4, 3), TraversalStatus.TRANSITION_EDGE);
        map.placePlayer(CENTER);

        assertEquals(Direction.DOWN, advisor.suggest(map).suggested);

        makeStuck();
        DirectionSuggestion stuck = advisor.suggest(map);

        assertTrue(stuck.stuck);
        assertEquals(Direction.UP, stuck.suggested);
    }

    @Test
    void testStuckFallsBackToWalkable() {
        map.setTraversal(Coordinate.of(3, 4), TraversalStatus.WALKABLE);
        map.placePlayer(CENTER);
        makeStuck();

        DirectionSuggestion suggestion = advisor.suggest(map);

        assertEquals(Direction.LEFT, suggestion.suggested);
    }

    @Test
    void testEnclosedTileHasNoSuggestion() {
        fillKnownSquare();
        for (Direction dir : Direction.values()) {
            map.setTraversal(CENTER.move(dir), TraversalStatus.BLOCKED);
        }

        DirectionSuggestion suggestion = advisor.suggest(map);

        assertNull(suggestion.suggested);
        assertFalse(suggestion.hasSuggestion());
    }

    @Test
    void testNoPlayerPositionGivesNone() {
        DirectionSuggestion suggestion = advisor.suggest(map);

        assertFalse(suggestion.hasSuggestion());
        assertTrue(suggestion.unexploredDirections.isEmpty());
    }
}
