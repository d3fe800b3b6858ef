package overworld.map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import overworld.domain.AreaId;
import overworld.domain.Coordinate;
import overworld.domain.TraversalStatus;
import overworld.planning.NavConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ObservationMergerTest {

    private NavConfig config;
    private ObservationMerger merger;
    private AreaMap map;

    @BeforeEach
    void setUp() {
        config = NavConfig.defaults();
        merger = new ObservationMerger(config);
        map = new AreaMap(AreaId.of(0, 1), "Route 1");
    }

    /**
     * Default 9x15 window of grass with a tree column at window column 0.
     */
    private static Observation grassWithTreeColumn() throws MalformedObservationException {
        List<List<String>> rows = new ArrayList<>();
        for (int r = 0; r < NavConfig.DEFAULT_WINDOW_ROWS; r++) {
            List<String> row = new ArrayList<>();
            for (int c = 0; c < NavConfig.DEFAULT_WINDOW_COLS; c++) {
                row.add(c == 0 ? "tree" : "grass");
            }
            rows.add(row);
        }
        return Observation.fromRows(rows, NavConfig.DEFAULT_AGENT_ROW, NavConfig.DEFAULT_AGENT_COL);
    }

    @Test
    void testMergeWritesTerrainAroundAgent() throws Exception {
        Coordinate agent = Coordinate.of(10, 10);

        assertTrue(merger.merge(map, grassWithTreeColumn(), agent));

        // Window column 0 is 7 tiles left of the agent, row 0 is 4 tiles up
        assertEquals("tree", map.getTerrain(Coordinate.of(3, 6)));
        assertEquals("grass", map.getTerrain(Coordinate.of(17, 14)));
        assertEquals(AreaMap.UNKNOWN_LABEL, map.getTerrain(Coordinate.of(18, 14)));
        assertEquals(new GridBounds(3, 6, 17, 14), map.terrainGrid().bounds());
    }

    @Test
    void testSolidLabelsBecomeBlockedAndNothingElseIsInferred() throws Exception {
        Coordinate agent = Coordinate.of(10, 10);
        merger.merge(map, grassWithTreeColumn(), agent);

        assertEquals(TraversalStatus.BLOCKED, map.getTraversal(Coordinate.of(3, 10)));
        assertEquals(TraversalStatus.UNKNOWN, map.getTraversal(Coordinate.of(9, 10)));
        assertEquals(TraversalStatus.PLAYER, map.getTraversal(agent));
        assertEquals(NavConfig.DEFAULT_WINDOW_ROWS + 1, map.exploredCount());
    }

    @Test
    void testSolidLabelDoesNotOverrideKnownStatus() throws Exception {
        Coordinate walkedTree = Coordinate.of(3, 10);
        map.setTraversal(walkedTree, TraversalStatus.WALKABLE);

        merger.merge(map, grassWithTreeColumn(), Coordinate.of(10, 10));

        assertEquals(TraversalStatus.WALKABLE, map.getTraversal(walkedTree));
    }

    @Test
    void testMergingTwiceIsIdempotent() throws Exception {
        Observation observation = grassWithTreeColumn();
        Coordinate agent = Coordinate.of(0, 0);

        merger.merge(map, observation, agent);
        List<List<String>> terrainAfterFirst = map.terrainGrid().toRows();
        List<List<TraversalStatus>> traversalAfterFirst = map.traversalGrid().toRows();

        merger.merge(map, observation, agent);

        assertEquals(terrainAfterFirst, map.terrainGrid().toRows());
        assertEquals(traversalAfterFirst, map.traversalGrid().toRows());
    }

    @Test
    void testNegativeCoordinatesKeptByDefault() throws Exception {
        merger.merge(map, grassWithTreeColumn(), Coordinate.of(0, 0));

        assertEquals("tree", map.getTerrain(Coordinate.of(-7, -4)));
        assertEquals(TraversalStatus.BLOCKED, map.getTraversal(Coordinate.of(-7, -4)));
    }

    @Test
    void testNegativeCoordinatesDroppedWhenConfigured() throws Exception {
        config.setKeepNegativeCoordinates(false);

        merger.merge(map, grassWithTreeColumn(), Coordinate.of(0, 0));

        assertEquals(AreaMap.UNKNOWN_LABEL, map.getTerrain(Coordinate.of(-7, -4)));
        assertEquals("grass", map.getTerrain(Coordinate.of(1, 1)));
        assertEquals(0, map.terrainGrid().bounds().minX);
    }

    @Test
    void testStalePlayerMarkerMovesWithAgent() throws Exception {
        Observation observation = grassWithTreeColumn();
        merger.merge(map, observation, Coordinate.of(10, 10));
        merger.merge(map, observation, Coordinate.of(11, 10));

        assertEquals(TraversalStatus.WALKABLE, map.getTraversal(Coordinate.of(10, 10)));
        assertEquals(TraversalStatus.PLAYER, map.getTraversal(Coordinate.of(11, 10)));
        assertEquals(1, map.traversalGrid().count(s -> s == TraversalStatus.PLAYER));
    }

    @Test
    void testMismatchedWindowIsRejected() throws Exception {
        List<List<String>> rows = List.of(List.of("grass", "grass", "grass"), List.of("tree", "grass", "tree"));
        Observation small = Observation.fromRows(rows, 1, 1);

        assertFalse(merger.merge(map, small, Coordinate.of(0, 0)));
        assertTrue(map.terrainGrid().isEmpty());
        assertTrue(map.traversalGrid().isEmpty());
    }

    @Test
    void testInjectedSolidLabels() throws Exception {
        config.setSolidLabels(Set.of("grass"));

        merger.merge(map, grassWithTreeColumn(), Coordinate.of(10, 10));

        assertEquals(TraversalStatus.UNKNOWN, map.getTraversal(Coordinate.of(3, 10)));
        assertEquals(TraversalStatus.BLOCKED, map.getTraversal(Coordinate.of(9, 10)));
    }
}
