package overworld.map;

import org.junit.jupiter.api.Test;
import overworld.domain.Coordinate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class CoordinateGridTest {

    @Test
    void testGetBeforeAnyWriteReturnsDefault() {
        CoordinateGrid<String> grid = new CoordinateGrid<>("?");

        assertEquals("?", grid.get(0, 0));
        assertEquals("?", grid.get(-100, 250));
        assertTrue(grid.isEmpty());
        assertNull(grid.bounds());
    }

    @Test
    void testWritesSurviveGrowthInEveryDirection() {
        CoordinateGrid<Integer> grid = new CoordinateGrid<>(0);
        grid.set(0, 0, 1);
        grid.set(5, 0, 2);
        grid.set(-7, 0, 3);
        grid.set(0, 9, 4);
        grid.set(0, -12, 5);
        grid.set(-3, -3, 6);

        assertEquals(1, grid.get(0, 0));
        assertEquals(2, grid.get(5, 0));
        assertEquals(3, grid.get(-7, 0));
        assertEquals(4, grid.get(0, 9));
        assertEquals(5, grid.get(0, -12));
        assertEquals(6, grid.get(-3, -3));
        assertEquals(0, grid.get(1, 1));

        assertEquals(new GridBounds(-7, -12, 5, 9), grid.bounds());
    }

    @Test
    void testRandomWriteSequencesAreRecoverable() {
        Random random = new Random(42);
        for (int round = 0; round < 20; round++) {
            CoordinateGrid<Integer> grid = new CoordinateGrid<>(-1);
            Map<Coordinate, Integer> expected = new HashMap<>();

            for (int i = 0; i < 300; i++) {
                int x = random.nextInt(121) - 60;
                int y = random.nextInt(121) - 60;
                grid.set(x, y, i);
                expected.put(Coordinate.of(x, y), i);

                // Every earlier write must still read back after this expansion
                if (i % 50 == 0) {
                    for (Map.Entry<Coordinate, Integer> e : expected.entrySet()) {
                        assertEquals(e.getValue(), grid.get(e.getKey()));
                    }
                }
            }
            for (Map.Entry<Coordinate, Integer> e : expected.entrySet()) {
                assertEquals(e.getValue(), grid.get(e.getKey()), "round " + round + " at " + e.getKey());
            }
        }
    }

    @Test
    void testSingleStepGrowthIsAmortized() {
        CoordinateGrid<Integer> grid = new CoordinateGrid<>(0);
        for (int x = 0; x > -1000; x--) {
            grid.set(x, 0, x);
        }
        // Growth adds at least half the extent, so storage never exceeds twice the written width
        assertTrue(grid.storageWidth() <= 2000);
        assertEquals(-999, grid.get(-999, 0));
        assertEquals(0, grid.get(0, 0));
    }

    @Test
    void testNullValueIsRejected() {
        CoordinateGrid<String> grid = new CoordinateGrid<>("?");
        assertThrows(NullPointerException.class, () -> grid.set(0, 0, null));
    }

    @Test
    void testFindCountAndReplaceAll() {
        CoordinateGrid<String> grid = new CoordinateGrid<>(".");
        grid.set(0, 0, "a");
        grid.set(2, 1, "b");
        grid.set(-1, 3, "a");

        assertEquals(List.of(Coordinate.of(0, 0), Coordinate.of(-1, 3)).size(), grid.find("a"::equals).size());
        assertTrue(grid.find("a"::equals).contains(Coordinate.of(-1, 3)));
        assertEquals(1, grid.count("b"::equals));

        assertEquals(2, grid.replaceAll("a", "c"));
        assertEquals("c", grid.get(0, 0));
        assertEquals("c", grid.get(-1, 3));
        assertEquals(0, grid.count("a"::equals));
    }

    @Test
    void testRowsExportAndRebuild() {
        CoordinateGrid<String> grid = new CoordinateGrid<>("?");
        grid.set(-2, -1, "x");
        grid.set(1, 0, "y");

        List<List<String>> rows = grid.toRows();
        assertEquals(2, rows.size());
        assertEquals(List.of("x", "?", "?", "?"), rows.get(0));
        assertEquals(List.of("?", "?", "?", "y"), rows.get(1));

        CoordinateGrid<String> rebuilt = CoordinateGrid.fromRows("?", -2, -1, rows);
        assertEquals("x", rebuilt.get(-2, -1));
        assertEquals("y", rebuilt.get(1, 0));
        assertEquals(grid.bounds(), rebuilt.bounds());
    }

    @Test
    void testCopyIsIndependent() {
        CoordinateGrid<String> grid = new CoordinateGrid<>("?");
        grid.set(0, 0, "a");
        CoordinateGrid<String> copy = grid.copy();

        copy.set(0, 0, "b");
        copy.set(10, 10, "c");

        assertEquals("a", grid.get(0, 0));
        assertEquals("?", grid.get(10, 10));
        assertEquals("b", copy.get(0, 0));
    }
}
