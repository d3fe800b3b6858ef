package overworld.map;

import overworld.domain.Coordinate;
import overworld.domain.TraversalStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable rectangular cut of an area's terrain and traversal grids, handed
 * to the decision source. Row 0 is the top row; {@link #topLeft} is the world
 * coordinate of cell (0, 0).
 */
public final class MapWindow {

    public final Coordinate topLeft;
    public final Coordinate center;
    public final int rows;
    public final int cols;

    private final List<List<String>> terrainRows;
    private final List<String> traversalRows;

    private MapWindow(Coordinate topLeft, Coordinate center, int rows, int cols,
                      List<List<String>> terrainRows, List<String> traversalRows) {
        this.topLeft = topLeft;
        this.center = center;
        this.rows = rows;
        this.cols = cols;
        this.terrainRows = terrainRows;
        this.traversalRows = traversalRows;
    }

    static MapWindow cut(AreaMap map, Coordinate center, int halfWidth, int halfHeight) {
        Coordinate topLeft = center.offset(-halfWidth, -halfHeight);
        int rows = halfHeight * 2 + 1;
        int cols = halfWidth * 2 + 1;

        List<List<String>> terrainRows = new ArrayList<>(rows);
        List<String> traversalRows = new ArrayList<>(rows);
        for (int r = 0; r < rows; r++) {
            List<String> labels = new ArrayList<>(cols);
            StringBuilder symbols = new StringBuilder(cols);
            for (int c = 0; c < cols; c++) {
                Coordinate world = topLeft.offset(c, r);
                labels.add(map.getTerrain(world));
                symbols.append(map.getTraversal(world).symbol);
            }
            terrainRows.add(Collections.unmodifiableList(labels));
            traversalRows.add(symbols.toString());
        }
        return new MapWindow(topLeft, center, rows, cols,
                Collections.unmodifiableList(terrainRows), Collections.unmodifiableList(traversalRows));
    }

    public List<List<String>> getTerrainRows() {
        return terrainRows;
    }

    /**
     * Traversal rows as symbol strings (see {@link TraversalStatus}).
     */
    public List<String> getTraversalRows() {
        return traversalRows;
    }

    public TraversalStatus traversalAt(int row, int col) {
        return TraversalStatus.fromSymbol(traversalRows.get(row).charAt(col));
    }

    public String terrainAt(int row, int col) {
        return terrainRows.get(row).get(col);
    }

    @Override
    public String toString() {
        return String.join("\n", traversalRows);
    }
}
