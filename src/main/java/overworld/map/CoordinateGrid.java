package overworld.map;

import overworld.domain.Coordinate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * A 2D grid over signed coordinates that grows in any direction as values are
 * written.
 *
 * Storage is a dense row-major array plus the world coordinate of its first
 * cell (the origin offset). Writing outside storage reallocates with whole
 * rows/columns added at the touched edges and shifts the origin, so every
 * previously written value keeps its coordinate. Reads outside storage return
 * the default value; there is no shrink operation.
 *
 * Growth adds at least half the current extent on the touched side, which
 * keeps repeated single-step growth amortized linear.
 *
 * @param <T> cell value type; null is not a legal value
 */
public class CoordinateGrid<T> {

    /**
     * Callback for {@link #forEach}.
     */
    @FunctionalInterface
    public interface CellVisitor<T> {
        void visit(int x, int y, T value);
    }

    private final T defaultValue;

    /** World coordinate of cells[0] */
    private int originX;
    private int originY;

    /** Storage extent */
    private int width;
    private int height;

    private Object[] cells = new Object[0];

    /** Extent of coordinates written through set(), null until the first write */
    private GridBounds writtenBounds;

    /**
     * Creates an empty grid.
     *
     * @param defaultValue value returned for cells never written
     */
    public CoordinateGrid(T defaultValue) {
        this.defaultValue = Objects.requireNonNull(defaultValue, "defaultValue");
    }

    public T getDefaultValue() {
        return defaultValue;
    }

    /**
     * Returns the value at (x, y), or the default if the cell was never written.
     */
    @SuppressWarnings("unchecked")
    public T get(int x, int y) {
        int localX = x - originX;
        int localY = y - originY;
        if (localX < 0 || localY < 0 || localX >= width || localY >= height) {
            return defaultValue;
        }
        return (T) cells[localY * width + localX];
    }

    public T get(Coordinate c) {
        return get(c.x, c.y);
    }

    /**
     * Sets the value at (x, y), expanding storage if needed.
     */
    public void set(int x, int y, T value) {
        Objects.requireNonNull(value, "Grid values cannot be null");
        ensureCapacity(x, y);
        cells[(y - originY) * width + (x - originX)] = value;
        writtenBounds = writtenBounds == null ? new GridBounds(x, y, x, y) : writtenBounds.including(x, y);
    }

    public void set(Coordinate c, T value) {
        set(c.x, c.y, value);
    }

    /**
     * @return true if nothing has been written yet
     */
    public boolean isEmpty() {
        return writtenBounds == null;
    }

    /**
     * Extent of all written coordinates, or null for an empty grid.
     */
    public GridBounds bounds() {
        return writtenBounds;
    }

    public int storageWidth() {
        return width;
    }

    public int storageHeight() {
        return height;
    }

    /**
     * Visits every cell inside the written bounds, row by row.
     */
    public void forEach(CellVisitor<T> visitor) {
        if (writtenBounds == null) return;
        for (int y = writtenBounds.minY; y <= writtenBounds.maxY; y++) {
            for (int x = writtenBounds.minX; x <= writtenBounds.maxX; x++) {
                visitor.visit(x, y, get(x, y));
            }
        }
    }

    /**
     * Finds all coordinates whose value matches.
     */
    public List<Coordinate> find(Predicate<T> matcher) {
        List<Coordinate> found = new ArrayList<>();
        forEach((x, y, value) -> {
            if (matcher.test(value)) found.add(Coordinate.of(x, y));
        });
        return found;
    }

    public int count(Predicate<T> matcher) {
        int[] count = {0};
        forEach((x, y, value) -> {
            if (matcher.test(value)) count[0]++;
        });
        return count[0];
    }

    /**
     * Returns a deep copy of the grid (values themselves are shared).
     */
    public CoordinateGrid<T> copy() {
        CoordinateGrid<T> copy = new CoordinateGrid<>(defaultValue);
        copy.originX = originX;
        copy.originY = originY;
        copy.width = width;
        copy.height = height;
        copy.cells = Arrays.copyOf(cells, cells.length);
        copy.writtenBounds = writtenBounds;
        return copy;
    }

    /**
     * Replaces every written occurrence of {@code from} with {@code to}.
     *
     * @return number of cells changed
     */
    public int replaceAll(T from, T to) {
        Objects.requireNonNull(to, "to");
        int changed = 0;
        for (Coordinate c : find(value -> value.equals(from))) {
            set(c, to);
            changed++;
        }
        return changed;
    }

    /**
     * Exports the written region as rows, top to bottom.
     */
    public List<List<T>> toRows() {
        if (writtenBounds == null) return new ArrayList<>();
        return rowsWithin(writtenBounds);
    }

    /**
     * Exports an arbitrary rectangle as rows; cells outside storage read as
     * the default value.
     */
    public List<List<T>> rowsWithin(GridBounds region) {
        List<List<T>> rows = new ArrayList<>(region.height());
        for (int y = region.minY; y <= region.maxY; y++) {
            List<T> row = new ArrayList<>(region.width());
            for (int x = region.minX; x <= region.maxX; x++) {
                row.add(get(x, y));
            }
            rows.add(row);
        }
        return rows;
    }

    /**
     * Rebuilds a grid from exported rows whose first cell lies at
     * (originX, originY). Rows may be ragged.
     */
    public static <T> CoordinateGrid<T> fromRows(T defaultValue, int originX, int originY,
                                                 List<? extends List<T>> rows) {
        CoordinateGrid<T> grid = new CoordinateGrid<>(defaultValue);
        for (int row = 0; row < rows.size(); row++) {
            List<T> values = rows.get(row);
            for (int col = 0; col < values.size(); col++) {
                T value = values.get(col);
                grid.set(originX + col, originY + row, value != null ? value : defaultValue);
            }
        }
        return grid;
    }

    // ============ Internal Helpers ============

    /**
     * Grows storage so that (x, y) lies inside it. Existing cells are copied to
     * the same world coordinates in the new array.
     */
    private void ensureCapacity(int x, int y) {
        if (width == 0) {
            originX = x;
            originY = y;
            width = 1;
            height = 1;
            cells = new Object[] {defaultValue};
            return;
        }

        int minX = originX;
        int minY = originY;
        int maxX = originX + width - 1;
        int maxY = originY + height - 1;
        if (x >= minX && x <= maxX && y >= minY && y <= maxY) {
            return;
        }

        // Expand left / right
        if (x < minX) minX -= Math.max(minX - x, width / 2);
        if (x > maxX) maxX += Math.max(x - maxX, width / 2);

        // Expand up / down
        if (y < minY) minY -= Math.max(minY - y, height / 2);
        if (y > maxY) maxY += Math.max(y - maxY, height / 2);

        int newWidth = maxX - minX + 1;
        int newHeight = maxY - minY + 1;
        Object[] newCells = new Object[newWidth * newHeight];
        Arrays.fill(newCells, defaultValue);

        int shiftX = originX - minX;
        int shiftY = originY - minY;
        for (int row = 0; row < height; row++) {
            System.arraycopy(cells, row * width, newCells, (row + shiftY) * newWidth + shiftX, width);
        }

        cells = newCells;
        originX = minX;
        originY = minY;
        width = newWidth;
        height = newHeight;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (List<T> row : toRows()) {
            for (int i = 0; i < row.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(row.get(i));
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
