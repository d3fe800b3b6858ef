package overworld.map;

import overworld.domain.Coordinate;

/**
 * Inclusive rectangle of coordinates. Immutable; {@link #including} returns
 * a widened copy.
 */
public final class GridBounds {

    public final int minX;
    public final int minY;
    public final int maxX;
    public final int maxY;

    public GridBounds(int minX, int minY, int maxX, int maxY) {
        if (maxX < minX || maxY < minY) {
            throw new IllegalArgumentException("Inverted bounds: (" + minX + "," + minY
                    + ") to (" + maxX + "," + maxY + ")");
        }
        this.minX = minX;
        this.minY = minY;
        this.maxX = maxX;
        this.maxY = maxY;
    }

    public static GridBounds of(Coordinate c) {
        return new GridBounds(c.x, c.y, c.x, c.y);
    }

    public GridBounds including(int x, int y) {
        if (contains(x, y)) return this;
        return new GridBounds(Math.min(minX, x), Math.min(minY, y), Math.max(maxX, x), Math.max(maxY, y));
    }

    public GridBounds including(GridBounds other) {
        if (other == null) return this;
        return new GridBounds(Math.min(minX, other.minX), Math.min(minY, other.minY),
                Math.max(maxX, other.maxX), Math.max(maxY, other.maxY));
    }

    public boolean contains(int x, int y) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }

    public boolean contains(Coordinate c) {
        return contains(c.x, c.y);
    }

    public int width() {
        return maxX - minX + 1;
    }

    public int height() {
        return maxY - minY + 1;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof GridBounds)) return false;
        GridBounds other = (GridBounds) obj;
        return minX == other.minX && minY == other.minY && maxX == other.maxX && maxY == other.maxY;
    }

    @Override
    public int hashCode() {
        int result = minX;
        result = 31 * result + minY;
        result = 31 * result + maxX;
        result = 31 * result + maxY;
        return result;
    }

    @Override
    public String toString() {
        return "(" + minX + "," + minY + ") to (" + maxX + "," + maxY + ")";
    }
}
