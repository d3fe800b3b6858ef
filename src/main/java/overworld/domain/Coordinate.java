package overworld.domain;

/**
 * Immutable class representing a tile coordinate in area-local space.
 * Components are signed: an area's storage origin is decoupled from its
 * coordinate origin, so negative values are legal.
 * X increases rightward, y increases downward.
 */
public final class Coordinate {

    /** The horizontal component */
    public final int x;

    /** The vertical component (grows downward) */
    public final int y;

    /** Shared origin instance */
    public static final Coordinate ORIGIN = new Coordinate(0, 0);

    /**
     * Creates a new Coordinate.
     *
     * @param x the horizontal component
     * @param y the vertical component
     */
    public Coordinate(int x, int y) {
        this.x = x;
        this.y = y;
    }

    /**
     * Factory method, reads better at call sites that build many coordinates.
     */
    public static Coordinate of(int x, int y) {
        if (x == 0 && y == 0) return ORIGIN;
        return new Coordinate(x, y);
    }

    /**
     * Returns the Coordinate adjacent to this one in the given direction.
     *
     * @param direction the direction to step
     * @return the neighbouring Coordinate
     */
    public Coordinate move(Direction direction) {
        return Coordinate.of(x + direction.dx, y + direction.dy);
    }

    /**
     * Returns the Coordinate reached after {@code steps} steps in a direction.
     */
    public Coordinate move(Direction direction, int steps) {
        return Coordinate.of(x + direction.dx * steps, y + direction.dy * steps);
    }

    /**
     * Returns this coordinate translated by the given deltas.
     */
    public Coordinate offset(int dx, int dy) {
        return Coordinate.of(x + dx, y + dy);
    }

    /**
     * Calculates the Manhattan distance from this coordinate to another.
     * Manhattan distance is |x1 - x2| + |y1 - y2|.
     *
     * @param other the other coordinate
     * @return the Manhattan distance
     */
    public int manhattanDistance(Coordinate other) {
        return Math.abs(this.x - other.x) + Math.abs(this.y - other.y);
    }

    /**
     * Checks if this coordinate is cardinally adjacent to another
     * (not diagonally, only up/down/left/right).
     *
     * @param other the other coordinate
     * @return true if coordinates are cardinally adjacent
     */
    public boolean isCardinallyAdjacentTo(Coordinate other) {
        return manhattanDistance(other) == 1;
    }

    /**
     * Returns the direction of a single cardinal step from this coordinate to
     * {@code other}, or null if the two are not cardinally adjacent.
     */
    public Direction directionTo(Coordinate other) {
        if (!isCardinallyAdjacentTo(other)) return null;
        if (other.x > x) return Direction.RIGHT;
        if (other.x < x) return Direction.LEFT;
        if (other.y > y) return Direction.DOWN;
        return Direction.UP;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Coordinate other = (Coordinate) obj;
        return x == other.x && y == other.y;
    }

    @Override
    public int hashCode() {
        return 31 * x + y;
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
