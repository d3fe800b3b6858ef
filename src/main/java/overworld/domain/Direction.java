package overworld.domain;

/**
 * Enum representing the four cardinal directions a character can face or walk.
 * Each direction has associated x and y deltas in area-local space,
 * where y grows downward.
 */
public enum Direction {
    /** Up - decrease y */
    UP(0, -1),

    /** Down - increase y */
    DOWN(0, 1),

    /** Left - decrease x */
    LEFT(-1, 0),

    /** Right - increase x */
    RIGHT(1, 0);

    /** X delta when moving in this direction */
    public final int dx;

    /** Y delta when moving in this direction */
    public final int dy;

    Direction(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    /**
     * Returns the opposite direction.
     * UP <-> DOWN, LEFT <-> RIGHT
     *
     * @return the opposite direction
     */
    public Direction opposite() {
        return switch (this) {
            case UP -> DOWN;
            case DOWN -> UP;
            case LEFT -> RIGHT;
            case RIGHT -> LEFT;
        };
    }

    /**
     * Returns the display name used in logs and persisted connection records
     * ("Up", "Down", "Left", "Right").
     */
    public String displayName() {
        return switch (this) {
            case UP -> "Up";
            case DOWN -> "Down";
            case LEFT -> "Left";
            case RIGHT -> "Right";
        };
    }

    /**
     * Parses a direction from its string representation.
     * Accepts the display names, single letters and compass names, case-insensitively.
     *
     * @param s the string representation
     * @return the corresponding Direction
     * @throws IllegalArgumentException if the string is not a valid direction
     */
    public static Direction fromString(String s) {
        if (s == null) {
            throw new IllegalArgumentException("Invalid direction: null");
        }
        return switch (s.trim().toUpperCase()) {
            case "UP", "U", "N", "NORTH" -> UP;
            case "DOWN", "D", "S", "SOUTH" -> DOWN;
            case "LEFT", "L", "W", "WEST" -> LEFT;
            case "RIGHT", "R", "E", "EAST" -> RIGHT;
            default -> throw new IllegalArgumentException("Invalid direction: " + s);
        };
    }
}
