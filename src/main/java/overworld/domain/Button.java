package overworld.domain;

/**
 * Enum of the inputs the execution collaborator accepts.
 *
 * - Directional: UP, DOWN, LEFT, RIGHT (turn in place, or step if already facing)
 * - Buttons: A (interact), B, START, SELECT
 * - WAIT: issue nothing for one cycle
 */
public enum Button {
    UP(Direction.UP),
    DOWN(Direction.DOWN),
    LEFT(Direction.LEFT),
    RIGHT(Direction.RIGHT),
    A(null),
    B(null),
    START(null),
    SELECT(null),
    WAIT(null);

    /** Direction pressed, or null for non-directional buttons */
    private final Direction direction;

    Button(Direction direction) {
        this.direction = direction;
    }

    public boolean isDirectional() {
        return direction != null;
    }

    /**
     * @return the pressed direction, or null for non-directional buttons
     */
    public Direction direction() {
        return direction;
    }

    /**
     * Returns the directional button for a direction.
     */
    public static Button of(Direction direction) {
        return switch (direction) {
            case UP -> UP;
            case DOWN -> DOWN;
            case LEFT -> LEFT;
            case RIGHT -> RIGHT;
        };
    }

    /**
     * Parses a button from the form a decision source emits
     * ("Up", "a", "Start", "WAIT", ...).
     *
     * @throws IllegalArgumentException if the string names no button
     */
    public static Button fromString(String s) {
        if (s == null) {
            throw new IllegalArgumentException("Invalid button: null");
        }
        String normalized = s.trim().toUpperCase();
        for (Button button : values()) {
            if (button.name().equals(normalized)) return button;
        }
        throw new IllegalArgumentException("Invalid button: " + s);
    }
}
