package overworld.domain;

import java.util.Objects;

/**
 * A single primitive step of a movement plan.
 *
 * Step types:
 * - Turn: the character changes facing without leaving its tile
 * - Move: the character steps one tile in the direction it already faces
 *
 * A character must face a direction before stepping into it, so a plan
 * interleaves the two. Both kinds are issued as the same directional button;
 * the game decides whether the press turns or walks.
 */
public final class PlanStep {

    /**
     * Enum representing the type of step.
     */
    public enum StepType {
        TURN,
        MOVE
    }

    /** The type of this step */
    public final StepType type;

    /** Direction turned to or stepped in */
    public final Direction direction;

    // --- Static step cache: 4 Turn + 4 Move = 8 total ---
    private static final PlanStep[] TURN_STEPS = new PlanStep[Direction.values().length];
    private static final PlanStep[] MOVE_STEPS = new PlanStep[Direction.values().length];

    static {
        for (Direction dir : Direction.values()) {
            TURN_STEPS[dir.ordinal()] = new PlanStep(StepType.TURN, dir);
            MOVE_STEPS[dir.ordinal()] = new PlanStep(StepType.MOVE, dir);
        }
    }

    /**
     * Private constructor - use factory methods to create steps.
     */
    private PlanStep(StepType type, Direction direction) {
        this.type = type;
        this.direction = direction;
    }

    /**
     * Creates a Turn step towards the specified direction.
     */
    public static PlanStep turn(Direction direction) {
        Objects.requireNonNull(direction, "Direction cannot be null for Turn step");
        return TURN_STEPS[direction.ordinal()];
    }

    /**
     * Creates a Move step in the specified direction.
     */
    public static PlanStep move(Direction direction) {
        Objects.requireNonNull(direction, "Direction cannot be null for Move step");
        return MOVE_STEPS[direction.ordinal()];
    }

    public boolean isTurn() {
        return type == StepType.TURN;
    }

    public boolean isMove() {
        return type == StepType.MOVE;
    }

    /**
     * Returns the button that performs this step.
     */
    public Button toButton() {
        return Button.of(direction);
    }

    /**
     * Parses a step from its string form, e.g. "Turn(Up)" or "Move(Left)".
     *
     * @throws IllegalArgumentException if the format is invalid
     */
    public static PlanStep fromString(String s) {
        s = s.trim();
        if (s.startsWith("Turn(") && s.endsWith(")")) {
            return turn(Direction.fromString(s.substring(5, s.length() - 1)));
        }
        if (s.startsWith("Move(") && s.endsWith(")")) {
            return move(Direction.fromString(s.substring(5, s.length() - 1)));
        }
        throw new IllegalArgumentException("Unknown step format: " + s);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        PlanStep step = (PlanStep) obj;
        return type == step.type && direction == step.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, direction);
    }

    @Override
    public String toString() {
        return (type == StepType.TURN ? "Turn(" : "Move(") + direction.displayName() + ")";
    }
}
