package overworld.outcome;

import overworld.domain.AreaId;
import overworld.domain.Coordinate;
import overworld.domain.Direction;

import java.util.Objects;

/**
 * What an attempted action actually did, as observed after it settled.
 *
 * Outcome types and the fields they carry:
 * - MOVED(from, to): position changed within one area
 * - TURNED(fromFacing, toFacing): facing changed in place
 * - BLOCKED(target): a directional press neither moved nor turned the agent
 * - AREA_CHANGED(fromArea, exit, toArea, entry, direction): the agent left the area
 * - INTERACTED(target, dialogue): the interact button was pressed facing target
 * - AUTO_DIALOGUE(from, to): a move ended on a tile that started dialogue by itself
 * - WAITED: nothing was issued
 * - UNKNOWN(reason): the snapshots did not allow a classification
 *
 * Fields not used by a type are null.
 */
public final class ActionOutcome {

    /**
     * Enum representing the type of outcome.
     */
    public enum Type {
        MOVED,
        TURNED,
        BLOCKED,
        AREA_CHANGED,
        INTERACTED,
        AUTO_DIALOGUE,
        WAITED,
        UNKNOWN
    }

    public final Type type;

    /** MOVED / AUTO_DIALOGUE start tile; AREA_CHANGED vacated tile */
    public final Coordinate from;

    /** MOVED / AUTO_DIALOGUE end tile; AREA_CHANGED entry tile */
    public final Coordinate to;

    /** BLOCKED tile stepped against; INTERACTED faced tile; AREA_CHANGED exit tile */
    public final Coordinate target;

    public final Direction fromFacing;
    public final Direction toFacing;

    public final AreaId fromArea;
    public final AreaId toArea;

    /** AREA_CHANGED direction of travel */
    public final Direction direction;

    /** INTERACTED: dialogue became active within the polling window */
    public final boolean dialogue;

    /** UNKNOWN: why no classification was possible */
    public final String reason;

    /** Pre-created WAITED instance for reuse */
    public static final ActionOutcome WAITED = new ActionOutcome(Type.WAITED, null, null, null,
            null, null, null, null, null, false, null);

    private ActionOutcome(Type type, Coordinate from, Coordinate to, Coordinate target,
                          Direction fromFacing, Direction toFacing, AreaId fromArea, AreaId toArea,
                          Direction direction, boolean dialogue, String reason) {
        this.type = type;
        this.from = from;
        this.to = to;
        this.target = target;
        this.fromFacing = fromFacing;
        this.toFacing = toFacing;
        this.fromArea = fromArea;
        this.toArea = toArea;
        this.direction = direction;
        this.dialogue = dialogue;
        this.reason = reason;
    }

    public static ActionOutcome moved(Coordinate from, Coordinate to) {
        return new ActionOutcome(Type.MOVED, from, to, null, null, null, null, null, null, false, null);
    }

    public static ActionOutcome turned(Direction fromFacing, Direction toFacing, Coordinate at) {
        return new ActionOutcome(Type.TURNED, at, at, null, fromFacing, toFacing, null, null, null, false, null);
    }

    public static ActionOutcome blocked(Coordinate at, Coordinate target) {
        return new ActionOutcome(Type.BLOCKED, at, at, target, null, null, null, null, null, false, null);
    }

    /**
     * @param fromArea  area left
     * @param vacated   tile the agent stood on before leaving
     * @param exit      tile that led out of the area
     * @param toArea    area entered
     * @param entry     tile the agent arrived on
     * @param direction direction of travel
     */
    public static ActionOutcome areaChanged(AreaId fromArea, Coordinate vacated, Coordinate exit,
                                            AreaId toArea, Coordinate entry, Direction direction) {
        return new ActionOutcome(Type.AREA_CHANGED, vacated, entry, exit, null, null,
                fromArea, toArea, direction, false, null);
    }

    public static ActionOutcome interacted(Coordinate at, Coordinate faced, boolean dialogue) {
        return new ActionOutcome(Type.INTERACTED, at, at, faced, null, null, null, null, null, dialogue, null);
    }

    public static ActionOutcome autoDialogue(Coordinate from, Coordinate trigger) {
        return new ActionOutcome(Type.AUTO_DIALOGUE, from, trigger, trigger, null, null, null, null, null, true, null);
    }

    public static ActionOutcome waited() {
        return WAITED;
    }

    public static ActionOutcome unknown(String reason) {
        return new ActionOutcome(Type.UNKNOWN, null, null, null, null, null, null, null, null, false, reason);
    }

    /**
     * Exit tile of an AREA_CHANGED outcome.
     */
    public Coordinate exit() {
        return target;
    }

    /**
     * Entry tile of an AREA_CHANGED outcome.
     */
    public Coordinate entry() {
        return to;
    }

    /**
     * True if the agent's tile changed (within or across areas).
     */
    public boolean changedPosition() {
        return type == Type.MOVED || type == Type.AUTO_DIALOGUE || type == Type.AREA_CHANGED;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ActionOutcome)) return false;
        ActionOutcome other = (ActionOutcome) obj;
        return type == other.type
                && Objects.equals(from, other.from)
                && Objects.equals(to, other.to)
                && Objects.equals(target, other.target)
                && fromFacing == other.fromFacing
                && toFacing == other.toFacing
                && Objects.equals(fromArea, other.fromArea)
                && Objects.equals(toArea, other.toArea)
                && direction == other.direction
                && dialogue == other.dialogue
                && Objects.equals(reason, other.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, from, to, target, fromFacing, toFacing, fromArea, toArea, direction, dialogue, reason);
    }

    @Override
    public String toString() {
        return switch (type) {
            case MOVED -> "Moved" + from + "->" + to;
            case TURNED -> "Turned(" + fromFacing.displayName() + "->" + toFacing.displayName() + ")";
            case BLOCKED -> "Blocked" + target;
            case AREA_CHANGED -> "AreaChanged(" + fromArea + exit() + " -> " + toArea + entry()
                    + " " + direction.displayName() + ")";
            case INTERACTED -> "Interacted" + target + (dialogue ? " dialogue" : "");
            case AUTO_DIALOGUE -> "AutoDialogue" + to;
            case WAITED -> "Waited";
            case UNKNOWN -> "Unknown(" + reason + ")";
        };
    }
}
