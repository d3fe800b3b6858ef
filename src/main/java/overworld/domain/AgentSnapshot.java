package overworld.domain;

import java.util.Objects;

/**
 * One side-effect-free reading of the controlled character: which area it is
 * in, where, which way it faces, and whether the overworld is currently
 * navigable (no menu, battle or dialogue on screen).
 *
 * Fields may be null when the underlying read failed; consumers treat such
 * snapshots as inconsistent rather than guessing.
 */
public final class AgentSnapshot {

    public final AreaId areaId;
    public final String areaName;
    public final Coordinate position;
    public final Direction facing;
    public final boolean dialogueActive;
    public final boolean navigable;

    public AgentSnapshot(AreaId areaId, String areaName, Coordinate position, Direction facing,
                         boolean dialogueActive, boolean navigable) {
        this.areaId = areaId;
        this.areaName = areaName;
        this.position = position;
        this.facing = facing;
        this.dialogueActive = dialogueActive;
        this.navigable = navigable;
    }

    /**
     * Convenience factory for a navigable overworld reading with no dialogue.
     */
    public static AgentSnapshot at(AreaId areaId, int x, int y, Direction facing) {
        return new AgentSnapshot(areaId, null, Coordinate.of(x, y), facing, false, true);
    }

    /**
     * True when area, position and facing were all read.
     */
    public boolean isComplete() {
        return areaId != null && position != null && facing != null;
    }

    /**
     * Same area, tile and facing. Dialogue and navigability are ignored.
     */
    public boolean samePlacement(AgentSnapshot other) {
        return other != null
                && Objects.equals(areaId, other.areaId)
                && Objects.equals(position, other.position)
                && facing == other.facing;
    }

    public AgentSnapshot withDialogue(boolean active) {
        return new AgentSnapshot(areaId, areaName, position, facing, active, navigable && !active);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AgentSnapshot)) return false;
        AgentSnapshot other = (AgentSnapshot) obj;
        return samePlacement(other)
                && dialogueActive == other.dialogueActive
                && navigable == other.navigable;
    }

    @Override
    public int hashCode() {
        return Objects.hash(areaId, position, facing, dialogueActive, navigable);
    }

    @Override
    public String toString() {
        return "Agent[" + areaId + " " + position + " facing "
                + (facing != null ? facing.displayName() : "?")
                + (dialogueActive ? " dialogue" : "")
                + (navigable ? "" : " not-navigable") + "]";
    }
}
