package overworld.graph;

import overworld.domain.AreaId;
import overworld.domain.Coordinate;
import overworld.domain.Direction;

import java.util.Objects;

/**
 * A directed link between two areas: stepping out of {@code fromArea} at
 * {@code fromCoord} while travelling in {@code direction} arrives in
 * {@code toArea} at {@code toCoord}.
 *
 * Connections are identified by (fromArea, fromCoord, toArea); the arrival
 * tile and direction are payload that a later traversal may correct.
 */
public final class AreaConnection {

    public final AreaId fromArea;
    public final Coordinate fromCoord;
    public final AreaId toArea;
    public final Coordinate toCoord;
    public final Direction direction;

    public AreaConnection(AreaId fromArea, Coordinate fromCoord, AreaId toArea, Coordinate toCoord,
                          Direction direction) {
        this.fromArea = Objects.requireNonNull(fromArea, "fromArea");
        this.fromCoord = Objects.requireNonNull(fromCoord, "fromCoord");
        this.toArea = Objects.requireNonNull(toArea, "toArea");
        this.toCoord = Objects.requireNonNull(toCoord, "toCoord");
        this.direction = Objects.requireNonNull(direction, "direction");
    }

    /**
     * Returns the reciprocal connection: endpoints swapped, direction reversed.
     */
    public AreaConnection reverse() {
        return new AreaConnection(toArea, toCoord, fromArea, fromCoord, direction.opposite());
    }

    /**
     * True if both connections have the same identity
     * (fromArea, fromCoord, toArea), regardless of payload.
     */
    public boolean sameKey(AreaConnection other) {
        return fromArea.equals(other.fromArea) && fromCoord.equals(other.fromCoord) && toArea.equals(other.toArea);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AreaConnection)) return false;
        AreaConnection other = (AreaConnection) obj;
        return sameKey(other) && toCoord.equals(other.toCoord) && direction == other.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromArea, fromCoord, toArea, toCoord, direction);
    }

    @Override
    public String toString() {
        return fromArea.key() + fromCoord + " --" + direction.displayName() + "--> " + toArea + toCoord;
    }
}
