package overworld.outcome;

import overworld.domain.AreaId;
import overworld.map.AreaMap;

import java.util.Objects;

/**
 * Handle on the area the agent is currently in. Owned by the decision loop;
 * only {@link TraversalUpdater} swaps the map it points at.
 */
public final class ActiveArea {

    private AreaMap current;

    public ActiveArea(AreaMap initial) {
        this.current = Objects.requireNonNull(initial, "initial");
    }

    public AreaMap current() {
        return current;
    }

    public AreaId areaId() {
        return current.getAreaId();
    }

    void swap(AreaMap next) {
        this.current = Objects.requireNonNull(next, "next");
    }

    @Override
    public String toString() {
        return "ActiveArea[" + current.getAreaId() + "]";
    }
}
