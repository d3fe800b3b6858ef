package overworld.explore;

import overworld.domain.Direction;

import java.util.List;

/**
 * What the advisor found around the agent and which way it recommends.
 */
public final class DirectionSuggestion {

    /**
     * A known transition edge along a straight line from the agent.
     */
    public static final class TransitionHint {
        public final Direction direction;
        public final int distance;

        public TransitionHint(Direction direction, int distance) {
            this.direction = direction;
            this.distance = distance;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof TransitionHint)) return false;
            TransitionHint other = (TransitionHint) obj;
            return direction == other.direction && distance == other.distance;
        }

        @Override
        public int hashCode() {
            return direction.hashCode() * 31 + distance;
        }

        @Override
        public String toString() {
            return direction.displayName() + "@" + distance;
        }
    }

    /** Directions with an unknown tile within the scan radius, nearest first */
    public final List<Direction> unexploredDirections;

    /** At most one hint per direction, nearest first */
    public final List<TransitionHint> transitions;

    /** Directions whose adjacent tile is confirmed walkable */
    public final List<Direction> walkableDirections;

    /** Recommended direction, null if nothing qualifies */
    public final Direction suggested;

    public final boolean stuck;

    public DirectionSuggestion(List<Direction> unexploredDirections, List<TransitionHint> transitions,
                               List<Direction> walkableDirections, Direction suggested, boolean stuck) {
        this.unexploredDirections = List.copyOf(unexploredDirections);
        this.transitions = List.copyOf(transitions);
        this.walkableDirections = List.copyOf(walkableDirections);
        this.suggested = suggested;
        this.stuck = stuck;
    }

    public static DirectionSuggestion none(boolean stuck) {
        return new DirectionSuggestion(List.of(), List.of(), List.of(), null, stuck);
    }

    public boolean hasSuggestion() {
        return suggested != null;
    }

    @Override
    public String toString() {
        return "Suggestion[" + (suggested != null ? suggested.displayName() : "none")
                + ", unexplored=" + unexploredDirections
                + ", transitions=" + transitions
                + ", walkable=" + walkableDirections
                + (stuck ? ", STUCK" : "") + "]";
    }
}
