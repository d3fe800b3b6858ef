package overworld.domain;

/**
 * Per-tile classification of walkability and role in a traversal grid.
 *
 * Each status has a single-character symbol used for persisted rows and for
 * grid rendering:
 * <pre>
 *   ?  UNKNOWN          never resolved by a movement attempt
 *   W  WALKABLE         the agent has stood here
 *   N  BLOCKED          a step into this tile did not move the agent
 *   P  PLAYER           the agent's current tile (at most one per area)
 *   T  TRANSITION_EDGE  stepping here leads into another area
 *   I  INTERACTABLE     NPC, sign, or walk-on dialogue trigger
 *   L  LEDGE            a one-way hop starts here
 * </pre>
 */
public enum TraversalStatus {
    UNKNOWN('?'),
    WALKABLE('W'),
    BLOCKED('N'),
    PLAYER('P'),
    TRANSITION_EDGE('T'),
    INTERACTABLE('I'),
    LEDGE('L');

    public final char symbol;

    TraversalStatus(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Structural markers record something learned about the tile itself and
     * are never replaced by the transient PLAYER marker or a plain WALKABLE.
     */
    public boolean isStructural() {
        return this == TRANSITION_EDGE || this == INTERACTABLE || this == LEDGE;
    }

    /**
     * True for statuses a path may step onto at unit cost.
     */
    public boolean isConfirmedTraversable() {
        return this == WALKABLE || this == PLAYER || this == TRANSITION_EDGE || this == LEDGE;
    }

    /**
     * Parses a status from its symbol.
     *
     * @throws IllegalArgumentException for an unknown symbol
     */
    public static TraversalStatus fromSymbol(char symbol) {
        for (TraversalStatus status : values()) {
            if (status.symbol == symbol) return status;
        }
        // Older records wrote 'Y' for walkable
        if (symbol == 'Y') return WALKABLE;
        throw new IllegalArgumentException("Unknown traversal symbol: " + symbol);
    }
}
