package overworld.client;

import overworld.domain.AgentSnapshot;
import overworld.planning.NavConfig;

/**
 * Waits for the agent to come to rest after an action.
 *
 * Waits the minimum settle time, then polls until {@code stablePolls}
 * consecutive readings agree on area, tile and facing, or the timeout
 * expires. Elapsed time is the sum of the pauses taken, so the wait is
 * deterministic under a fake {@link Sleeper}.
 *
 * A reading that is neither navigable nor showing dialogue (menu, battle)
 * interrupts the wait. Dialogue does not interrupt; it is reported so the
 * outcome can be tagged.
 */
public class SettleWaiter {

    /**
     * How a wait ended.
     */
    public enum Status {
        STABILIZED,
        TIMED_OUT,
        /** Stabilized (or timed out) in a different area than the one left */
        AREA_CHANGED,
        /** A non-navigable screen appeared; the cycle must not touch the map */
        INTERRUPTED
    }

    /**
     * Result of {@link #await}.
     */
    public static final class SettleResult {
        public final Status status;
        /** Last reading taken, may be null if every read failed */
        public final AgentSnapshot snapshot;
        /** Dialogue was seen during the wait */
        public final boolean dialogueSeen;
        public final long elapsedMs;

        public SettleResult(Status status, AgentSnapshot snapshot, boolean dialogueSeen, long elapsedMs) {
            this.status = status;
            this.snapshot = snapshot;
            this.dialogueSeen = dialogueSeen;
            this.elapsedMs = elapsedMs;
        }

        public boolean isUsable() {
            return status != Status.INTERRUPTED && snapshot != null && snapshot.isComplete();
        }

        @Override
        public String toString() {
            return "Settle[" + status + " after " + elapsedMs + "ms" + (dialogueSeen ? ", dialogue" : "")
                    + ", " + snapshot + "]";
        }
    }

    private final PositionReader reader;
    private final Sleeper sleeper;
    private final NavConfig config;

    public SettleWaiter(PositionReader reader, Sleeper sleeper, NavConfig config) {
        this.reader = reader;
        this.sleeper = sleeper;
        this.config = config;
    }

    /**
     * Waits for the agent to settle after leaving the placement in {@code before}.
     */
    public SettleResult await(AgentSnapshot before) {
        long elapsed = 0;
        AgentSnapshot last = null;
        AgentSnapshot previous = null;
        boolean dialogueSeen = false;
        int stableCount = 0;

        try {
            sleeper.sleep(config.getSettleMinMs());
            elapsed += config.getSettleMinMs();

            while (true) {
                last = reader.read();

                if (last != null) {
                    dialogueSeen |= last.dialogueActive;
                    if (!last.navigable && !last.dialogueActive) {
                        return new SettleResult(Status.INTERRUPTED, last, dialogueSeen, elapsed);
                    }
                    if (last.isComplete() && last.samePlacement(previous)) {
                        stableCount++;
                    } else {
                        stableCount = last.isComplete() ? 1 : 0;
                    }
                    if (stableCount >= config.getStablePolls()) {
                        return new SettleResult(settledStatus(before, last), last, dialogueSeen, elapsed);
                    }
                } else {
                    stableCount = 0;
                }

                if (elapsed >= config.getSettleTimeoutMs()) {
                    Status status = last != null && last.isComplete() && changedArea(before, last)
                            ? Status.AREA_CHANGED : Status.TIMED_OUT;
                    return new SettleResult(status, last, dialogueSeen, elapsed);
                }

                previous = last;
                sleeper.sleep(config.getPollIntervalMs());
                elapsed += config.getPollIntervalMs();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new SettleResult(Status.INTERRUPTED, last, dialogueSeen, elapsed);
        }
    }

    /**
     * Polls for dialogue for up to the configured dialogue window.
     *
     * @return true as soon as a reading shows dialogue
     */
    public boolean watchForDialogue() {
        long elapsed = 0;
        try {
            while (true) {
                AgentSnapshot reading = reader.read();
                if (reading != null && reading.dialogueActive) {
                    return true;
                }
                if (elapsed >= config.getDialogueWindowMs()) {
                    return false;
                }
                sleeper.sleep(config.getPollIntervalMs());
                elapsed += config.getPollIntervalMs();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static Status settledStatus(AgentSnapshot before, AgentSnapshot settled) {
        return changedArea(before, settled) ? Status.AREA_CHANGED : Status.STABILIZED;
    }

    private static boolean changedArea(AgentSnapshot before, AgentSnapshot after) {
        return before != null && before.areaId != null && !before.areaId.equals(after.areaId);
    }
}
