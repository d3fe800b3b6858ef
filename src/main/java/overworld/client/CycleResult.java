package overworld.client;

import overworld.domain.Button;
import overworld.outcome.ActionOutcome;

/**
 * Summary of one decision cycle.
 */
public final class CycleResult {

    public enum Status {
        /** Action issued, outcome classified and applied */
        COMPLETED,
        /** Nothing issued: the agent could not be read or is not in the overworld */
        SKIPPED,
        /** Action issued but the wait was interrupted; the map was not touched */
        ABORTED
    }

    public final Status status;
    public final Button action;
    public final ActionOutcome outcome;
    public final SettleWaiter.Status settleStatus;
    public final String reason;

    private CycleResult(Status status, Button action, ActionOutcome outcome, SettleWaiter.Status settleStatus,
                        String reason) {
        this.status = status;
        this.action = action;
        this.outcome = outcome;
        this.settleStatus = settleStatus;
        this.reason = reason;
    }

    public static CycleResult completed(Button action, ActionOutcome outcome, SettleWaiter.Status settleStatus) {
        return new CycleResult(Status.COMPLETED, action, outcome, settleStatus, null);
    }

    public static CycleResult skipped(String reason) {
        return new CycleResult(Status.SKIPPED, null, null, null, reason);
    }

    public static CycleResult aborted(Button action, SettleWaiter.Status settleStatus, String reason) {
        return new CycleResult(Status.ABORTED, action, null, settleStatus, reason);
    }

    @Override
    public String toString() {
        switch (status) {
            case COMPLETED:
                return "Cycle[" + action + " -> " + outcome + "]";
            case ABORTED:
                return "Cycle[" + action + " aborted: " + reason + "]";
            default:
                return "Cycle[skipped: " + reason + "]";
        }
    }
}
