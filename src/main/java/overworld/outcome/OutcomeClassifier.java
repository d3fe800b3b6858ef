package overworld.outcome;

import overworld.domain.AgentSnapshot;
import overworld.domain.AreaId;
import overworld.domain.Button;
import overworld.domain.Coordinate;
import overworld.domain.Direction;

/**
 * Classifies what an action did from the agent's state before and after it
 * settled. Pure: no I/O, no state, never throws. Snapshots that cannot be
 * interpreted produce an UNKNOWN outcome.
 *
 * Evaluation order:
 * 1. A changed area is AREA_CHANGED, whatever else changed with it, WAIT included.
 * 2. Otherwise WAIT is WAITED, even without readings.
 * 3. Directional presses: moved, else turned, else blocked. Exactly one holds.
 *    A move that started dialogue by itself is AUTO_DIALOGUE.
 * 4. A is INTERACTED, flagged when dialogue started.
 * 5. Anything else has no map effect and is UNKNOWN.
 */
public final class OutcomeClassifier {

    private OutcomeClassifier() {}

    /**
     * Classifies from two snapshots.
     *
     * @param action               the button that was issued
     * @param before               reading taken before issuing it
     * @param after                reading taken once it settled
     * @param dialogueBecameActive dialogue opened within the post-action polling window
     */
    public static ActionOutcome classify(Button action, AgentSnapshot before, AgentSnapshot after,
                                         boolean dialogueBecameActive) {
        if (before == null || after == null) {
            return action == Button.WAIT ? ActionOutcome.waited() : ActionOutcome.unknown("missing snapshot");
        }
        return classify(action, before.position, after.position, before.areaId, after.areaId,
                before.facing, after.facing, dialogueBecameActive);
    }

    /**
     * Classifies from the individual before/after components.
     */
    public static ActionOutcome classify(Button action,
                                         Coordinate posBefore, Coordinate posAfter,
                                         AreaId areaBefore, AreaId areaAfter,
                                         Direction facingBefore, Direction facingAfter,
                                         boolean dialogueBecameActive) {
        if (action == null) {
            return ActionOutcome.unknown("no action");
        }
        boolean complete = posBefore != null && posAfter != null && areaBefore != null && areaAfter != null;
        if (complete && !areaBefore.equals(areaAfter)) {
            return classifyAreaChange(action, posBefore, posAfter, areaBefore, areaAfter,
                    facingBefore, facingAfter);
        }
        if (action == Button.WAIT) {
            return ActionOutcome.waited();
        }
        if (posBefore == null || posAfter == null) {
            return ActionOutcome.unknown("missing position");
        }
        if (areaBefore == null || areaAfter == null) {
            return ActionOutcome.unknown("missing area");
        }

        if (action.isDirectional()) {
            Direction attempted = action.direction();
            if (!posBefore.equals(posAfter)) {
                return dialogueBecameActive
                        ? ActionOutcome.autoDialogue(posBefore, posAfter)
                        : ActionOutcome.moved(posBefore, posAfter);
            }
            if (facingBefore == null || facingAfter == null) {
                return ActionOutcome.unknown("missing facing");
            }
            if (facingBefore != facingAfter) {
                return ActionOutcome.turned(facingBefore, facingAfter, posAfter);
            }
            return ActionOutcome.blocked(posBefore, posBefore.move(attempted));
        }

        if (action == Button.A) {
            if (facingAfter == null) {
                return ActionOutcome.unknown("missing facing");
            }
            return ActionOutcome.interacted(posAfter, posAfter.move(facingAfter), dialogueBecameActive);
        }

        return ActionOutcome.unknown("no map effect for " + action);
    }

    private static ActionOutcome classifyAreaChange(Button action,
                                                    Coordinate posBefore, Coordinate posAfter,
                                                    AreaId areaBefore, AreaId areaAfter,
                                                    Direction facingBefore, Direction facingAfter) {
        Direction travel;
        Coordinate exit;
        if (action.isDirectional()) {
            travel = action.direction();
            exit = posBefore.move(travel);
        } else {
            // Warp tile under the agent, e.g. stairs triggered by a button press
            travel = facingBefore != null ? facingBefore : facingAfter;
            exit = posBefore;
        }
        if (travel == null) {
            return ActionOutcome.unknown("area changed without a direction");
        }
        return ActionOutcome.areaChanged(areaBefore, posBefore, exit, areaAfter, posAfter, travel);
    }
}
