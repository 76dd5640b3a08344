package com.ledger.engine.action;

import com.ledger.engine.domain.RuleAction;

/**
 * Result of one action within an {@link ExecutionResult}.
 *
 * @param index     position of the action in the rule's list
 * @param action    the action
 * @param status    what happened to it
 * @param errorKind why it failed; null unless {@code status == FAILED}
 * @param message   failure or skip reason; null when applied
 */
public record ActionOutcome(int index,
                            RuleAction action,
                            Status status,
                            ActionExecutionException.ErrorKind errorKind,
                            String message) {

    public enum Status {
        /** Applied and kept. */
        APPLIED,
        /** This action failed; the batch was rolled back. */
        FAILED,
        /** Applied, then undone because a later action failed. */
        ROLLED_BACK,
        /** Not attempted. */
        SKIPPED
    }

    static ActionOutcome applied(int index, RuleAction action) {
        return new ActionOutcome(index, action, Status.APPLIED, null, null);
    }

    static ActionOutcome failed(int index, RuleAction action, ActionExecutionException e) {
        return new ActionOutcome(index, action, Status.FAILED, e.getKind(), e.getMessage());
    }

    static ActionOutcome skipped(int index, RuleAction action, String reason) {
        return new ActionOutcome(index, action, Status.SKIPPED, null, reason);
    }

    ActionOutcome rolledBack() {
        return new ActionOutcome(index, action, Status.ROLLED_BACK, null, "Rolled back after a later action failed");
    }

    public boolean isFailure() {
        return status == Status.FAILED;
    }
}
