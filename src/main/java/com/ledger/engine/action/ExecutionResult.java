package com.ledger.engine.action;

import com.ledger.engine.domain.Transaction;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of applying a rule's action list to one transaction.
 *
 * @param transactionId id of the transaction
 * @param outcomes      one entry per action, in list order
 * @param success       true when every attempted action applied and the update committed
 * @param dryRun        true when the update was rolled back on purpose
 * @param resultingState state after the actions; in a dry run the state that would have been
 *                       committed. Null when the batch failed.
 */
public record ExecutionResult(String transactionId,
                              List<ActionOutcome> outcomes,
                              boolean success,
                              boolean dryRun,
                              Transaction resultingState) {

    public ExecutionResult {
        outcomes = List.copyOf(outcomes);
    }

    public long appliedCount() {
        return outcomes.stream().filter(o -> o.status() == ActionOutcome.Status.APPLIED).count();
    }

    public long failedCount() {
        return outcomes.stream().filter(ActionOutcome::isFailure).count();
    }

    public long skippedCount() {
        return outcomes.stream().filter(o -> o.status() == ActionOutcome.Status.SKIPPED).count();
    }

    /**
     * The action that made the batch fail, if any.
     */
    public Optional<ActionOutcome> failure() {
        return outcomes.stream().filter(ActionOutcome::isFailure).findFirst();
    }

    public String failureMessage() {
        return failure().map(ActionOutcome::message).orElse(null);
    }
}
