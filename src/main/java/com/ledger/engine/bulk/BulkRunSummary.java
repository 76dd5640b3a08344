package com.ledger.engine.bulk;

import java.util.List;

/**
 * Aggregate result of a bulk run.
 *
 * @param processed       transactions processed
 * @param succeeded       transactions processed without failure, matched or not
 * @param failed          transactions that failed
 * @param changed         transactions at least one rule was applied to
 * @param rulesMatched    total rule matches across all transactions
 * @param failures        failure details, capped at the configured maximum
 * @param cancelled       whether the run was cancelled before the last chunk
 * @param durationMs      wall-clock duration
 */
public record BulkRunSummary(long processed,
                             long succeeded,
                             long failed,
                             long changed,
                             long rulesMatched,
                             List<BulkFailure> failures,
                             boolean cancelled,
                             long durationMs) {

    public BulkRunSummary {
        failures = List.copyOf(failures);
    }

    /**
     * User-facing summary line, e.g. {@code "9999 applied, 1 failed"}.
     */
    public String message() {
        String message = succeeded + " applied, " + failed + " failed";
        return cancelled ? message + " (cancelled)" : message;
    }
}
