package com.ledger.engine.bulk;

import java.util.List;

/**
 * Progress event pushed after every chunk of a bulk run.
 *
 * @param processed     transactions processed so far
 * @param total         total transactions in the run, or -1 when unknown
 * @param succeeded     transactions processed without failure so far
 * @param failed        transactions that failed so far
 * @param rulesMatched  rule applications so far, across all transactions
 * @param chunk         1-based number of the chunk just finished
 * @param elapsedMs     wall-clock time since the run started
 * @param chunkFailures failures of the chunk just finished
 */
public record BulkProgress(long processed,
                           long total,
                           long succeeded,
                           long failed,
                           long rulesMatched,
                           int chunk,
                           long elapsedMs,
                           List<BulkFailure> chunkFailures) {

    public BulkProgress {
        chunkFailures = chunkFailures == null ? List.of() : List.copyOf(chunkFailures);
    }

    /**
     * Completion in percent, or -1 when the total is unknown.
     */
    public int percent() {
        if (total < 0) {
            return -1;
        }
        if (total == 0) {
            return 100;
        }
        return (int) Math.min(100, processed * 100 / total);
    }

    /**
     * Remaining time extrapolated from the average time per transaction so far: 0 once
     * everything is processed, -1 when the total is unknown or nothing was processed yet.
     */
    public long estimatedRemainingMs() {
        if (total < 0 || processed <= 0) {
            return -1;
        }
        if (processed >= total) {
            return 0;
        }
        return Math.round((double) elapsedMs / processed * (total - processed));
    }

    /**
     * Transactions per second so far, 0 before any time has elapsed.
     */
    public double throughputPerSecond() {
        return elapsedMs <= 0 ? 0.0 : processed * 1000.0 / elapsedMs;
    }
}
