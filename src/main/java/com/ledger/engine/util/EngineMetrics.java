package com.ledger.engine.util;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lightweight in-process counters for rule engine observability.
 * <p>
 * No external dependency required. Can be replaced with Micrometer later.
 */
@ApplicationScoped
public class EngineMetrics {

    private final AtomicLong rulesEvaluatedTotal = new AtomicLong();
    private final AtomicLong rulesMatchedTotal = new AtomicLong();
    private final AtomicLong stopProcessingTotal = new AtomicLong();

    private final AtomicLong actionBatchSuccessTotal = new AtomicLong();
    private final AtomicLong actionBatchRollbackTotal = new AtomicLong();
    private final AtomicLong actionDryRunTotal = new AtomicLong();

    private final AtomicLong storeFailureTotal = new AtomicLong();
    private final AtomicLong statisticsPersistFailureTotal = new AtomicLong();

    private final AtomicLong bulkRunStartedTotal = new AtomicLong();
    private final AtomicLong bulkRunCompletedTotal = new AtomicLong();
    private final AtomicLong bulkRunCancelledTotal = new AtomicLong();
    private final AtomicLong bulkTransactionsProcessedTotal = new AtomicLong();
    private final AtomicLong bulkTransactionFailureTotal = new AtomicLong();
    private final AtomicLong bulkRunDurationMsLast = new AtomicLong();

    private final AtomicLong simulationTotal = new AtomicLong();

    public void incrementRulesEvaluated() {
        rulesEvaluatedTotal.incrementAndGet();
    }

    public void incrementRulesMatched() {
        rulesMatchedTotal.incrementAndGet();
    }

    public void incrementStopProcessing() {
        stopProcessingTotal.incrementAndGet();
    }

    public void incrementActionBatchSuccess() {
        actionBatchSuccessTotal.incrementAndGet();
    }

    public void incrementActionBatchRollback() {
        actionBatchRollbackTotal.incrementAndGet();
    }

    public void incrementActionDryRun() {
        actionDryRunTotal.incrementAndGet();
    }

    public void incrementStoreFailure() {
        storeFailureTotal.incrementAndGet();
    }

    public void incrementStatisticsPersistFailure() {
        statisticsPersistFailureTotal.incrementAndGet();
    }

    public void incrementBulkRunStarted() {
        bulkRunStartedTotal.incrementAndGet();
    }

    public void recordBulkRunFinished(boolean cancelled, long processed, long failed, long durationMs) {
        if (cancelled) {
            bulkRunCancelledTotal.incrementAndGet();
        } else {
            bulkRunCompletedTotal.incrementAndGet();
        }
        bulkTransactionsProcessedTotal.addAndGet(processed);
        bulkTransactionFailureTotal.addAndGet(failed);
        bulkRunDurationMsLast.set(durationMs);
    }

    public void incrementSimulation() {
        simulationTotal.incrementAndGet();
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> m = new LinkedHashMap<>();
        m.put("rules_evaluated_total", rulesEvaluatedTotal.get());
        m.put("rules_matched_total", rulesMatchedTotal.get());
        m.put("stop_processing_total", stopProcessingTotal.get());
        m.put("action_batch_success_total", actionBatchSuccessTotal.get());
        m.put("action_batch_rollback_total", actionBatchRollbackTotal.get());
        m.put("action_dry_run_total", actionDryRunTotal.get());
        m.put("store_failure_total", storeFailureTotal.get());
        m.put("statistics_persist_failure_total", statisticsPersistFailureTotal.get());
        m.put("bulk_run_started_total", bulkRunStartedTotal.get());
        m.put("bulk_run_completed_total", bulkRunCompletedTotal.get());
        m.put("bulk_run_cancelled_total", bulkRunCancelledTotal.get());
        m.put("bulk_transactions_processed_total", bulkTransactionsProcessedTotal.get());
        m.put("bulk_transaction_failure_total", bulkTransactionFailureTotal.get());
        m.put("bulk_run_duration_ms_last", bulkRunDurationMsLast.get());
        m.put("simulation_total", simulationTotal.get());
        return m;
    }
}
