package com.ledger.engine.util;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EngineMetricsTest {

    @Test
    void snapshotStartsAtZero() {
        Map<String, Long> snapshot = new EngineMetrics().snapshot();

        assertThat(snapshot).hasSize(15);
        assertThat(snapshot.values()).containsOnly(0L);
    }

    @Test
    void bulkRunsAreSplitByOutcome() {
        EngineMetrics metrics = new EngineMetrics();

        metrics.incrementBulkRunStarted();
        metrics.incrementBulkRunStarted();
        metrics.recordBulkRunFinished(false, 100, 2, 40);
        metrics.recordBulkRunFinished(true, 30, 0, 12);

        Map<String, Long> snapshot = metrics.snapshot();
        assertThat(snapshot)
                .containsEntry("bulk_run_started_total", 2L)
                .containsEntry("bulk_run_completed_total", 1L)
                .containsEntry("bulk_run_cancelled_total", 1L)
                .containsEntry("bulk_transactions_processed_total", 130L)
                .containsEntry("bulk_transaction_failure_total", 2L)
                .containsEntry("bulk_run_duration_ms_last", 12L);
    }

    @Test
    void countersAreIndependent() {
        EngineMetrics metrics = new EngineMetrics();

        metrics.incrementRulesEvaluated();
        metrics.incrementRulesEvaluated();
        metrics.incrementRulesMatched();
        metrics.incrementActionBatchRollback();
        metrics.incrementSimulation();

        assertThat(metrics.snapshot())
                .containsEntry("rules_evaluated_total", 2L)
                .containsEntry("rules_matched_total", 1L)
                .containsEntry("action_batch_rollback_total", 1L)
                .containsEntry("action_batch_success_total", 0L)
                .containsEntry("simulation_total", 1L);
    }
}
