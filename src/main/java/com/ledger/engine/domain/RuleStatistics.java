package com.ledger.engine.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Performance statistics of one rule, kept apart from the rule definition.
 *
 * Tracks:
 * - How often the rule was evaluated and how often it matched
 * - Action failures (a matched rule whose actions were rolled back)
 * - A moving average of the trigger evaluation time
 * - When the rule last matched and when it last took part in a bulk run
 */
public class RuleStatistics {

    /**
     * Weight of the newest sample in the evaluation time moving average.
     */
    public static final double EVALUATION_TIME_WEIGHT = 0.1;

    /**
     * A rule that matched within this window counts as actively used.
     */
    public static final Duration ACTIVE_WINDOW = Duration.ofDays(7);

    public enum PerformanceCategory {
        EXCELLENT,
        GOOD,
        NEEDS_OPTIMIZATION,
        UNUSED
    }

    @JsonProperty("rule_id")
    private String ruleId;

    @JsonProperty("match_count")
    private long matchCount;

    @JsonProperty("total_evaluations")
    private long totalEvaluations;

    @JsonProperty("error_count")
    private long errorCount;

    @JsonProperty("average_evaluation_time_ms")
    private double averageEvaluationTimeMs;

    @JsonProperty("last_matched_at")
    private Instant lastMatchedAt;

    @JsonProperty("last_bulk_processed_at")
    private Instant lastBulkProcessedAt;

    public RuleStatistics() {
    }

    public RuleStatistics(String ruleId) {
        this.ruleId = ruleId;
    }

    // ========== Updates ==========

    /**
     * Records one evaluation of the rule's triggers, matched or not. The first sample seeds
     * the moving average.
     */
    public void recordEvaluation(double evaluationTimeMs) {
        double sample = Math.max(0.0, evaluationTimeMs);
        averageEvaluationTimeMs = totalEvaluations == 0
                ? sample
                : averageEvaluationTimeMs * (1 - EVALUATION_TIME_WEIGHT) + sample * EVALUATION_TIME_WEIGHT;
        totalEvaluations++;
    }

    public void recordMatch(Instant at) {
        matchCount++;
        lastMatchedAt = at;
    }

    public void recordError() {
        errorCount++;
    }

    public void recordBulkProcessing(Instant at) {
        lastBulkProcessedAt = at;
    }

    public void reset() {
        matchCount = 0;
        totalEvaluations = 0;
        errorCount = 0;
        averageEvaluationTimeMs = 0.0;
        lastMatchedAt = null;
        lastBulkProcessedAt = null;
    }

    // ========== Derived ==========

    /**
     * Matches per evaluation, 0-100.
     */
    @JsonIgnore
    public double getMatchRatePercentage() {
        return totalEvaluations == 0 ? 0.0 : matchCount * 100.0 / totalEvaluations;
    }

    /**
     * Failed applications among all triggered applications (matches plus errors), 0-100.
     */
    @JsonIgnore
    public double getErrorRatePercentage() {
        long attempts = matchCount + errorCount;
        return attempts == 0 ? 0.0 : errorCount * 100.0 / attempts;
    }

    public boolean isActivelyUsed(Instant now) {
        return lastMatchedAt != null && Duration.between(lastMatchedAt, now).compareTo(ACTIVE_WINDOW) < 0;
    }

    public PerformanceCategory performanceCategory(Instant now) {
        double matchRate = getMatchRatePercentage();
        double errorRate = getErrorRatePercentage();
        if (!isActivelyUsed(now) && matchRate < 1.0) {
            return PerformanceCategory.UNUSED;
        }
        if (averageEvaluationTimeMs > 20.0 || errorRate > 10.0) {
            return PerformanceCategory.NEEDS_OPTIMIZATION;
        }
        if (averageEvaluationTimeMs < 5.0 && errorRate < 1.0 && matchRate > 5.0) {
            return PerformanceCategory.EXCELLENT;
        }
        return PerformanceCategory.GOOD;
    }

    public RuleStatistics copy() {
        RuleStatistics copy = new RuleStatistics(ruleId);
        copy.matchCount = matchCount;
        copy.totalEvaluations = totalEvaluations;
        copy.errorCount = errorCount;
        copy.averageEvaluationTimeMs = averageEvaluationTimeMs;
        copy.lastMatchedAt = lastMatchedAt;
        copy.lastBulkProcessedAt = lastBulkProcessedAt;
        return copy;
    }

    // ========== Accessors ==========

    public String getRuleId() {
        return ruleId;
    }

    public void setRuleId(String ruleId) {
        this.ruleId = ruleId;
    }

    public long getMatchCount() {
        return matchCount;
    }

    public void setMatchCount(long matchCount) {
        this.matchCount = matchCount;
    }

    public long getTotalEvaluations() {
        return totalEvaluations;
    }

    public void setTotalEvaluations(long totalEvaluations) {
        this.totalEvaluations = totalEvaluations;
    }

    public long getErrorCount() {
        return errorCount;
    }

    public void setErrorCount(long errorCount) {
        this.errorCount = errorCount;
    }

    public double getAverageEvaluationTimeMs() {
        return averageEvaluationTimeMs;
    }

    public void setAverageEvaluationTimeMs(double averageEvaluationTimeMs) {
        this.averageEvaluationTimeMs = averageEvaluationTimeMs;
    }

    public Instant getLastMatchedAt() {
        return lastMatchedAt;
    }

    public void setLastMatchedAt(Instant lastMatchedAt) {
        this.lastMatchedAt = lastMatchedAt;
    }

    public Instant getLastBulkProcessedAt() {
        return lastBulkProcessedAt;
    }

    public void setLastBulkProcessedAt(Instant lastBulkProcessedAt) {
        this.lastBulkProcessedAt = lastBulkProcessedAt;
    }

    @Override
    public String toString() {
        return String.format("RuleStatistics{rule=%s, matches=%d/%d, errors=%d, avg=%.2fms}",
                ruleId, matchCount, totalEvaluations, errorCount, averageEvaluationTimeMs);
    }
}
