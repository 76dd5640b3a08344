package com.ledger.engine.service;

/**
 * Aggregate view over the statistics of all rules.
 *
 * @param totalRules              rules with statistics, plus stored rules never evaluated
 * @param excellentRules          rules in the excellent category
 * @param goodRules               rules in the good category
 * @param needsOptimization       slow or error-prone rules
 * @param unusedRules             rules that practically never match
 * @param totalMatches            matches across all rules
 * @param totalEvaluations        evaluations across all rules
 * @param totalErrors             action failures across all rules
 * @param averageEvaluationTimeMs mean of the per-rule average evaluation times
 * @param overallMatchRate        matches per evaluation, 0-100
 * @param overallErrorRate        failures per triggered application, 0-100
 */
public record RulePerformanceSummary(int totalRules,
                                     int excellentRules,
                                     int goodRules,
                                     int needsOptimization,
                                     int unusedRules,
                                     long totalMatches,
                                     long totalEvaluations,
                                     long totalErrors,
                                     double averageEvaluationTimeMs,
                                     double overallMatchRate,
                                     double overallErrorRate) {
}
