package com.ledger.engine.service;

import com.ledger.engine.domain.Rule;
import com.ledger.engine.domain.RuleStatistics;
import com.ledger.engine.domain.RuleStatistics.PerformanceCategory;
import com.ledger.engine.store.LedgerStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only queries over rule statistics: busiest rules, rules that never match and rules
 * that are slow or keep failing. Stored rules that were never evaluated are reported with
 * empty statistics.
 */
@ApplicationScoped
public class RuleStatisticsAnalyzer {

    private static final Logger LOG = Logger.getLogger(RuleStatisticsAnalyzer.class);

    @Inject
    LedgerStore store;

    Clock clock = Clock.systemUTC();

    public RuleStatisticsAnalyzer() {
    }

    public RuleStatisticsAnalyzer(LedgerStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Statistics of every known rule, most matches first.
     */
    public List<RuleStatistics> allStatistics() {
        Map<String, RuleStatistics> byRule = new LinkedHashMap<>();
        for (RuleStatistics statistics : store.loadRuleStatistics()) {
            byRule.put(statistics.getRuleId(), statistics);
        }
        for (Rule rule : store.loadRules()) {
            byRule.computeIfAbsent(rule.getId(), RuleStatistics::new);
        }
        List<RuleStatistics> all = new ArrayList<>(byRule.values());
        all.sort(Comparator.comparingLong(RuleStatistics::getMatchCount).reversed());
        return all;
    }

    public List<RuleStatistics> topPerformingRules(int limit) {
        List<RuleStatistics> all = allStatistics();
        return all.subList(0, Math.min(Math.max(0, limit), all.size()));
    }

    public List<RuleStatistics> rulesNeedingOptimization() {
        return inCategory(PerformanceCategory.NEEDS_OPTIMIZATION);
    }

    /**
     * Candidates for removal.
     */
    public List<RuleStatistics> unusedRules() {
        return inCategory(PerformanceCategory.UNUSED);
    }

    public RulePerformanceSummary performanceSummary() {
        Instant now = clock.instant();
        List<RuleStatistics> all = allStatistics();
        Map<PerformanceCategory, Integer> counts = new LinkedHashMap<>();
        long matches = 0;
        long evaluations = 0;
        long errors = 0;
        double averageTimeSum = 0.0;
        for (RuleStatistics statistics : all) {
            counts.merge(statistics.performanceCategory(now), 1, Integer::sum);
            matches += statistics.getMatchCount();
            evaluations += statistics.getTotalEvaluations();
            errors += statistics.getErrorCount();
            averageTimeSum += statistics.getAverageEvaluationTimeMs();
        }
        RulePerformanceSummary summary = new RulePerformanceSummary(
                all.size(),
                counts.getOrDefault(PerformanceCategory.EXCELLENT, 0),
                counts.getOrDefault(PerformanceCategory.GOOD, 0),
                counts.getOrDefault(PerformanceCategory.NEEDS_OPTIMIZATION, 0),
                counts.getOrDefault(PerformanceCategory.UNUSED, 0),
                matches,
                evaluations,
                errors,
                averageTimeSum / Math.max(all.size(), 1),
                evaluations > 0 ? matches * 100.0 / evaluations : 0.0,
                matches + errors > 0 ? errors * 100.0 / (matches + errors) : 0.0);
        LOG.debugf("Rule performance: %d rules, %d unused, %d need optimization",
                summary.totalRules(), summary.unusedRules(), summary.needsOptimization());
        return summary;
    }

    private List<RuleStatistics> inCategory(PerformanceCategory category) {
        Instant now = clock.instant();
        return allStatistics().stream()
                .filter(statistics -> statistics.performanceCategory(now) == category)
                .toList();
    }
}
