package com.ledger.engine.engine;

import com.ledger.engine.action.ActionExecutor;
import com.ledger.engine.action.ExecutionResult;
import com.ledger.engine.config.EngineConfig;
import com.ledger.engine.domain.Rule;
import com.ledger.engine.domain.RuleStatistics;
import com.ledger.engine.domain.Transaction;
import com.ledger.engine.store.LedgerStore;
import com.ledger.engine.store.StoreException;
import com.ledger.engine.util.EngineMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Runs rules against one transaction.
 *
 * <p>Active rules are evaluated in ascending priority (ties keep their list order). Each
 * matching rule's actions are applied atomically; on success its match count is incremented
 * and persisted. Every evaluation also updates the rule's {@link RuleStatistics} in the store
 * (evaluation time, match or action failure). A matching rule with {@code stopProcessing}
 * ends evaluation for the transaction whether or not its actions succeeded. No state is kept
 * between calls.
 */
@ApplicationScoped
public class RuleEngine {

    private static final Logger LOG = Logger.getLogger(RuleEngine.class);

    @Inject
    TriggerGroupEvaluator groupEvaluator;

    @Inject
    ActionExecutor actionExecutor;

    @Inject
    LedgerStore store;

    @Inject
    EngineConfig config;

    @Inject
    EngineMetrics metrics;

    Clock clock = Clock.systemUTC();

    public RuleEngine() {
    }

    public RuleEngine(TriggerGroupEvaluator groupEvaluator, ActionExecutor actionExecutor,
                      LedgerStore store, EngineConfig config, EngineMetrics metrics) {
        this.groupEvaluator = groupEvaluator;
        this.actionExecutor = actionExecutor;
        this.store = store;
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Active rules in evaluation order.
     */
    public static List<Rule> orderForEvaluation(List<Rule> rules) {
        if (rules == null) {
            return List.of();
        }
        return rules.stream()
                .filter(rule -> rule != null && rule.isActive())
                .sorted(Comparator.comparingInt(Rule::getPriority))
                .toList();
    }

    /**
     * Applies the active rules to the transaction and commits each matching rule's actions.
     *
     * @throws StoreException if the store fails while applying actions
     */
    public RuleApplicationResult apply(List<Rule> rules, Transaction tx) {
        return run(orderForEvaluation(rules), tx, false);
    }

    /**
     * Applies one rule regardless of its active flag.
     */
    public RuleApplicationResult applySingle(Rule rule, Transaction tx) {
        return run(rule == null ? List.of() : List.of(rule), tx, false);
    }

    /**
     * Evaluates the active rules without changing the transaction or the store. Later rules
     * see the state earlier matching rules would have produced. Match counts are not touched.
     */
    public RuleApplicationResult preview(List<Rule> rules, Transaction tx) {
        return run(orderForEvaluation(rules), tx, true);
    }

    private RuleApplicationResult run(List<Rule> ordered, Transaction tx, boolean dryRun) {
        List<RuleOutcome> outcomes = new ArrayList<>(ordered.size());
        Transaction current = dryRun ? tx.copy() : tx;
        String stoppedBy = null;

        for (Rule rule : ordered) {
            metrics.incrementRulesEvaluated();
            long startNanos = System.nanoTime();
            boolean matched = groupEvaluator.evaluateGroup(rule.getTriggerGroup(), current);
            double evaluationMs = (System.nanoTime() - startNanos) / 1_000_000.0;
            if (!matched) {
                if (!dryRun) {
                    recordStatistics(rule, false, false, evaluationMs);
                }
                outcomes.add(RuleOutcome.notMatched(rule.getId(), rule.getName()));
                continue;
            }
            metrics.incrementRulesMatched();

            ExecutionResult execution = dryRun
                    ? actionExecutor.preview(rule.getActions(), current)
                    : actionExecutor.execute(rule.getActions(), current);

            if (execution.success()) {
                if (dryRun) {
                    current = execution.resultingState();
                }
            } else {
                LOG.debugf("Rule %s matched transaction %s but its actions were rolled back: %s",
                        rule.getId(), tx.getId(), execution.failureMessage());
            }
            if (!dryRun) {
                recordStatistics(rule, true, execution.success(), evaluationMs);
            }

            boolean stop = rule.isStopProcessing();
            outcomes.add(new RuleOutcome(rule.getId(), rule.getName(), true, execution, stop));
            if (stop) {
                metrics.incrementStopProcessing();
                stoppedBy = rule.getId();
                break;
            }
        }

        return new RuleApplicationResult(tx.getId(), outcomes, stoppedBy != null, stoppedBy,
                dryRun ? current : tx.copy());
    }

    /**
     * Stamps the last bulk run on the statistics of every rule that took part in it.
     */
    public void recordBulkProcessed(Collection<Rule> rules) {
        if (!config.persistStatistics || rules == null) {
            return;
        }
        Instant now = clock.instant();
        for (Rule rule : rules) {
            if (rule == null) {
                continue;
            }
            try {
                store.updateRuleStatistics(rule.getId(), statistics -> statistics.recordBulkProcessing(now));
            } catch (StoreException e) {
                metrics.incrementStatisticsPersistFailure();
                LOG.warnf(e, "Failed to record bulk run for rule %s", rule.getId());
            }
        }
    }

    // One failure counter increment per rule outcome, however many writes fail.
    private void recordStatistics(Rule rule, boolean matched, boolean applied, double evaluationMs) {
        Instant now = clock.instant();
        long matchCount = matched && applied ? rule.recordMatch(now) : -1;
        if (!config.persistStatistics) {
            return;
        }
        try {
            if (matchCount >= 0) {
                store.persistRuleStatistics(rule, matchCount);
            }
            store.updateRuleStatistics(rule.getId(), statistics -> {
                statistics.recordEvaluation(evaluationMs);
                if (matched && applied) {
                    statistics.recordMatch(now);
                } else if (matched) {
                    statistics.recordError();
                }
            });
        } catch (StoreException e) {
            metrics.incrementStatisticsPersistFailure();
            LOG.warnf(e, "Failed to persist statistics for rule %s", rule.getId());
        }
    }
}
