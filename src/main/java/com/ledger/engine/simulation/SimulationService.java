package com.ledger.engine.simulation;

import com.ledger.engine.action.ActionOutcome;
import com.ledger.engine.catalog.RuleCatalog;
import com.ledger.engine.catalog.RuleCatalogParser;
import com.ledger.engine.catalog.RuleCatalogParser.InvalidCatalogException;
import com.ledger.engine.config.EngineConfig;
import com.ledger.engine.domain.Rule;
import com.ledger.engine.domain.RuleFormatter;
import com.ledger.engine.domain.Transaction;
import com.ledger.engine.engine.RuleApplicationResult;
import com.ledger.engine.engine.RuleEngine;
import com.ledger.engine.engine.RuleOutcome;
import com.ledger.engine.store.StoreException;
import com.ledger.engine.util.EngineMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Dry-runs a rule catalog against a transaction.
 * <p>
 * Unlike normal application:
 * <ul>
 *   <li>Nothing is committed (the transaction and the store stay untouched)</li>
 *   <li>Match counts are not incremented</li>
 *   <li>Every matched rule is explained, together with the resulting field changes</li>
 * </ul>
 */
@ApplicationScoped
public class SimulationService {

    private static final Logger LOG = Logger.getLogger(SimulationService.class);

    private static final Map<String, Function<Transaction, Object>> TRACKED_FIELDS = trackedFields();

    @Inject
    RuleEngine ruleEngine;

    @Inject
    RuleCatalogParser catalogParser;

    @Inject
    EngineConfig config;

    @Inject
    EngineMetrics metrics;

    public SimulationService() {
    }

    public SimulationService(RuleEngine ruleEngine, RuleCatalogParser catalogParser,
                             EngineConfig config, EngineMetrics metrics) {
        this.ruleEngine = ruleEngine;
        this.catalogParser = catalogParser;
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Simulates an inline catalog against a transaction given as YAML or JSON.
     */
    public SimulationResult simulate(String catalogYaml, String transactionYaml) {
        ensureEnabled();
        return simulate(catalogParser.parse(catalogYaml), catalogParser.parseTransaction(transactionYaml));
    }

    /**
     * Simulates an inline catalog against a transaction.
     *
     * @throws InvalidCatalogException if the catalog cannot be parsed
     * @throws SimulationException     if the simulation fails for any other reason
     */
    public SimulationResult simulate(String catalogYaml, Transaction transaction) {
        ensureEnabled();
        return simulate(catalogParser.parse(catalogYaml), transaction);
    }

    public SimulationResult simulate(RuleCatalog catalog, Transaction transaction) {
        ensureEnabled();
        if (transaction == null) {
            throw new SimulationException("Transaction is required");
        }
        long startTime = System.currentTimeMillis();
        try {
            List<Rule> rules = catalog.activeRules();
            RuleApplicationResult preview = ruleEngine.preview(rules, transaction);
            metrics.incrementSimulation();
            return buildSimulationResult(transaction, catalog, preview, System.currentTimeMillis() - startTime);
        } catch (StoreException e) {
            LOG.errorf(e, "Simulation failed for transaction %s", transaction.getId());
            throw new SimulationException("Simulation failed: " + e.getMessage(), e);
        }
    }

    private void ensureEnabled() {
        if (!config.simulationEnabled) {
            throw new SimulationException("Simulation is disabled");
        }
    }

    private SimulationResult buildSimulationResult(Transaction original, RuleCatalog catalog,
                                                   RuleApplicationResult preview, long elapsedMs) {
        SimulationResult result = new SimulationResult();
        result.setTransactionId(original.getId());
        result.setRulesEvaluated(preview.outcomes().size());
        result.setEvaluatedAt(Instant.now());
        result.setEvaluationTimeMs(elapsedMs);
        result.setStoppedByRuleId(preview.stoppedByRuleId());
        result.setResultingState(preview.finalState());
        result.setChanges(diff(original, preview.finalState()));

        List<String> explanations = new ArrayList<>();
        List<String> matched = new ArrayList<>();
        for (RuleOutcome outcome : preview.matchedRules()) {
            matched.add(outcome.ruleId());
            Rule rule = catalog.findRule(outcome.ruleId()).orElse(null);
            explanations.add(buildRuleExplanation(outcome, rule));
        }
        result.setMatchedRuleIds(matched);
        result.setExplanations(explanations);
        result.setExplanation(buildPrimaryExplanation(preview, explanations));
        return result;
    }

    private String buildRuleExplanation(RuleOutcome outcome, Rule rule) {
        StringBuilder sb = new StringBuilder();
        sb.append("Rule '").append(outcome.ruleName()).append("' matched");
        if (rule != null) {
            sb.append(": ").append(RuleFormatter.summarize(rule));
        }
        if (outcome.failed()) {
            sb.append(" -> rolled back: ").append(outcome.execution().failureMessage());
        } else if (outcome.execution() != null) {
            long skipped = outcome.execution().outcomes().stream()
                    .filter(o -> o.status() == ActionOutcome.Status.SKIPPED)
                    .count();
            sb.append(" -> ").append(outcome.execution().appliedCount()).append(" action(s) applied");
            if (skipped > 0) {
                sb.append(", ").append(skipped).append(" skipped");
            }
        }
        if (outcome.stoppedProcessing()) {
            sb.append(", stopped further rules");
        }
        return sb.toString();
    }

    private String buildPrimaryExplanation(RuleApplicationResult preview, List<String> explanations) {
        if (explanations.isEmpty()) {
            return "No rules matched - transaction unchanged";
        }
        if (!preview.success()) {
            return preview.failureMessage();
        }
        return String.format("%d rule(s) matched, first: %s", explanations.size(), explanations.get(0));
    }

    private static Map<String, String> diff(Transaction before, Transaction after) {
        Map<String, String> changes = new LinkedHashMap<>();
        TRACKED_FIELDS.forEach((name, getter) -> {
            Object old = getter.apply(before);
            Object now = getter.apply(after);
            if (!Objects.equals(old, now)) {
                changes.put(name, old + " -> " + now);
            }
        });
        return changes;
    }

    private static Map<String, Function<Transaction, Object>> trackedFields() {
        Map<String, Function<Transaction, Object>> fields = new LinkedHashMap<>();
        fields.put("description", Transaction::getDescription);
        fields.put("notes", Transaction::getNotes);
        fields.put("category", Transaction::getEffectiveCategory);
        fields.put("amount", tx -> tx.getAmount() == null ? null : tx.getAmount().stripTrailingZeros().toPlainString());
        fields.put("transaction_type", Transaction::getTransactionType);
        fields.put("account", tx -> tx.getAccount() == null ? null : tx.getAccount().getName());
        fields.put("iban", Transaction::getIban);
        fields.put("counter_party", Transaction::getCounterName);
        fields.put("date", Transaction::getDate);
        return fields;
    }

    /**
     * Simulation result.
     */
    public static class SimulationResult {
        private String transactionId;
        private int rulesEvaluated;
        private List<String> matchedRuleIds = new ArrayList<>();
        private String stoppedByRuleId;
        private List<String> explanations = new ArrayList<>();
        private String explanation;
        private Map<String, String> changes = new LinkedHashMap<>();
        private Transaction resultingState;
        private Instant evaluatedAt;
        private long evaluationTimeMs;

        public String getTransactionId() {
            return transactionId;
        }

        public void setTransactionId(String transactionId) {
            this.transactionId = transactionId;
        }

        public int getRulesEvaluated() {
            return rulesEvaluated;
        }

        public void setRulesEvaluated(int rulesEvaluated) {
            this.rulesEvaluated = rulesEvaluated;
        }

        public List<String> getMatchedRuleIds() {
            return matchedRuleIds;
        }

        public void setMatchedRuleIds(List<String> matchedRuleIds) {
            this.matchedRuleIds = matchedRuleIds;
        }

        public String getStoppedByRuleId() {
            return stoppedByRuleId;
        }

        public void setStoppedByRuleId(String stoppedByRuleId) {
            this.stoppedByRuleId = stoppedByRuleId;
        }

        public List<String> getExplanations() {
            return explanations;
        }

        public void setExplanations(List<String> explanations) {
            this.explanations = explanations;
        }

        public String getExplanation() {
            return explanation;
        }

        public void setExplanation(String explanation) {
            this.explanation = explanation;
        }

        public Map<String, String> getChanges() {
            return changes;
        }

        public void setChanges(Map<String, String> changes) {
            this.changes = changes;
        }

        public Transaction getResultingState() {
            return resultingState;
        }

        public void setResultingState(Transaction resultingState) {
            this.resultingState = resultingState;
        }

        public Instant getEvaluatedAt() {
            return evaluatedAt;
        }

        public void setEvaluatedAt(Instant evaluatedAt) {
            this.evaluatedAt = evaluatedAt;
        }

        public long getEvaluationTimeMs() {
            return evaluationTimeMs;
        }

        public void setEvaluationTimeMs(long evaluationTimeMs) {
            this.evaluationTimeMs = evaluationTimeMs;
        }
    }

    /**
     * Exception for simulation errors.
     */
    public static class SimulationException extends RuntimeException {
        public SimulationException(String message) {
            super(message);
        }

        public SimulationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
