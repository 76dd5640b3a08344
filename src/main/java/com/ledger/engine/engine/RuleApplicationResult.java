package com.ledger.engine.engine;

import com.ledger.engine.domain.Transaction;

import java.util.List;

/**
 * Result of running a rule list against one transaction.
 *
 * @param transactionId  id of the transaction
 * @param outcomes       one entry per evaluated rule, in evaluation order
 * @param stoppedEarly   whether a matching {@code stopProcessing} rule ended evaluation
 * @param stoppedByRuleId id of that rule, or null
 * @param finalState     the transaction state after all rules; in a preview the state that
 *                       would have been committed
 */
public record RuleApplicationResult(String transactionId,
                                    List<RuleOutcome> outcomes,
                                    boolean stoppedEarly,
                                    String stoppedByRuleId,
                                    Transaction finalState) {

    public RuleApplicationResult {
        outcomes = List.copyOf(outcomes);
    }

    public List<RuleOutcome> matchedRules() {
        return outcomes.stream().filter(RuleOutcome::matched).toList();
    }

    public List<RuleOutcome> failedRules() {
        return outcomes.stream().filter(RuleOutcome::failed).toList();
    }

    public boolean anyMatched() {
        return outcomes.stream().anyMatch(RuleOutcome::matched);
    }

    /**
     * True when no matching rule had its actions rolled back.
     */
    public boolean success() {
        return outcomes.stream().noneMatch(RuleOutcome::failed);
    }

    /**
     * First action failure message, for bulk failure reports.
     */
    public String failureMessage() {
        return failedRules().stream()
                .findFirst()
                .map(o -> "Rule '" + o.ruleName() + "': " + o.execution().failureMessage())
                .orElse(null);
    }
}
