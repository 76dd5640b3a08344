package com.ledger.engine.engine;

import com.ledger.engine.action.ExecutionResult;

/**
 * What happened when one rule was evaluated against a transaction.
 *
 * @param ruleId          the rule's id
 * @param ruleName        the rule's name
 * @param matched         whether the rule's trigger group matched
 * @param execution       result of the rule's actions; null when the rule did not match
 * @param stoppedProcessing whether this rule ended evaluation for the transaction
 */
public record RuleOutcome(String ruleId,
                          String ruleName,
                          boolean matched,
                          ExecutionResult execution,
                          boolean stoppedProcessing) {

    static RuleOutcome notMatched(String ruleId, String ruleName) {
        return new RuleOutcome(ruleId, ruleName, false, null, false);
    }

    /**
     * True when the rule matched and its actions were applied.
     */
    public boolean applied() {
        return matched && execution != null && execution.success();
    }

    /**
     * True when the rule matched but its actions were rolled back.
     */
    public boolean failed() {
        return matched && execution != null && !execution.success();
    }
}
