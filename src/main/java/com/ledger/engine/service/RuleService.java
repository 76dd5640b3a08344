package com.ledger.engine.service;

import com.ledger.engine.bulk.BulkProgressListener;
import com.ledger.engine.bulk.BulkRuleRunner;
import com.ledger.engine.bulk.BulkRunHandle;
import com.ledger.engine.bulk.BulkRunSummary;
import com.ledger.engine.bulk.CancellationToken;
import com.ledger.engine.bulk.TransactionSource;
import com.ledger.engine.catalog.RuleCatalog;
import com.ledger.engine.domain.Rule;
import com.ledger.engine.domain.RuleValidator;
import com.ledger.engine.domain.Transaction;
import com.ledger.engine.domain.TriggerGroup;
import com.ledger.engine.engine.TriggerGroupEvaluator;
import com.ledger.engine.store.LedgerStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.function.Predicate;

/**
 * Entry point for callers of the rule engine: live match previews, single-rule and
 * all-rules application, and rule validation.
 */
@ApplicationScoped
public class RuleService {

    private static final Logger LOG = Logger.getLogger(RuleService.class);

    private static final Predicate<Transaction> ALL_TRANSACTIONS = tx -> true;

    @Inject
    TriggerGroupEvaluator groupEvaluator;

    @Inject
    BulkRuleRunner bulkRunner;

    @Inject
    LedgerStore store;

    public RuleService() {
    }

    public RuleService(TriggerGroupEvaluator groupEvaluator, BulkRuleRunner bulkRunner, LedgerStore store) {
        this.groupEvaluator = groupEvaluator;
        this.bulkRunner = bulkRunner;
        this.store = store;
    }

    public boolean evaluateTriggerGroup(TriggerGroup group, Transaction tx) {
        return groupEvaluator.evaluateGroup(group, tx);
    }

    /**
     * Number of transactions the group matches, for "N transactions match" previews.
     */
    public long countMatches(TriggerGroup group, List<Transaction> transactions) {
        if (transactions == null) {
            return 0;
        }
        return transactions.stream().filter(tx -> groupEvaluator.evaluateGroup(group, tx)).count();
    }

    /**
     * Number of stored transactions the group matches.
     */
    public long countMatches(TriggerGroup group) {
        return store.countTransactions(tx -> groupEvaluator.evaluateGroup(group, tx));
    }

    /**
     * Applies one rule to the transactions, whether or not the rule is active.
     */
    public BulkRunSummary applyRule(Rule rule, List<Transaction> transactions) {
        return applyRule(rule, transactions, BulkProgressListener.NONE, new CancellationToken());
    }

    public BulkRunSummary applyRule(Rule rule, List<Transaction> transactions,
                                    BulkProgressListener listener, CancellationToken token) {
        return bulkRunner.runSingle(rule, TransactionSource.of(transactions), listener, token);
    }

    /**
     * Applies every active rule of an active (or no) group to the transactions, e.g. right
     * after an import.
     */
    public BulkRunSummary applyAllActiveRules(List<Transaction> transactions) {
        return applyAllActiveRules(transactions, BulkProgressListener.NONE, new CancellationToken());
    }

    public BulkRunSummary applyAllActiveRules(List<Transaction> transactions,
                                              BulkProgressListener listener, CancellationToken token) {
        return bulkRunner.run(activeRules(), TransactionSource.of(transactions), listener, token);
    }

    /**
     * Applies every active rule to all stored transactions.
     */
    public BulkRunSummary applyAllActiveRules() {
        return bulkRunner.run(activeRules(), TransactionSource.fromStore(store, ALL_TRANSACTIONS),
                BulkProgressListener.NONE, new CancellationToken());
    }

    /**
     * Starts applying every active rule to all stored transactions in the background.
     */
    public BulkRunHandle startApplyAllActiveRules(BulkProgressListener listener) {
        return bulkRunner.submit(activeRules(), TransactionSource.fromStore(store, ALL_TRANSACTIONS), listener);
    }

    /**
     * Starts applying one rule to all stored transactions in the background.
     */
    public BulkRunHandle startApplyRule(Rule rule, BulkProgressListener listener) {
        return bulkRunner.submitSingle(rule, TransactionSource.fromStore(store, ALL_TRANSACTIONS), listener);
    }

    public List<RuleValidator.Issue> validate(Rule rule) {
        return RuleValidator.validate(rule);
    }

    /**
     * Stored rules that are active and not in an inactive group.
     */
    public List<Rule> activeRules() {
        RuleCatalog catalog = new RuleCatalog(store.loadRuleGroups(), store.loadRules());
        List<Rule> rules = catalog.activeRules();
        LOG.debugf("Loaded %d active rules out of %d", rules.size(), catalog.getRules().size());
        return rules;
    }
}
