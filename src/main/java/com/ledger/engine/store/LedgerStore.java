package com.ledger.engine.store;

import com.ledger.engine.domain.Account;
import com.ledger.engine.domain.Category;
import com.ledger.engine.domain.Rule;
import com.ledger.engine.domain.RuleGroup;
import com.ledger.engine.domain.RuleStatistics;
import com.ledger.engine.domain.Transaction;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Persistence boundary of the rule engine.
 * <p>
 * Single-writer: the engine processes one transaction at a time, each inside its own
 * {@link UnitOfWork}, and never holds a lock across transactions.
 */
public interface LedgerStore {

    /**
     * Finds an account by name, ignoring case.
     */
    Optional<Account> findAccountByName(String name);

    /**
     * Returns the category with this name (ignoring case), creating it if absent.
     */
    Category findOrCreateCategoryByName(String name);

    /**
     * Opens an atomic update scope for one transaction.
     */
    UnitOfWork beginAtomicUpdate(Transaction transaction);

    /**
     * Reads a page of transactions matching the predicate, in a stable order.
     */
    List<Transaction> fetchTransactions(Predicate<Transaction> predicate, int offset, int limit);

    long countTransactions(Predicate<Transaction> predicate);

    /**
     * Persists a rule's match statistic.
     */
    void persistRuleStatistics(Rule rule, long matchCount);

    /**
     * Applies an update to a rule's performance statistics as one read-modify-write,
     * starting from an empty record if the rule has none yet.
     */
    void updateRuleStatistics(String ruleId, Consumer<RuleStatistics> update);

    Optional<RuleStatistics> findRuleStatistics(String ruleId);

    List<RuleStatistics> loadRuleStatistics();

    List<Rule> loadRules();

    List<RuleGroup> loadRuleGroups();
}
