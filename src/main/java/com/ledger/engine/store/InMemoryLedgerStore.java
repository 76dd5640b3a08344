package com.ledger.engine.store;

import com.ledger.engine.domain.Account;
import com.ledger.engine.domain.Category;
import com.ledger.engine.domain.Rule;
import com.ledger.engine.domain.RuleGroup;
import com.ledger.engine.domain.RuleStatistics;
import com.ledger.engine.domain.Transaction;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-memory ledger store for tests, simulation and embedded use.
 * <p>
 * Transactions are kept in insertion order, so offset paging is stable as long as the
 * paging predicate is not affected by the actions being applied. Failure hooks let tests
 * make commits or statistic writes fail.
 */
@ApplicationScoped
public class InMemoryLedgerStore implements LedgerStore {

    private static final Logger LOG = Logger.getLogger(InMemoryLedgerStore.class);

    private final Map<String, Account> accounts = new LinkedHashMap<>();
    private final Map<String, Category> categories = new LinkedHashMap<>();
    private final List<Transaction> transactions = new ArrayList<>();
    private final Map<String, Rule> rules = new LinkedHashMap<>();
    private final Map<String, RuleGroup> ruleGroups = new LinkedHashMap<>();
    private final Map<String, Long> ruleStatistics = new LinkedHashMap<>();
    private final Map<String, RuleStatistics> rulePerformance = new LinkedHashMap<>();

    private volatile Predicate<Transaction> commitFailure = tx -> false;
    private volatile boolean failStatistics;

    // ========== Accounts & categories ==========

    public synchronized InMemoryLedgerStore addAccount(Account account) {
        accounts.put(key(account.getName()), account);
        return this;
    }

    @Override
    public synchronized Optional<Account> findAccountByName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(accounts.get(key(name)));
    }

    @Override
    public synchronized Category findOrCreateCategoryByName(String name) {
        if (name == null || name.isBlank()) {
            throw new StoreException("Category name must not be blank");
        }
        return categories.computeIfAbsent(key(name), k -> {
            LOG.debugf("Created category '%s'", name.trim());
            return new Category(name.trim());
        });
    }

    synchronized Optional<Category> findCategory(String name) {
        return Optional.ofNullable(categories.get(key(name)));
    }

    synchronized void insertCategories(Collection<Category> staged) {
        for (Category category : staged) {
            categories.putIfAbsent(key(category.name()), category);
        }
    }

    public synchronized List<Category> getCategories() {
        return List.copyOf(categories.values());
    }

    // ========== Transactions ==========

    public synchronized InMemoryLedgerStore addTransaction(Transaction transaction) {
        transactions.add(transaction);
        return this;
    }

    public synchronized InMemoryLedgerStore addTransactions(Collection<Transaction> batch) {
        transactions.addAll(batch);
        return this;
    }

    @Override
    public synchronized UnitOfWork beginAtomicUpdate(Transaction transaction) {
        if (transaction == null) {
            throw new StoreException("Cannot begin an update without a transaction");
        }
        return new InMemoryUnitOfWork(this, transaction);
    }

    @Override
    public synchronized List<Transaction> fetchTransactions(Predicate<Transaction> predicate, int offset, int limit) {
        if (offset < 0 || limit <= 0) {
            return List.of();
        }
        Predicate<Transaction> filter = predicate != null ? predicate : tx -> true;
        List<Transaction> page = new ArrayList<>(Math.min(limit, transactions.size()));
        int skipped = 0;
        for (Transaction tx : transactions) {
            if (!filter.test(tx)) {
                continue;
            }
            if (skipped < offset) {
                skipped++;
                continue;
            }
            page.add(tx);
            if (page.size() == limit) {
                break;
            }
        }
        return page;
    }

    @Override
    public synchronized long countTransactions(Predicate<Transaction> predicate) {
        Predicate<Transaction> filter = predicate != null ? predicate : tx -> true;
        return transactions.stream().filter(filter).count();
    }

    synchronized void write(Transaction target, Transaction workingCopy, Collection<Category> stagedCategories) {
        if (commitFailure.test(workingCopy)) {
            throw new StoreException("Commit rejected for transaction " + workingCopy.getId());
        }
        insertCategories(stagedCategories);
        target.restoreFrom(workingCopy);
    }

    // ========== Rules ==========

    public synchronized InMemoryLedgerStore saveRule(Rule rule) {
        rules.put(rule.getId(), rule);
        return this;
    }

    public synchronized InMemoryLedgerStore saveRuleGroup(RuleGroup group) {
        ruleGroups.put(group.getId(), group);
        return this;
    }

    /**
     * Deletes a group; its rules stay and become ungrouped.
     */
    public synchronized void deleteRuleGroup(String groupId) {
        if (ruleGroups.remove(groupId) == null) {
            return;
        }
        for (Rule rule : rules.values()) {
            if (groupId.equals(rule.getGroupId())) {
                rule.setGroupId(null);
            }
        }
    }

    @Override
    public synchronized List<Rule> loadRules() {
        return List.copyOf(rules.values());
    }

    @Override
    public synchronized List<RuleGroup> loadRuleGroups() {
        return List.copyOf(ruleGroups.values());
    }

    @Override
    public synchronized void persistRuleStatistics(Rule rule, long matchCount) {
        if (failStatistics) {
            throw new StoreException("Statistics write rejected for rule " + rule.getId());
        }
        ruleStatistics.put(rule.getId(), matchCount);
    }

    public synchronized Optional<Long> getPersistedMatchCount(String ruleId) {
        return Optional.ofNullable(ruleStatistics.get(ruleId));
    }

    @Override
    public synchronized void updateRuleStatistics(String ruleId, Consumer<RuleStatistics> update) {
        if (failStatistics) {
            throw new StoreException("Statistics write rejected for rule " + ruleId);
        }
        RuleStatistics current = rulePerformance.get(ruleId);
        RuleStatistics working = current != null ? current.copy() : new RuleStatistics(ruleId);
        update.accept(working);
        rulePerformance.put(ruleId, working);
    }

    @Override
    public synchronized Optional<RuleStatistics> findRuleStatistics(String ruleId) {
        RuleStatistics statistics = rulePerformance.get(ruleId);
        return statistics != null ? Optional.of(statistics.copy()) : Optional.empty();
    }

    @Override
    public synchronized List<RuleStatistics> loadRuleStatistics() {
        return rulePerformance.values().stream().map(RuleStatistics::copy).toList();
    }

    // ========== Failure hooks ==========

    /**
     * Makes commits fail for working copies matching the predicate.
     */
    public void failCommitsWhen(Predicate<Transaction> predicate) {
        this.commitFailure = predicate != null ? predicate : tx -> false;
    }

    public void failStatisticsWrites(boolean fail) {
        this.failStatistics = fail;
    }

    static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
