package com.ledger.engine.store;

import com.ledger.engine.domain.Account;
import com.ledger.engine.domain.Category;
import com.ledger.engine.domain.Transaction;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Unit of work of {@link InMemoryLedgerStore}: a detached working copy plus staged categories.
 */
class InMemoryUnitOfWork implements UnitOfWork {

    private final InMemoryLedgerStore store;
    private final Transaction target;
    private final Transaction workingCopy;
    private final Map<String, Category> stagedCategories = new LinkedHashMap<>();
    private boolean committed;
    private boolean closed;

    InMemoryUnitOfWork(InMemoryLedgerStore store, Transaction target) {
        this.store = store;
        this.target = target;
        this.workingCopy = target.copy();
    }

    @Override
    public Transaction workingCopy() {
        return workingCopy;
    }

    @Override
    public Optional<Account> findAccountByName(String name) {
        return store.findAccountByName(name);
    }

    @Override
    public Category findOrCreateCategoryByName(String name) {
        ensureOpen();
        if (name == null || name.isBlank()) {
            throw new StoreException("Category name must not be blank");
        }
        String key = InMemoryLedgerStore.key(name);
        Optional<Category> existing = store.findCategory(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        return stagedCategories.computeIfAbsent(key, k -> new Category(name.trim()));
    }

    @Override
    public void commit() {
        ensureOpen();
        store.write(target, workingCopy, stagedCategories.values());
        committed = true;
        closed = true;
    }

    @Override
    public void rollback() {
        stagedCategories.clear();
        workingCopy.restoreFrom(target);
        closed = true;
    }

    @Override
    public boolean isCommitted() {
        return committed;
    }

    @Override
    public void close() {
        if (!closed) {
            rollback();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new StoreException("Unit of work for transaction " + target.getId() + " is already closed");
        }
    }
}
