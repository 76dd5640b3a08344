package com.ledger.engine.store;

import com.ledger.engine.domain.Account;
import com.ledger.engine.domain.Category;
import com.ledger.engine.domain.Transaction;

import java.util.Optional;

/**
 * Atomic update scope for one transaction.
 * <p>
 * Actions mutate {@link #workingCopy()} and create categories through this scope. Nothing is
 * visible in the store until {@link #commit()}; {@link #rollback()} or closing an uncommitted
 * unit discards the working copy and every staged category.
 */
public interface UnitOfWork extends AutoCloseable {

    /**
     * Detached copy of the transaction that actions mutate.
     */
    Transaction workingCopy();

    /**
     * Looks up an account by name, ignoring case. Accounts are never created.
     */
    Optional<Account> findAccountByName(String name);

    /**
     * Returns the category with this name (ignoring case), staging a new one if none exists.
     * Repeated calls with the same name within one unit stage at most one category.
     */
    Category findOrCreateCategoryByName(String name);

    /**
     * Writes the working copy onto the transaction and persists staged categories.
     *
     * @throws StoreException if the store rejects the update; nothing is written in that case
     */
    void commit();

    /**
     * Discards the working copy and staged categories.
     */
    void rollback();

    boolean isCommitted();

    /**
     * Rolls back unless already committed.
     */
    @Override
    void close();
}
