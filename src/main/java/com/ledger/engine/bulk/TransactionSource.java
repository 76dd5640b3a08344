package com.ledger.engine.bulk;

import com.ledger.engine.domain.Transaction;
import com.ledger.engine.store.LedgerStore;

import java.util.List;
import java.util.function.Predicate;

/**
 * Chunked supply of transactions for a bulk run.
 */
public interface TransactionSource {

    /**
     * Returns up to {@code size} transactions starting at {@code offset}; an empty list
     * ends the run.
     */
    List<Transaction> chunk(int offset, int size);

    /**
     * Number of transactions in the source, or -1 if unknown.
     */
    long size();

    /**
     * Source over an explicit list, chunked with sub-list views.
     */
    static TransactionSource of(List<Transaction> transactions) {
        List<Transaction> list = transactions != null ? transactions : List.of();
        return new TransactionSource() {
            @Override
            public List<Transaction> chunk(int offset, int size) {
                if (offset >= list.size()) {
                    return List.of();
                }
                return list.subList(offset, Math.min(list.size(), offset + size));
            }

            @Override
            public long size() {
                return list.size();
            }
        };
    }

    /**
     * Source paging through the store. The predicate should not depend on fields the
     * applied rules change, otherwise offset paging skips or repeats transactions.
     */
    static TransactionSource fromStore(LedgerStore store, Predicate<Transaction> predicate) {
        return new TransactionSource() {
            @Override
            public List<Transaction> chunk(int offset, int size) {
                return store.fetchTransactions(predicate, offset, size);
            }

            @Override
            public long size() {
                return store.countTransactions(predicate);
            }
        };
    }
}
