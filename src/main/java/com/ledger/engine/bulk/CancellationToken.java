package com.ledger.engine.bulk;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal, checked by the bulk runner between chunks.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
