package com.ledger.engine.bulk;

import java.util.concurrent.CompletableFuture;

/**
 * Handle on a bulk run executing in the background.
 */
public class BulkRunHandle {

    private final CancellationToken token;
    private final CompletableFuture<BulkRunSummary> completion;

    BulkRunHandle(CancellationToken token, CompletableFuture<BulkRunSummary> completion) {
        this.token = token;
        this.completion = completion;
    }

    /**
     * Requests cancellation; the run stops after the chunk in progress.
     */
    public void cancel() {
        token.cancel();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    public boolean isDone() {
        return completion.isDone();
    }

    /**
     * Completes with the run's summary, or exceptionally if the run aborted.
     */
    public CompletableFuture<BulkRunSummary> completion() {
        return completion;
    }
}
