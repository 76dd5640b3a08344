package com.ledger.engine.bulk;

/**
 * Receives progress events of a bulk run, on the thread executing the run.
 */
@FunctionalInterface
public interface BulkProgressListener {

    BulkProgressListener NONE = progress -> { };

    void onProgress(BulkProgress progress);
}
