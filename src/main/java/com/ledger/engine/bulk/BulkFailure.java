package com.ledger.engine.bulk;

/**
 * A transaction that could not be processed during a bulk run.
 *
 * @param transactionId id of the transaction
 * @param kind          failure category
 * @param reason        human-readable reason
 */
public record BulkFailure(String transactionId, Kind kind, String reason) {

    public enum Kind {
        /** A matching rule's actions failed and were rolled back. */
        ACTION,
        /** The store failed while updating the transaction. */
        STORE,
        /** Any other runtime failure. */
        UNEXPECTED
    }

    @Override
    public String toString() {
        return transactionId + " [" + kind + "]: " + reason;
    }
}
