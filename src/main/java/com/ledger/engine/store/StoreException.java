package com.ledger.engine.store;

/**
 * Failure of the underlying ledger store (I/O, constraint violation).
 * Fatal for the transaction being processed; bulk runs record it and continue.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
