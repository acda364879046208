package com.example.scvl.exception;

/**
 * A read or write against the durable store failed. The operation is aborted; since the store is
 * written before the cache, no partial mutation is visible.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
