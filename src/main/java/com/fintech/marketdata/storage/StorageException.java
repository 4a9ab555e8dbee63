package com.fintech.marketdata.storage;

/**
 * Raised when a single read or write against the store fails.
 * Callers on the ingestion path log, count and continue.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
