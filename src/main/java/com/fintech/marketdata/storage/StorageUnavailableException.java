package com.fintech.marketdata.storage;

/**
 * Raised by {@link MarketDataStoreFactory#open} when the store cannot be
 * initialised: the directory is unwritable, the lock is held elsewhere, or the
 * engine failed to open its data file.
 */
public class StorageUnavailableException extends Exception {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
