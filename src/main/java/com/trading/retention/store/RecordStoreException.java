package com.trading.retention.store;

/**
 * Runtime exception thrown when the record store cannot serve a query or a delete.
 */
public class RecordStoreException extends RuntimeException {

    public RecordStoreException(String message) {
        super(message);
    }

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
