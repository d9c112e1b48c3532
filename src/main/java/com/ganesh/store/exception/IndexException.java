package com.ganesh.store.exception;

/**
 * Thrown when the record index fails to open, read, write or query.
 */
public class IndexException extends StoreException {

    public IndexException(String message) {
        super(message);
    }

    public IndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
