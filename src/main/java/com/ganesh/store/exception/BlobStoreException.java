package com.ganesh.store.exception;

import java.io.IOException;

/**
 * Thrown when a blob file or one of the store directories cannot be created, read, written or
 * removed. The underlying {@link IOException} is always the cause.
 */
public class BlobStoreException extends StoreException {

    public BlobStoreException(String message, IOException cause) {
        super(message, cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
