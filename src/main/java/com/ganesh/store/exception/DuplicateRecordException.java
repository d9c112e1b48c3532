package com.ganesh.store.exception;

/**
 * Thrown when inserting a record under a key that is already present in the record index.
 */
public class DuplicateRecordException extends IndexException {

    private final String key;

    public DuplicateRecordException(String key) {
        super("A record already exists for key " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
