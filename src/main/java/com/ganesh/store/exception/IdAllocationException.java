package com.ganesh.store.exception;

/**
 * Thrown when no free Item ID could be found within the configured number of attempts.
 */
public class IdAllocationException extends StoreException {

    private final int attempts;

    public IdAllocationException(int attempts) {
        super("Failed to allocate an Item ID after " + attempts + " attempts");
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
