package com.tsgate.store;

/**
 * Thrown when the backing store cannot be reached or rejects an operation.
 */
public class StoreUnavailableException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     * @param cause driver failure
     */
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
