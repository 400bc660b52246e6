package com.tsgate.service;

/**
 * Thrown when a query descriptor, its embedded payload or its filter cannot be parsed.
 */
public class MalformedQueryException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     * @param cause parser failure
     */
    public MalformedQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
