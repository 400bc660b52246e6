package com.tsgate.service;

/**
 * Thrown when a query ran but produced nothing a value column can be built from.
 */
public class NoDataException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public NoDataException(String message) {
        super(message);
    }
}
