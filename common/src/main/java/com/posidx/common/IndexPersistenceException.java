package com.posidx.common;

/**
 * Raised when the relational store cannot be read or written.
 */
public class IndexPersistenceException extends Exception {
    private static final long serialVersionUID = 1L;

    public IndexPersistenceException(String message) {
        super(message);
    }

    public IndexPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
