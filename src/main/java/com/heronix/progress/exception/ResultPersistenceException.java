package com.heronix.progress.exception;

/**
 * Exception thrown when an evaluation result cannot be stored.
 */
public class ResultPersistenceException extends RuntimeException {

    public ResultPersistenceException(String message) {
        super(message);
    }

    public ResultPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
