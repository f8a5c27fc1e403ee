package com.heronix.progress.exception;

/**
 * Exception thrown when academic records cannot be read.
 */
public class AcademicDataAccessException extends RuntimeException {

    public AcademicDataAccessException(String message) {
        super(message);
    }

    public AcademicDataAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
