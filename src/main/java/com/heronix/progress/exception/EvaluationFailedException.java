package com.heronix.progress.exception;

import com.heronix.progress.model.result.DomainError;

import lombok.Getter;

/**
 * Exception thrown at the API boundary when a calculation returns a failure.
 */
@Getter
public class EvaluationFailedException extends RuntimeException {

    private final DomainError error;

    public EvaluationFailedException(DomainError error) {
        super(error.code() + ": " + error.message());
        this.error = error;
    }
}
