package com.heronix.progress.model.enums;

/**
 * Broad classes of engine failures. Callers decide retry behavior from the category.
 */
public enum ErrorCategory {

    /**
     * Malformed calculator input. Never retried blindly.
     */
    VALIDATION,

    /**
     * Required academic data is missing for one entity. Reported and skipped.
     */
    DATA_INCOMPLETE,

    /**
     * Data-access or persistence failure.
     */
    INFRASTRUCTURE
}
