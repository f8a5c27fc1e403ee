package com.heronix.progress.model.enums;

/**
 * Lifecycle of one batch evaluation run.
 */
public enum BatchRunState {

    /**
     * Resolving cohort membership
     */
    COLLECTING,

    /**
     * Evaluating sub-batches
     */
    PROCESSING,

    /**
     * Every member was evaluated (individual failures allowed)
     */
    COMPLETED,

    /**
     * Cohort retrieval failed, nothing was evaluated
     */
    FAILED,

    /**
     * Stopped on request between sub-batches
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
