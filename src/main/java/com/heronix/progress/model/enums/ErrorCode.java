package com.heronix.progress.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error codes produced by the calculators and the batch orchestrator.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    INVALID_COURSE_ATTEMPT(ErrorCategory.VALIDATION),
    INVALID_SAP_INPUT(ErrorCategory.VALIDATION),
    INVALID_GRADUATION_INPUT(ErrorCategory.VALIDATION),
    INVALID_HONORS_INPUT(ErrorCategory.VALIDATION),
    INVALID_STANDING_INPUT(ErrorCategory.VALIDATION),
    INVALID_BATCH_REQUEST(ErrorCategory.VALIDATION),

    SNAPSHOT_NOT_FOUND(ErrorCategory.DATA_INCOMPLETE),

    DATA_ACCESS_FAILED(ErrorCategory.INFRASTRUCTURE),
    PERSISTENCE_FAILED(ErrorCategory.INFRASTRUCTURE),
    COHORT_RETRIEVAL_FAILED(ErrorCategory.INFRASTRUCTURE),
    UNEXPECTED_FAILURE(ErrorCategory.INFRASTRUCTURE);

    /**
     * Category deciding how the failure is handled
     */
    private final ErrorCategory category;

    public boolean isRetryable() {
        return category == ErrorCategory.INFRASTRUCTURE;
    }
}
