package com.heronix.progress.model.batch;

import com.heronix.progress.model.enums.ErrorCode;

/**
 * Failure of one cohort member.
 */
public record BatchError(String studentId, ErrorCode code, String message) {
}
