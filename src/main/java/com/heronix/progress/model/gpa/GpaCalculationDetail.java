package com.heronix.progress.model.gpa;

import java.math.BigDecimal;

/**
 * Audit entry describing how one attempt was counted.
 *
 * @param excludedReason set only when the attempt was excluded from every total
 */
public record GpaCalculationDetail(
        String registrationId,
        String courseId,
        BigDecimal credits,
        String gradeCode,
        BigDecimal gradePoints,
        BigDecimal qualityPoints,
        boolean includedInGpa,
        String excludedReason
) {
    public boolean isExcluded() {
        return excludedReason != null;
    }
}
