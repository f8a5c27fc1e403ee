package com.heronix.progress.model.honors;

import java.math.BigDecimal;

import lombok.Builder;

/**
 * Academic totals used to determine Latin honors.
 *
 * @param cumulativeGpa GPA over all credits, null when the student has no graded work
 * @param institutionalGpa GPA over institutional credits only, null when not tracked
 */
@Builder(toBuilder = true)
public record LatinHonorsInput(
        BigDecimal cumulativeGpa,
        BigDecimal institutionalGpa,
        BigDecimal earnedCredits,
        BigDecimal institutionalCredits,
        BigDecimal transferCredits,
        boolean hasAcademicIntegrityViolation
) {
}
