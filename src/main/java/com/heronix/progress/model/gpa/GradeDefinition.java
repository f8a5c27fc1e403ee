package com.heronix.progress.model.gpa;

import java.math.BigDecimal;

import lombok.Builder;

/**
 * Entry of an institution's grade scale.
 *
 * @param gradeCode grade code (e.g., "A-", "W", "I")
 * @param gradePoints points for the grade, null for non-GPA grades
 * @param countInGpa whether the grade participates in GPA
 * @param earnedCredits whether the grade earns credit
 * @param attemptedCredits whether the grade counts as attempted
 * @param incomplete whether the grade is an incomplete
 * @param withdrawal whether the grade is a withdrawal
 */
@Builder
public record GradeDefinition(
        String gradeCode,
        BigDecimal gradePoints,
        boolean countInGpa,
        boolean earnedCredits,
        boolean attemptedCredits,
        boolean incomplete,
        boolean withdrawal
) {
}
