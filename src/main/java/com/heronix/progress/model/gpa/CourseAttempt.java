package com.heronix.progress.model.gpa;

import java.math.BigDecimal;

import com.heronix.progress.model.enums.RepeatPolicy;

import lombok.Builder;

/**
 * One graded or in-progress enrollment, captured for a single calculation.
 *
 * A regrade produces a new snapshot; attempts are never mutated in place.
 *
 * @param registrationId unique registration identifier
 * @param courseId course identity used for repeat detection
 * @param termId term in which the attempt was taken
 * @param credits credit hours attempted
 * @param gradeCode grade code (e.g., "A", "W"), null while in progress
 * @param gradePoints grade points for the grade, null for non-GPA grades or in progress
 * @param includeInGpa whether the attempt counts toward GPA
 * @param creditsEarned whether credits were earned (passed)
 * @param repeat whether this attempt repeats an earlier one
 * @param repeatPolicy policy for the repeat group, null to use the calculation default
 * @param repeatsRegistrationId registration this attempt replaces, if any
 */
@Builder(toBuilder = true)
public record CourseAttempt(
        String registrationId,
        String courseId,
        String termId,
        BigDecimal credits,
        String gradeCode,
        BigDecimal gradePoints,
        boolean includeInGpa,
        boolean creditsEarned,
        boolean repeat,
        RepeatPolicy repeatPolicy,
        String repeatsRegistrationId
) {
    public boolean isGraded() {
        return gradeCode != null;
    }
}
