package com.heronix.progress.model.graduation;

import java.math.BigDecimal;

import lombok.Builder;

/**
 * One student of a conferral batch, already cleared for graduation.
 */
@Builder(toBuilder = true)
public record BatchConferralStudentInput(
        String studentId,
        String studentProgramId,
        String graduationApplicationId,
        String diplomaName,
        String programName,
        String degreeCode,
        BigDecimal cumulativeGpa,
        BigDecimal institutionalGpa,
        BigDecimal totalEarnedCredits,
        BigDecimal institutionalEarnedCredits,
        BigDecimal transferCredits,
        boolean hasAcademicIntegrityViolation
) {
}
