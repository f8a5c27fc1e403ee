package com.heronix.progress.model.sap;

import java.math.BigDecimal;
import java.util.Set;

import com.heronix.progress.model.enums.SapStatus;

import lombok.Builder;

/**
 * One student's academic snapshot for a SAP evaluation.
 *
 * @param cumulativeGpa null when the student has no graded work yet
 * @param maxTimeframePercentage program override of the policy timeframe, null to use the policy
 * @param previousSapStatus status from the prior evaluation, null on first evaluation
 * @param academicPlanRequirements plan terms, only meaningful with {@code onAcademicPlan}
 * @param termGpa GPA of the term under evaluation, used for plan compliance
 * @param completedCourseIds courses completed in the term under evaluation
 */
@Builder(toBuilder = true)
public record SapInput(
        BigDecimal cumulativeAttemptedCredits,
        BigDecimal cumulativeEarnedCredits,
        BigDecimal cumulativeGpa,
        BigDecimal programCredits,
        BigDecimal maxTimeframePercentage,
        SapStatus previousSapStatus,
        boolean appealApproved,
        boolean onAcademicPlan,
        AcademicPlanRequirements academicPlanRequirements,
        BigDecimal termGpa,
        BigDecimal termAttemptedCredits,
        BigDecimal termEarnedCredits,
        Set<String> completedCourseIds
) {
    public SapInput {
        completedCourseIds = completedCourseIds == null ? Set.of() : Set.copyOf(completedCourseIds);
    }
}
