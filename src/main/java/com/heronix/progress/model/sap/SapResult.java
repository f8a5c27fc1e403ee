package com.heronix.progress.model.sap;

import java.math.BigDecimal;
import java.util.List;

import com.heronix.progress.model.enums.SapStatus;

/**
 * Tri-component SAP evaluation with the derived status.
 *
 * @param academicPlanCompliance present only when the student is on a plan with requirements
 */
public record SapResult(
        SapStatus status,
        boolean eligibleForAid,
        GpaComponent gpaComponent,
        PaceComponent paceComponent,
        MaxTimeframeComponent maxTimeframeComponent,
        boolean allRequirementsMet,
        String statusReason,
        List<String> recommendations,
        AcademicPlanCompliance academicPlanCompliance
) {
    public SapResult {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    /**
     * GPA component.
     *
     * @param currentGpa null when there is no graded work (counted as met)
     * @param deficit required minus current when unmet, otherwise null
     */
    public record GpaComponent(
            BigDecimal currentGpa,
            BigDecimal requiredGpa,
            boolean met,
            BigDecimal deficit
    ) {
    }

    /**
     * Pace (completion rate) component.
     *
     * @param pace earned over attempted, four decimal places; zero when nothing was attempted
     */
    public record PaceComponent(
            BigDecimal attemptedCredits,
            BigDecimal earnedCredits,
            BigDecimal pace,
            BigDecimal requiredPace,
            boolean met,
            BigDecimal deficit
    ) {
    }

    /**
     * Maximum timeframe component.
     */
    public record MaxTimeframeComponent(
            BigDecimal attemptedCredits,
            BigDecimal maxAllowedCredits,
            BigDecimal percentageUsed,
            boolean exceeded,
            BigDecimal creditsRemaining
    ) {
    }

    /**
     * Term performance against an academic plan. Reported only; never changes the status.
     */
    public record AcademicPlanCompliance(
            boolean onPlan,
            boolean meetingPlanRequirements,
            List<String> unmetRequirements,
            String planDetails
    ) {
        public AcademicPlanCompliance {
            unmetRequirements = unmetRequirements == null ? List.of() : List.copyOf(unmetRequirements);
        }
    }
}
