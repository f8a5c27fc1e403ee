package com.heronix.progress.model.graduation;

import java.math.BigDecimal;
import java.util.List;

/**
 * Academic checklist for graduation.
 *
 * @param missingRequirements one entry per failed check, in checklist order
 */
public record AcademicRequirementsStatus(
        BigDecimal degreeAuditCompletionPct,
        boolean allRequiredCoursesComplete,
        boolean allCreditsEarned,
        boolean gpaRequirementsMet,
        boolean residencyRequirementMet,
        boolean noIncompleteGrades,
        boolean noPendingFinalGrades,
        boolean milestonesComplete,
        List<String> missingRequirements
) {
    public AcademicRequirementsStatus {
        missingRequirements = List.copyOf(missingRequirements);
    }

    public boolean passed() {
        return allRequiredCoursesComplete && allCreditsEarned && gpaRequirementsMet && residencyRequirementMet
                && noIncompleteGrades && noPendingFinalGrades && milestonesComplete;
    }
}
