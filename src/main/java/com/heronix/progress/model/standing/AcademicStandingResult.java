package com.heronix.progress.model.standing;

import java.util.List;

import com.heronix.progress.model.enums.AcademicStandingStatus;
import com.heronix.progress.model.standing.AcademicStandingPolicy.AppliedThreshold;

/**
 * Standing determination with the updated counters and student-facing action items.
 */
public record AcademicStandingResult(
        AcademicStandingStatus standing,
        AcademicStandingStatus previousStanding,
        boolean standingChanged,
        String reason,
        AppliedThreshold appliedThreshold,
        ProbationTracking probationTracking,
        SuspensionTracking suspensionTracking,
        List<String> actionItems,
        boolean appealRecommended
) {
    public AcademicStandingResult {
        actionItems = actionItems == null ? List.of() : List.copyOf(actionItems);
    }

    /**
     * @param termsRemaining probation terms left before suspension, null unless on probation
     */
    public record ProbationTracking(
            int consecutiveTerms,
            int totalTerms,
            int maxTermsBeforeSuspension,
            Integer termsRemaining
    ) {
    }

    public record SuspensionTracking(
            int totalSuspensions,
            int maxSuspensions,
            int suspensionsRemaining
    ) {
    }
}
