package com.heronix.progress.model.standing;

import com.heronix.progress.model.enums.AcademicStandingStatus;

/**
 * Standing recorded for an earlier term, with the running probation and suspension counters.
 */
public record StandingHistoryEntry(
        String termId,
        AcademicStandingStatus standing,
        int consecutiveProbationTerms,
        int totalProbationTerms,
        int totalSuspensions
) {
}
