package com.heronix.progress.model.standing;

import java.math.BigDecimal;
import java.util.List;

import com.heronix.progress.model.enums.AcademicStandingStatus;

import lombok.Builder;

/**
 * One student's term-end snapshot for a standing evaluation.
 *
 * @param currentStanding standing before this evaluation, null on first evaluation
 * @param previousHistory earlier evaluations, oldest first; only the last entry's counters are used
 */
@Builder(toBuilder = true)
public record AcademicStandingInput(
        String termId,
        BigDecimal cumulativeGpa,
        BigDecimal termGpa,
        BigDecimal cumulativeCreditsAttempted,
        BigDecimal cumulativeCreditsEarned,
        BigDecimal termCreditsAttempted,
        BigDecimal termCreditsEarned,
        AcademicStandingStatus currentStanding,
        List<StandingHistoryEntry> previousHistory
) {
    public AcademicStandingInput {
        previousHistory = previousHistory == null ? List.of() : List.copyOf(previousHistory);
    }
}
