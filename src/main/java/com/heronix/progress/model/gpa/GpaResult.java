package com.heronix.progress.model.gpa;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of a GPA calculation.
 *
 * @param attemptedCredits credits attempted, failed courses included
 * @param earnedCredits credits earned
 * @param qualityPoints sum of grade points times credits
 * @param cumulativeGpa quality points over GPA credits, null when there are no GPA credits
 * @param gpaCredits GPA-eligible attempted credits
 * @param details one entry per attempt, in input order by course group
 */
public record GpaResult(
        BigDecimal attemptedCredits,
        BigDecimal earnedCredits,
        BigDecimal qualityPoints,
        BigDecimal cumulativeGpa,
        BigDecimal gpaCredits,
        List<GpaCalculationDetail> details
) {
    public GpaResult {
        details = details == null ? List.of() : List.copyOf(details);
    }

    public boolean hasGpa() {
        return cumulativeGpa != null;
    }
}
