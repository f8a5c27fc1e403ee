package com.heronix.progress.model.gpa;

import java.math.BigDecimal;
import java.util.List;

/**
 * GPA result restricted to one term.
 */
public record TermGpaResult(
        String termId,
        BigDecimal attemptedCredits,
        BigDecimal earnedCredits,
        BigDecimal qualityPoints,
        BigDecimal termGpa,
        BigDecimal gpaCredits,
        List<GpaCalculationDetail> details
) {
    public TermGpaResult {
        details = details == null ? List.of() : List.copyOf(details);
    }

    public static TermGpaResult of(String termId, GpaResult result) {
        return new TermGpaResult(termId, result.attemptedCredits(), result.earnedCredits(),
                result.qualityPoints(), result.cumulativeGpa(), result.gpaCredits(), result.details());
    }
}
