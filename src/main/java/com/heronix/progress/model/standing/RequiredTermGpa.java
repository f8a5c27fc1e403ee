package com.heronix.progress.model.standing;

import java.math.BigDecimal;

/**
 * Term GPA a student needs next term to bring the cumulative GPA up to a target.
 *
 * @param requiredTermGpa null when the target cannot be reached in one term
 */
public record RequiredTermGpa(
        BigDecimal targetGpa,
        BigDecimal nextTermCredits,
        BigDecimal requiredTermGpa,
        boolean achievable
) {
}
