package com.heronix.progress.model.standing;

import java.math.BigDecimal;

/**
 * Good standing minimum for students up to a number of attempted credits.
 *
 * @param maxCredits inclusive upper bound of the tier
 * @param probationMinGpa optional probation floor for the tier
 */
public record CreditThreshold(
        BigDecimal maxCredits,
        BigDecimal goodStandingMinGpa,
        BigDecimal probationMinGpa
) {
}
