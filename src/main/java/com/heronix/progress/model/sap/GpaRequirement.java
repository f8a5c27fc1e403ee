package com.heronix.progress.model.sap;

import java.math.BigDecimal;

/**
 * Minimum GPA for a band of attempted credits (e.g., 1.75 for 0-30 credits).
 *
 * @param maxCredits inclusive upper bound, null for no upper bound
 */
public record GpaRequirement(
        BigDecimal minCredits,
        BigDecimal maxCredits,
        BigDecimal minimumGpa
) {
    public boolean covers(BigDecimal attemptedCredits) {
        return attemptedCredits.compareTo(minCredits) >= 0
                && (maxCredits == null || attemptedCredits.compareTo(maxCredits) <= 0);
    }
}
