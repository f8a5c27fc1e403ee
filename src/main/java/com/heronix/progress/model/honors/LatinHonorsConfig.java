package com.heronix.progress.model.honors;

import java.math.BigDecimal;

import lombok.Builder;

/**
 * Latin honors thresholds and eligibility rules.
 *
 * Thresholds are expected in descending order (summa above magna above cum); they are
 * checked in that order and never re-sorted.
 */
@Builder(toBuilder = true)
public record LatinHonorsConfig(
        BigDecimal minimumCredits,
        BigDecimal minimumInstitutionalCredits,
        BigDecimal summaThreshold,
        BigDecimal magnaThreshold,
        BigDecimal cumThreshold,
        boolean excludeTransferCredits,
        boolean disqualifyForAcademicIntegrity
) {
    public static LatinHonorsConfig defaults() {
        return new LatinHonorsConfig(
                BigDecimal.valueOf(60),
                BigDecimal.valueOf(60),
                new BigDecimal("3.9"),
                new BigDecimal("3.7"),
                new BigDecimal("3.5"),
                false,
                true);
    }
}
