package com.heronix.progress.model.standing;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;

import lombok.Builder;

/**
 * Institution academic standing policy.
 *
 * @param warningMinGpa lowest GPA that still earns a warning instead of probation, null when the
 *                      institution has no warning state
 * @param probationMaxTerms consecutive probation terms allowed before suspension
 * @param maxSuspensions suspensions allowed before dismissal
 * @param thresholdsByCredits sliding scale of good standing minimums, empty for a flat minimum
 */
@Builder(toBuilder = true)
public record AcademicStandingPolicy(
        BigDecimal goodStandingMinGpa,
        BigDecimal warningMinGpa,
        BigDecimal probationMinGpa,
        int probationMaxTerms,
        int suspensionDurationTerms,
        int maxSuspensions,
        List<CreditThreshold> thresholdsByCredits
) {
    public AcademicStandingPolicy {
        thresholdsByCredits = thresholdsByCredits == null ? List.of() : List.copyOf(thresholdsByCredits);
    }

    /**
     * 2.0 minimum, two probation terms, one-term suspension, two suspensions before dismissal.
     */
    public static AcademicStandingPolicy defaults() {
        return new AcademicStandingPolicy(new BigDecimal("2.0"), null, null, 2, 1, 2, List.of());
    }

    /**
     * Thresholds in force at the given attempted-credit level. The warning minimum is never tiered.
     */
    public AppliedThreshold thresholdsFor(BigDecimal creditsAttempted) {
        return thresholdsByCredits.stream()
                .sorted(Comparator.comparing(CreditThreshold::maxCredits))
                .filter(tier -> creditsAttempted.compareTo(tier.maxCredits()) <= 0)
                .findFirst()
                .map(tier -> new AppliedThreshold(tier.goodStandingMinGpa(), tier.probationMinGpa(), warningMinGpa))
                .orElseGet(() -> new AppliedThreshold(goodStandingMinGpa, probationMinGpa, warningMinGpa));
    }

    public record AppliedThreshold(
            BigDecimal goodStandingMinGpa,
            BigDecimal probationMinGpa,
            BigDecimal warningMinGpa
    ) {
    }
}
