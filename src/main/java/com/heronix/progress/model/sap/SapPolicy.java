package com.heronix.progress.model.sap;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import com.heronix.progress.model.enums.EvaluationFrequency;

import lombok.Builder;

/**
 * Institution or program SAP policy.
 *
 * @param minimumPace minimum completion rate as a fraction (0.67 for 67%)
 * @param maxTimeframePercentage maximum attempted credits as a multiple of program credits (1.5 for 150%)
 * @param gpaRequirementsByCredits tiered minimums checked in order, empty for a flat minimum
 */
@Builder(toBuilder = true)
public record SapPolicy(
        BigDecimal minimumGpa,
        BigDecimal minimumPace,
        BigDecimal maxTimeframePercentage,
        EvaluationFrequency evaluationFrequency,
        boolean allowWarningPeriod,
        boolean allowProbationAfterAppeal,
        List<GpaRequirement> gpaRequirementsByCredits
) {
    public SapPolicy {
        evaluationFrequency = evaluationFrequency == null ? EvaluationFrequency.TERM : evaluationFrequency;
        gpaRequirementsByCredits = gpaRequirementsByCredits == null ? List.of() : List.copyOf(gpaRequirementsByCredits);
    }

    /**
     * Common federal defaults: 2.0 GPA, 67% pace, 150% timeframe, evaluated each term.
     */
    public static SapPolicy defaults() {
        return new SapPolicy(
                new BigDecimal("2.0"),
                new BigDecimal("0.67"),
                new BigDecimal("1.5"),
                EvaluationFrequency.TERM,
                true,
                true,
                List.of());
    }

    /**
     * GPA required at the given attempted-credit level.
     */
    public BigDecimal requiredGpa(BigDecimal attemptedCredits) {
        Optional<GpaRequirement> tier = gpaRequirementsByCredits.stream()
                .filter(requirement -> requirement.covers(attemptedCredits))
                .findFirst();
        return tier.map(GpaRequirement::minimumGpa).orElse(minimumGpa);
    }
}
