package com.heronix.progress.model.batch;

import com.heronix.progress.model.enums.CalculationKind;

import lombok.Builder;

/**
 * Request to evaluate a cohort.
 *
 * @param calculateCumulative GPA runs only: also recompute the cumulative summary
 */
@Builder(toBuilder = true)
public record BatchRequest(
        String batchId,
        CalculationKind kind,
        EvaluationPeriod period,
        CohortSelector cohort,
        boolean calculateCumulative
) {
    public BatchRequest {
        cohort = cohort == null ? CohortSelector.allEligible() : cohort;
    }
}
