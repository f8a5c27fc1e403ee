package com.heronix.progress.model.batch;

/**
 * Period a batch run evaluates. Together with the student id it forms the natural key of
 * persisted results.
 *
 * @param awardYearId financial aid award year (required for SAP)
 * @param termId term being evaluated
 */
public record EvaluationPeriod(String awardYearId, String termId) {
}
