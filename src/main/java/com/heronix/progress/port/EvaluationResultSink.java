package com.heronix.progress.port;

import com.heronix.progress.exception.ResultPersistenceException;
import com.heronix.progress.model.batch.EvaluationPeriod;
import com.heronix.progress.model.gpa.GpaResult;
import com.heronix.progress.model.gpa.TermGpaResult;
import com.heronix.progress.model.sap.SapInput;
import com.heronix.progress.model.sap.SapResult;

/**
 * Stores evaluation results.
 *
 * Every write is an idempotent upsert on its natural key: storing the same student and
 * period twice overwrites rather than duplicates. Implementations throw
 * {@link ResultPersistenceException} when a write fails.
 */
public interface EvaluationResultSink {

    /**
     * Upsert the SAP record keyed by (student, award year, term) and update the student's
     * current SAP status for the award year.
     */
    void upsertSap(String studentId, EvaluationPeriod period, SapInput input, SapResult result);

    /**
     * Upsert the term GPA keyed by (student, term) and, when given, the cumulative summary
     * keyed by student.
     *
     * @param cumulative cumulative result, null to leave the summary untouched
     */
    void upsertGpa(String studentId, EvaluationPeriod period, TermGpaResult term, GpaResult cumulative);
}
