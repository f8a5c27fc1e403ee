package com.heronix.progress.port;

import java.util.List;
import java.util.Optional;

import com.heronix.progress.exception.AcademicDataAccessException;
import com.heronix.progress.model.batch.AcademicSnapshot;
import com.heronix.progress.model.batch.CohortSelector;
import com.heronix.progress.model.batch.EvaluationPeriod;
import com.heronix.progress.model.enums.CalculationKind;

/**
 * Read-only access to student academic records.
 *
 * Implementations own any timeout or retry policy; the engine calls each method once.
 */
public interface AcademicDataSource {

    /**
     * Resolve cohort membership.
     *
     * @param kind     calculation the cohort is selected for
     * @param period   evaluation period
     * @param selector explicit ids or all eligible students
     * @return distinct student ids
     * @throws AcademicDataAccessException if the records cannot be read
     */
    List<String> findCohort(CalculationKind kind, EvaluationPeriod period, CohortSelector selector);

    /**
     * Load one student's snapshot for the period.
     *
     * @return the snapshot, or empty when the student has no usable academic record
     * @throws AcademicDataAccessException if the records cannot be read
     */
    Optional<AcademicSnapshot> findSnapshot(String studentId, EvaluationPeriod period);
}
