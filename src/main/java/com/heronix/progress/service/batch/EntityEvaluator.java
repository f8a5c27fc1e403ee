package com.heronix.progress.service.batch;

import com.heronix.progress.model.batch.BatchRequest;
import com.heronix.progress.model.enums.CalculationKind;
import com.heronix.progress.model.result.DomainError;

/**
 * Evaluates and persists one cohort member for a calculation kind.
 *
 * Implementations are stateless and safe to call from many threads. Expected domain
 * conditions come back as a failed {@link Outcome}; infrastructure failures from the
 * collaborators propagate as exceptions and are turned into failures by the orchestrator.
 */
public interface EntityEvaluator {

    /**
     * Get the calculation kind this evaluator handles.
     */
    CalculationKind getKind();

    /**
     * Evaluate one student and upsert the result.
     *
     * @param studentId cohort member
     * @param request   the run's request (period and options)
     * @return outcome for the student
     */
    Outcome evaluate(String studentId, BatchRequest request);

    /**
     * Result of evaluating one student.
     */
    record Outcome(String studentId, boolean success, DomainError error) {

        public static Outcome success(String studentId) {
            return new Outcome(studentId, true, null);
        }

        public static Outcome failure(String studentId, DomainError error) {
            return new Outcome(studentId, false, error);
        }
    }
}
