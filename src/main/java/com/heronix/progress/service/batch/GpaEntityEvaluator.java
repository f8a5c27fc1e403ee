package com.heronix.progress.service.batch;

import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.heronix.progress.calculator.gpa.GpaCalculator;
import com.heronix.progress.model.batch.AcademicSnapshot;
import com.heronix.progress.model.batch.BatchRequest;
import com.heronix.progress.model.enums.CalculationKind;
import com.heronix.progress.model.enums.ErrorCode;
import com.heronix.progress.model.gpa.GpaCalculationOptions;
import com.heronix.progress.model.gpa.GpaResult;
import com.heronix.progress.model.gpa.TermGpaResult;
import com.heronix.progress.model.result.CalculationResult;
import com.heronix.progress.model.result.DomainError;
import com.heronix.progress.port.AcademicDataSource;
import com.heronix.progress.port.EvaluationResultSink;

import lombok.RequiredArgsConstructor;

/**
 * GPA evaluation of one student: term GPA for the period and, on request, the cumulative summary.
 */
@Component
@RequiredArgsConstructor
public class GpaEntityEvaluator implements EntityEvaluator {

    private final AcademicDataSource dataSource;
    private final EvaluationResultSink resultSink;
    private final GpaCalculator gpaCalculator;
    private final GpaCalculationOptions gpaOptions;

    @Override
    public CalculationKind getKind() {
        return CalculationKind.GPA;
    }

    @Override
    public Outcome evaluate(String studentId, BatchRequest request) {
        Optional<AcademicSnapshot> found = dataSource.findSnapshot(studentId, request.period());
        if (found.isEmpty()) {
            return Outcome.failure(studentId, DomainError.of(ErrorCode.SNAPSHOT_NOT_FOUND,
                    "No academic record for GPA calculation", Map.of("studentId", studentId)));
        }
        AcademicSnapshot snapshot = found.get();

        CalculationResult<TermGpaResult> term = gpaCalculator.calculateTermGpa(
                snapshot.attempts(), request.period().termId(), gpaOptions);
        if (term.isFailure()) {
            return Outcome.failure(studentId, term.error());
        }

        GpaResult cumulative = null;
        if (request.calculateCumulative()) {
            CalculationResult<GpaResult> result = gpaCalculator.calculateGpa(snapshot.attempts(), gpaOptions);
            if (result.isFailure()) {
                return Outcome.failure(studentId, result.error());
            }
            cumulative = result.value();
        }

        resultSink.upsertGpa(studentId, request.period(), term.value(), cumulative);
        return Outcome.success(studentId);
    }
}
