package com.heronix.progress.service.batch;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.heronix.progress.calculator.gpa.GpaCalculator;
import com.heronix.progress.calculator.sap.SapCalculator;
import com.heronix.progress.model.batch.AcademicSnapshot;
import com.heronix.progress.model.batch.BatchRequest;
import com.heronix.progress.model.batch.EvaluationPeriod;
import com.heronix.progress.model.enums.CalculationKind;
import com.heronix.progress.model.enums.ErrorCode;
import com.heronix.progress.model.gpa.CourseAttempt;
import com.heronix.progress.model.gpa.GpaCalculationOptions;
import com.heronix.progress.model.gpa.GpaResult;
import com.heronix.progress.model.gpa.TermGpaResult;
import com.heronix.progress.model.result.CalculationResult;
import com.heronix.progress.model.result.DomainError;
import com.heronix.progress.model.sap.SapInput;
import com.heronix.progress.model.sap.SapPolicy;
import com.heronix.progress.model.sap.SapResult;
import com.heronix.progress.port.AcademicDataSource;
import com.heronix.progress.port.EvaluationResultSink;

import lombok.RequiredArgsConstructor;

/**
 * SAP evaluation of one student: snapshot, GPA totals, SAP result, upsert.
 */
@Component
@RequiredArgsConstructor
public class SapEntityEvaluator implements EntityEvaluator {

    private final AcademicDataSource dataSource;
    private final EvaluationResultSink resultSink;
    private final GpaCalculator gpaCalculator;
    private final SapCalculator sapCalculator;
    private final GpaCalculationOptions gpaOptions;
    private final SapPolicy sapPolicy;

    @Override
    public CalculationKind getKind() {
        return CalculationKind.SAP;
    }

    @Override
    public Outcome evaluate(String studentId, BatchRequest request) {
        EvaluationPeriod period = request.period();
        Optional<AcademicSnapshot> found = dataSource.findSnapshot(studentId, period);
        if (found.isEmpty()) {
            return Outcome.failure(studentId, DomainError.of(ErrorCode.SNAPSHOT_NOT_FOUND,
                    "Insufficient academic data for SAP", Map.of("studentId", studentId)));
        }
        AcademicSnapshot snapshot = found.get();

        CalculationResult<GpaResult> cumulative = gpaCalculator.calculateGpa(snapshot.attempts(), gpaOptions);
        if (cumulative.isFailure()) {
            return Outcome.failure(studentId, cumulative.error());
        }

        CalculationResult<TermGpaResult> term = gpaCalculator.calculateTermGpa(
                snapshot.attempts(), period.termId(), gpaOptions);
        if (term.isFailure()) {
            return Outcome.failure(studentId, term.error());
        }

        SapInput input = toSapInput(snapshot, cumulative.value(), term.value(), period);
        CalculationResult<SapResult> sap = sapCalculator.calculateSap(input, sapPolicy);
        if (sap.isFailure()) {
            return Outcome.failure(studentId, sap.error());
        }

        resultSink.upsertSap(studentId, period, input, sap.value());
        return Outcome.success(studentId);
    }

    private SapInput toSapInput(AcademicSnapshot snapshot, GpaResult cumulative, TermGpaResult term,
                                EvaluationPeriod period) {
        Set<String> completedThisTerm = snapshot.attempts().stream()
                .filter(attempt -> period.termId() != null && period.termId().equals(attempt.termId()))
                .filter(CourseAttempt::creditsEarned)
                .map(CourseAttempt::courseId)
                .collect(Collectors.toSet());

        return SapInput.builder()
                .cumulativeAttemptedCredits(cumulative.attemptedCredits())
                .cumulativeEarnedCredits(cumulative.earnedCredits())
                .cumulativeGpa(cumulative.cumulativeGpa())
                .programCredits(snapshot.programCredits())
                .maxTimeframePercentage(snapshot.maxTimeframePercentage())
                .previousSapStatus(snapshot.previousSapStatus())
                .appealApproved(snapshot.appealApproved())
                .onAcademicPlan(snapshot.onAcademicPlan())
                .academicPlanRequirements(snapshot.academicPlanRequirements())
                .termGpa(term.termGpa())
                .termAttemptedCredits(term.attemptedCredits())
                .termEarnedCredits(term.earnedCredits())
                .completedCourseIds(completedThisTerm)
                .build();
    }
}
