package com.heronix.progress.service.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.heronix.progress.calculator.gpa.GpaCalculator;
import com.heronix.progress.model.batch.AcademicSnapshot;
import com.heronix.progress.model.batch.BatchRequest;
import com.heronix.progress.model.batch.EvaluationPeriod;
import com.heronix.progress.model.enums.CalculationKind;
import com.heronix.progress.model.enums.ErrorCode;
import com.heronix.progress.model.gpa.CourseAttempt;
import com.heronix.progress.model.gpa.GpaCalculationOptions;
import com.heronix.progress.model.gpa.GpaResult;
import com.heronix.progress.model.gpa.TermGpaResult;
import com.heronix.progress.port.AcademicDataSource;
import com.heronix.progress.port.EvaluationResultSink;
import com.heronix.progress.service.batch.EntityEvaluator.Outcome;

@ExtendWith(MockitoExtension.class)
class GpaEntityEvaluatorTest {

    private static final EvaluationPeriod PERIOD = new EvaluationPeriod(null, "FA-2024");

    @Mock
    private AcademicDataSource dataSource;

    @Mock
    private EvaluationResultSink resultSink;

    private GpaEntityEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new GpaEntityEvaluator(dataSource, resultSink, new GpaCalculator(),
                GpaCalculationOptions.defaults());
    }

    @Test
    void storesTermGpaOnly() {
        when(dataSource.findSnapshot("S-1", PERIOD)).thenReturn(Optional.of(snapshot(
                attempt("R-1", "SP-2024", "A", "4.0", "3"),
                attempt("R-2", "FA-2024", "B", "3.0", "3"),
                attempt("R-3", "FA-2024", "C", "2.0", "3"))));

        Outcome outcome = evaluator.evaluate("S-1", request(false));

        assertThat(outcome.success()).isTrue();
        ArgumentCaptor<TermGpaResult> term = ArgumentCaptor.forClass(TermGpaResult.class);
        verify(resultSink).upsertGpa(eq("S-1"), eq(PERIOD), term.capture(), isNull());
        assertThat(term.getValue().termId()).isEqualTo("FA-2024");
        assertThat(term.getValue().attemptedCredits()).isEqualByComparingTo("6");
        assertThat(term.getValue().termGpa()).isEqualByComparingTo("2.5");
    }

    @Test
    void storesCumulativeSummaryWhenRequested() {
        when(dataSource.findSnapshot("S-1", PERIOD)).thenReturn(Optional.of(snapshot(
                attempt("R-1", "SP-2024", "A", "4.0", "3"),
                attempt("R-2", "FA-2024", "B", "3.0", "3"))));

        Outcome outcome = evaluator.evaluate("S-1", request(true));

        assertThat(outcome.success()).isTrue();
        ArgumentCaptor<GpaResult> cumulative = ArgumentCaptor.forClass(GpaResult.class);
        verify(resultSink).upsertGpa(eq("S-1"), eq(PERIOD), any(),
                cumulative.capture());
        assertThat(cumulative.getValue().cumulativeGpa()).isEqualByComparingTo("3.5");
        assertThat(cumulative.getValue().earnedCredits()).isEqualByComparingTo("6");
    }

    @Test
    void invalidAttemptFailsWithoutWriting() {
        when(dataSource.findSnapshot("S-2", PERIOD)).thenReturn(Optional.of(snapshot(
                attempt("R-9", "FA-2024", "A", "4.0", "-3"))));

        Outcome outcome = evaluator.evaluate("S-2", request(false));

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.error().code()).isEqualTo(ErrorCode.INVALID_COURSE_ATTEMPT);
        verifyNoInteractions(resultSink);
    }

    @Test
    void missingProfileIsReportedAsMissingSnapshot() {
        when(dataSource.findSnapshot("S-3", PERIOD)).thenReturn(Optional.empty());

        Outcome outcome = evaluator.evaluate("S-3", request(false));

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.error().code()).isEqualTo(ErrorCode.SNAPSHOT_NOT_FOUND);
        verifyNoInteractions(resultSink);
    }

    private static BatchRequest request(boolean cumulative) {
        return BatchRequest.builder()
                .batchId("gpa-1")
                .kind(CalculationKind.GPA)
                .period(PERIOD)
                .calculateCumulative(cumulative)
                .build();
    }

    private static AcademicSnapshot snapshot(CourseAttempt... attempts) {
        return AcademicSnapshot.builder()
                .studentId("S-1")
                .programCredits(BigDecimal.valueOf(120))
                .attempts(List.of(attempts))
                .build();
    }

    private static CourseAttempt attempt(String registrationId, String termId, String grade, String points,
                                         String credits) {
        return CourseAttempt.builder()
                .registrationId(registrationId)
                .courseId("C-" + registrationId)
                .termId(termId)
                .credits(new BigDecimal(credits))
                .gradeCode(grade)
                .gradePoints(new BigDecimal(points))
                .includeInGpa(true)
                .creditsEarned(true)
                .build();
    }
}
