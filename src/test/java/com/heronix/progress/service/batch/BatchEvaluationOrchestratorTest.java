package com.heronix.progress.service.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import com.heronix.progress.calculator.gpa.GpaCalculator;
import com.heronix.progress.calculator.sap.SapCalculator;
import com.heronix.progress.config.ProgressProperties;
import com.heronix.progress.exception.AcademicDataAccessException;
import com.heronix.progress.exception.ResultPersistenceException;
import com.heronix.progress.model.batch.AcademicSnapshot;
import com.heronix.progress.model.batch.BatchError;
import com.heronix.progress.model.batch.BatchRequest;
import com.heronix.progress.model.batch.BatchResult;
import com.heronix.progress.model.batch.CohortSelector;
import com.heronix.progress.model.batch.EvaluationPeriod;
import com.heronix.progress.model.enums.BatchRunState;
import com.heronix.progress.model.enums.CalculationKind;
import com.heronix.progress.model.enums.ErrorCategory;
import com.heronix.progress.model.enums.ErrorCode;
import com.heronix.progress.model.gpa.CourseAttempt;
import com.heronix.progress.model.gpa.GpaCalculationOptions;
import com.heronix.progress.model.result.CalculationResult;
import com.heronix.progress.model.sap.SapPolicy;
import com.heronix.progress.port.AcademicDataSource;
import com.heronix.progress.port.EvaluationResultSink;
import com.heronix.progress.port.JobProgressReporter;

class BatchEvaluationOrchestratorTest {

    private static final EvaluationPeriod PERIOD = new EvaluationPeriod("AY-2025", "FA-2024");
    private static final List<String> COHORT = IntStream.rangeClosed(1, 10)
            .mapToObj(i -> String.format("S-%02d", i))
            .toList();

    private AcademicDataSource dataSource;
    private EvaluationResultSink resultSink;
    private JobProgressReporter reporter;
    private BatchRunRegistry registry;
    private ProgressProperties properties;
    private ExecutorService executor;
    private BatchEvaluationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        dataSource = mock(AcademicDataSource.class);
        resultSink = mock(EvaluationResultSink.class);
        reporter = mock(JobProgressReporter.class);
        registry = new BatchRunRegistry();
        properties = new ProgressProperties();
        properties.getBatch().setSapBatchSize(3);
        properties.getBatch().setGpaBatchSize(4);
        executor = Executors.newFixedThreadPool(4);

        GpaCalculator gpaCalculator = new GpaCalculator();
        GpaCalculationOptions options = GpaCalculationOptions.defaults();
        Map<CalculationKind, EntityEvaluator> evaluators = new EnumMap<>(CalculationKind.class);
        evaluators.put(CalculationKind.SAP, new SapEntityEvaluator(dataSource, resultSink, gpaCalculator,
                new SapCalculator(), options, SapPolicy.defaults()));
        evaluators.put(CalculationKind.GPA, new GpaEntityEvaluator(dataSource, resultSink, gpaCalculator, options));

        orchestrator = new BatchEvaluationOrchestrator(dataSource, reporter, evaluators, registry, executor,
                properties);

        when(dataSource.findCohort(any(), any(), any())).thenReturn(COHORT);
        when(dataSource.findSnapshot(anyString(), any()))
                .thenAnswer(invocation -> Optional.of(snapshot(invocation.getArgument(0))));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void oneFailingStudentDoesNotAffectTheOthers() {
        when(dataSource.findSnapshot(eq("S-04"), any()))
                .thenThrow(new AcademicDataAccessException("connection reset"));

        CalculationResult<BatchResult> outcome = orchestrator.run(sapRequest("sap-1"));

        assertThat(outcome.success()).isTrue();
        BatchResult result = outcome.value();
        assertThat(result.state()).isEqualTo(BatchRunState.COMPLETED);
        assertThat(result.total()).isEqualTo(10);
        assertThat(result.processed()).isEqualTo(10);
        assertThat(result.successful()).isEqualTo(9);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.skipped()).isZero();
        assertThat(result.errors()).containsExactly(
                new BatchError("S-04", ErrorCode.DATA_ACCESS_FAILED, "connection reset"));
        assertThat(result.errorsTruncated()).isFalse();

        verify(resultSink, times(9)).upsertSap(anyString(), eq(PERIOD), any(), any());
        verify(resultSink, never()).upsertSap(eq("S-04"), any(), any(), any());
        verify(reporter).completed(result);
        assertThat(registry.isActive("sap-1")).isFalse();
    }

    @Test
    void reportsProgressAfterEachSubBatch() {
        orchestrator.run(sapRequest("sap-2"));

        InOrder order = inOrder(reporter);
        order.verify(reporter).started(any());
        order.verify(reporter).reportProgress("sap-2", 30);
        order.verify(reporter).reportProgress("sap-2", 60);
        order.verify(reporter).reportProgress("sap-2", 90);
        order.verify(reporter).reportProgress("sap-2", 100);
        order.verify(reporter).completed(any());
    }

    @Test
    void capsErrorListAndKeepsTotalCount() {
        properties.getBatch().setMaxErrors(2);
        when(dataSource.findSnapshot(anyString(), any())).thenReturn(Optional.empty());

        BatchResult result = orchestrator.run(sapRequest("sap-3")).orElseThrow();

        assertThat(result.failed()).isEqualTo(10);
        assertThat(result.errors()).hasSize(2)
                .allSatisfy(error -> assertThat(error.code()).isEqualTo(ErrorCode.SNAPSHOT_NOT_FOUND));
        assertThat(result.totalErrorCount()).isEqualTo(10);
        assertThat(result.errorsTruncated()).isTrue();
        verifyNoInteractions(resultSink);
    }

    @Test
    void cancelStopsBeforeTheNextSubBatch() {
        doAnswer(invocation -> {
            registry.requestCancel(invocation.getArgument(0));
            return null;
        }).when(reporter).reportProgress(anyString(), anyInt());

        BatchResult result = orchestrator.run(sapRequest("sap-4")).orElseThrow();

        assertThat(result.state()).isEqualTo(BatchRunState.CANCELLED);
        assertThat(result.processed()).isEqualTo(3);
        assertThat(result.skipped()).isEqualTo(7);
        assertThat(result.total()).isEqualTo(result.successful() + result.failed() + result.skipped());
        verify(resultSink, times(3)).upsertSap(anyString(), any(), any(), any());
    }

    @Test
    void cohortFailureFailsTheRun() {
        when(dataSource.findCohort(any(), any(), any()))
                .thenThrow(new AcademicDataAccessException("database unavailable"));

        CalculationResult<BatchResult> outcome = orchestrator.run(sapRequest("sap-5"));

        assertThat(outcome.isFailure()).isTrue();
        assertThat(outcome.error().code()).isEqualTo(ErrorCode.COHORT_RETRIEVAL_FAILED);
        assertThat(outcome.error().category()).isEqualTo(ErrorCategory.INFRASTRUCTURE);
        verify(reporter).failed(eq("sap-5"), anyString());
        verify(reporter, never()).completed(any());
        assertThat(registry.isActive("sap-5")).isFalse();
    }

    @Test
    void persistenceAndUnexpectedFailuresAreRecordedPerStudent() {
        doThrow(new ResultPersistenceException("deadlock")).when(resultSink)
                .upsertSap(eq("S-02"), any(), any(), any());
        when(dataSource.findSnapshot(eq("S-07"), any())).thenThrow(new IllegalArgumentException("bad row"));

        BatchResult result = orchestrator.run(sapRequest("sap-6")).orElseThrow();

        assertThat(result.successful()).isEqualTo(8);
        assertThat(result.errors()).extracting(BatchError::studentId, BatchError::code)
                .containsExactlyInAnyOrder(
                        tuple("S-02", ErrorCode.PERSISTENCE_FAILED),
                        tuple("S-07", ErrorCode.UNEXPECTED_FAILURE));
    }

    @Test
    void reporterFailureDoesNotAbortTheRun() {
        doThrow(new IllegalStateException("job table locked")).when(reporter).reportProgress(anyString(), anyInt());

        BatchResult result = orchestrator.run(sapRequest("sap-7")).orElseThrow();

        assertThat(result.state()).isEqualTo(BatchRunState.COMPLETED);
        assertThat(result.successful()).isEqualTo(10);
    }

    @Test
    void duplicateCohortIdsAreEvaluatedOnce() {
        when(dataSource.findCohort(any(), any(), any())).thenReturn(List.of("S-01", "S-02", "S-01"));

        BatchResult result = orchestrator.run(sapRequest("sap-8")).orElseThrow();

        assertThat(result.total()).isEqualTo(2);
        verify(resultSink, times(1)).upsertSap(eq("S-01"), any(), any(), any());
    }

    @Test
    void emptyCohortCompletesImmediately() {
        when(dataSource.findCohort(any(), any(), any())).thenReturn(List.of());

        BatchResult result = orchestrator.run(sapRequest("sap-9")).orElseThrow();

        assertThat(result.state()).isEqualTo(BatchRunState.COMPLETED);
        assertThat(result.total()).isZero();
        verify(reporter, never()).reportProgress(anyString(), anyInt());
    }

    @Test
    void gpaRunStoresTermAndCumulativeResults() {
        BatchRequest request = BatchRequest.builder()
                .batchId("gpa-1")
                .kind(CalculationKind.GPA)
                .period(new EvaluationPeriod(null, "FA-2024"))
                .cohort(CohortSelector.explicit(COHORT))
                .calculateCumulative(true)
                .build();

        BatchResult result = orchestrator.run(request).orElseThrow();

        assertThat(result.successful()).isEqualTo(10);
        verify(resultSink, times(10)).upsertGpa(anyString(), any(), any(), any());
        verify(resultSink, never()).upsertGpa(anyString(), any(), any(), isNull());
    }

    @Test
    void rejectsInvalidRequestWithoutTouchingCollaborators() {
        BatchRequest request = BatchRequest.builder()
                .batchId("sap-10")
                .kind(CalculationKind.SAP)
                .period(new EvaluationPeriod(null, "FA-2024"))
                .build();

        CalculationResult<BatchResult> outcome = orchestrator.run(request);

        assertThat(outcome.isFailure()).isTrue();
        assertThat(outcome.error().code()).isEqualTo(ErrorCode.INVALID_BATCH_REQUEST);
        assertThat(outcome.error().details()).containsExactly("SAP runs require an award year");
        verifyNoInteractions(dataSource, reporter);
    }

    @Test
    void rejectsSecondRunWithActiveBatchId() {
        registry.register("sap-11", CalculationKind.SAP);

        CalculationResult<BatchResult> outcome = orchestrator.run(sapRequest("sap-11"));

        assertThat(outcome.isFailure()).isTrue();
        assertThat(outcome.error().code()).isEqualTo(ErrorCode.INVALID_BATCH_REQUEST);
        assertThat(registry.isActive("sap-11")).isTrue();
        verifyNoInteractions(dataSource);
    }

    private static BatchRequest sapRequest(String batchId) {
        return BatchRequest.builder()
                .batchId(batchId)
                .kind(CalculationKind.SAP)
                .period(PERIOD)
                .cohort(CohortSelector.allEligible())
                .build();
    }

    private static AcademicSnapshot snapshot(String studentId) {
        return AcademicSnapshot.builder()
                .studentId(studentId)
                .programCredits(BigDecimal.valueOf(120))
                .attempts(List.of(
                        attempt(studentId + "-1", "MATH101", "SP-2024", "4.0"),
                        attempt(studentId + "-2", "ENGL101", "FA-2024", "3.0")))
                .build();
    }

    private static CourseAttempt attempt(String registrationId, String courseId, String termId, String points) {
        return CourseAttempt.builder()
                .registrationId(registrationId)
                .courseId(courseId)
                .termId(termId)
                .credits(BigDecimal.valueOf(3))
                .gradeCode("A")
                .gradePoints(new BigDecimal(points))
                .includeInGpa(true)
                .creditsEarned(true)
                .build();
    }
}
