package com.heronix.progress.adapter.jpa;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import com.heronix.progress.calculator.gpa.GpaCalculator;
import com.heronix.progress.calculator.sap.SapCalculator;
import com.heronix.progress.model.batch.AcademicSnapshot;
import com.heronix.progress.model.batch.BatchError;
import com.heronix.progress.model.batch.BatchRequest;
import com.heronix.progress.model.batch.BatchResult;
import com.heronix.progress.model.batch.CohortSelector;
import com.heronix.progress.model.batch.EvaluationPeriod;
import com.heronix.progress.model.domain.BatchRun;
import com.heronix.progress.model.domain.CourseAttemptRecord;
import com.heronix.progress.model.domain.SapRecord;
import com.heronix.progress.model.domain.StudentAidYear;
import com.heronix.progress.model.domain.StudentProfile;
import com.heronix.progress.model.enums.BatchRunState;
import com.heronix.progress.model.enums.CalculationKind;
import com.heronix.progress.model.enums.ErrorCode;
import com.heronix.progress.model.enums.SapStatus;
import com.heronix.progress.model.gpa.CourseAttempt;
import com.heronix.progress.model.gpa.GpaCalculationOptions;
import com.heronix.progress.model.gpa.GpaResult;
import com.heronix.progress.model.gpa.TermGpaResult;
import com.heronix.progress.model.sap.SapInput;
import com.heronix.progress.model.sap.SapPolicy;
import com.heronix.progress.model.sap.SapResult;
import com.heronix.progress.repository.BatchRunRepository;
import com.heronix.progress.repository.CourseAttemptRecordRepository;
import com.heronix.progress.repository.GpaSummaryRepository;
import com.heronix.progress.repository.SapRecordRepository;
import com.heronix.progress.repository.StudentAidYearRepository;
import com.heronix.progress.repository.StudentProfileRepository;
import com.heronix.progress.repository.TermGpaRecordRepository;

@DataJpaTest
@Import({JpaAcademicDataSource.class, JpaEvaluationResultSink.class, JpaJobProgressReporter.class})
class JpaAdaptersTest {

    private static final EvaluationPeriod FALL = new EvaluationPeriod("AY-2025", "FA-2024");

    @Autowired
    private JpaAcademicDataSource dataSource;

    @Autowired
    private JpaEvaluationResultSink resultSink;

    @Autowired
    private JpaJobProgressReporter reporter;

    @Autowired
    private StudentProfileRepository profileRepository;

    @Autowired
    private CourseAttemptRecordRepository attemptRepository;

    @Autowired
    private StudentAidYearRepository aidYearRepository;

    @Autowired
    private SapRecordRepository sapRecordRepository;

    @Autowired
    private TermGpaRecordRepository termGpaRepository;

    @Autowired
    private GpaSummaryRepository gpaSummaryRepository;

    @Autowired
    private BatchRunRepository batchRunRepository;

    private final SapCalculator sapCalculator = new SapCalculator();
    private final GpaCalculator gpaCalculator = new GpaCalculator();

    @BeforeEach
    void setUp() {
        profileRepository.save(StudentProfile.builder().studentId("S-1").programCredits(BigDecimal.valueOf(60)).build());
        profileRepository.save(StudentProfile.builder().studentId("S-2").build());
        profileRepository.save(StudentProfile.builder().studentId("S-3").active(false).build());

        aidYearRepository.save(StudentAidYear.builder().studentId("S-1").awardYearId("AY-2025")
                .appealApproved(true).onAcademicPlan(true)
                .planTermMinimumGpa(new BigDecimal("2.5"))
                .planRequiredCourses("MATH102, ENGL102")
                .planTermsRemaining(2)
                .build());
        aidYearRepository.save(StudentAidYear.builder().studentId("S-3").awardYearId("AY-2025").build());

        attemptRepository.save(attempt("R-2", "S-1", "ENGL101", "FA-2024", 2, 0, "B", "3.0"));
        attemptRepository.save(attempt("R-1", "S-1", "MATH101", "SP-2024", 1, 0, "A", "4.0"));
        attemptRepository.save(attempt("R-3", "S-2", "HIST101", "FA-2024", 2, 0, "C", "2.0"));
        attemptRepository.save(attempt("R-4", "S-3", "HIST101", "FA-2024", 2, 0, "C", "2.0"));
        attemptRepository.save(attempt("R-5", "S-2", "ART101", "SP-2025", 3, 0, null, null));
    }

    @Test
    void sapCohortIsActiveStudentsWithAidInTheYear() {
        assertThat(dataSource.findCohort(CalculationKind.SAP, FALL, CohortSelector.allEligible()))
                .containsExactly("S-1");
        assertThat(dataSource.findCohort(CalculationKind.SAP, FALL, CohortSelector.explicit(List.of("S-2", "S-3"))))
                .isEmpty();
    }

    @Test
    void gpaCohortIsActiveStudentsGradedInTheTerm() {
        assertThat(dataSource.findCohort(CalculationKind.GPA, FALL, CohortSelector.allEligible()))
                .containsExactly("S-1", "S-2");
        assertThat(dataSource.findCohort(CalculationKind.GPA, new EvaluationPeriod(null, "SP-2025"),
                CohortSelector.allEligible())).isEmpty();
        assertThat(dataSource.findCohort(CalculationKind.GPA, FALL, CohortSelector.explicit(List.of()))).isEmpty();
    }

    @Test
    void snapshotCarriesOrderedAttemptsAndAidYearFlags() {
        sapRecordRepository.save(SapRecord.builder().studentId("S-1").awardYearId("AY-2024").termId("SP-2024")
                .sapStatus(SapStatus.WARNING).eligibleForAid(true).requirementsMet(false)
                .calculatedAt(LocalDateTime.now().minusMonths(6)).build());

        AcademicSnapshot snapshot = dataSource.findSnapshot("S-1", FALL).orElseThrow();

        assertThat(snapshot.attempts()).extracting(CourseAttempt::registrationId).containsExactly("R-1", "R-2");
        assertThat(snapshot.programCredits()).isEqualByComparingTo("60");
        assertThat(snapshot.previousSapStatus()).isEqualTo(SapStatus.WARNING);
        assertThat(snapshot.appealApproved()).isTrue();
        assertThat(snapshot.onAcademicPlan()).isTrue();
        assertThat(snapshot.academicPlanRequirements().requiredCourses()).containsExactly("MATH102", "ENGL102");
        assertThat(snapshot.academicPlanRequirements().termsRemaining()).isEqualTo(2);
    }

    @Test
    void snapshotFallsBackToDefaultProgramCredits() {
        AcademicSnapshot snapshot = dataSource.findSnapshot("S-2", FALL).orElseThrow();

        assertThat(snapshot.programCredits()).isEqualByComparingTo("120");
        assertThat(snapshot.previousSapStatus()).isNull();
        assertThat(snapshot.onAcademicPlan()).isFalse();
        assertThat(dataSource.findSnapshot("S-404", FALL)).isEmpty();
    }

    @Test
    void sapUpsertIsIdempotentAndUpdatesAidYearStatus() {
        SapInput input = SapInput.builder()
                .cumulativeAttemptedCredits(BigDecimal.valueOf(30))
                .cumulativeEarnedCredits(BigDecimal.valueOf(27))
                .cumulativeGpa(new BigDecimal("3.100"))
                .programCredits(BigDecimal.valueOf(120))
                .build();
        SapResult first = sapCalculator.calculateSap(input, SapPolicy.defaults()).orElseThrow();
        SapInput weaker = input.toBuilder().cumulativeGpa(new BigDecimal("1.800")).build();
        SapResult second = sapCalculator.calculateSap(weaker, SapPolicy.defaults()).orElseThrow();

        resultSink.upsertSap("S-1", FALL, input, first);
        resultSink.upsertSap("S-1", FALL, weaker, second);

        assertThat(sapRecordRepository.findByStudentIdOrderByCalculatedAtDesc("S-1")).hasSize(1);
        SapRecord record = sapRecordRepository.findByStudentIdAndAwardYearIdAndTermId("S-1", "AY-2025", "FA-2024")
                .orElseThrow();
        assertThat(record.getSapStatus()).isEqualTo(SapStatus.WARNING);
        assertThat(record.getCumulativeGpa()).isEqualByComparingTo("1.8");
        assertThat(record.getCompletionRate()).isEqualByComparingTo("0.9");
        assertThat(aidYearRepository.findByStudentIdAndAwardYearId("S-1", "AY-2025").orElseThrow().getSapStatus())
                .isEqualTo(SapStatus.WARNING);
    }

    @Test
    void gpaUpsertOverwritesTermRowAndSummary() {
        List<CourseAttempt> attempts =
                attemptRepository.findByStudentIdOrderByTermSequenceAscAttemptSequenceAsc("S-1").stream()
                        .map(CourseAttemptRecord::toCourseAttempt)
                        .toList();
        GpaCalculationOptions options = GpaCalculationOptions.defaults();
        TermGpaResult term = gpaCalculator.calculateTermGpa(attempts, "FA-2024", options).orElseThrow();
        GpaResult cumulative = gpaCalculator.calculateGpa(attempts, options).orElseThrow();

        resultSink.upsertGpa("S-1", FALL, term, cumulative);
        resultSink.upsertGpa("S-1", FALL, term, null);

        assertThat(termGpaRepository.findByStudentId("S-1")).hasSize(1);
        assertThat(termGpaRepository.findByStudentIdAndTermId("S-1", "FA-2024").orElseThrow().getTermGpa())
                .isEqualByComparingTo("3.0");
        assertThat(gpaSummaryRepository.findByStudentId("S-1").orElseThrow().getCumulativeGpa())
                .isEqualByComparingTo("3.5");
    }

    @Test
    void reporterKeepsJobRecordThroughTheRun() {
        BatchRequest request = BatchRequest.builder()
                .batchId("sap-42")
                .kind(CalculationKind.SAP)
                .period(FALL)
                .build();

        reporter.started(request);
        reporter.reportProgress("sap-42", 50);
        assertThat(batchRunRepository.findByBatchId("sap-42").orElseThrow().getState())
                .isEqualTo(BatchRunState.PROCESSING);

        LocalDateTime now = LocalDateTime.now();
        reporter.completed(new BatchResult("sap-42", CalculationKind.SAP, FALL, BatchRunState.COMPLETED,
                4, 4, 3, 1, 0, 120L,
                List.of(new BatchError("S-9", ErrorCode.SNAPSHOT_NOT_FOUND, "Insufficient academic data for SAP")),
                1, false, now, now));

        BatchRun run = batchRunRepository.findWithErrorsByBatchId("sap-42").orElseThrow();
        assertThat(run.getState()).isEqualTo(BatchRunState.COMPLETED);
        assertThat(run.getPercentComplete()).isEqualTo(100);
        assertThat(run.getSuccessful()).isEqualTo(3);
        assertThat(run.getErrors()).singleElement()
                .satisfies(error -> assertThat(error.getErrorCode()).isEqualTo(ErrorCode.SNAPSHOT_NOT_FOUND));
    }

    @Test
    void reporterFloorsPercentOfCancelledRun() {
        reporter.started(BatchRequest.builder().batchId("sap-43").kind(CalculationKind.SAP).period(FALL).build());

        LocalDateTime now = LocalDateTime.now();
        reporter.completed(new BatchResult("sap-43", CalculationKind.SAP, FALL, BatchRunState.CANCELLED,
                200, 199, 199, 0, 1, 900L, List.of(), 0, false, now, now));

        BatchRun run = batchRunRepository.findByBatchId("sap-43").orElseThrow();
        assertThat(run.getState()).isEqualTo(BatchRunState.CANCELLED);
        assertThat(run.getPercentComplete()).isEqualTo(99);
        assertThat(run.getSkipped()).isEqualTo(1);
    }

    @Test
    void reporterMarksFailedRuns() {
        reporter.started(BatchRequest.builder().batchId("gpa-7").kind(CalculationKind.GPA)
                .period(new EvaluationPeriod(null, "FA-2024")).build());

        reporter.failed("gpa-7", "Cohort retrieval failed: timeout");

        BatchRun run = batchRunRepository.findByBatchId("gpa-7").orElseThrow();
        assertThat(run.getState()).isEqualTo(BatchRunState.FAILED);
        assertThat(run.getMessage()).isEqualTo("Cohort retrieval failed: timeout");
        assertThat(run.getCompletedAt()).isNotNull();
    }

    private static CourseAttemptRecord attempt(String registrationId, String studentId, String courseId,
                                               String termId, int termSequence, int attemptSequence,
                                               String grade, String points) {
        return CourseAttemptRecord.builder()
                .registrationId(registrationId)
                .studentId(studentId)
                .courseId(courseId)
                .termId(termId)
                .termSequence(termSequence)
                .attemptSequence(attemptSequence)
                .credits(BigDecimal.valueOf(3))
                .gradeCode(grade)
                .gradePoints(points == null ? null : new BigDecimal(points))
                .creditsEarned(grade != null)
                .build();
    }
}
