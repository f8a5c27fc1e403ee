package com.heronix.progress.adapter.jpa;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import com.heronix.progress.calculator.gpa.GpaCalculator;
import com.heronix.progress.calculator.sap.SapCalculator;
import com.heronix.progress.model.batch.EvaluationPeriod;
import com.heronix.progress.model.domain.SapRecord;
import com.heronix.progress.model.enums.SapStatus;
import com.heronix.progress.model.gpa.CourseAttempt;
import com.heronix.progress.model.gpa.GpaCalculationOptions;
import com.heronix.progress.model.gpa.GpaResult;
import com.heronix.progress.model.gpa.TermGpaResult;
import com.heronix.progress.model.sap.SapInput;
import com.heronix.progress.model.sap.SapPolicy;
import com.heronix.progress.model.sap.SapResult;
import com.heronix.progress.repository.GpaSummaryRepository;
import com.heronix.progress.repository.SapRecordRepository;
import com.heronix.progress.repository.TermGpaRecordRepository;

/**
 * Two runs writing the same natural key at the same moment. Runs outside a test transaction
 * so each write commits on its own.
 */
@SpringBootTest
class JpaEvaluationResultSinkConcurrencyTest {

    private static final int ROUNDS = 20;
    private static final EvaluationPeriod PERIOD = new EvaluationPeriod("AY-RACE", "TERM-RACE");

    @Autowired
    private JpaEvaluationResultSink resultSink;

    @Autowired
    private SapRecordRepository sapRecordRepository;

    @Autowired
    private TermGpaRecordRepository termGpaRepository;

    @Autowired
    private GpaSummaryRepository gpaSummaryRepository;

    private final ExecutorService writers = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        writers.shutdownNow();
    }

    @Test
    void simultaneousSapWritesLeaveOneRowPerKey() throws Exception {
        SapInput strong = SapInput.builder()
                .cumulativeAttemptedCredits(BigDecimal.valueOf(30))
                .cumulativeEarnedCredits(BigDecimal.valueOf(27))
                .cumulativeGpa(new BigDecimal("3.100"))
                .programCredits(BigDecimal.valueOf(120))
                .build();
        SapInput weak = strong.toBuilder().cumulativeGpa(new BigDecimal("1.800")).build();
        SapCalculator calculator = new SapCalculator();
        SapResult satisfactory = calculator.calculateSap(strong, SapPolicy.defaults()).orElseThrow();
        SapResult warning = calculator.calculateSap(weak, SapPolicy.defaults()).orElseThrow();

        ConcurrentLinkedQueue<Throwable> failures = new ConcurrentLinkedQueue<>();
        for (int round = 0; round < ROUNDS; round++) {
            String studentId = "RACE-SAP-" + round;
            race(failures,
                    () -> resultSink.upsertSap(studentId, PERIOD, strong, satisfactory),
                    () -> resultSink.upsertSap(studentId, PERIOD, weak, warning));
        }

        assertThat(failures).isEmpty();
        for (int round = 0; round < ROUNDS; round++) {
            List<SapRecord> rows = sapRecordRepository.findByStudentIdOrderByCalculatedAtDesc("RACE-SAP-" + round);
            assertThat(rows).hasSize(1);
            assertThat(rows.get(0).getSapStatus()).isIn(SapStatus.SATISFACTORY, SapStatus.WARNING);
        }
    }

    @Test
    void simultaneousGpaWritesLeaveOneTermRowAndOneSummary() throws Exception {
        GpaCalculator calculator = new GpaCalculator();
        List<CourseAttempt> attempts = List.of(CourseAttempt.builder()
                .registrationId("RACE-R1")
                .courseId("MATH101")
                .termId(PERIOD.termId())
                .credits(BigDecimal.valueOf(3))
                .gradeCode("B")
                .gradePoints(new BigDecimal("3.0"))
                .includeInGpa(true)
                .creditsEarned(true)
                .build());
        TermGpaResult term = calculator.calculateTermGpa(attempts, PERIOD.termId(), GpaCalculationOptions.defaults())
                .orElseThrow();
        GpaResult cumulative = calculator.calculateGpa(attempts, GpaCalculationOptions.defaults()).orElseThrow();

        ConcurrentLinkedQueue<Throwable> failures = new ConcurrentLinkedQueue<>();
        for (int round = 0; round < ROUNDS; round++) {
            String studentId = "RACE-GPA-" + round;
            race(failures,
                    () -> resultSink.upsertGpa(studentId, PERIOD, term, cumulative),
                    () -> resultSink.upsertGpa(studentId, PERIOD, term, cumulative));
        }

        assertThat(failures).isEmpty();
        for (int round = 0; round < ROUNDS; round++) {
            String studentId = "RACE-GPA-" + round;
            assertThat(termGpaRepository.findByStudentId(studentId)).hasSize(1);
            assertThat(gpaSummaryRepository.findByStudentId(studentId))
                    .hasValueSatisfying(summary -> assertThat(summary.getCumulativeGpa()).isEqualByComparingTo("3.0"));
        }
    }

    private void race(ConcurrentLinkedQueue<Throwable> failures, Runnable first, Runnable second) throws Exception {
        CyclicBarrier start = new CyclicBarrier(2);
        Future<?> one = writers.submit(() -> runAfter(start, first, failures));
        Future<?> two = writers.submit(() -> runAfter(start, second, failures));
        one.get(30, TimeUnit.SECONDS);
        two.get(30, TimeUnit.SECONDS);
    }

    private static void runAfter(CyclicBarrier start, Runnable write, ConcurrentLinkedQueue<Throwable> failures) {
        try {
            start.await(10, TimeUnit.SECONDS);
            write.run();
        } catch (Exception e) {
            failures.add(e);
        }
    }
}
