package com.heronix.progress.adapter.jpa;

import java.time.LocalDateTime;

import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.heronix.progress.exception.ResultPersistenceException;
import com.heronix.progress.model.batch.EvaluationPeriod;
import com.heronix.progress.model.domain.GpaSummary;
import com.heronix.progress.model.domain.SapRecord;
import com.heronix.progress.model.domain.TermGpaRecord;
import com.heronix.progress.model.gpa.GpaResult;
import com.heronix.progress.model.gpa.TermGpaResult;
import com.heronix.progress.model.sap.SapInput;
import com.heronix.progress.model.sap.SapResult;
import com.heronix.progress.port.EvaluationResultSink;
import com.heronix.progress.repository.GpaSummaryRepository;
import com.heronix.progress.repository.SapRecordRepository;
import com.heronix.progress.repository.StudentAidYearRepository;
import com.heronix.progress.repository.TermGpaRecordRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Result sink writing to the local JPA store. Each upsert looks the row up by its natural
 * key and updates it in place, creating it on first write.
 *
 * Every write runs in its own transaction. When a concurrent run inserts the same natural key
 * first, the losing insert fails on the unique constraint and the write is repeated, which
 * then finds the winner's row and overwrites it (last writer wins).
 */
@Component
@Slf4j
public class JpaEvaluationResultSink implements EvaluationResultSink {

    static final int MAX_WRITE_ATTEMPTS = 3;

    private final SapRecordRepository sapRecordRepository;
    private final StudentAidYearRepository aidYearRepository;
    private final TermGpaRecordRepository termGpaRepository;
    private final GpaSummaryRepository gpaSummaryRepository;
    private final TransactionTemplate writeTx;

    public JpaEvaluationResultSink(SapRecordRepository sapRecordRepository,
                                   StudentAidYearRepository aidYearRepository,
                                   TermGpaRecordRepository termGpaRepository,
                                   GpaSummaryRepository gpaSummaryRepository,
                                   PlatformTransactionManager transactionManager) {
        this.sapRecordRepository = sapRecordRepository;
        this.aidYearRepository = aidYearRepository;
        this.termGpaRepository = termGpaRepository;
        this.gpaSummaryRepository = gpaSummaryRepository;
        this.writeTx = new TransactionTemplate(transactionManager);
    }

    @Override
    public void upsertSap(String studentId, EvaluationPeriod period, SapInput input, SapResult result) {
        write("SAP", studentId, () -> {
            SapRecord record = sapRecordRepository
                    .findByStudentIdAndAwardYearIdAndTermId(studentId, period.awardYearId(), period.termId())
                    .orElseGet(() -> SapRecord.builder()
                            .studentId(studentId)
                            .awardYearId(period.awardYearId())
                            .termId(period.termId())
                            .build());

            record.setSapStatus(result.status());
            record.setEligibleForAid(result.eligibleForAid());
            record.setCumulativeGpa(input.cumulativeGpa());
            record.setCumulativeAttemptedCredits(input.cumulativeAttemptedCredits());
            record.setCumulativeEarnedCredits(input.cumulativeEarnedCredits());
            record.setCompletionRate(result.paceComponent().pace());
            record.setMaxTimeframePercentage(result.maxTimeframeComponent().percentageUsed());
            record.setRequirementsMet(result.allRequirementsMet());
            record.setStatusReason(result.statusReason());
            record.setRecommendations(String.join("\n", result.recommendations()));
            record.setCalculatedAt(LocalDateTime.now());
            sapRecordRepository.save(record);

            aidYearRepository.findByStudentIdAndAwardYearId(studentId, period.awardYearId())
                    .ifPresent(aidYear -> {
                        aidYear.setSapStatus(result.status());
                        aidYearRepository.save(aidYear);
                    });

            log.debug("Stored SAP {} for student {} in {}", result.status(), studentId, period);
        });
    }

    @Override
    public void upsertGpa(String studentId, EvaluationPeriod period, TermGpaResult term, GpaResult cumulative) {
        write("GPA", studentId, () -> {
            LocalDateTime now = LocalDateTime.now();

            TermGpaRecord termRecord = termGpaRepository.findByStudentIdAndTermId(studentId, term.termId())
                    .orElseGet(() -> TermGpaRecord.builder()
                            .studentId(studentId)
                            .termId(term.termId())
                            .build());
            termRecord.setAttemptedCredits(term.attemptedCredits());
            termRecord.setEarnedCredits(term.earnedCredits());
            termRecord.setQualityPoints(term.qualityPoints());
            termRecord.setGpaCredits(term.gpaCredits());
            termRecord.setTermGpa(term.termGpa());
            termRecord.setCalculatedAt(now);
            termGpaRepository.save(termRecord);

            if (cumulative != null) {
                GpaSummary summary = gpaSummaryRepository.findByStudentId(studentId)
                        .orElseGet(() -> GpaSummary.builder().studentId(studentId).build());
                summary.setCumulativeAttemptedCredits(cumulative.attemptedCredits());
                summary.setCumulativeEarnedCredits(cumulative.earnedCredits());
                summary.setCumulativeQualityPoints(cumulative.qualityPoints());
                summary.setCumulativeGpaCredits(cumulative.gpaCredits());
                summary.setCumulativeGpa(cumulative.cumulativeGpa());
                summary.setLastCalculatedAt(now);
                gpaSummaryRepository.save(summary);
            }

            log.debug("Stored GPA for student {} in term {}", studentId, term.termId());
        });
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private void write(String resultType, String studentId, Runnable upsert) {
        for (int attempt = 1; ; attempt++) {
            try {
                writeTx.executeWithoutResult(status -> upsert.run());
                return;
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                if (attempt >= MAX_WRITE_ATTEMPTS) {
                    throw new ResultPersistenceException(
                            "Failed to store " + resultType + " result for student " + studentId, e);
                }
                log.debug("Concurrent {} write for student {}; retrying as update", resultType, studentId);
            } catch (DataAccessException e) {
                throw new ResultPersistenceException(
                        "Failed to store " + resultType + " result for student " + studentId, e);
            }
        }
    }
}
