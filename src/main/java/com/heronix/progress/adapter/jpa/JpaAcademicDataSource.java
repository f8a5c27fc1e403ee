package com.heronix.progress.adapter.jpa;

import java.util.List;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.progress.config.ProgressProperties;
import com.heronix.progress.exception.AcademicDataAccessException;
import com.heronix.progress.model.batch.AcademicSnapshot;
import com.heronix.progress.model.batch.CohortSelector;
import com.heronix.progress.model.batch.EvaluationPeriod;
import com.heronix.progress.model.domain.CourseAttemptRecord;
import com.heronix.progress.model.domain.SapRecord;
import com.heronix.progress.model.domain.StudentAidYear;
import com.heronix.progress.model.domain.StudentProfile;
import com.heronix.progress.model.enums.CalculationKind;
import com.heronix.progress.port.AcademicDataSource;
import com.heronix.progress.repository.CourseAttemptRecordRepository;
import com.heronix.progress.repository.SapRecordRepository;
import com.heronix.progress.repository.StudentAidYearRepository;
import com.heronix.progress.repository.StudentProfileRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Academic data source backed by the local JPA store.
 *
 * SAP cohorts are the active students holding an aid year for the award year; GPA cohorts
 * are the active students with a graded attempt in the term.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaAcademicDataSource implements AcademicDataSource {

    private final StudentProfileRepository profileRepository;
    private final CourseAttemptRecordRepository attemptRepository;
    private final StudentAidYearRepository aidYearRepository;
    private final SapRecordRepository sapRecordRepository;
    private final ProgressProperties properties;

    @Override
    @Transactional(readOnly = true)
    public List<String> findCohort(CalculationKind kind, EvaluationPeriod period, CohortSelector selector) {
        if (!selector.isAllEligible() && selector.studentIds().isEmpty()) {
            return List.of();
        }

        try {
            List<String> cohort = switch (kind) {
                case SAP -> selector.isAllEligible()
                        ? aidYearRepository.findAidedStudentIds(period.awardYearId())
                        : aidYearRepository.findAidedStudentIds(period.awardYearId(), selector.studentIds());
                case GPA -> selector.isAllEligible()
                        ? attemptRepository.findGradedStudentIdsForTerm(period.termId())
                        : attemptRepository.findGradedStudentIdsForTerm(period.termId(), selector.studentIds());
            };
            log.debug("Resolved {} cohort of {} students for {}", kind, cohort.size(), period);
            return cohort;
        } catch (DataAccessException e) {
            throw new AcademicDataAccessException("Failed to resolve " + kind + " cohort for " + period, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AcademicSnapshot> findSnapshot(String studentId, EvaluationPeriod period) {
        try {
            Optional<StudentProfile> profile = profileRepository.findByStudentId(studentId);
            if (profile.isEmpty()) {
                return Optional.empty();
            }

            List<CourseAttemptRecord> attempts =
                    attemptRepository.findByStudentIdOrderByTermSequenceAscAttemptSequenceAsc(studentId);

            AcademicSnapshot.AcademicSnapshotBuilder snapshot = AcademicSnapshot.builder()
                    .studentId(studentId)
                    .attempts(attempts.stream().map(CourseAttemptRecord::toCourseAttempt).toList())
                    .programCredits(profile.get().getProgramCredits() != null
                            ? profile.get().getProgramCredits()
                            : properties.getBatch().getDefaultProgramCredits())
                    .maxTimeframePercentage(profile.get().getMaxTimeframePercentage());

            sapRecordRepository.findFirstByStudentIdAndTermIdNotOrderByCalculatedAtDesc(studentId, period.termId())
                    .map(SapRecord::getSapStatus)
                    .ifPresent(snapshot::previousSapStatus);

            if (period.awardYearId() != null) {
                aidYearRepository.findByStudentIdAndAwardYearId(studentId, period.awardYearId())
                        .ifPresent(aidYear -> applyAidYear(snapshot, aidYear));
            }

            return Optional.of(snapshot.build());
        } catch (DataAccessException e) {
            throw new AcademicDataAccessException("Failed to load academic record for student " + studentId, e);
        }
    }

    private void applyAidYear(AcademicSnapshot.AcademicSnapshotBuilder snapshot, StudentAidYear aidYear) {
        snapshot.appealApproved(Boolean.TRUE.equals(aidYear.getAppealApproved()))
                .onAcademicPlan(Boolean.TRUE.equals(aidYear.getOnAcademicPlan()))
                .academicPlanRequirements(aidYear.toPlanRequirements());
    }
}
