package com.heronix.progress.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.heronix.progress.model.domain.SapRecord;
import com.heronix.progress.model.enums.SapStatus;

/**
 * Repository for SapRecord entities.
 */
@Repository
public interface SapRecordRepository extends JpaRepository<SapRecord, Long> {

    /**
     * Find by natural key.
     */
    Optional<SapRecord> findByStudentIdAndAwardYearIdAndTermId(String studentId, String awardYearId, String termId);

    /**
     * Latest evaluation of a student for any other term.
     */
    Optional<SapRecord> findFirstByStudentIdAndTermIdNotOrderByCalculatedAtDesc(String studentId, String termId);

    /**
     * SAP history of a student, newest first.
     */
    List<SapRecord> findByStudentIdOrderByCalculatedAtDesc(String studentId);

    long countByAwardYearIdAndTermIdAndSapStatus(String awardYearId, String termId, SapStatus status);
}
