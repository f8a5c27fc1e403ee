package com.heronix.progress.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.heronix.progress.model.domain.TermGpaRecord;

/**
 * Repository for TermGpaRecord entities.
 */
@Repository
public interface TermGpaRecordRepository extends JpaRepository<TermGpaRecord, Long> {

    Optional<TermGpaRecord> findByStudentIdAndTermId(String studentId, String termId);

    List<TermGpaRecord> findByStudentId(String studentId);
}
