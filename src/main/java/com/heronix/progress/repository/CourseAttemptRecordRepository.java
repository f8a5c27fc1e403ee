package com.heronix.progress.repository;

import java.util.Collection;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.heronix.progress.model.domain.CourseAttemptRecord;

/**
 * Repository for CourseAttemptRecord entities.
 */
@Repository
public interface CourseAttemptRecordRepository extends JpaRepository<CourseAttemptRecord, Long> {

    /**
     * All attempts of a student in chronological order.
     */
    List<CourseAttemptRecord> findByStudentIdOrderByTermSequenceAscAttemptSequenceAsc(String studentId);

    /**
     * Active students with at least one graded attempt in the term.
     */
    @Query("SELECT DISTINCT a.studentId FROM CourseAttemptRecord a, StudentProfile p " +
           "WHERE p.studentId = a.studentId AND p.active = true " +
           "AND a.termId = :termId AND a.gradeCode IS NOT NULL " +
           "ORDER BY a.studentId")
    List<String> findGradedStudentIdsForTerm(@Param("termId") String termId);

    /**
     * Restrict {@link #findGradedStudentIdsForTerm} to the given students.
     */
    @Query("SELECT DISTINCT a.studentId FROM CourseAttemptRecord a, StudentProfile p " +
           "WHERE p.studentId = a.studentId AND p.active = true " +
           "AND a.termId = :termId AND a.gradeCode IS NOT NULL " +
           "AND a.studentId IN :studentIds " +
           "ORDER BY a.studentId")
    List<String> findGradedStudentIdsForTerm(@Param("termId") String termId,
                                             @Param("studentIds") Collection<String> studentIds);
}
