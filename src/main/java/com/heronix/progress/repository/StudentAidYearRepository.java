package com.heronix.progress.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.heronix.progress.model.domain.StudentAidYear;

/**
 * Repository for StudentAidYear entities.
 */
@Repository
public interface StudentAidYearRepository extends JpaRepository<StudentAidYear, Long> {

    Optional<StudentAidYear> findByStudentIdAndAwardYearId(String studentId, String awardYearId);

    /**
     * Active students with aid in the award year.
     */
    @Query("SELECT DISTINCT y.studentId FROM StudentAidYear y, StudentProfile p " +
           "WHERE p.studentId = y.studentId AND p.active = true " +
           "AND y.awardYearId = :awardYearId " +
           "ORDER BY y.studentId")
    List<String> findAidedStudentIds(@Param("awardYearId") String awardYearId);

    /**
     * Restrict {@link #findAidedStudentIds} to the given students.
     */
    @Query("SELECT DISTINCT y.studentId FROM StudentAidYear y, StudentProfile p " +
           "WHERE p.studentId = y.studentId AND p.active = true " +
           "AND y.awardYearId = :awardYearId AND y.studentId IN :studentIds " +
           "ORDER BY y.studentId")
    List<String> findAidedStudentIds(@Param("awardYearId") String awardYearId,
                                     @Param("studentIds") Collection<String> studentIds);
}
