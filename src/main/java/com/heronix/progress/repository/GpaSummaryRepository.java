package com.heronix.progress.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.heronix.progress.model.domain.GpaSummary;

/**
 * Repository for GpaSummary entities.
 */
@Repository
public interface GpaSummaryRepository extends JpaRepository<GpaSummary, Long> {

    Optional<GpaSummary> findByStudentId(String studentId);
}
