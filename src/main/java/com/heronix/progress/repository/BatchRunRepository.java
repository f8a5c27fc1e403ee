package com.heronix.progress.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.heronix.progress.model.domain.BatchRun;
import com.heronix.progress.model.enums.BatchRunState;
import com.heronix.progress.model.enums.CalculationKind;

/**
 * Repository for BatchRun entities.
 */
@Repository
public interface BatchRunRepository extends JpaRepository<BatchRun, Long> {

    /**
     * Find by batch ID.
     */
    Optional<BatchRun> findByBatchId(String batchId);

    /**
     * Find by batch ID with its error entries loaded.
     */
    @Query("SELECT r FROM BatchRun r LEFT JOIN FETCH r.errors WHERE r.batchId = :batchId")
    Optional<BatchRun> findWithErrorsByBatchId(@Param("batchId") String batchId);

    /**
     * Recent runs, newest first.
     */
    Page<BatchRun> findAllByOrderByStartedAtDesc(Pageable pageable);

    Page<BatchRun> findByKindOrderByStartedAtDesc(CalculationKind kind, Pageable pageable);

    List<BatchRun> findByStateIn(List<BatchRunState> states);

    long countByState(BatchRunState state);
}
