package com.heronix.progress.model.domain;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import com.heronix.progress.model.enums.BatchRunState;
import com.heronix.progress.model.enums.CalculationKind;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Batch Run - Job record of a batch evaluation.
 *
 * Created when a run starts, updated with its progress and closed with the final
 * counters. Per-student errors are kept up to the configured cap.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Entity
@Table(name = "batch_runs", indexes = {
    @Index(name = "idx_br_batch", columnList = "batch_id", unique = true),
    @Index(name = "idx_br_state", columnList = "state"),
    @Index(name = "idx_br_started", columnList = "started_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "batch_id", nullable = false, unique = true, length = 64)
    private String batchId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 10)
    private CalculationKind kind;

    @Column(name = "award_year_id", length = 36)
    private String awardYearId;

    @Column(name = "term_id", length = 36)
    private String termId;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    @Builder.Default
    private BatchRunState state = BatchRunState.COLLECTING;

    @Column(name = "percent_complete", nullable = false)
    @Builder.Default
    private Integer percentComplete = 0;

    @Column(name = "total")
    private Integer total;

    @Column(name = "processed")
    private Integer processed;

    @Column(name = "successful")
    private Integer successful;

    @Column(name = "failed")
    private Integer failed;

    @Column(name = "skipped")
    private Integer skipped;

    @Column(name = "total_error_count")
    private Integer totalErrorCount;

    @Column(name = "errors_truncated")
    @Builder.Default
    private Boolean errorsTruncated = false;

    @Column(name = "duration_ms")
    private Long durationMs;

    /**
     * Failure reason of a FAILED run.
     */
    @Column(name = "message", length = 1000)
    private String message;

    @OneToMany(mappedBy = "batchRun", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("id ASC")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @Builder.Default
    private List<BatchRunError> errors = new ArrayList<>();

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @PrePersist
    protected void onCreate() {
        if (startedAt == null) {
            startedAt = LocalDateTime.now();
        }
    }

    /**
     * Add an error entry to this run.
     */
    public void addError(BatchRunError error) {
        errors.add(error);
        error.setBatchRun(this);
    }

    /**
     * Mark as failed.
     */
    public void fail(String reason) {
        this.state = BatchRunState.FAILED;
        this.message = reason;
        this.completedAt = LocalDateTime.now();
    }
}
