package com.heronix.progress.model.domain;

import com.heronix.progress.model.enums.ErrorCode;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * One student's failure within a batch run.
 */
@Entity
@Table(name = "batch_run_errors", indexes = {
    @Index(name = "idx_bre_run", columnList = "batch_run_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchRunError {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "batch_run_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private BatchRun batchRun;

    @Column(name = "student_id", nullable = false, length = 36)
    private String studentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_code", nullable = false, length = 40)
    private ErrorCode errorCode;

    @Column(name = "message", length = 1000)
    private String message;
}
