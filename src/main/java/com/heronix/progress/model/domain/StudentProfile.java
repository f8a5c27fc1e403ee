package com.heronix.progress.model.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Student Profile - Enrollment status and primary program data used by evaluations.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Entity
@Table(name = "student_profiles", indexes = {
    @Index(name = "idx_sp_student", columnList = "student_id", unique = true),
    @Index(name = "idx_sp_active", columnList = "active")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudentProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * SIS student identifier.
     */
    @Column(name = "student_id", nullable = false, unique = true, length = 36)
    private String studentId;

    /**
     * Only active students are selected into cohorts.
     */
    @Column(name = "active", nullable = false)
    @Builder.Default
    private Boolean active = true;

    /**
     * Credits required by the primary program; null falls back to the configured default.
     */
    @Column(name = "program_credits", precision = 6, scale = 2)
    private BigDecimal programCredits;

    /**
     * Program-specific maximum timeframe multiplier, null to use the policy value.
     */
    @Column(name = "max_timeframe_percentage", precision = 5, scale = 3)
    private BigDecimal maxTimeframePercentage;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
