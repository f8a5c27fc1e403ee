package com.heronix.progress.model.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.heronix.progress.model.enums.SapStatus;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * SAP Record - Stored SAP evaluation for one student, award year and term.
 *
 * Re-evaluating the same period overwrites the row; earlier terms stay as history.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Entity
@Table(name = "sap_records",
    uniqueConstraints = @UniqueConstraint(name = "uk_sap_student_year_term",
            columnNames = {"student_id", "award_year_id", "term_id"}),
    indexes = {
        @Index(name = "idx_sap_student", columnList = "student_id"),
        @Index(name = "idx_sap_status", columnList = "sap_status"),
        @Index(name = "idx_sap_calculated", columnList = "calculated_at")
    })
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SapRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false, length = 36)
    private String studentId;

    @Column(name = "award_year_id", nullable = false, length = 36)
    private String awardYearId;

    @Column(name = "term_id", nullable = false, length = 36)
    private String termId;

    @Enumerated(EnumType.STRING)
    @Column(name = "sap_status", nullable = false, length = 20)
    private SapStatus sapStatus;

    @Column(name = "eligible_for_aid", nullable = false)
    private Boolean eligibleForAid;

    @Column(name = "cumulative_gpa", precision = 5, scale = 3)
    private BigDecimal cumulativeGpa;

    @Column(name = "cumulative_attempted_credits", precision = 7, scale = 2)
    private BigDecimal cumulativeAttemptedCredits;

    @Column(name = "cumulative_earned_credits", precision = 7, scale = 2)
    private BigDecimal cumulativeEarnedCredits;

    /**
     * Pace as a ratio (0.6700 = 67%).
     */
    @Column(name = "completion_rate", precision = 6, scale = 4)
    private BigDecimal completionRate;

    @Column(name = "max_timeframe_percentage", precision = 7, scale = 4)
    private BigDecimal maxTimeframePercentage;

    @Column(name = "requirements_met", nullable = false)
    private Boolean requirementsMet;

    @Column(name = "status_reason", length = 500)
    private String statusReason;

    /**
     * Recommendations, one per line.
     */
    @Column(name = "recommendations", columnDefinition = "TEXT")
    private String recommendations;

    @Column(name = "calculated_at", nullable = false)
    private LocalDateTime calculatedAt;
}
