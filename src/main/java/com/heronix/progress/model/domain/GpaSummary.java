package com.heronix.progress.model.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Current cumulative GPA of a student.
 */
@Entity
@Table(name = "gpa_summary")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GpaSummary {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false, unique = true, length = 36)
    private String studentId;

    @Column(name = "cumulative_attempted_credits", nullable = false, precision = 7, scale = 2)
    private BigDecimal cumulativeAttemptedCredits;

    @Column(name = "cumulative_earned_credits", nullable = false, precision = 7, scale = 2)
    private BigDecimal cumulativeEarnedCredits;

    @Column(name = "cumulative_quality_points", nullable = false, precision = 9, scale = 3)
    private BigDecimal cumulativeQualityPoints;

    @Column(name = "cumulative_gpa_credits", nullable = false, precision = 7, scale = 2)
    private BigDecimal cumulativeGpaCredits;

    @Column(name = "cumulative_gpa", precision = 5, scale = 3)
    private BigDecimal cumulativeGpa;

    @Column(name = "last_calculated_at", nullable = false)
    private LocalDateTime lastCalculatedAt;
}
