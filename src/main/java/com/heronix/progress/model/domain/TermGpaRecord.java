package com.heronix.progress.model.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
 * Term GPA for one student and term.
 */
@Entity
@Table(name = "term_gpa",
    uniqueConstraints = @UniqueConstraint(name = "uk_tg_student_term", columnNames = {"student_id", "term_id"}),
    indexes = @Index(name = "idx_tg_term", columnList = "term_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TermGpaRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false, length = 36)
    private String studentId;

    @Column(name = "term_id", nullable = false, length = 36)
    private String termId;

    @Column(name = "attempted_credits", nullable = false, precision = 7, scale = 2)
    private BigDecimal attemptedCredits;

    @Column(name = "earned_credits", nullable = false, precision = 7, scale = 2)
    private BigDecimal earnedCredits;

    @Column(name = "quality_points", nullable = false, precision = 9, scale = 3)
    private BigDecimal qualityPoints;

    @Column(name = "gpa_credits", nullable = false, precision = 7, scale = 2)
    private BigDecimal gpaCredits;

    /**
     * Null when the term has no GPA credits.
     */
    @Column(name = "term_gpa", precision = 5, scale = 3)
    private BigDecimal termGpa;

    @Column(name = "calculated_at", nullable = false)
    private LocalDateTime calculatedAt;
}
