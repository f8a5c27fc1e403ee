package com.heronix.progress.model.domain;

import java.math.BigDecimal;

import com.heronix.progress.model.enums.RepeatPolicy;
import com.heronix.progress.model.gpa.CourseAttempt;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Course Attempt Record - One registration of a student in a course section.
 *
 * Rows are read in term order ({@code termSequence}) and, within a term, in
 * registration order ({@code attemptSequence}).
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Entity
@Table(name = "course_attempts", indexes = {
    @Index(name = "idx_ca_student", columnList = "student_id"),
    @Index(name = "idx_ca_term", columnList = "term_id"),
    @Index(name = "idx_ca_registration", columnList = "registration_id", unique = true)
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CourseAttemptRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "registration_id", nullable = false, unique = true, length = 36)
    private String registrationId;

    @Column(name = "student_id", nullable = false, length = 36)
    private String studentId;

    @Column(name = "course_id", nullable = false, length = 36)
    private String courseId;

    @Column(name = "term_id", nullable = false, length = 36)
    private String termId;

    /**
     * Chronological position of the term.
     */
    @Column(name = "term_sequence", nullable = false)
    private Integer termSequence;

    @Column(name = "attempt_sequence", nullable = false)
    @Builder.Default
    private Integer attemptSequence = 0;

    @Column(name = "credits", nullable = false, precision = 5, scale = 2)
    private BigDecimal credits;

    /**
     * Null while the course is in progress.
     */
    @Column(name = "grade_code", length = 5)
    private String gradeCode;

    @Column(name = "grade_points", precision = 4, scale = 2)
    private BigDecimal gradePoints;

    @Column(name = "include_in_gpa", nullable = false)
    @Builder.Default
    private Boolean includeInGpa = true;

    @Column(name = "credits_earned", nullable = false)
    @Builder.Default
    private Boolean creditsEarned = false;

    @Column(name = "is_repeat", nullable = false)
    @Builder.Default
    private Boolean repeat = false;

    /**
     * Course repeat policy, null for the institution default.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "repeat_policy", length = 20)
    private RepeatPolicy repeatPolicy;

    @Column(name = "repeats_registration_id", length = 36)
    private String repeatsRegistrationId;

    /**
     * Convert to the immutable calculation input.
     */
    public CourseAttempt toCourseAttempt() {
        return CourseAttempt.builder()
                .registrationId(registrationId)
                .courseId(courseId)
                .termId(termId)
                .credits(credits)
                .gradeCode(gradeCode)
                .gradePoints(gradePoints)
                .includeInGpa(Boolean.TRUE.equals(includeInGpa))
                .creditsEarned(Boolean.TRUE.equals(creditsEarned))
                .repeat(Boolean.TRUE.equals(repeat))
                .repeatPolicy(repeatPolicy)
                .repeatsRegistrationId(repeatsRegistrationId)
                .build();
    }
}
