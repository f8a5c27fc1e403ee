package com.heronix.progress.model.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import com.heronix.progress.model.enums.SapStatus;
import com.heronix.progress.model.sap.AcademicPlanRequirements;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Student Aid Year - A student's financial aid record for one award year.
 *
 * Carries the appeal and academic plan flags read by SAP evaluation and the current SAP
 * status written back after each evaluation.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Entity
@Table(name = "student_aid_years",
    uniqueConstraints = @UniqueConstraint(name = "uk_say_student_year",
            columnNames = {"student_id", "award_year_id"}),
    indexes = {
        @Index(name = "idx_say_award_year", columnList = "award_year_id")
    })
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudentAidYear {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false, length = 36)
    private String studentId;

    @Column(name = "award_year_id", nullable = false, length = 36)
    private String awardYearId;

    @Column(name = "appeal_approved", nullable = false)
    @Builder.Default
    private Boolean appealApproved = false;

    @Column(name = "on_academic_plan", nullable = false)
    @Builder.Default
    private Boolean onAcademicPlan = false;

    @Column(name = "plan_term_minimum_gpa", precision = 4, scale = 3)
    private BigDecimal planTermMinimumGpa;

    @Column(name = "plan_term_minimum_pace", precision = 5, scale = 4)
    private BigDecimal planTermMinimumPace;

    @Column(name = "plan_max_term_credits", precision = 5, scale = 2)
    private BigDecimal planMaxTermCredits;

    /**
     * Comma-separated course ids the plan requires.
     */
    @Column(name = "plan_required_courses", length = 1000)
    private String planRequiredCourses;

    @Column(name = "plan_terms_remaining")
    private Integer planTermsRemaining;

    /**
     * Status from the latest SAP evaluation in this award year.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "sap_status", length = 20)
    private SapStatus sapStatus;

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

    /**
     * Plan requirements, or null when the student has no plan on file.
     */
    public AcademicPlanRequirements toPlanRequirements() {
        if (!Boolean.TRUE.equals(onAcademicPlan)) {
            return null;
        }
        List<String> courses = planRequiredCourses == null || planRequiredCourses.isBlank()
                ? List.of()
                : Arrays.stream(planRequiredCourses.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .toList();
        return AcademicPlanRequirements.builder()
                .termMinimumGpa(planTermMinimumGpa)
                .termMinimumPace(planTermMinimumPace)
                .maxTermCredits(planMaxTermCredits)
                .requiredCourses(courses)
                .termsRemaining(planTermsRemaining == null ? 0 : planTermsRemaining)
                .build();
    }
}
