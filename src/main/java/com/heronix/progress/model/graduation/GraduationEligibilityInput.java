package com.heronix.progress.model.graduation;

import java.math.BigDecimal;
import java.util.List;

import lombok.Builder;

/**
 * Everything needed to decide graduation eligibility for one student program.
 *
 * Holds and balances arrive pre-resolved; the validator performs no lookups.
 */
@Builder(toBuilder = true)
public record GraduationEligibilityInput(
        String studentId,
        String studentProgramId,
        DegreeAudit degreeAudit,
        GpaTotals gpa,
        CreditTotals credits,
        GradeStatus grades,
        Milestones milestones,
        List<BlockingHold> holds,
        BigDecimal financialBalance,
        boolean libraryClearance,
        boolean departmentClearance,
        boolean exitCounselingRequired,
        boolean exitCounselingComplete,
        boolean international,
        Boolean sevisUpdated,
        String diplomaName,
        String mailingAddress,
        boolean majorDeclared,
        boolean hasAcademicIntegrityViolation
) {
    public GraduationEligibilityInput {
        holds = holds == null ? List.of() : List.copyOf(holds);
        milestones = milestones == null ? new Milestones(List.of(), List.of(), List.of()) : milestones;
    }

    public record DegreeAudit(
            BigDecimal completionPct,
            boolean allRequirementsComplete,
            List<String> missingRequirements
    ) {
        public DegreeAudit {
            missingRequirements = missingRequirements == null ? List.of() : List.copyOf(missingRequirements);
        }
    }

    /**
     * @param cumulative null when the student has no graded work
     * @param institutional null when institutional GPA is not tracked separately
     */
    public record GpaTotals(
            BigDecimal cumulative,
            BigDecimal institutional,
            BigDecimal major
    ) {
    }

    public record CreditTotals(
            BigDecimal totalEarned,
            BigDecimal institutionalEarned,
            BigDecimal transferCredits,
            BigDecimal inProgress
    ) {
    }

    public record GradeStatus(
            int incompleteCount,
            int pendingCount
    ) {
        public boolean hasIncompleteGrades() {
            return incompleteCount > 0;
        }

        public boolean hasPendingFinalGrades() {
            return pendingCount > 0;
        }
    }

    /**
     * @param required milestones that block graduation when missing (thesis, comprehensive exams)
     * @param recommended milestones that only produce a warning when missing
     */
    public record Milestones(
            List<String> required,
            List<String> recommended,
            List<String> completed
    ) {
        public Milestones {
            required = required == null ? List.of() : List.copyOf(required);
            recommended = recommended == null ? List.of() : List.copyOf(recommended);
            completed = completed == null ? List.of() : List.copyOf(completed);
        }
    }
}
