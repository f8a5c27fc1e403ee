package com.heronix.progress.calculator.standing;

import static com.heronix.progress.model.enums.AcademicStandingStatus.ACADEMIC_DISMISSAL;
import static com.heronix.progress.model.enums.AcademicStandingStatus.ACADEMIC_PROBATION;
import static com.heronix.progress.model.enums.AcademicStandingStatus.ACADEMIC_SUSPENSION;
import static com.heronix.progress.model.enums.AcademicStandingStatus.ACADEMIC_WARNING;
import static com.heronix.progress.model.enums.AcademicStandingStatus.GOOD_STANDING;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.heronix.progress.model.enums.AcademicStandingStatus;
import com.heronix.progress.model.enums.ErrorCode;
import com.heronix.progress.model.result.CalculationResult;
import com.heronix.progress.model.result.DomainError;
import com.heronix.progress.model.standing.AcademicStandingInput;
import com.heronix.progress.model.standing.AcademicStandingPolicy;
import com.heronix.progress.model.standing.AcademicStandingPolicy.AppliedThreshold;
import com.heronix.progress.model.standing.AcademicStandingResult;
import com.heronix.progress.model.standing.AcademicStandingResult.ProbationTracking;
import com.heronix.progress.model.standing.AcademicStandingResult.SuspensionTracking;
import com.heronix.progress.model.standing.RequiredTermGpa;
import com.heronix.progress.model.standing.StandingHistoryEntry;

/**
 * Institutional academic standing calculator.
 *
 * Compares the cumulative GPA with the good standing minimum in force at the student's
 * attempted-credit level, then advances the probation and suspension counters carried in the
 * standing history:
 * <ul>
 *   <li>returning from suspension always starts a new probation period</li>
 *   <li>dismissal is kept until the student is readmitted outside this calculation</li>
 *   <li>a warning is only given on a first drop from good standing</li>
 *   <li>probation beyond {@code probationMaxTerms} suspends, or dismisses once suspensions are used up</li>
 * </ul>
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Component
public class AcademicStandingCalculator {

    static final int GPA_SCALE = 3;

    private static final BigDecimal MAX_TERM_GPA = new BigDecimal("4.0");

    /**
     * Determine a student's standing at the end of a term.
     *
     * @return the standing, or a VALIDATION failure for malformed input or policy
     */
    public CalculationResult<AcademicStandingResult> calculateAcademicStanding(AcademicStandingInput input,
                                                                               AcademicStandingPolicy policy) {
        List<String> problems = validate(input, policy);
        if (!problems.isEmpty()) {
            return CalculationResult.failure(
                    DomainError.of(ErrorCode.INVALID_STANDING_INPUT, "Invalid academic standing input", problems));
        }

        AppliedThreshold thresholds = policy.thresholdsFor(input.cumulativeCreditsAttempted());
        Determination determination = determine(input, thresholds, policy, lastEntry(input.previousHistory()));
        AcademicStandingStatus standing = determination.standing();

        return CalculationResult.success(new AcademicStandingResult(
                standing,
                input.currentStanding(),
                input.currentStanding() != standing,
                reason(determination, thresholds, input, policy),
                thresholds,
                new ProbationTracking(
                        determination.consecutiveProbationTerms(),
                        determination.totalProbationTerms(),
                        policy.probationMaxTerms(),
                        standing == ACADEMIC_PROBATION
                                ? Math.max(0, policy.probationMaxTerms() - determination.consecutiveProbationTerms())
                                : null),
                new SuspensionTracking(
                        determination.totalSuspensions(),
                        policy.maxSuspensions(),
                        Math.max(0, policy.maxSuspensions() - determination.totalSuspensions())),
                actionItems(determination, thresholds, input, policy),
                standing == ACADEMIC_SUSPENSION || standing == ACADEMIC_DISMISSAL));
    }

    /**
     * What-if check: whether the GPA meets the good standing minimum at the credit level.
     */
    public boolean wouldBeInGoodStanding(BigDecimal gpa, BigDecimal creditsCompleted, AcademicStandingPolicy policy) {
        return gpa.compareTo(getMinimumGpaForGoodStanding(creditsCompleted, policy)) >= 0;
    }

    public BigDecimal getMinimumGpaForGoodStanding(BigDecimal creditsCompleted, AcademicStandingPolicy policy) {
        return policy.thresholdsFor(creditsCompleted).goodStandingMinGpa();
    }

    /**
     * Term GPA needed next term for the cumulative GPA to reach {@code targetGpa}. A target that
     * would need more than 4.0 is reported as not achievable; a target already exceeded needs 0.
     */
    public CalculationResult<RequiredTermGpa> calculateRequiredTermGpa(BigDecimal currentQualityPoints,
                                                                       BigDecimal currentGpaCredits,
                                                                       BigDecimal nextTermCredits,
                                                                       BigDecimal targetGpa) {
        List<String> problems = new ArrayList<>();
        requireNonNegative(problems, "Current quality points", currentQualityPoints);
        requireNonNegative(problems, "Current GPA credits", currentGpaCredits);
        requireNonNegative(problems, "Target GPA", targetGpa);
        if (nextTermCredits == null) {
            problems.add("Next term credits is required");
        } else if (nextTermCredits.signum() <= 0) {
            problems.add("Next term credits must be positive: " + nextTermCredits);
        }
        if (!problems.isEmpty()) {
            return CalculationResult.failure(
                    DomainError.of(ErrorCode.INVALID_STANDING_INPUT, "Invalid required term GPA input", problems));
        }

        BigDecimal requiredTotal = targetGpa.multiply(currentGpaCredits.add(nextTermCredits));
        BigDecimal required = requiredTotal.subtract(currentQualityPoints)
                .divide(nextTermCredits, 10, RoundingMode.HALF_UP);

        if (required.compareTo(MAX_TERM_GPA) > 0) {
            return CalculationResult.success(new RequiredTermGpa(targetGpa, nextTermCredits, null, false));
        }
        BigDecimal rounded = required.max(BigDecimal.ZERO).setScale(GPA_SCALE, RoundingMode.HALF_UP);
        return CalculationResult.success(new RequiredTermGpa(targetGpa, nextTermCredits, rounded, true));
    }

    // ========================================================================
    // DETERMINATION
    // ========================================================================

    private Determination determine(AcademicStandingInput input, AppliedThreshold thresholds,
                                    AcademicStandingPolicy policy, StandingHistoryEntry last) {
        AcademicStandingStatus current = input.currentStanding();
        int consecutive = last == null ? 0 : last.consecutiveProbationTerms();
        int totalProbation = last == null ? 0 : last.totalProbationTerms();
        int suspensions = last == null ? 0 : last.totalSuspensions();
        BigDecimal gpa = input.cumulativeGpa();

        // Suspension length is tracked by the registrar; reaching here means the student is back
        if (current == ACADEMIC_SUSPENSION) {
            return new Determination(ACADEMIC_PROBATION, 1, totalProbation + 1, suspensions);
        }
        if (current == ACADEMIC_DISMISSAL) {
            return new Determination(ACADEMIC_DISMISSAL, 0, totalProbation, suspensions);
        }
        if (gpa.compareTo(thresholds.goodStandingMinGpa()) >= 0) {
            return new Determination(GOOD_STANDING, 0, totalProbation, suspensions);
        }
        if (thresholds.warningMinGpa() != null && gpa.compareTo(thresholds.warningMinGpa()) >= 0
                && (current == null || current == GOOD_STANDING)) {
            return new Determination(ACADEMIC_WARNING, 0, totalProbation, suspensions);
        }
        if (current == ACADEMIC_PROBATION) {
            int nextConsecutive = consecutive + 1;
            if (nextConsecutive > policy.probationMaxTerms()) {
                if (suspensions >= policy.maxSuspensions()) {
                    return new Determination(ACADEMIC_DISMISSAL, 0, totalProbation + 1, suspensions);
                }
                return new Determination(ACADEMIC_SUSPENSION, 0, totalProbation + 1, suspensions + 1);
            }
            return new Determination(ACADEMIC_PROBATION, nextConsecutive, totalProbation + 1, suspensions);
        }
        return new Determination(ACADEMIC_PROBATION, 1, totalProbation + 1, suspensions);
    }

    private String reason(Determination determination, AppliedThreshold thresholds, AcademicStandingInput input,
                          AcademicStandingPolicy policy) {
        String gpa = fixed(input.cumulativeGpa());
        String minimum = fixed(thresholds.goodStandingMinGpa());
        AcademicStandingStatus previous = input.currentStanding();

        return switch (determination.standing()) {
            case GOOD_STANDING -> previous == ACADEMIC_PROBATION
                    ? "Cumulative GPA of " + gpa + " meets the minimum " + minimum
                            + " required for good standing. Student has been removed from academic probation."
                    : "Cumulative GPA of " + gpa + " meets the minimum " + minimum + " required for good standing.";
            case ACADEMIC_WARNING -> "Cumulative GPA of " + gpa + " is below the " + minimum
                    + " required for good standing. This is an academic warning - continued decline may result in academic probation.";
            case ACADEMIC_PROBATION -> {
                if (previous == ACADEMIC_SUSPENSION) {
                    yield "Student is returning from academic suspension on probation. Cumulative GPA of " + gpa
                            + " is below the minimum " + minimum + ".";
                }
                if (previous == ACADEMIC_PROBATION) {
                    yield "Student remains on academic probation. Cumulative GPA of " + gpa
                            + " is still below the minimum " + minimum + ". This is probation term "
                            + determination.consecutiveProbationTerms() + " of " + policy.probationMaxTerms()
                            + " allowed.";
                }
                yield "Cumulative GPA of " + gpa + " is below the " + minimum
                        + " minimum for good standing. Student has been placed on academic probation.";
            }
            case ACADEMIC_SUSPENSION -> "Student has exceeded the maximum " + policy.probationMaxTerms()
                    + " terms on academic probation without meeting the " + minimum
                    + " GPA requirement. Academic suspension for " + policy.suspensionDurationTerms() + " term(s).";
            case ACADEMIC_DISMISSAL -> "Student has exceeded the maximum " + policy.maxSuspensions()
                    + " academic suspensions. Academic dismissal is in effect.";
            case REINSTATED -> "Student has been reinstated following an approved appeal.";
        };
    }

    private List<String> actionItems(Determination determination, AppliedThreshold thresholds,
                                     AcademicStandingInput input, AcademicStandingPolicy policy) {
        List<String> items = new ArrayList<>();
        String gpaNeeded = fixed(thresholds.goodStandingMinGpa().subtract(input.cumulativeGpa()));

        switch (determination.standing()) {
            case GOOD_STANDING -> {
                if (input.currentStanding() == ACADEMIC_PROBATION) {
                    items.add("Congratulations on returning to good academic standing!");
                    items.add("Continue to maintain your GPA at or above the minimum requirement.");
                }
            }
            case ACADEMIC_WARNING -> {
                items.add("Schedule a meeting with your academic advisor immediately.");
                items.add("Your GPA needs to improve by " + gpaNeeded + " points to return to good standing.");
                items.add("Consider utilizing tutoring services and academic support resources.");
                items.add("Review your course load and consider adjustments if needed.");
            }
            case ACADEMIC_PROBATION -> {
                items.add("Schedule a mandatory meeting with your academic advisor.");
                items.add("Develop an academic success plan with specific goals.");
                items.add("You must raise your GPA by " + gpaNeeded + " points to return to good standing.");
                items.add("Utilize all available academic support services (tutoring, study groups, etc.).");
                if (determination.consecutiveProbationTerms() >= policy.probationMaxTerms() - 1) {
                    items.add("WARNING: This is your final probation term. Failure to meet requirements will result in academic suspension.");
                }
            }
            case ACADEMIC_SUSPENSION -> {
                items.add("You have been academically suspended and cannot enroll for the suspension period.");
                items.add("You may submit an appeal to the Academic Standards Committee.");
                items.add("Contact the Registrar's Office for information on the reinstatement process.");
                items.add("Consider using this time to address any personal or academic challenges.");
            }
            case ACADEMIC_DISMISSAL -> {
                items.add("You have been academically dismissed from the institution.");
                items.add("You may submit an appeal for readmission to the Academic Standards Committee.");
                items.add("Contact the Admissions Office for information on future reapplication.");
            }
            case REINSTATED -> {
                items.add("You have been reinstated following your appeal.");
                items.add("Adhere to all conditions specified in your reinstatement approval.");
                items.add("Meet with your academic advisor to review your academic plan.");
            }
        }
        return items;
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private List<String> validate(AcademicStandingInput input, AcademicStandingPolicy policy) {
        List<String> problems = new ArrayList<>();
        if (policy == null) {
            problems.add("Academic standing policy is required");
        } else {
            requireNonNegative(problems, "Good standing minimum GPA", policy.goodStandingMinGpa());
            if (policy.probationMaxTerms() < 1) {
                problems.add("Probation maximum terms must be at least 1: " + policy.probationMaxTerms());
            }
            if (policy.maxSuspensions() < 0) {
                problems.add("Maximum suspensions must not be negative: " + policy.maxSuspensions());
            }
            policy.thresholdsByCredits().forEach(tier -> {
                requireNonNegative(problems, "Threshold maximum credits", tier.maxCredits());
                requireNonNegative(problems, "Threshold good standing minimum GPA", tier.goodStandingMinGpa());
            });
        }
        if (input == null) {
            problems.add("Academic standing input is required");
            return problems;
        }

        requireNonNegative(problems, "Cumulative GPA", input.cumulativeGpa());
        requireNonNegative(problems, "Cumulative credits attempted", input.cumulativeCreditsAttempted());
        rejectNegative(problems, "Cumulative credits earned", input.cumulativeCreditsEarned());
        rejectNegative(problems, "Term GPA", input.termGpa());
        rejectNegative(problems, "Term credits attempted", input.termCreditsAttempted());
        rejectNegative(problems, "Term credits earned", input.termCreditsEarned());
        return problems;
    }

    private static StandingHistoryEntry lastEntry(List<StandingHistoryEntry> history) {
        return history.isEmpty() ? null : history.get(history.size() - 1);
    }

    private static void requireNonNegative(List<String> problems, String field, BigDecimal value) {
        if (value == null) {
            problems.add(field + " is required");
        } else {
            rejectNegative(problems, field, value);
        }
    }

    private static void rejectNegative(List<String> problems, String field, BigDecimal value) {
        if (value != null && value.signum() < 0) {
            problems.add(field + " must not be negative: " + value);
        }
    }

    private static String fixed(BigDecimal value) {
        return value.setScale(GPA_SCALE, RoundingMode.HALF_UP).toPlainString();
    }

    private record Determination(
            AcademicStandingStatus standing,
            int consecutiveProbationTerms,
            int totalProbationTerms,
            int totalSuspensions
    ) {
    }
}
