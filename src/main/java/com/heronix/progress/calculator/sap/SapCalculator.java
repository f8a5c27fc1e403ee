package com.heronix.progress.calculator.sap;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.heronix.progress.model.enums.ErrorCode;
import com.heronix.progress.model.enums.SapStatus;
import com.heronix.progress.model.result.CalculationResult;
import com.heronix.progress.model.result.DomainError;
import com.heronix.progress.model.sap.AcademicPlanRequirements;
import com.heronix.progress.model.sap.SapInput;
import com.heronix.progress.model.sap.SapPolicy;
import com.heronix.progress.model.sap.SapResult;
import com.heronix.progress.model.sap.SapResult.AcademicPlanCompliance;
import com.heronix.progress.model.sap.SapResult.GpaComponent;
import com.heronix.progress.model.sap.SapResult.MaxTimeframeComponent;
import com.heronix.progress.model.sap.SapResult.PaceComponent;

/**
 * Satisfactory Academic Progress calculator (34 CFR 668.34).
 *
 * Evaluates three independent components:
 * <ol>
 *   <li>GPA - minimum cumulative GPA, optionally tiered by attempted credits</li>
 *   <li>Pace - earned over attempted credits</li>
 *   <li>Maximum timeframe - attempted credits against a multiple of program length</li>
 * </ol>
 * and derives the status with a fixed precedence: timeframe exceeded, all met, first
 * failure, appeal, suspension.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Component
public class SapCalculator {

    static final int PACE_SCALE = 4;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal TIMEFRAME_ALERT = new BigDecimal("0.9");

    /**
     * Calculate SAP status for a student.
     *
     * @param input the student's cumulative snapshot and appeal state
     * @param policy the institution's SAP policy
     * @return the SAP result, or a VALIDATION failure for malformed input
     */
    public CalculationResult<SapResult> calculateSap(SapInput input, SapPolicy policy) {
        List<String> problems = validate(input, policy);
        if (!problems.isEmpty()) {
            return CalculationResult.failure(
                    DomainError.of(ErrorCode.INVALID_SAP_INPUT, "Invalid SAP calculation input", problems));
        }

        BigDecimal attempted = input.cumulativeAttemptedCredits();
        BigDecimal timeframePercentage = input.maxTimeframePercentage() != null
                ? input.maxTimeframePercentage()
                : policy.maxTimeframePercentage();

        GpaComponent gpa = evaluateGpa(input.cumulativeGpa(), attempted, policy);
        PaceComponent pace = evaluatePace(attempted, input.cumulativeEarnedCredits(), policy.minimumPace());
        MaxTimeframeComponent timeframe = evaluateMaxTimeframe(attempted, input.programCredits(), timeframePercentage);

        boolean allMet = gpa.met() && pace.met() && !timeframe.exceeded();
        SapStatus status = determineStatus(input, policy, gpa, pace, timeframe);

        AcademicPlanCompliance compliance = null;
        if (input.onAcademicPlan() && input.academicPlanRequirements() != null) {
            compliance = evaluatePlanCompliance(input, input.academicPlanRequirements());
        }

        return CalculationResult.success(new SapResult(
                status,
                status.isAidEligible(),
                gpa,
                pace,
                timeframe,
                allMet,
                statusReason(status, input.previousSapStatus()),
                recommendations(status, gpa, pace, timeframe),
                compliance));
    }

    /**
     * What-if evaluation: the status the student would hold after completing additional
     * credits with the projected cumulative GPA.
     */
    public CalculationResult<SapResult> projectSapStatus(SapInput current,
                                                        BigDecimal additionalAttemptedCredits,
                                                        BigDecimal additionalEarnedCredits,
                                                        BigDecimal projectedGpa,
                                                        SapPolicy policy) {
        if (current == null) {
            return calculateSap(null, policy);
        }
        SapInput projected = current.toBuilder()
                .cumulativeAttemptedCredits(add(current.cumulativeAttemptedCredits(), additionalAttemptedCredits))
                .cumulativeEarnedCredits(add(current.cumulativeEarnedCredits(), additionalEarnedCredits))
                .cumulativeGpa(projectedGpa)
                .build();
        return calculateSap(projected, policy);
    }

    // ========================================================================
    // COMPONENTS
    // ========================================================================

    private GpaComponent evaluateGpa(BigDecimal currentGpa, BigDecimal attempted, SapPolicy policy) {
        BigDecimal required = policy.requiredGpa(attempted);

        // No graded work yet cannot fail the GPA requirement
        if (currentGpa == null) {
            return new GpaComponent(null, required, true, null);
        }

        boolean met = currentGpa.compareTo(required) >= 0;
        return new GpaComponent(currentGpa, required, met, met ? null : required.subtract(currentGpa));
    }

    private PaceComponent evaluatePace(BigDecimal attempted, BigDecimal earned, BigDecimal requiredPace) {
        if (attempted.signum() == 0) {
            return new PaceComponent(attempted, earned, BigDecimal.ZERO.setScale(PACE_SCALE), requiredPace,
                    false, requiredPace);
        }

        BigDecimal exact = earned.divide(attempted, 10, RoundingMode.HALF_UP);
        BigDecimal pace = exact.setScale(PACE_SCALE, RoundingMode.HALF_UP);
        boolean met = exact.compareTo(requiredPace) >= 0;
        return new PaceComponent(attempted, earned, pace, requiredPace, met,
                met ? null : requiredPace.subtract(pace));
    }

    private MaxTimeframeComponent evaluateMaxTimeframe(BigDecimal attempted, BigDecimal programCredits,
                                                       BigDecimal percentage) {
        BigDecimal allowed = programCredits.multiply(percentage);
        BigDecimal used = attempted.divide(allowed, PACE_SCALE, RoundingMode.HALF_UP);
        boolean exceeded = attempted.compareTo(allowed) >= 0;
        BigDecimal remaining = allowed.subtract(attempted).max(BigDecimal.ZERO);
        return new MaxTimeframeComponent(attempted, allowed, used, exceeded, remaining);
    }

    private SapStatus determineStatus(SapInput input, SapPolicy policy, GpaComponent gpa, PaceComponent pace,
                                      MaxTimeframeComponent timeframe) {
        if (timeframe.exceeded()) {
            return SapStatus.INELIGIBLE;
        }
        if (gpa.met() && pace.met()) {
            return SapStatus.SATISFACTORY;
        }
        SapStatus previous = input.previousSapStatus();
        if (policy.allowWarningPeriod() && (previous == null || previous == SapStatus.SATISFACTORY)) {
            return SapStatus.WARNING;
        }
        if (input.appealApproved() && policy.allowProbationAfterAppeal()) {
            return input.onAcademicPlan() ? SapStatus.ACADEMIC_PLAN : SapStatus.PROBATION;
        }
        return SapStatus.SUSPENSION;
    }

    private AcademicPlanCompliance evaluatePlanCompliance(SapInput input, AcademicPlanRequirements plan) {
        List<String> unmet = new ArrayList<>();

        if (plan.termMinimumGpa() != null) {
            if (input.termGpa() == null) {
                unmet.add("No graded term work to compare against plan GPA " + plain(plan.termMinimumGpa()));
            } else if (input.termGpa().compareTo(plan.termMinimumGpa()) < 0) {
                unmet.add("Term GPA " + plain(input.termGpa()) + " below plan minimum " + plain(plan.termMinimumGpa()));
            }
        }

        if (plan.termMinimumPace() != null) {
            BigDecimal termAttempted = input.termAttemptedCredits();
            BigDecimal termEarned = input.termEarnedCredits() == null ? BigDecimal.ZERO : input.termEarnedCredits();
            if (termAttempted == null || termAttempted.signum() == 0) {
                unmet.add("No attempted term credits to compare against plan completion rate "
                        + percent(plan.termMinimumPace()) + "%");
            } else {
                BigDecimal termPace = termEarned.divide(termAttempted, PACE_SCALE, RoundingMode.HALF_UP);
                if (termPace.compareTo(plan.termMinimumPace()) < 0) {
                    unmet.add("Term completion rate " + percent(termPace) + "% below plan minimum "
                            + percent(plan.termMinimumPace()) + "%");
                }
            }
        }

        if (plan.maxTermCredits() != null && input.termAttemptedCredits() != null
                && input.termAttemptedCredits().compareTo(plan.maxTermCredits()) > 0) {
            unmet.add("Term credits " + plain(input.termAttemptedCredits()) + " exceed plan maximum "
                    + plain(plan.maxTermCredits()));
        }

        for (String course : plan.requiredCourses()) {
            if (!input.completedCourseIds().contains(course)) {
                unmet.add("Required course not completed: " + course);
            }
        }

        return new AcademicPlanCompliance(true, unmet.isEmpty(), unmet,
                "Student has " + plan.termsRemaining() + " term(s) remaining on academic plan.");
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private String statusReason(SapStatus status, SapStatus previous) {
        return switch (status) {
            case INELIGIBLE -> "Maximum timeframe exceeded. Attempted credits have reached the maximum allowed for the program.";
            case SATISFACTORY -> "Student is meeting all SAP requirements.";
            case WARNING -> "Student is not meeting SAP requirements but is being placed on warning for one term.";
            case PROBATION -> "Appeal approved. Student is on financial aid probation and must meet SAP requirements by the end of next term.";
            case ACADEMIC_PLAN -> "Appeal approved. Student is on an academic plan and must meet plan requirements to maintain aid eligibility.";
            case SUSPENSION -> previous == SapStatus.WARNING
                    ? "Student did not meet SAP requirements during warning period. Financial aid is suspended. Student may appeal."
                    : previous == SapStatus.PROBATION || previous == SapStatus.ACADEMIC_PLAN
                            ? "Student did not meet SAP requirements during probation period. Financial aid is suspended."
                            : "Student is not meeting SAP requirements and is not eligible for financial aid.";
        };
    }

    private List<String> recommendations(SapStatus status, GpaComponent gpa, PaceComponent pace,
                                         MaxTimeframeComponent timeframe) {
        List<String> recommendations = new ArrayList<>();

        switch (status) {
            case SATISFACTORY -> recommendations.add("Continue maintaining current academic performance.");
            case WARNING -> {
                if (!gpa.met()) {
                    recommendations.add("Improve GPA to at least " + gpa.requiredGpa().toPlainString()
                            + ". Consider tutoring or reducing course load.");
                }
                if (!pace.met()) {
                    recommendations.add("Complete at least " + percent(pace.requiredPace())
                            + "% of attempted credits. Avoid withdrawals.");
                }
                recommendations.add("Meet with academic advisor to develop improvement plan.");
            }
            case PROBATION, ACADEMIC_PLAN -> {
                recommendations.add("Follow all academic plan requirements strictly.");
                recommendations.add("Meet regularly with academic advisor.");
                recommendations.add("Consider using campus support services (tutoring, counseling).");
            }
            case SUSPENSION -> {
                recommendations.add("Submit SAP appeal with supporting documentation if circumstances warrant.");
                recommendations.add("Include academic plan showing how you will meet requirements.");
                recommendations.add("Consider paying out of pocket or taking time off to improve academic standing.");
            }
            case INELIGIBLE -> {
                recommendations.add("Maximum timeframe has been exceeded. Federal aid is no longer available for this program.");
                recommendations.add("Consider alternative funding options or program change.");
                recommendations.add("Speak with financial aid office about any potential exceptions.");
            }
        }

        if (!timeframe.exceeded() && timeframe.percentageUsed().compareTo(TIMEFRAME_ALERT) > 0) {
            recommendations.add("Warning: Only " + timeframe.creditsRemaining().setScale(0, RoundingMode.HALF_UP)
                    + " credits remaining before maximum timeframe is reached.");
        }
        return recommendations;
    }

    private List<String> validate(SapInput input, SapPolicy policy) {
        List<String> problems = new ArrayList<>();
        if (policy == null) {
            problems.add("SAP policy is required");
        } else {
            requireNonNegative(problems, "Policy minimum GPA", policy.minimumGpa());
            requireNonNegative(problems, "Policy minimum pace", policy.minimumPace());
            requirePositive(problems, "Policy maximum timeframe percentage", policy.maxTimeframePercentage());
        }
        if (input == null) {
            problems.add("SAP input is required");
            return problems;
        }

        requireNonNegative(problems, "Cumulative attempted credits", input.cumulativeAttemptedCredits());
        requireNonNegative(problems, "Cumulative earned credits", input.cumulativeEarnedCredits());
        requirePositive(problems, "Program credits", input.programCredits());
        if (input.maxTimeframePercentage() != null && input.maxTimeframePercentage().signum() <= 0) {
            problems.add("Maximum timeframe percentage must be positive: " + input.maxTimeframePercentage());
        }
        if (input.cumulativeGpa() != null && input.cumulativeGpa().signum() < 0) {
            problems.add("Cumulative GPA must not be negative: " + input.cumulativeGpa());
        }
        if (input.termAttemptedCredits() != null && input.termAttemptedCredits().signum() < 0) {
            problems.add("Term attempted credits must not be negative: " + input.termAttemptedCredits());
        }
        if (input.termEarnedCredits() != null && input.termEarnedCredits().signum() < 0) {
            problems.add("Term earned credits must not be negative: " + input.termEarnedCredits());
        }
        return problems;
    }

    private static void requireNonNegative(List<String> problems, String field, BigDecimal value) {
        if (value == null) {
            problems.add(field + " is required");
        } else if (value.signum() < 0) {
            problems.add(field + " must not be negative: " + value);
        }
    }

    private static void requirePositive(List<String> problems, String field, BigDecimal value) {
        if (value == null) {
            problems.add(field + " is required");
        } else if (value.signum() <= 0) {
            problems.add(field + " must be positive: " + value);
        }
    }

    private static BigDecimal add(BigDecimal base, BigDecimal addition) {
        if (base == null) {
            return null;
        }
        return addition == null ? base : base.add(addition);
    }

    private static String percent(BigDecimal fraction) {
        return fraction.multiply(HUNDRED).setScale(0, RoundingMode.HALF_UP).toPlainString();
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
