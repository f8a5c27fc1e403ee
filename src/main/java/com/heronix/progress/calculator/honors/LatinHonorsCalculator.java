package com.heronix.progress.calculator.honors;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.heronix.progress.model.enums.ErrorCode;
import com.heronix.progress.model.enums.LatinHonorsDesignation;
import com.heronix.progress.model.honors.LatinHonorsConfig;
import com.heronix.progress.model.honors.LatinHonorsInput;
import com.heronix.progress.model.honors.LatinHonorsResult;
import com.heronix.progress.model.result.CalculationResult;
import com.heronix.progress.model.result.DomainError;

/**
 * Determines Latin honors from GPA and credit totals.
 *
 * Every well-formed input yields a result with an explanation. Disqualifying conditions
 * are checked before any GPA threshold.
 */
@Component
public class LatinHonorsCalculator {

    /**
     * Determine the honors designation.
     *
     * @return the designation and explanation, or a VALIDATION failure when the input or the
     *         configuration is missing or malformed
     */
    public CalculationResult<LatinHonorsResult> calculate(LatinHonorsInput input, LatinHonorsConfig config) {
        List<String> problems = validate(input, config);
        if (!problems.isEmpty()) {
            return CalculationResult.failure(DomainError.of(
                    ErrorCode.INVALID_HONORS_INPUT, "Invalid Latin honors input", problems));
        }
        return CalculationResult.success(determine(input, config));
    }

    private LatinHonorsResult determine(LatinHonorsInput input, LatinHonorsConfig config) {
        BigDecimal earned = zeroIfNull(input.earnedCredits());
        BigDecimal institutional = zeroIfNull(input.institutionalCredits());
        boolean meetsCredits = earned.compareTo(config.minimumCredits()) >= 0;
        boolean meetsInstitutional = institutional.compareTo(config.minimumInstitutionalCredits()) >= 0;

        if (config.disqualifyForAcademicIntegrity() && input.hasAcademicIntegrityViolation()) {
            return new LatinHonorsResult(null, input.cumulativeGpa(), meetsCredits, meetsInstitutional, true,
                    "Disqualified from Latin honors due to academic integrity violation");
        }

        if (!meetsCredits) {
            return new LatinHonorsResult(null, input.cumulativeGpa(), false, meetsInstitutional, false,
                    "Requires minimum " + plain(config.minimumCredits()) + " credits; student has " + plain(earned));
        }

        if (!meetsInstitutional) {
            return new LatinHonorsResult(null, input.cumulativeGpa(), true, false, false,
                    "Requires minimum " + plain(config.minimumInstitutionalCredits())
                            + " institutional credits; student has " + plain(institutional));
        }

        BigDecimal gpaUsed = config.excludeTransferCredits() && input.institutionalGpa() != null
                ? input.institutionalGpa()
                : input.cumulativeGpa();

        if (gpaUsed == null) {
            return new LatinHonorsResult(null, null, true, true, false,
                    "No GPA on record; honors cannot be determined");
        }

        LatinHonorsDesignation designation = null;
        BigDecimal threshold = config.cumThreshold();
        if (gpaUsed.compareTo(config.summaThreshold()) >= 0) {
            designation = LatinHonorsDesignation.SUMMA_CUM_LAUDE;
            threshold = config.summaThreshold();
        } else if (gpaUsed.compareTo(config.magnaThreshold()) >= 0) {
            designation = LatinHonorsDesignation.MAGNA_CUM_LAUDE;
            threshold = config.magnaThreshold();
        } else if (gpaUsed.compareTo(config.cumThreshold()) >= 0) {
            designation = LatinHonorsDesignation.CUM_LAUDE;
        }

        String gpaText = gpaUsed.setScale(3, RoundingMode.HALF_UP).toPlainString();
        String explanation = designation == null
                ? "GPA " + gpaText + " does not meet minimum honors threshold (" + plain(threshold) + ")"
                : "GPA " + gpaText + " meets " + designation.getDisplayName().toLowerCase()
                        + " threshold (" + plain(threshold) + ")";

        return new LatinHonorsResult(designation, gpaUsed, true, true, false, explanation);
    }

    private static List<String> validate(LatinHonorsInput input, LatinHonorsConfig config) {
        List<String> problems = new ArrayList<>();
        if (config == null) {
            problems.add("Latin honors configuration is required");
        } else {
            requireNonNegative(problems, "Minimum credits", config.minimumCredits());
            requireNonNegative(problems, "Minimum institutional credits", config.minimumInstitutionalCredits());
            requireNonNegative(problems, "Summa cum laude threshold", config.summaThreshold());
            requireNonNegative(problems, "Magna cum laude threshold", config.magnaThreshold());
            requireNonNegative(problems, "Cum laude threshold", config.cumThreshold());
        }
        if (input == null) {
            problems.add("Latin honors input is required");
            return problems;
        }
        rejectNegative(problems, "Earned credits", input.earnedCredits());
        rejectNegative(problems, "Institutional credits", input.institutionalCredits());
        rejectNegative(problems, "Cumulative GPA", input.cumulativeGpa());
        rejectNegative(problems, "Institutional GPA", input.institutionalGpa());
        return problems;
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
            problems.add(field + " must not be negative: " + value.toPlainString());
        }
    }

    private static BigDecimal zeroIfNull(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
