package com.heronix.progress.calculator.gpa;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.heronix.progress.model.enums.ErrorCode;
import com.heronix.progress.model.enums.RepeatPolicy;
import com.heronix.progress.model.gpa.CourseAttempt;
import com.heronix.progress.model.gpa.GpaCalculationDetail;
import com.heronix.progress.model.gpa.GpaCalculationOptions;
import com.heronix.progress.model.gpa.GpaResult;
import com.heronix.progress.model.gpa.GradeDefinition;
import com.heronix.progress.model.gpa.TermGpaResult;
import com.heronix.progress.model.result.CalculationResult;
import com.heronix.progress.model.result.DomainError;

/**
 * Grade Point Average calculator.
 *
 * Pure function of the attempts and options: no I/O, no shared state. Repeat groups are
 * resolved per course before totals are summed; every attempt (counted or excluded) is
 * recorded in the result details.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Component
public class GpaCalculator {

    static final String EXCLUDED_REPLACE = "Excluded by repeat policy (replace)";
    static final String EXCLUDED_HIGHEST = "Excluded by repeat policy (highest)";

    private static final BigDecimal NO_POINTS = BigDecimal.valueOf(-1);

    /**
     * Calculate GPA over all attempts.
     *
     * @param attempts attempts in chronological order
     * @param options repeat policy, precision and grade scale
     * @return the GPA result, or a VALIDATION failure listing every malformed attempt
     */
    public CalculationResult<GpaResult> calculateGpa(List<CourseAttempt> attempts, GpaCalculationOptions options) {
        GpaCalculationOptions effective = options == null ? GpaCalculationOptions.defaults() : options;
        List<String> problems = validate(attempts, effective);
        if (!problems.isEmpty()) {
            return invalid(problems);
        }
        return CalculationResult.success(compute(attempts, effective));
    }

    /**
     * Calculate GPA for the attempts taken in one term.
     */
    public CalculationResult<TermGpaResult> calculateTermGpa(List<CourseAttempt> attempts, String termId,
                                                            GpaCalculationOptions options) {
        List<CourseAttempt> termAttempts = attempts == null ? List.of() : attempts.stream()
                .filter(attempt -> termId != null && termId.equals(attempt.termId()))
                .toList();
        return calculateGpa(termAttempts, options).map(result -> TermGpaResult.of(termId, result));
    }

    /**
     * Calculate GPA for every term present, keyed by term id in order of first appearance.
     */
    public CalculationResult<Map<String, TermGpaResult>> calculateGpaByTerm(List<CourseAttempt> attempts,
                                                                          GpaCalculationOptions options) {
        GpaCalculationOptions effective = options == null ? GpaCalculationOptions.defaults() : options;
        List<String> problems = validate(attempts, effective);
        if (!problems.isEmpty()) {
            return invalid(problems);
        }

        Map<String, List<CourseAttempt>> byTerm = new LinkedHashMap<>();
        for (CourseAttempt attempt : attempts) {
            byTerm.computeIfAbsent(attempt.termId(), key -> new ArrayList<>()).add(attempt);
        }

        Map<String, TermGpaResult> results = new LinkedHashMap<>();
        byTerm.forEach((termId, termAttempts) ->
                results.put(termId, TermGpaResult.of(termId, compute(termAttempts, effective))));
        return CalculationResult.success(Collections.unmodifiableMap(results));
    }

    /**
     * Calculate cumulative GPA combining institutional attempts with transfer totals.
     *
     * Attempted and earned credits stay institutional; quality points and GPA credits
     * include the transfer work.
     */
    public CalculationResult<GpaResult> calculateCumulativeGpaWithTransfer(List<CourseAttempt> institutionalAttempts,
                                                                           BigDecimal transferQualityPoints,
                                                                           BigDecimal transferGpaCredits,
                                                                           GpaCalculationOptions options) {
        GpaCalculationOptions effective = options == null ? GpaCalculationOptions.defaults() : options;
        BigDecimal transferPoints = transferQualityPoints == null ? BigDecimal.ZERO : transferQualityPoints;
        BigDecimal transferCredits = transferGpaCredits == null ? BigDecimal.ZERO : transferGpaCredits;

        List<String> problems = validate(institutionalAttempts, effective);
        if (transferPoints.signum() < 0) {
            problems.add("Transfer quality points must not be negative");
        }
        if (transferCredits.signum() < 0) {
            problems.add("Transfer GPA credits must not be negative");
        }
        if (!problems.isEmpty()) {
            return invalid(problems);
        }

        GpaResult institutional = compute(institutionalAttempts, effective);
        BigDecimal totalPoints = institutional.qualityPoints().add(transferPoints);
        BigDecimal totalCredits = institutional.gpaCredits().add(transferCredits);

        return CalculationResult.success(new GpaResult(
                institutional.attemptedCredits(),
                institutional.earnedCredits(),
                round(totalPoints, effective.decimalPlaces()),
                divide(totalPoints, totalCredits, effective.decimalPlaces()),
                totalCredits,
                institutional.details()));
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private GpaResult compute(List<CourseAttempt> attempts, GpaCalculationOptions options) {
        BigDecimal attempted = BigDecimal.ZERO;
        BigDecimal earned = BigDecimal.ZERO;
        BigDecimal qualityPoints = BigDecimal.ZERO;
        BigDecimal gpaCredits = BigDecimal.ZERO;
        List<GpaCalculationDetail> details = new ArrayList<>();

        for (ResolvedAttempt resolved : applyRepeatPolicy(attempts, options.defaultRepeatPolicy())) {
            CourseAttempt attempt = resolved.attempt();
            if (resolved.excludedReason() != null) {
                details.add(detail(attempt, BigDecimal.ZERO, false, resolved.excludedReason()));
                continue;
            }

            Optional<GradeDefinition> grade = options.findGrade(attempt.gradeCode());
            boolean countsAttempted = grade.map(GradeDefinition::attemptedCredits).orElse(attempt.isGraded());
            boolean countsInGpa = attempt.includeInGpa() && grade.map(GradeDefinition::countInGpa).orElse(true);

            if (countsAttempted) {
                attempted = attempted.add(attempt.credits());
            }
            if (attempt.creditsEarned()) {
                earned = earned.add(attempt.credits());
            }

            BigDecimal attemptPoints = BigDecimal.ZERO;
            boolean included = false;
            if (countsInGpa && attempt.gradePoints() != null) {
                attemptPoints = attempt.credits().multiply(attempt.gradePoints());
                qualityPoints = qualityPoints.add(attemptPoints);
                gpaCredits = gpaCredits.add(attempt.credits());
                included = true;
            }
            details.add(detail(attempt, attemptPoints, included, null));
        }

        return new GpaResult(
                attempted,
                earned,
                round(qualityPoints, options.decimalPlaces()),
                divide(qualityPoints, gpaCredits, options.decimalPlaces()),
                gpaCredits,
                details);
    }

    private List<ResolvedAttempt> applyRepeatPolicy(List<CourseAttempt> attempts, RepeatPolicy defaultPolicy) {
        Map<String, List<CourseAttempt>> byCourse = new LinkedHashMap<>();
        for (CourseAttempt attempt : attempts) {
            byCourse.computeIfAbsent(attempt.courseId(), key -> new ArrayList<>()).add(attempt);
        }

        List<ResolvedAttempt> resolved = new ArrayList<>();
        for (List<CourseAttempt> group : byCourse.values()) {
            if (group.size() == 1) {
                resolved.add(new ResolvedAttempt(group.get(0), null));
                continue;
            }

            RepeatPolicy policy = group.get(0).repeatPolicy() != null ? group.get(0).repeatPolicy() : defaultPolicy;
            switch (policy) {
                case REPLACE -> {
                    CourseAttempt mostRecent = null;
                    for (CourseAttempt attempt : group) {
                        if (attempt.isGraded()) {
                            mostRecent = attempt;
                        }
                    }
                    for (CourseAttempt attempt : group) {
                        boolean counts = attempt == mostRecent || !attempt.isGraded();
                        resolved.add(new ResolvedAttempt(attempt, counts ? null : EXCLUDED_REPLACE));
                    }
                }
                case HIGHEST -> {
                    CourseAttempt highest = group.get(0);
                    for (CourseAttempt attempt : group) {
                        if (pointsOf(attempt).compareTo(pointsOf(highest)) > 0) {
                            highest = attempt;
                        }
                    }
                    for (CourseAttempt attempt : group) {
                        resolved.add(new ResolvedAttempt(attempt, attempt == highest ? null : EXCLUDED_HIGHEST));
                    }
                }
                // The credit-weighted mean of an AVERAGE group falls out of the summed totals,
                // so both policies count every attempt.
                case AVERAGE, ALL_COUNT -> group.forEach(attempt -> resolved.add(new ResolvedAttempt(attempt, null)));
            }
        }
        return resolved;
    }

    private List<String> validate(List<CourseAttempt> attempts, GpaCalculationOptions options) {
        List<String> problems = new ArrayList<>();
        if (options.decimalPlaces() < 0) {
            problems.add("Decimal places must not be negative: " + options.decimalPlaces());
        }
        if (attempts == null) {
            problems.add("Course attempts are required");
            return problems;
        }

        for (int i = 0; i < attempts.size(); i++) {
            CourseAttempt attempt = attempts.get(i);
            if (attempt == null) {
                problems.add("Attempt #" + i + " is null");
                continue;
            }
            String label = attempt.registrationId() != null ? attempt.registrationId() : "#" + i;
            if (isBlank(attempt.registrationId())) {
                problems.add("Attempt " + label + ": registration id is required");
            }
            if (isBlank(attempt.courseId())) {
                problems.add("Attempt " + label + ": course id is required");
            }
            if (attempt.credits() == null) {
                problems.add("Attempt " + label + ": credits are required");
            } else if (attempt.credits().signum() < 0) {
                problems.add("Attempt " + label + ": credits must not be negative (" + attempt.credits() + ")");
            }
            if (attempt.gradePoints() != null && attempt.gradeCode() == null) {
                problems.add("Attempt " + label + ": grade points present without a grade code");
            }
            if (attempt.gradePoints() != null && attempt.gradePoints().signum() < 0) {
                problems.add("Attempt " + label + ": grade points must not be negative (" + attempt.gradePoints() + ")");
            }
        }
        return problems;
    }

    private static <T> CalculationResult<T> invalid(List<String> problems) {
        return CalculationResult.failure(
                DomainError.of(ErrorCode.INVALID_COURSE_ATTEMPT, "Invalid GPA calculation input", problems));
    }

    private static GpaCalculationDetail detail(CourseAttempt attempt, BigDecimal qualityPoints,
                                               boolean included, String excludedReason) {
        return new GpaCalculationDetail(attempt.registrationId(), attempt.courseId(), attempt.credits(),
                attempt.gradeCode(), attempt.gradePoints(), qualityPoints, included, excludedReason);
    }

    private static BigDecimal pointsOf(CourseAttempt attempt) {
        return attempt.gradePoints() != null ? attempt.gradePoints() : NO_POINTS;
    }

    private static BigDecimal divide(BigDecimal points, BigDecimal credits, int decimalPlaces) {
        if (credits.signum() == 0) {
            return null;
        }
        return points.divide(credits, decimalPlaces, RoundingMode.HALF_UP);
    }

    private static BigDecimal round(BigDecimal value, int decimalPlaces) {
        return value.setScale(decimalPlaces, RoundingMode.HALF_UP);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record ResolvedAttempt(CourseAttempt attempt, String excludedReason) {
    }
}
