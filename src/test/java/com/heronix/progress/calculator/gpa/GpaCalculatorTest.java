package com.heronix.progress.calculator.gpa;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.heronix.progress.model.enums.ErrorCategory;
import com.heronix.progress.model.enums.ErrorCode;
import com.heronix.progress.model.enums.RepeatPolicy;
import com.heronix.progress.model.gpa.CourseAttempt;
import com.heronix.progress.model.gpa.GpaCalculationDetail;
import com.heronix.progress.model.gpa.GpaCalculationOptions;
import com.heronix.progress.model.gpa.GpaResult;
import com.heronix.progress.model.gpa.GradeDefinition;
import com.heronix.progress.model.gpa.TermGpaResult;
import com.heronix.progress.model.result.CalculationResult;

class GpaCalculatorTest {

    private final GpaCalculator calculator = new GpaCalculator();

    @Test
    void weightsGradePointsByCreditsAndRoundsToThreePlaces() {
        List<CourseAttempt> attempts = List.of(
                graded("r1", "MATH101", "3", "A", "4.0"),
                graded("r2", "ENG101", "4", "B", "3.0"));

        GpaResult result = calculator.calculateGpa(attempts, GpaCalculationOptions.defaults()).orElseThrow();

        assertThat(result.cumulativeGpa()).isEqualByComparingTo("3.429");
        assertThat(result.qualityPoints()).isEqualByComparingTo("24");
        assertThat(result.gpaCredits()).isEqualByComparingTo("7");
        assertThat(result.attemptedCredits()).isEqualByComparingTo("7");
        assertThat(result.earnedCredits()).isEqualByComparingTo("7");
        assertThat(result.details()).hasSize(2).allMatch(GpaCalculationDetail::includedInGpa);
    }

    @Test
    void gpaIsNullWhenNoCreditsCountTowardGpa() {
        List<CourseAttempt> attempts = List.of(
                graded("r1", "ART100", "3", "P", null).toBuilder().includeInGpa(false).build(),
                inProgress("r2", "BIO110", "4"));

        GpaResult result = calculator.calculateGpa(attempts, GpaCalculationOptions.defaults()).orElseThrow();

        assertThat(result.cumulativeGpa()).isNull();
        assertThat(result.hasGpa()).isFalse();
        assertThat(result.gpaCredits()).isEqualByComparingTo("0");
        assertThat(result.attemptedCredits()).isEqualByComparingTo("3");
    }

    @Test
    void emptyAttemptListHasNoGpa() {
        GpaResult result = calculator.calculateGpa(List.of(), null).orElseThrow();

        assertThat(result.cumulativeGpa()).isNull();
        assertThat(result.details()).isEmpty();
    }

    @Test
    void nonGpaAttemptCountsTowardCreditsButNotQualityPoints() {
        List<CourseAttempt> attempts = List.of(
                graded("r1", "MATH101", "3", "A", "4.0"),
                graded("r2", "PE100", "2", "P", null).toBuilder().includeInGpa(false).build());

        GpaResult result = calculator.calculateGpa(attempts, GpaCalculationOptions.defaults()).orElseThrow();

        assertThat(result.attemptedCredits()).isEqualByComparingTo("5");
        assertThat(result.earnedCredits()).isEqualByComparingTo("5");
        assertThat(result.gpaCredits()).isEqualByComparingTo("3");
        assertThat(result.cumulativeGpa()).isEqualByComparingTo("4.000");
    }

    @Test
    void replacePolicyMatchesSingleAttemptOfReplacingGrade() {
        CourseAttempt failed = graded("r1", "CHEM101", "4", "F", "0.0").toBuilder().creditsEarned(false).build();
        CourseAttempt retake = graded("r2", "CHEM101", "4", "B", "3.0").toBuilder()
                .repeat(true).repeatPolicy(RepeatPolicy.REPLACE).repeatsRegistrationId("r1").build();
        CourseAttempt other = graded("r3", "HIST101", "3", "A", "4.0");

        GpaResult repeated = calculator.calculateGpa(List.of(failed, retake, other),
                GpaCalculationOptions.defaults()).orElseThrow();
        GpaResult single = calculator.calculateGpa(List.of(retake, other),
                GpaCalculationOptions.defaults()).orElseThrow();

        assertThat(repeated.attemptedCredits()).isEqualByComparingTo(single.attemptedCredits());
        assertThat(repeated.earnedCredits()).isEqualByComparingTo(single.earnedCredits());
        assertThat(repeated.qualityPoints()).isEqualByComparingTo(single.qualityPoints());
        assertThat(repeated.cumulativeGpa()).isEqualByComparingTo(single.cumulativeGpa());

        GpaCalculationDetail replaced = repeated.details().get(0);
        assertThat(replaced.registrationId()).isEqualTo("r1");
        assertThat(replaced.includedInGpa()).isFalse();
        assertThat(replaced.excludedReason()).isEqualTo(GpaCalculator.EXCLUDED_REPLACE);
    }

    @Test
    void replacePolicyKeepsInProgressRetakeWithoutCountingIt() {
        CourseAttempt failed = graded("r1", "CHEM101", "4", "D", "1.0");
        CourseAttempt retake = inProgress("r2", "CHEM101", "4");

        GpaResult result = calculator.calculateGpa(List.of(failed, retake),
                GpaCalculationOptions.defaults()).orElseThrow();

        assertThat(result.cumulativeGpa()).isEqualByComparingTo("1.000");
        assertThat(result.details()).noneMatch(GpaCalculationDetail::isExcluded);
    }

    @Test
    void defaultPolicyAppliesWhenGroupHasNone() {
        CourseAttempt first = graded("r1", "CS101", "3", "C", "2.0");
        CourseAttempt second = graded("r2", "CS101", "3", "A", "4.0");
        GpaCalculationOptions allCount = new GpaCalculationOptions(RepeatPolicy.ALL_COUNT, 3, Map.of());

        GpaResult replaced = calculator.calculateGpa(List.of(first, second),
                GpaCalculationOptions.defaults()).orElseThrow();
        GpaResult counted = calculator.calculateGpa(List.of(first, second), allCount).orElseThrow();

        assertThat(replaced.cumulativeGpa()).isEqualByComparingTo("4.000");
        assertThat(replaced.attemptedCredits()).isEqualByComparingTo("3");
        assertThat(counted.cumulativeGpa()).isEqualByComparingTo("3.000");
        assertThat(counted.attemptedCredits()).isEqualByComparingTo("6");
    }

    @Test
    void highestPolicyKeepsBestAttemptAndFirstOnTies() {
        CourseAttempt first = graded("r1", "CS101", "3", "B", "3.0").toBuilder()
                .repeatPolicy(RepeatPolicy.HIGHEST).build();
        CourseAttempt second = graded("r2", "CS101", "3", "C", "2.0");
        CourseAttempt third = graded("r3", "CS101", "3", "B", "3.0");

        GpaResult result = calculator.calculateGpa(List.of(first, second, third),
                GpaCalculationOptions.defaults()).orElseThrow();

        assertThat(result.cumulativeGpa()).isEqualByComparingTo("3.000");
        assertThat(result.attemptedCredits()).isEqualByComparingTo("3");
        assertThat(result.details()).extracting(GpaCalculationDetail::excludedReason)
                .containsExactly(null, GpaCalculator.EXCLUDED_HIGHEST, GpaCalculator.EXCLUDED_HIGHEST);
    }

    @Test
    void averagePolicyProducesCreditWeightedMean() {
        CourseAttempt first = graded("r1", "LAB200", "1", "A", "4.0").toBuilder()
                .repeatPolicy(RepeatPolicy.AVERAGE).build();
        CourseAttempt second = graded("r2", "LAB200", "3", "C", "2.0");

        GpaResult result = calculator.calculateGpa(List.of(first, second),
                GpaCalculationOptions.defaults()).orElseThrow();

        assertThat(result.cumulativeGpa()).isEqualByComparingTo("2.500");
        assertThat(result.details()).noneMatch(GpaCalculationDetail::isExcluded);
    }

    @Test
    void gradeScaleDecidesAttemptedAndGpaInclusion() {
        GpaCalculationOptions options = GpaCalculationOptions.defaults().withGradeScale(List.of(
                GradeDefinition.builder().gradeCode("A").gradePoints(new BigDecimal("4.0"))
                        .countInGpa(true).earnedCredits(true).attemptedCredits(true).build(),
                GradeDefinition.builder().gradeCode("AU")
                        .countInGpa(false).earnedCredits(false).attemptedCredits(false).build()));
        List<CourseAttempt> attempts = List.of(
                graded("r1", "MATH101", "3", "A", "4.0"),
                graded("r2", "MUS100", "2", "AU", "4.0").toBuilder().creditsEarned(false).build());

        GpaResult result = calculator.calculateGpa(attempts, options).orElseThrow();

        assertThat(result.attemptedCredits()).isEqualByComparingTo("3");
        assertThat(result.gpaCredits()).isEqualByComparingTo("3");
        assertThat(result.cumulativeGpa()).isEqualByComparingTo("4.000");
    }

    @Test
    void reportsEveryMalformedAttempt() {
        List<CourseAttempt> attempts = List.of(
                graded("r1", "MATH101", "-3", "A", "4.0"),
                CourseAttempt.builder().registrationId("r2").courseId("ENG101").termId("T1")
                        .credits(BigDecimal.ONE).gradePoints(new BigDecimal("3.0")).includeInGpa(true).build());

        CalculationResult<GpaResult> result = calculator.calculateGpa(attempts, GpaCalculationOptions.defaults());

        assertThat(result.isFailure()).isTrue();
        assertThat(result.error().code()).isEqualTo(ErrorCode.INVALID_COURSE_ATTEMPT);
        assertThat(result.error().category()).isEqualTo(ErrorCategory.VALIDATION);
        assertThat(result.error().details()).hasSize(2);
        assertThat(result.error().details().get(0)).contains("r1").contains("negative");
        assertThat(result.error().details().get(1)).contains("r2").contains("without a grade code");
    }

    @Test
    void respectsConfiguredPrecision() {
        List<CourseAttempt> attempts = List.of(
                graded("r1", "MATH101", "3", "A", "4.0"),
                graded("r2", "ENG101", "4", "B", "3.0"));
        GpaCalculationOptions twoPlaces = new GpaCalculationOptions(RepeatPolicy.REPLACE, 2, Map.of());

        GpaResult result = calculator.calculateGpa(attempts, twoPlaces).orElseThrow();

        assertThat(result.cumulativeGpa()).isEqualByComparingTo("3.43");
        assertThat(result.cumulativeGpa().scale()).isEqualTo(2);
    }

    @Test
    void groupsTermGpaByFirstAppearance() {
        List<CourseAttempt> attempts = List.of(
                graded("r1", "MATH101", "3", "A", "4.0").toBuilder().termId("2024FA").build(),
                graded("r2", "ENG101", "3", "C", "2.0").toBuilder().termId("2025SP").build(),
                graded("r3", "HIST101", "3", "B", "3.0").toBuilder().termId("2024FA").build());

        Map<String, TermGpaResult> byTerm = calculator.calculateGpaByTerm(attempts,
                GpaCalculationOptions.defaults()).orElseThrow();
        TermGpaResult spring = calculator.calculateTermGpa(attempts, "2025SP",
                GpaCalculationOptions.defaults()).orElseThrow();

        assertThat(byTerm.keySet()).containsExactly("2024FA", "2025SP");
        assertThat(byTerm.get("2024FA").termGpa()).isEqualByComparingTo("3.500");
        assertThat(spring.termId()).isEqualTo("2025SP");
        assertThat(spring.termGpa()).isEqualByComparingTo("2.000");
    }

    @Test
    void combinesTransferWorkIntoCumulativeGpa() {
        List<CourseAttempt> attempts = List.of(graded("r1", "MATH101", "3", "A", "4.0"));

        GpaResult result = calculator.calculateCumulativeGpaWithTransfer(attempts,
                new BigDecimal("6"), new BigDecimal("3"), GpaCalculationOptions.defaults()).orElseThrow();

        assertThat(result.cumulativeGpa()).isEqualByComparingTo("3.000");
        assertThat(result.gpaCredits()).isEqualByComparingTo("6");
        assertThat(result.attemptedCredits()).isEqualByComparingTo("3");
    }

    private static CourseAttempt graded(String registrationId, String courseId, String credits,
                                        String gradeCode, String gradePoints) {
        return CourseAttempt.builder()
                .registrationId(registrationId)
                .courseId(courseId)
                .termId("2024FA")
                .credits(new BigDecimal(credits))
                .gradeCode(gradeCode)
                .gradePoints(gradePoints == null ? null : new BigDecimal(gradePoints))
                .includeInGpa(true)
                .creditsEarned(true)
                .build();
    }

    private static CourseAttempt inProgress(String registrationId, String courseId, String credits) {
        return CourseAttempt.builder()
                .registrationId(registrationId)
                .courseId(courseId)
                .termId("2024FA")
                .credits(new BigDecimal(credits))
                .includeInGpa(true)
                .build();
    }
}
