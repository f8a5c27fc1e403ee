package com.heronix.progress.model.gpa;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.heronix.progress.model.enums.RepeatPolicy;

/**
 * Options for a GPA calculation.
 *
 * @param defaultRepeatPolicy policy applied to repeat groups that carry none
 * @param decimalPlaces rounding precision for GPA and quality points
 * @param gradeScale grade definitions keyed by grade code, empty when attempt flags decide
 */
public record GpaCalculationOptions(
        RepeatPolicy defaultRepeatPolicy,
        int decimalPlaces,
        Map<String, GradeDefinition> gradeScale
) {
    public static final int DEFAULT_DECIMAL_PLACES = 3;

    public GpaCalculationOptions {
        defaultRepeatPolicy = defaultRepeatPolicy == null ? RepeatPolicy.REPLACE : defaultRepeatPolicy;
        gradeScale = gradeScale == null ? Map.of() : Map.copyOf(gradeScale);
    }

    public static GpaCalculationOptions defaults() {
        return new GpaCalculationOptions(RepeatPolicy.REPLACE, DEFAULT_DECIMAL_PLACES, Map.of());
    }

    public GpaCalculationOptions withGradeScale(List<GradeDefinition> definitions) {
        Map<String, GradeDefinition> scale = definitions.stream()
                .collect(Collectors.toMap(GradeDefinition::gradeCode, Function.identity(), (a, b) -> b));
        return new GpaCalculationOptions(defaultRepeatPolicy, decimalPlaces, scale);
    }

    public Optional<GradeDefinition> findGrade(String gradeCode) {
        return gradeCode == null ? Optional.empty() : Optional.ofNullable(gradeScale.get(gradeCode));
    }
}
