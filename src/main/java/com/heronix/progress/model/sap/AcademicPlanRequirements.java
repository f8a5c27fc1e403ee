package com.heronix.progress.model.sap;

import java.math.BigDecimal;
import java.util.List;

import lombok.Builder;

/**
 * Term requirements of an academic plan agreed on appeal. Null fields are not required.
 */
@Builder
public record AcademicPlanRequirements(
        BigDecimal termMinimumGpa,
        BigDecimal termMinimumPace,
        BigDecimal maxTermCredits,
        List<String> requiredCourses,
        int termsRemaining
) {
    public AcademicPlanRequirements {
        requiredCourses = requiredCourses == null ? List.of() : List.copyOf(requiredCourses);
    }
}
