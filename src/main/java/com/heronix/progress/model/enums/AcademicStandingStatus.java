package com.heronix.progress.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Institutional academic standing, independent of financial aid SAP status.
 *
 * Progression: GOOD_STANDING -> ACADEMIC_WARNING -> ACADEMIC_PROBATION -> ACADEMIC_SUSPENSION
 * -> ACADEMIC_DISMISSAL. REINSTATED follows an approved appeal.
 */
@Getter
@RequiredArgsConstructor
public enum AcademicStandingStatus {

    GOOD_STANDING("good_standing", "Good Standing", 0),

    /**
     * First drop below the good standing minimum, only when the policy has a warning threshold
     */
    ACADEMIC_WARNING("academic_warning", "Academic Warning", 2),

    ACADEMIC_PROBATION("academic_probation", "Academic Probation", 3),

    /**
     * Probation limit exceeded, student sits out for the suspension period
     */
    ACADEMIC_SUSPENSION("academic_suspension", "Academic Suspension", 4),

    /**
     * Suspension limit exceeded, only lifted by readmission
     */
    ACADEMIC_DISMISSAL("academic_dismissal", "Academic Dismissal", 5),

    REINSTATED("reinstated", "Reinstated", 1);

    private final String code;

    private final String displayName;

    /**
     * Ordering for reports, 0 is best
     */
    private final int severity;

    public static AcademicStandingStatus fromCode(String code) {
        for (AcademicStandingStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown academic standing: " + code);
    }
}
