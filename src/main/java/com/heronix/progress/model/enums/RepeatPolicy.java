package com.heronix.progress.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How repeated attempts of the same course contribute to GPA.
 */
@Getter
@RequiredArgsConstructor
public enum RepeatPolicy {

    /**
     * Only the most recent graded attempt counts
     */
    REPLACE("replace"),

    /**
     * All attempts count; the course contributes a credit-weighted mean
     */
    AVERAGE("average"),

    /**
     * Only the attempt with the highest grade points counts
     */
    HIGHEST("highest"),

    /**
     * Every attempt counts independently
     */
    ALL_COUNT("all_count");

    /**
     * Code stored on course catalog records
     */
    private final String code;

    /**
     * Get RepeatPolicy from a stored code.
     *
     * @param code the stored code (e.g., "replace")
     * @return matching RepeatPolicy
     * @throws IllegalArgumentException if code not found
     */
    public static RepeatPolicy fromCode(String code) {
        for (RepeatPolicy policy : values()) {
            if (policy.code.equalsIgnoreCase(code)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown repeat policy: " + code);
    }
}
