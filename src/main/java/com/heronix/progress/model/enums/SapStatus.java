package com.heronix.progress.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Satisfactory Academic Progress status (34 CFR 668.34).
 *
 * Progression: SATISFACTORY -> WARNING -> PROBATION | ACADEMIC_PLAN -> SUSPENSION.
 * INELIGIBLE is terminal and only reached by exceeding the maximum timeframe.
 */
@Getter
@RequiredArgsConstructor
public enum SapStatus {

    /**
     * Meeting all requirements
     */
    SATISFACTORY("satisfactory", true),

    /**
     * First failure, one term to improve
     */
    WARNING("warning", true),

    /**
     * Appeal approved, must meet requirements by end of next term
     */
    PROBATION("probation", true),

    /**
     * Appeal approved with a structured academic plan
     */
    ACADEMIC_PLAN("academic_plan", true),

    /**
     * Not meeting requirements, aid suspended, may appeal
     */
    SUSPENSION("suspension", false),

    /**
     * Maximum timeframe exceeded, not reversible by appeal
     */
    INELIGIBLE("ineligible", false);

    /**
     * Code stored on SAP records
     */
    private final String code;

    /**
     * Whether a student in this status may receive federal aid
     */
    private final boolean aidEligible;

    public static SapStatus fromCode(String code) {
        for (SapStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown SAP status: " + code);
    }
}
