package com.heronix.progress.model.enums;

/**
 * Calculation a batch run performs for each cohort member.
 */
public enum CalculationKind {

    /**
     * Satisfactory Academic Progress for an award year and term
     */
    SAP,

    /**
     * Term and cumulative GPA
     */
    GPA
}
