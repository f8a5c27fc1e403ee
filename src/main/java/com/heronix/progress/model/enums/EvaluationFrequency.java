package com.heronix.progress.model.enums;

/**
 * How often SAP is evaluated under a policy.
 */
public enum EvaluationFrequency {
    TERM,
    ANNUAL,
    PAYMENT_PERIOD
}
