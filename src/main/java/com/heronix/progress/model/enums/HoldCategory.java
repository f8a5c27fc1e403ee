package com.heronix.progress.model.enums;

/**
 * Category of a registrar/bursar hold.
 */
public enum HoldCategory {
    FINANCIAL,
    ACADEMIC,
    ADMINISTRATIVE,
    DISCIPLINARY
}
