package com.heronix.progress.model.enums;

/**
 * Outcome of conferring a degree on one student in a conferral batch.
 */
public enum ConferralStatus {
    CONFERRED,
    FAILED
}
