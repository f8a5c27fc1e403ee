package com.heronix.progress.model.graduation;

import java.util.List;

/**
 * Record-completeness checklist for graduation.
 */
public record DataValidationStatus(
        boolean diplomaNameVerified,
        boolean mailingAddressConfirmed,
        boolean programRecordComplete,
        boolean declarationsComplete,
        boolean honorsCalculated,
        List<String> missingFields
) {
    public DataValidationStatus {
        missingFields = List.copyOf(missingFields);
    }

    public boolean passed() {
        return diplomaNameVerified && mailingAddressConfirmed && programRecordComplete && declarationsComplete;
    }
}
