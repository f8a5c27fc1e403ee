package com.heronix.progress.model.honors;

import java.math.BigDecimal;

import com.heronix.progress.model.enums.LatinHonorsDesignation;

/**
 * Latin honors determination.
 *
 * @param designation the tier awarded, null when not eligible
 * @param gpaUsed the GPA compared against the thresholds
 * @param explanation always set: the threshold met or the condition that disqualified
 */
public record LatinHonorsResult(
        LatinHonorsDesignation designation,
        BigDecimal gpaUsed,
        boolean meetsCreditsRequirement,
        boolean meetsInstitutionalCreditsRequirement,
        boolean disqualifiedForIntegrity,
        String explanation
) {
    public boolean hasHonors() {
        return designation != null;
    }

    /**
     * Diploma text for the designation, empty when none was awarded.
     */
    public String displayName() {
        return designation == null ? "" : designation.getDisplayName();
    }
}
