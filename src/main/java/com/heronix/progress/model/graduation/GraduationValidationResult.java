package com.heronix.progress.model.graduation;

import java.time.LocalDateTime;
import java.util.List;

import com.heronix.progress.model.honors.LatinHonorsResult;

/**
 * Graduation eligibility verdict.
 *
 * @param blockers failing conditions ordered academic, administrative, then data
 * @param warnings non-blocking issues
 */
public record GraduationValidationResult(
        String studentId,
        String studentProgramId,
        boolean eligible,
        LocalDateTime validationDate,
        AcademicRequirementsStatus academicChecks,
        AdministrativeClearanceStatus administrativeChecks,
        DataValidationStatus dataValidation,
        LatinHonorsResult latinHonors,
        List<String> blockers,
        List<String> warnings
) {
    public GraduationValidationResult {
        blockers = List.copyOf(blockers);
        warnings = List.copyOf(warnings);
    }
}
