package com.heronix.progress.model.batch;

import java.math.BigDecimal;
import java.util.List;

import com.heronix.progress.model.enums.SapStatus;
import com.heronix.progress.model.gpa.CourseAttempt;
import com.heronix.progress.model.sap.AcademicPlanRequirements;

import lombok.Builder;

/**
 * A student's academic record as of one evaluation period.
 *
 * @param attempts all course attempts in chronological order
 * @param maxTimeframePercentage program override of the policy timeframe, null for none
 * @param previousSapStatus latest SAP status recorded before this period, null if none
 */
@Builder(toBuilder = true)
public record AcademicSnapshot(
        String studentId,
        List<CourseAttempt> attempts,
        BigDecimal programCredits,
        BigDecimal maxTimeframePercentage,
        SapStatus previousSapStatus,
        boolean appealApproved,
        boolean onAcademicPlan,
        AcademicPlanRequirements academicPlanRequirements
) {
    public AcademicSnapshot {
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }
}
