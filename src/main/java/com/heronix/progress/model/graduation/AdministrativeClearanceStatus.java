package com.heronix.progress.model.graduation;

import java.math.BigDecimal;
import java.util.List;

/**
 * Administrative checklist for graduation.
 *
 * @param sevisUpdated null when the student is not international
 * @param outstandingBalance the balance when positive, otherwise null
 */
public record AdministrativeClearanceStatus(
        boolean noBlockingHolds,
        boolean financialClearance,
        boolean libraryClearance,
        boolean departmentClearance,
        boolean exitCounselingComplete,
        Boolean sevisUpdated,
        List<BlockingHold> blockingHolds,
        List<BlockingHold> nonBlockingHolds,
        BigDecimal outstandingBalance
) {
    public AdministrativeClearanceStatus {
        blockingHolds = List.copyOf(blockingHolds);
        nonBlockingHolds = List.copyOf(nonBlockingHolds);
    }

    public boolean passed() {
        return noBlockingHolds && financialClearance && libraryClearance && departmentClearance
                && exitCounselingComplete && !Boolean.FALSE.equals(sevisUpdated);
    }
}
