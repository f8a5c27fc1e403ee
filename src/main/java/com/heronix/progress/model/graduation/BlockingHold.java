package com.heronix.progress.model.graduation;

import java.time.LocalDate;

import com.heronix.progress.model.enums.HoldCategory;

/**
 * An active hold on the student's record, resolved by the registrar or bursar.
 */
public record BlockingHold(
        String holdId,
        String holdCode,
        String holdName,
        String releaseAuthority,
        LocalDate placedDate,
        HoldCategory category
) {
}
