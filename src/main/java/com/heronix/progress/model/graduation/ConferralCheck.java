package com.heronix.progress.model.graduation;

import java.util.List;

/**
 * Final pre-conferral check.
 */
public record ConferralCheck(boolean canConfer, List<String> blockers) {

    public ConferralCheck {
        blockers = List.copyOf(blockers);
    }
}
