package com.heronix.progress.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Terms of the academic year in calendar order, starting with Fall.
 */
@Getter
@RequiredArgsConstructor
public enum TermSeason {

    FALL("Fall"),
    SPRING("Spring"),
    SUMMER("Summer");

    private final String displayName;

    /**
     * The following term. Summer rolls over to Fall, which starts the next year.
     */
    public TermSeason next() {
        return values()[(ordinal() + 1) % values().length];
    }
}
