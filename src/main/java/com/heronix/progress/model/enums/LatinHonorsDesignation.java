package com.heronix.progress.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Latin honors tiers, highest first.
 */
@Getter
@RequiredArgsConstructor
public enum LatinHonorsDesignation {

    SUMMA_CUM_LAUDE("summa_cum_laude", "Summa Cum Laude"),
    MAGNA_CUM_LAUDE("magna_cum_laude", "Magna Cum Laude"),
    CUM_LAUDE("cum_laude", "Cum Laude");

    /**
     * Code stored on graduation records
     */
    private final String code;

    /**
     * Text printed on diplomas and transcripts
     */
    private final String displayName;
}
