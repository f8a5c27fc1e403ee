package com.heronix.progress.model.dto;

import java.util.List;

import com.heronix.progress.model.enums.CalculationKind;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for starting a batch run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchRunRequestDTO {

    /**
     * Calculation to run.
     */
    @NotNull(message = "Calculation kind is required")
    private CalculationKind kind;

    /**
     * Award year, required for SAP runs.
     */
    private String awardYearId;

    @NotBlank(message = "Term ID is required")
    private String termId;

    /**
     * Explicit cohort. If null, every eligible student is evaluated.
     */
    private List<String> studentIds;

    /**
     * GPA runs: also recompute cumulative GPA.
     */
    private boolean calculateCumulative;
}
