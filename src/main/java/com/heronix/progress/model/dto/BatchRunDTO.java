package com.heronix.progress.model.dto;

import java.time.LocalDateTime;
import java.util.List;

import com.heronix.progress.model.domain.BatchRun;
import com.heronix.progress.model.enums.BatchRunState;
import com.heronix.progress.model.enums.CalculationKind;
import com.heronix.progress.model.enums.ErrorCode;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Job record of a batch run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchRunDTO {

    private String batchId;
    private CalculationKind kind;
    private String awardYearId;
    private String termId;
    private BatchRunState state;
    private int percentComplete;
    private Integer total;
    private Integer processed;
    private Integer successful;
    private Integer failed;
    private Integer skipped;
    private Integer totalErrorCount;
    private boolean errorsTruncated;
    private Long durationMs;
    private String message;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    /**
     * Per-student errors. Empty in list views.
     */
    private List<ErrorEntry> errors;

    public record ErrorEntry(String studentId, ErrorCode code, String message) {
    }

    public static BatchRunDTO from(BatchRun run, boolean includeErrors) {
        return BatchRunDTO.builder()
                .batchId(run.getBatchId())
                .kind(run.getKind())
                .awardYearId(run.getAwardYearId())
                .termId(run.getTermId())
                .state(run.getState())
                .percentComplete(run.getPercentComplete() == null ? 0 : run.getPercentComplete())
                .total(run.getTotal())
                .processed(run.getProcessed())
                .successful(run.getSuccessful())
                .failed(run.getFailed())
                .skipped(run.getSkipped())
                .totalErrorCount(run.getTotalErrorCount())
                .errorsTruncated(Boolean.TRUE.equals(run.getErrorsTruncated()))
                .durationMs(run.getDurationMs())
                .message(run.getMessage())
                .startedAt(run.getStartedAt())
                .completedAt(run.getCompletedAt())
                .errors(includeErrors
                        ? run.getErrors().stream()
                                .map(e -> new ErrorEntry(e.getStudentId(), e.getErrorCode(), e.getMessage()))
                                .toList()
                        : List.of())
                .build();
    }
}
