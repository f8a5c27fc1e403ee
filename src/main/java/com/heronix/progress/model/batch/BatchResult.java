package com.heronix.progress.model.batch;

import java.time.LocalDateTime;
import java.util.List;

import com.heronix.progress.model.enums.BatchRunState;
import com.heronix.progress.model.enums.CalculationKind;

/**
 * Summary of a batch run.
 *
 * Counters always reconcile: {@code processed == successful + failed} and
 * {@code skipped == total - processed}. The error list is capped and therefore not
 * exhaustive; {@code totalErrorCount} holds the real number of failures recorded and
 * {@code errorsTruncated} tells whether entries were dropped.
 */
public record BatchResult(
        String batchId,
        CalculationKind kind,
        EvaluationPeriod period,
        BatchRunState state,
        int total,
        int processed,
        int successful,
        int failed,
        int skipped,
        long durationMs,
        List<BatchError> errors,
        int totalErrorCount,
        boolean errorsTruncated,
        LocalDateTime startedAt,
        LocalDateTime completedAt
) {
    public BatchResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
