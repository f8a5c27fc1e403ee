package com.heronix.progress.service.batch;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.heronix.progress.config.AsyncConfig;
import com.heronix.progress.config.ProgressProperties;
import com.heronix.progress.exception.AcademicDataAccessException;
import com.heronix.progress.exception.ResultPersistenceException;
import com.heronix.progress.model.batch.BatchError;
import com.heronix.progress.model.batch.BatchProgress;
import com.heronix.progress.model.batch.BatchRequest;
import com.heronix.progress.model.batch.BatchResult;
import com.heronix.progress.model.enums.BatchRunState;
import com.heronix.progress.model.enums.CalculationKind;
import com.heronix.progress.model.enums.ErrorCode;
import com.heronix.progress.model.result.CalculationResult;
import com.heronix.progress.model.result.DomainError;
import com.heronix.progress.port.AcademicDataSource;
import com.heronix.progress.port.JobProgressReporter;
import com.heronix.progress.service.batch.EntityEvaluator.Outcome;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs a calculation over a student cohort.
 *
 * Run lifecycle: COLLECTING (cohort lookup) -> PROCESSING (sub-batches) -> COMPLETED,
 * FAILED or CANCELLED. The calling thread controls the run: each sub-batch fans out to the
 * evaluation executor and is joined in full before counters are tallied, so one student's
 * failure never affects another and counters are only written by the controlling thread.
 *
 * Only a failed cohort lookup fails the run; every later failure is recorded against the
 * student and the run continues.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Service
@Slf4j
public class BatchEvaluationOrchestrator {

    private final AcademicDataSource dataSource;
    private final JobProgressReporter progressReporter;
    private final Map<CalculationKind, EntityEvaluator> evaluators;
    private final BatchRunRegistry runRegistry;
    private final Executor evaluationExecutor;
    private final ProgressProperties properties;

    public BatchEvaluationOrchestrator(AcademicDataSource dataSource,
                                       JobProgressReporter progressReporter,
                                       Map<CalculationKind, EntityEvaluator> entityEvaluators,
                                       BatchRunRegistry runRegistry,
                                       @Qualifier(AsyncConfig.EVALUATION_EXECUTOR) Executor evaluationExecutor,
                                       ProgressProperties properties) {
        this.dataSource = dataSource;
        this.progressReporter = progressReporter;
        this.evaluators = entityEvaluators;
        this.runRegistry = runRegistry;
        this.evaluationExecutor = evaluationExecutor;
        this.properties = properties;
    }

    /**
     * Evaluate every member of the requested cohort.
     *
     * @param request cohort, calculation kind and period
     * @return the batch summary (also for cancelled runs), or a failure when the request is
     *         invalid or the cohort could not be retrieved
     */
    public CalculationResult<BatchResult> run(BatchRequest request) {
        CalculationResult<EntityEvaluator> resolved = resolveEvaluator(request);
        if (resolved.isFailure()) {
            log.warn("Rejected batch request {}: {}", request == null ? null : request.batchId(),
                    resolved.error().message());
            return CalculationResult.failure(resolved.error());
        }
        EntityEvaluator evaluator = resolved.value();
        String batchId = request.batchId();

        try {
            runRegistry.register(batchId, request.kind());
        } catch (IllegalStateException e) {
            log.warn("Rejected batch request {}: run already active", batchId);
            return CalculationResult.failure(DomainError.of(ErrorCode.INVALID_BATCH_REQUEST,
                    "Batch run already active: " + batchId, Map.of("batchId", batchId)));
        }

        try {
            return execute(request, evaluator);
        } finally {
            runRegistry.remove(batchId);
        }
    }

    private CalculationResult<BatchResult> execute(BatchRequest request, EntityEvaluator evaluator) {
        String batchId = request.batchId();
        LocalDateTime startedAt = LocalDateTime.now();
        long startNanos = System.nanoTime();

        log.info("Starting {} batch run {} for period {}", request.kind(), batchId, request.period());
        report(batchId, () -> progressReporter.started(request));

        // COLLECTING
        List<String> cohort;
        try {
            cohort = List.copyOf(new LinkedHashSet<>(
                    dataSource.findCohort(request.kind(), request.period(), request.cohort())));
        } catch (RuntimeException e) {
            log.error("Batch run {} failed: cohort retrieval failed: {}", batchId, e.getMessage());
            runRegistry.updateState(batchId, BatchRunState.FAILED);
            String message = "Cohort retrieval failed: " + e.getMessage();
            report(batchId, () -> progressReporter.failed(batchId, message));
            return CalculationResult.failure(DomainError.of(ErrorCode.COHORT_RETRIEVAL_FAILED, message,
                    Map.of("batchId", batchId, "kind", request.kind().name())));
        }

        // PROCESSING
        runRegistry.updateState(batchId, BatchRunState.PROCESSING);
        BatchProgress progress = new BatchProgress(cohort.size());
        int maxErrors = Math.max(0, properties.getBatch().getMaxErrors());
        List<BatchError> errors = new ArrayList<>();
        int totalErrorCount = 0;
        boolean cancelled = false;

        log.info("Batch run {}: {} students to evaluate", batchId, cohort.size());

        int subBatchSize = subBatchSize(request.kind());
        for (int from = 0; from < cohort.size(); from += subBatchSize) {
            if (runRegistry.isCancelRequested(batchId)) {
                cancelled = true;
                log.info("Batch run {} cancelled after {} of {} students", batchId,
                        progress.getProcessed(), progress.getTotal());
                break;
            }

            List<String> subBatch = cohort.subList(from, Math.min(from + subBatchSize, cohort.size()));
            Map<String, Outcome> outcomes = evaluateSubBatch(subBatch, request, evaluator);

            for (Outcome outcome : outcomes.values()) {
                if (outcome.success()) {
                    progress.recordSuccess();
                    continue;
                }
                progress.recordFailure();
                totalErrorCount++;
                if (errors.size() < maxErrors) {
                    errors.add(new BatchError(outcome.studentId(), outcome.error().code(), outcome.error().message()));
                }
            }

            int percent = progress.percentComplete();
            runRegistry.updateProgress(batchId, percent);
            report(batchId, () -> progressReporter.reportProgress(batchId, percent));
            log.debug("Batch run {} progress: {}/{}", batchId, progress.getProcessed(), progress.getTotal());
        }

        BatchRunState finalState = cancelled ? BatchRunState.CANCELLED : BatchRunState.COMPLETED;
        runRegistry.updateState(batchId, finalState);

        BatchResult result = new BatchResult(
                batchId,
                request.kind(),
                request.period(),
                finalState,
                progress.getTotal(),
                progress.getProcessed(),
                progress.getSuccessful(),
                progress.getFailed(),
                progress.getSkipped(),
                (System.nanoTime() - startNanos) / 1_000_000,
                errors,
                totalErrorCount,
                totalErrorCount > errors.size(),
                startedAt,
                LocalDateTime.now());

        log.info("Batch run {} {}: processed={}, successful={}, failed={}, skipped={}, durationMs={}",
                batchId, finalState, result.processed(), result.successful(), result.failed(),
                result.skipped(), result.durationMs());
        report(batchId, () -> progressReporter.completed(result));

        return CalculationResult.success(result);
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    /**
     * Evaluate every member concurrently and wait for all of them. Exceptions become
     * per-student failures; results are keyed by student id.
     */
    private Map<String, Outcome> evaluateSubBatch(List<String> subBatch, BatchRequest request,
                                                  EntityEvaluator evaluator) {
        Map<String, CompletableFuture<Outcome>> futures = new LinkedHashMap<>();
        for (String studentId : subBatch) {
            futures.put(studentId, CompletableFuture
                    .supplyAsync(() -> evaluator.evaluate(studentId, request), evaluationExecutor)
                    .handle((outcome, throwable) -> throwable == null
                            ? outcome
                            : Outcome.failure(studentId, toError(studentId, throwable))));
        }

        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

        Map<String, Outcome> outcomes = new LinkedHashMap<>();
        futures.forEach((studentId, future) -> outcomes.put(studentId, future.join()));
        return outcomes;
    }

    private DomainError toError(String studentId, Throwable throwable) {
        Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                ? throwable.getCause()
                : throwable;
        log.warn("Evaluation failed for student {}: {}", studentId, cause.getMessage());

        ErrorCode code;
        if (cause instanceof AcademicDataAccessException) {
            code = ErrorCode.DATA_ACCESS_FAILED;
        } else if (cause instanceof ResultPersistenceException) {
            code = ErrorCode.PERSISTENCE_FAILED;
        } else {
            code = ErrorCode.UNEXPECTED_FAILURE;
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return DomainError.of(code, message, Map.of("studentId", studentId));
    }

    private CalculationResult<EntityEvaluator> resolveEvaluator(BatchRequest request) {
        List<String> problems = new ArrayList<>();
        if (request == null) {
            problems.add("Batch request is required");
        } else {
            if (request.batchId() == null || request.batchId().isBlank()) {
                problems.add("Batch id is required");
            }
            if (request.kind() == null) {
                problems.add("Calculation kind is required");
            } else if (!evaluators.containsKey(request.kind())) {
                problems.add("No evaluator registered for " + request.kind());
            }
            if (request.period() == null || request.period().termId() == null) {
                problems.add("Evaluation period with a term is required");
            } else if (request.kind() == CalculationKind.SAP && request.period().awardYearId() == null) {
                problems.add("SAP runs require an award year");
            }
        }

        if (!problems.isEmpty()) {
            return CalculationResult.failure(
                    DomainError.of(ErrorCode.INVALID_BATCH_REQUEST, "Invalid batch request", problems));
        }
        return CalculationResult.success(evaluators.get(request.kind()));
    }

    private int subBatchSize(CalculationKind kind) {
        int size = switch (kind) {
            case SAP -> properties.getBatch().getSapBatchSize();
            case GPA -> properties.getBatch().getGpaBatchSize();
        };
        return Math.max(1, size);
    }

    private void report(String batchId, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("Progress reporting failed for batch run {}: {}", batchId, e.getMessage());
        }
    }
}
