package com.heronix.progress.service.batch;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.progress.config.AsyncConfig;
import com.heronix.progress.exception.BatchRunNotFoundException;
import com.heronix.progress.model.batch.BatchRequest;
import com.heronix.progress.model.batch.BatchResult;
import com.heronix.progress.model.dto.BatchRunDTO;
import com.heronix.progress.model.result.CalculationResult;
import com.heronix.progress.repository.BatchRunRepository;
import com.heronix.progress.service.batch.BatchRunRegistry.ActiveRunView;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Starts, cancels and reports on batch runs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchJobService {

    private final BatchEvaluationOrchestrator orchestrator;
    private final BatchRunRegistry runRegistry;
    private final BatchRunRepository batchRunRepository;

    /**
     * Give the request a batch id if it has none.
     */
    public BatchRequest withBatchId(BatchRequest request) {
        if (request.batchId() != null && !request.batchId().isBlank()) {
            return request;
        }
        String batchId = request.kind().name().toLowerCase() + "-" + UUID.randomUUID();
        return request.toBuilder().batchId(batchId).build();
    }

    /**
     * Run a batch on the batch run executor.
     */
    @Async(AsyncConfig.BATCH_RUN_EXECUTOR)
    public CompletableFuture<CalculationResult<BatchResult>> startRun(BatchRequest request) {
        log.info("Starting batch job {}", request.batchId());

        try {
            return CompletableFuture.completedFuture(orchestrator.run(request));
        } catch (Exception e) {
            log.error("Batch job {} failed: {}", request.batchId(), e.getMessage(), e);
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Ask an active run to stop after its current sub-batch.
     *
     * @throws BatchRunNotFoundException if no such run is active
     */
    public void cancel(String batchId) {
        if (!runRegistry.requestCancel(batchId)) {
            throw new BatchRunNotFoundException(batchId);
        }
    }

    @Transactional(readOnly = true)
    public Optional<BatchRunDTO> findRun(String batchId) {
        return batchRunRepository.findWithErrorsByBatchId(batchId)
                .map(run -> BatchRunDTO.from(run, true));
    }

    @Transactional(readOnly = true)
    public List<BatchRunDTO> recentRuns(int limit) {
        return batchRunRepository.findAllByOrderByStartedAtDesc(PageRequest.of(0, Math.max(1, limit)))
                .map(run -> BatchRunDTO.from(run, false))
                .getContent();
    }

    public List<ActiveRunView> activeRuns() {
        return runRegistry.activeRuns();
    }
}
