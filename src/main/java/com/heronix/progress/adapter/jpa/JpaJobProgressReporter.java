package com.heronix.progress.adapter.jpa;

import java.time.LocalDateTime;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.progress.model.batch.BatchError;
import com.heronix.progress.model.batch.BatchRequest;
import com.heronix.progress.model.batch.BatchResult;
import com.heronix.progress.model.domain.BatchRun;
import com.heronix.progress.model.domain.BatchRunError;
import com.heronix.progress.model.enums.BatchRunState;
import com.heronix.progress.port.JobProgressReporter;
import com.heronix.progress.repository.BatchRunRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the {@link BatchRun} job record of every run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaJobProgressReporter implements JobProgressReporter {

    private final BatchRunRepository batchRunRepository;

    @Override
    @Transactional
    public void started(BatchRequest request) {
        BatchRun run = batchRunRepository.findByBatchId(request.batchId())
                .orElseGet(() -> BatchRun.builder().batchId(request.batchId()).build());

        run.setKind(request.kind());
        run.setAwardYearId(request.period().awardYearId());
        run.setTermId(request.period().termId());
        run.setState(BatchRunState.COLLECTING);
        run.setPercentComplete(0);
        run.setMessage(null);
        run.setStartedAt(LocalDateTime.now());
        run.setCompletedAt(null);
        run.getErrors().clear();
        batchRunRepository.save(run);
    }

    @Override
    @Transactional
    public void reportProgress(String batchId, int percent) {
        batchRunRepository.findByBatchId(batchId).ifPresentOrElse(run -> {
            run.setState(BatchRunState.PROCESSING);
            run.setPercentComplete(percent);
            batchRunRepository.save(run);
        }, () -> log.warn("Progress for unknown batch run {}", batchId));
    }

    @Override
    @Transactional
    public void completed(BatchResult result) {
        BatchRun run = batchRunRepository.findByBatchId(result.batchId())
                .orElseGet(() -> BatchRun.builder()
                        .batchId(result.batchId())
                        .kind(result.kind())
                        .startedAt(result.startedAt())
                        .build());

        run.setState(result.state());
        run.setPercentComplete(result.total() == 0 ? 100 : result.processed() * 100 / result.total());
        run.setTotal(result.total());
        run.setProcessed(result.processed());
        run.setSuccessful(result.successful());
        run.setFailed(result.failed());
        run.setSkipped(result.skipped());
        run.setTotalErrorCount(result.totalErrorCount());
        run.setErrorsTruncated(result.errorsTruncated());
        run.setDurationMs(result.durationMs());
        run.setCompletedAt(result.completedAt());

        run.getErrors().clear();
        for (BatchError error : result.errors()) {
            run.addError(BatchRunError.builder()
                    .studentId(error.studentId())
                    .errorCode(error.code())
                    .message(error.message())
                    .build());
        }
        batchRunRepository.save(run);
    }

    @Override
    @Transactional
    public void failed(String batchId, String message) {
        batchRunRepository.findByBatchId(batchId).ifPresentOrElse(run -> {
            run.fail(message);
            batchRunRepository.save(run);
        }, () -> log.warn("Failure reported for unknown batch run {}", batchId));
    }
}
