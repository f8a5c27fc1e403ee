package com.heronix.progress.service.batch;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.heronix.progress.config.ProgressProperties;
import com.heronix.progress.model.batch.BatchRequest;
import com.heronix.progress.model.batch.CohortSelector;
import com.heronix.progress.model.batch.EvaluationPeriod;
import com.heronix.progress.model.enums.CalculationKind;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Nightly SAP run for the configured award year and term.
 */
@Component
@ConditionalOnProperty(prefix = "heronix.progress.batch", name = "scheduled-enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class BatchScheduler {

    private final BatchJobService batchJobService;
    private final ProgressProperties properties;

    @Scheduled(cron = "${heronix.progress.batch.schedule-cron:0 0 2 * * ?}")
    public void runScheduledSap() {
        ProgressProperties.BatchConfig batch = properties.getBatch();
        if (batch.getScheduledAwardYearId() == null || batch.getScheduledTermId() == null) {
            log.warn("Scheduled SAP run skipped: award year and term are not configured");
            return;
        }

        BatchRequest request = batchJobService.withBatchId(BatchRequest.builder()
                .kind(CalculationKind.SAP)
                .period(new EvaluationPeriod(batch.getScheduledAwardYearId(), batch.getScheduledTermId()))
                .cohort(CohortSelector.allEligible())
                .build());

        log.info("Triggering scheduled SAP run {}", request.batchId());
        batchJobService.startRun(request);
    }
}
