package com.heronix.progress.config;

import java.util.List;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.heronix.progress.service.batch.BatchRunRegistry;
import com.heronix.progress.service.batch.BatchRunRegistry.ActiveRunView;

import lombok.RequiredArgsConstructor;

/**
 * Spring Boot Actuator health indicator for the batch engine.
 *
 * Always UP; reports the runs executing in this instance and whether the run pool is
 * saturated.
 */
@Component
@RequiredArgsConstructor
public class BatchEngineHealthIndicator implements HealthIndicator {

    private final BatchRunRegistry runRegistry;
    private final ProgressProperties properties;

    @Override
    public Health health() {
        List<ActiveRunView> active = runRegistry.activeRuns();
        int capacity = properties.getBatch().getConcurrentRuns();

        return Health.up()
                .withDetail("active-runs", active.size())
                .withDetail("run-capacity", capacity)
                .withDetail("saturated", active.size() >= capacity)
                .withDetail("runs", active.stream().map(ActiveRunView::batchId).toList())
                .build();
    }
}
