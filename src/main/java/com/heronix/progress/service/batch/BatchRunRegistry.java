package com.heronix.progress.service.batch;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.stereotype.Component;

import com.heronix.progress.model.enums.BatchRunState;
import com.heronix.progress.model.enums.CalculationKind;

import lombok.extern.slf4j.Slf4j;

/**
 * In-memory registry of runs currently executing in this instance.
 *
 * Holds the cooperative cancel flag of each run and a read-only view of its state for
 * monitoring. Runs leave the registry when they reach a terminal state.
 */
@Component
@Slf4j
public class BatchRunRegistry {

    private final Map<String, ActiveRun> runs = new ConcurrentHashMap<>();

    /**
     * Snapshot of an active run.
     */
    public record ActiveRunView(
            String batchId,
            CalculationKind kind,
            BatchRunState state,
            int percentComplete,
            boolean cancelRequested,
            LocalDateTime startedAt
    ) {
    }

    /**
     * Register a run.
     *
     * @throws IllegalStateException if a run with the same id is already active
     */
    public void register(String batchId, CalculationKind kind) {
        ActiveRun previous = runs.putIfAbsent(batchId, new ActiveRun(batchId, kind, LocalDateTime.now()));
        if (previous != null) {
            throw new IllegalStateException("Batch run already active: " + batchId);
        }
    }

    public void updateState(String batchId, BatchRunState state) {
        ActiveRun run = runs.get(batchId);
        if (run != null) {
            run.state = state;
        }
    }

    public void updateProgress(String batchId, int percentComplete) {
        ActiveRun run = runs.get(batchId);
        if (run != null) {
            run.percentComplete = percentComplete;
        }
    }

    /**
     * Ask a run to stop after its current sub-batch.
     *
     * @return false if no such run is active
     */
    public boolean requestCancel(String batchId) {
        ActiveRun run = runs.get(batchId);
        if (run == null) {
            return false;
        }
        run.cancelRequested.set(true);
        log.info("Cancellation requested for batch run {}", batchId);
        return true;
    }

    public boolean isCancelRequested(String batchId) {
        ActiveRun run = runs.get(batchId);
        return run != null && run.cancelRequested.get();
    }

    public boolean isActive(String batchId) {
        return runs.containsKey(batchId);
    }

    public void remove(String batchId) {
        runs.remove(batchId);
    }

    public List<ActiveRunView> activeRuns() {
        return runs.values().stream()
                .map(ActiveRun::view)
                .sorted(Comparator.comparing(ActiveRunView::startedAt))
                .toList();
    }

    private static final class ActiveRun {

        private final String batchId;
        private final CalculationKind kind;
        private final LocalDateTime startedAt;
        private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
        private volatile BatchRunState state = BatchRunState.COLLECTING;
        private volatile int percentComplete;

        private ActiveRun(String batchId, CalculationKind kind, LocalDateTime startedAt) {
            this.batchId = batchId;
            this.kind = kind;
            this.startedAt = startedAt;
        }

        private ActiveRunView view() {
            return new ActiveRunView(batchId, kind, state, percentComplete, cancelRequested.get(), startedAt);
        }
    }
}
