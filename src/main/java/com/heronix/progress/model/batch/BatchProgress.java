package com.heronix.progress.model.batch;

import lombok.Getter;

/**
 * Counters of one run. Owned and mutated by the run's controlling thread only.
 */
@Getter
public class BatchProgress {

    private final int total;
    private int processed;
    private int successful;
    private int failed;

    public BatchProgress(int total) {
        this.total = total;
    }

    public void recordSuccess() {
        processed++;
        successful++;
    }

    public void recordFailure() {
        processed++;
        failed++;
    }

    public int getSkipped() {
        return total - processed;
    }

    /**
     * Processed share of the cohort, 0-100. An empty cohort is complete.
     */
    public int percentComplete() {
        return total == 0 ? 100 : processed * 100 / total;
    }
}
