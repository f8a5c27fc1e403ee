package com.heronix.progress.port;

import com.heronix.progress.model.batch.BatchRequest;
import com.heronix.progress.model.batch.BatchResult;

/**
 * Receives job lifecycle and progress updates. Calls are fire-and-forget: the engine logs
 * and ignores reporter failures.
 */
public interface JobProgressReporter {

    void started(BatchRequest request);

    /**
     * @param percent processed share of the cohort, 0-100
     */
    void reportProgress(String batchId, int percent);

    void completed(BatchResult result);

    void failed(String batchId, String message);
}
