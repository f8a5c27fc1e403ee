package com.heronix.progress.exception;

/**
 * Exception thrown when a batch run is not found.
 */
public class BatchRunNotFoundException extends RuntimeException {

    public BatchRunNotFoundException(String batchId) {
        super("Batch run not found: " + batchId);
    }
}
