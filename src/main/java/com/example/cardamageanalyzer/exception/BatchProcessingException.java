package com.example.cardamageanalyzer.exception;

import com.example.cardamageanalyzer.model.PipelineSnapshot;

import java.util.Objects;

/**
 * Raised when a pipeline operation fails as a whole. The snapshot reflects the pipeline state at
 * the moment of failure, which lets callers still render partial item results.
 */
public class BatchProcessingException extends RuntimeException {

    private final BatchFailure failure;
    private final transient PipelineSnapshot snapshot;

    public BatchProcessingException(BatchFailure failure, String message, PipelineSnapshot snapshot) {
        super(message);
        this.failure = Objects.requireNonNull(failure, "failure");
        this.snapshot = snapshot;
    }

    public BatchFailure getFailure() {
        return failure;
    }

    public PipelineSnapshot getSnapshot() {
        return snapshot;
    }
}
