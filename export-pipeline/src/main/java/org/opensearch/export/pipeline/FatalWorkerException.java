package org.opensearch.export.pipeline;

import org.opensearch.export.pipeline.ir.Job;

import lombok.Getter;

/**
 * A worker could not finish a job. The worker that threw it stops and its job is reported failed.
 */
public class FatalWorkerException extends RuntimeException {
    @Getter
    private final transient Job job;

    public FatalWorkerException(Job job, String message, Throwable cause) {
        super(message, cause);
        this.job = job;
    }
}
