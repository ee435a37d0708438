package com.intelscan.orchestrator.store;

import java.util.UUID;

/**
 * Thrown when a job id does not exist (or is not visible to the caller).
 */
public class JobNotFoundException extends RuntimeException {

    private final UUID jobId;

    public JobNotFoundException(UUID jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public UUID jobId() { return jobId; }
}
