package com.intelscan.orchestrator.store;

/**
 * Thrown when the job store's backing storage fails or is unreachable.
 * Unlike transition rejections this is a service-health problem.
 */
public class JobStoreUnavailableException extends RuntimeException {

    public JobStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
