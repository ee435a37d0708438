package com.intelscan.orchestrator.poller;

/**
 * A fetch of the job list failed. Transient: the poller retries on its next tick.
 */
public class JobFeedException extends RuntimeException {

    public JobFeedException(String message) {
        super(message);
    }

    public JobFeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
