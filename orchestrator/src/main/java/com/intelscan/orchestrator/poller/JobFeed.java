package com.intelscan.orchestrator.poller;

import java.util.List;

/**
 * Source of the full set of jobs visible to the observer.
 */
@FunctionalInterface
public interface JobFeed {

    /**
     * @return every visible job, possibly empty, never null
     * @throws JobFeedException on network error, timeout or a non-success response
     */
    List<FetchedJob> fetchJobs();
}
