package com.intelscan.orchestrator.service;

import com.intelscan.orchestrator.access.JobVisibilityFilter;
import com.intelscan.orchestrator.model.JobKind;
import com.intelscan.orchestrator.model.JobRecord;
import com.intelscan.orchestrator.model.TimeFilter;
import com.intelscan.orchestrator.store.JobLockRegistry;
import com.intelscan.orchestrator.store.JobQuery;
import com.intelscan.orchestrator.store.JobRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Job submission, lookup and disposal.
 *
 * Phase changes do not happen here: see {@link CommandProcessor} for user
 * commands and {@link WorkerTickService} for worker progress.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobRecordStore      store;
    private final JobLockRegistry     locks;
    private final JobVisibilityFilter visibility;

    public JobService(JobRecordStore store,
                      JobLockRegistry locks,
                      JobVisibilityFilter visibility) {
        this.store      = store;
        this.locks      = locks;
        this.visibility = visibility;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Create a new job in the QUEUED phase. The dispatcher picks it up on a
     * later tick.
     *
     * @throws IllegalArgumentException if target is blank
     */
    public JobRecord submit(JobKind kind, String name, String target, TimeFilter timeFilter) {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target is required");
        }
        String displayName = (name == null || name.isBlank()) ? null : name.strip();
        JobRecord job = store.create(JobRecord.queued(UUID.randomUUID(), kind, displayName,
                target.strip(), timeFilter, Instant.now()));
        log.info("Job {} submitted: kind={} target='{}' timeFilter={}",
                job.id(), kind, job.target(), timeFilter == null ? "all" : timeFilter);
        return job;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<JobRecord> findById(UUID id) {
        return store.get(id).filter(visibility::isVisible);
    }

    /** One page of the jobs visible to the caller. */
    public List<JobRecord> list(JobQuery query) {
        return store.list(query).stream()
                .filter(visibility::isVisible)
                .toList();
    }

    // ------------------------------------------------------------------
    // Disposal
    // ------------------------------------------------------------------

    /**
     * Delete a finished job.
     *
     * @return false if the job is still active (nothing deleted)
     */
    public boolean delete(UUID id) {
        return locks.withLock(id, () -> {
            boolean deleted = store.deleteIfFinished(id);
            if (deleted) {
                locks.release(id);
                log.info("Job {} deleted", id);
            }
            return deleted;
        });
    }

    /** Delete every finished job. Active jobs are left alone. */
    public int clearFinished() {
        int count = store.deleteAllFinished();
        log.info("Cleared {} finished jobs", count);
        return count;
    }

    /** Delete finished jobs that completed before {@code cutoff}. */
    public int purgeFinishedBefore(Instant cutoff) {
        int count = store.deleteFinishedBefore(cutoff);
        if (count > 0) {
            log.info("Purged {} jobs finished before {}", count, cutoff);
        }
        return count;
    }
}
