package com.intelscan.orchestrator.store;

import com.intelscan.orchestrator.model.JobCounters;
import com.intelscan.orchestrator.model.JobRecord;
import com.intelscan.orchestrator.model.PhaseChange;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Authoritative storage for job records, keyed by job id.
 *
 * The transition logic depends only on this interface. Phase writes go
 * through {@link #compareAndSwapPhase} so that a writer racing with another
 * process can detect that it lost; in-process callers additionally serialize
 * per job through {@link JobLockRegistry}.
 *
 * Implementations throw {@link JobStoreUnavailableException} when the
 * backing storage cannot be reached.
 */
public interface JobRecordStore {

    JobRecord create(JobRecord record);

    Optional<JobRecord> get(UUID id);

    List<JobRecord> list(JobQuery query);

    /**
     * Apply {@code change} only if the stored phase still equals
     * {@code change.expected()}.
     *
     * @return true if the row was updated, false if the phase had moved on
     *         or the job does not exist
     */
    boolean compareAndSwapPhase(UUID id, PhaseChange change);

    /**
     * Overwrite the counters of a job that is not in a terminal phase.
     *
     * @return false if the job is terminal or does not exist
     */
    boolean updateCounters(UUID id, JobCounters counters);

    /** Delete one job if it is in a terminal phase. */
    boolean deleteIfFinished(UUID id);

    /** Delete every job in a terminal phase. */
    int deleteAllFinished();

    /** Delete terminal jobs whose completedAt is before {@code cutoff}. */
    int deleteFinishedBefore(Instant cutoff);
}
