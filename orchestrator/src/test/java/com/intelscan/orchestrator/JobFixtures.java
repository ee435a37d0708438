package com.intelscan.orchestrator;

import com.intelscan.orchestrator.model.JobKind;
import com.intelscan.orchestrator.model.JobPhase;
import com.intelscan.orchestrator.model.JobRecord;
import com.intelscan.orchestrator.model.PhaseChange;
import com.intelscan.orchestrator.store.JobRecordStore;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Puts jobs into a given phase by walking legal edges in the store directly,
 * bypassing the state machine.
 */
public final class JobFixtures {

    private JobFixtures() {}

    public static UUID jobIn(JobRecordStore store, JobPhase phase) {
        return jobIn(store, phase, JobKind.SINGLE_TARGET);
    }

    public static UUID jobIn(JobRecordStore store, JobPhase phase, JobKind kind) {
        JobRecord job = store.create(JobRecord.queued(UUID.randomUUID(), kind, null,
                "example.com", null, Instant.now()));
        JobPhase current = JobPhase.QUEUED;
        for (JobPhase step : pathTo(phase)) {
            store.compareAndSwapPhase(job.id(), new PhaseChange(current, step, Instant.now(), "setup"));
            current = step;
        }
        return job.id();
    }

    private static List<JobPhase> pathTo(JobPhase target) {
        return switch (target) {
            case QUEUED     -> List.of();
            case COLLECTING -> List.of(JobPhase.COLLECTING);
            case PAUSED     -> List.of(JobPhase.COLLECTING, JobPhase.PAUSED);
            case PARSING    -> List.of(JobPhase.COLLECTING, JobPhase.PARSING);
            case UPSERTING  -> List.of(JobPhase.COLLECTING, JobPhase.PARSING, JobPhase.UPSERTING);
            case COMPLETED  -> List.of(JobPhase.COLLECTING, JobPhase.PARSING, JobPhase.UPSERTING, JobPhase.COMPLETED);
            case CANCELLING -> List.of(JobPhase.CANCELLING);
            case CANCELLED  -> List.of(JobPhase.CANCELLING, JobPhase.CANCELLED);
            case FAILED     -> List.of(JobPhase.FAILED);
        };
    }
}
