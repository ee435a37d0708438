package com.intelscan.orchestrator.poller;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Everything an observer knows about the job list, as of {@code refreshedAt}.
 *
 * Replaced wholesale after every successful poll. A failed poll keeps the
 * entries and only sets {@code stale}.
 */
public record ClientSnapshot(
        List<SnapshotEntry> jobs,
        Instant             refreshedAt,
        boolean             stale,
        String              staleReason
) {
    public static final ClientSnapshot EMPTY = new ClientSnapshot(List.of(), null, false, null);

    public ClientSnapshot {
        jobs = List.copyOf(jobs);
    }

    public static ClientSnapshot fresh(List<SnapshotEntry> jobs, Instant refreshedAt) {
        return new ClientSnapshot(jobs, refreshedAt, false, null);
    }

    /** Same entries, flagged as possibly out of date. */
    public ClientSnapshot markStale(String reason) {
        return new ClientSnapshot(jobs, refreshedAt, true, reason);
    }

    public int size() {
        return jobs.size();
    }

    public Optional<SnapshotEntry> find(String jobId) {
        return jobs.stream().filter(j -> j.id().equals(jobId)).findFirst();
    }
}
