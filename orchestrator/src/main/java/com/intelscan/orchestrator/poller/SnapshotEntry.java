package com.intelscan.orchestrator.poller;

import com.intelscan.orchestrator.model.JobCounters;
import com.intelscan.orchestrator.projection.DisplayStatus;

import java.time.Instant;

/**
 * The observer's view of one job after projection.
 *
 * {@code lastSeenPhase} is the raw phase string as fetched, kept even when
 * it was not recognized and {@code displayStatus} fell back to PENDING.
 */
public record SnapshotEntry(
        String        id,
        String        kind,
        String        target,
        String        timeFilter,
        DisplayStatus displayStatus,
        int           displayProgress,
        String        lastSeenPhase,
        JobCounters   counters,
        long          unparsed,
        Instant       startedAt,
        Instant       completedAt,
        String        error
) {
}
