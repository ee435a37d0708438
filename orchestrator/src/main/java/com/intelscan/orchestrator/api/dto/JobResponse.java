package com.intelscan.orchestrator.api.dto;

import com.intelscan.orchestrator.model.JobCounters;
import com.intelscan.orchestrator.model.JobKind;
import com.intelscan.orchestrator.model.JobRecord;
import com.intelscan.orchestrator.model.TimeFilter;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Response body for GET /jobs, GET /jobs/{id} and POST /jobs.
 *
 * {@code phase} is passed through exactly as stored, including phases this
 * build does not recognize. Projection to a display status is the client's job.
 */
public record JobResponse(
        UUID       id,
        JobKind    kind,
        String     name,
        String     target,
        TimeFilter timeFilter,
        String     phase,
        Counters   counters,
        Instant    createdAt,
        Instant    startedAt,
        Instant    completedAt,
        Long       durationSeconds,
        String     error
) {
    public record Counters(long totalRaw, long totalParsed, long totalNew,
                           long totalDuplicates, long unparsed) {

        static Counters from(JobCounters c) {
            return new Counters(c.totalRaw(), c.totalParsed(), c.totalNew(),
                    c.totalDuplicates(), c.unparsed());
        }
    }

    public static JobResponse from(JobRecord job) {
        return new JobResponse(
                job.id(),
                job.kind(),
                job.name(),
                job.target(),
                job.timeFilter(),
                job.phase(),
                Counters.from(job.counters()),
                job.createdAt(),
                job.startedAt(),
                job.completedAt(),
                job.duration().map(Duration::toSeconds).orElse(null),
                job.error()
        );
    }
}
