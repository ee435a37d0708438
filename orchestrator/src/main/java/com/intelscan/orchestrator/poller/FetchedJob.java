package com.intelscan.orchestrator.poller;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.intelscan.orchestrator.model.JobCounters;

import java.time.Instant;

/**
 * One job as received from {@code GET /jobs}.
 *
 * Deliberately loose: every enum-like field is a plain string and unknown
 * properties are skipped, so a server newer than this client (new phases,
 * new kinds, extra fields) still parses.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FetchedJob(
        String   id,
        String   kind,
        String   name,
        String   target,
        String   timeFilter,
        String   phase,
        Counters counters,
        Instant  createdAt,
        Instant  startedAt,
        Instant  completedAt,
        String   error
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Counters(long totalRaw, long totalParsed, long totalNew, long totalDuplicates) {

        /** Negative values from a malformed payload are read as zero. */
        public JobCounters toJobCounters() {
            return new JobCounters(Math.max(0, totalRaw), Math.max(0, totalParsed),
                    Math.max(0, totalNew), Math.max(0, totalDuplicates));
        }
    }

    public JobCounters jobCounters() {
        return counters == null ? JobCounters.ZERO : counters.toJobCounters();
    }
}
