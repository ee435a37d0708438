package com.intelscan.orchestrator.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Authoritative state of one collection job, as held by the job store.
 *
 * Immutable: every mutation goes through the store and yields a new value.
 * {@code phase} is kept as the raw wire string so that records written by a
 * newer worker with an unknown phase can still be loaded, listed and shown.
 *
 * Invariants maintained by the store:
 *   completedAt != null  iff  phase is terminal
 *   error       != null  iff  phase == failed
 */
public record JobRecord(
        UUID        id,
        JobKind     kind,
        String      name,
        String      target,
        TimeFilter  timeFilter,
        String      phase,
        JobCounters counters,
        Instant     createdAt,
        Instant     startedAt,
        Instant     completedAt,
        String      error
) {
    public JobRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(createdAt, "createdAt");
        if (counters == null) counters = JobCounters.ZERO;
    }

    /** A fresh job in the initial phase. */
    public static JobRecord queued(UUID id, JobKind kind, String name, String target,
                                   TimeFilter timeFilter, Instant createdAt) {
        return new JobRecord(id, kind, name, target, timeFilter,
                JobPhase.QUEUED.wireName(), JobCounters.ZERO, createdAt, null, null, null);
    }

    /** The parsed phase; empty if the stored value is not recognized by this build. */
    public Optional<JobPhase> knownPhase() {
        return JobPhase.fromWire(phase);
    }

    public boolean isTerminal() {
        return knownPhase().map(JobPhase::isTerminal).orElse(false);
    }

    public Optional<Duration> duration() {
        if (startedAt == null || completedAt == null) return Optional.empty();
        return Optional.of(Duration.between(startedAt, completedAt));
    }

    /** Apply an accepted phase change. Timestamps and error follow the invariants above. */
    public JobRecord withPhaseChange(PhaseChange change) {
        Instant started   = startedAt;
        Instant completed = completedAt;
        String  err       = error;
        if (change.next() == JobPhase.COLLECTING && started == null) {
            started = change.at();
        }
        if (change.next().isTerminal() && completed == null) {
            completed = change.at();
        }
        if (change.next() == JobPhase.FAILED && err == null) {
            err = change.error();
        }
        return new JobRecord(id, kind, name, target, timeFilter, change.next().wireName(),
                counters, createdAt, started, completed, err);
    }

    public JobRecord withCounters(JobCounters next) {
        return new JobRecord(id, kind, name, target, timeFilter, phase,
                next, createdAt, startedAt, completedAt, error);
    }
}
