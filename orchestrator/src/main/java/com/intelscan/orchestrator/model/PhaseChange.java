package com.intelscan.orchestrator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A compare-and-swap request against the job store: move from
 * {@code expected} to {@code next} only if the stored phase still equals
 * {@code expected}.
 *
 * {@code error} is only kept when {@code next} is FAILED, and is never blank there.
 */
public record PhaseChange(JobPhase expected, JobPhase next, Instant at, String error) {

    public PhaseChange {
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(next, "next");
        Objects.requireNonNull(at, "at");
        if (next != JobPhase.FAILED) {
            error = null;
        } else if (error == null || error.isBlank()) {
            error = "unknown failure";
        }
    }
}
