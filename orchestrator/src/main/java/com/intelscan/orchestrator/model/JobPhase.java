package com.intelscan.orchestrator.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Pipeline position of a collection job.
 *
 * Transitions (happy path):
 *   QUEUED → COLLECTING → PARSING → UPSERTING → COMPLETED
 *
 * Side branches:
 *   COLLECTING ⇄ PAUSED
 *   any non-terminal → CANCELLING → CANCELLED
 *   any non-terminal → FAILED
 *
 * The phase is persisted and sent over the wire as its lowercase name
 * ("queued", "collecting", ...). A newer worker may write phases this
 * build does not know, so parsing goes through {@link #fromWire(String)}
 * rather than {@link #valueOf(String)}.
 */
public enum JobPhase {
    QUEUED,
    COLLECTING,
    PARSING,
    UPSERTING,
    PAUSED,
    CANCELLING,
    COMPLETED,
    CANCELLED,
    FAILED;

    /** No outgoing transitions from COMPLETED, CANCELLED or FAILED. */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parse a stored or received phase; empty for null, blank or unrecognized values. */
    public static Optional<JobPhase> fromWire(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(value.strip().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
