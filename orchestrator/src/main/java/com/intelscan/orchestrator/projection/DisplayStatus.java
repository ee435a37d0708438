package com.intelscan.orchestrator.projection;

import java.util.Locale;

/**
 * Client-facing job status. Same as the pipeline phase except that QUEUED
 * (and anything unrecognized) collapses to PENDING.
 */
public enum DisplayStatus {
    PENDING,
    COLLECTING,
    PARSING,
    UPSERTING,
    PAUSED,
    CANCELLING,
    CANCELLED,
    COMPLETED,
    FAILED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
