package com.intelscan.orchestrator.model;

import java.util.Locale;

/**
 * What drives a job. Fixed at submission.
 */
public enum JobKind {
    SINGLE_TARGET,        // one domain / email query against the intel source
    BULK_TARGET,          // comma-separated list of targets, one work unit each
    FILE_PARSE,           // uploaded dump file, parsed line by line
    SCHEDULED_RECURRING;  // fired by the external scheduler

    /**
     * Case-insensitive; accepts {@code bulk_target} as well as {@code BULK_TARGET}.
     *
     * @throws IllegalArgumentException for null or an unknown kind
     */
    public static JobKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("kind is required");
        }
        try {
            return valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown job kind: " + value);
        }
    }
}
