package com.intelscan.orchestrator.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Coarse time-range restriction applied by the intel source.
 * Absent means "all time".
 */
public enum TimeFilter {
    D1, D7, D30,
    W1, W2, W4,
    M1, M3, M6,
    Y1;

    /**
     * Parse a filter code.
     *
     * @return empty for null or blank input
     * @throws IllegalArgumentException for an unknown code
     */
    public static Optional<TimeFilter> parse(String code) {
        if (code == null || code.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(code.strip().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown time filter: " + code);
        }
    }
}
