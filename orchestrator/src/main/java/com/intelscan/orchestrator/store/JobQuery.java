package com.intelscan.orchestrator.store;

/**
 * Listing filter for {@link JobRecordStore#list(JobQuery)}.
 *
 * @param phase optional wire phase filter; null lists every phase
 * @param page  zero-based page index
 * @param size  page size, 1..{@value #MAX_SIZE}
 */
public record JobQuery(String phase, int page, int size, Order order) {

    public static final int DEFAULT_SIZE = 50;
    public static final int MAX_SIZE     = 200;

    public enum Order { NEWEST_FIRST, OLDEST_FIRST }

    public JobQuery {
        if (page < 0) throw new IllegalArgumentException("page must be >= 0");
        if (size < 1 || size > MAX_SIZE) {
            throw new IllegalArgumentException("size must be between 1 and " + MAX_SIZE);
        }
        if (phase != null && phase.isBlank()) phase = null;
        if (order == null) order = Order.NEWEST_FIRST;
    }

    public static JobQuery newest(int size) {
        return new JobQuery(null, 0, size, Order.NEWEST_FIRST);
    }

    public static JobQuery oldestInPhase(String phase, int size) {
        return new JobQuery(phase, 0, size, Order.OLDEST_FIRST);
    }

    public int offset() {
        return page * size;
    }
}
