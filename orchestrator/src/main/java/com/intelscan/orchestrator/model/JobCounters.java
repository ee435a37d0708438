package com.intelscan.orchestrator.model;

/**
 * Running totals reported by the worker.
 *
 * All four values only grow while the job is active. {@code unparsed} is
 * derived and clamped at zero, because upstream data occasionally reports
 * more parsed lines than raw ones.
 */
public record JobCounters(long totalRaw, long totalParsed, long totalNew, long totalDuplicates) {

    public static final JobCounters ZERO = new JobCounters(0, 0, 0, 0);

    public JobCounters {
        if (totalRaw < 0 || totalParsed < 0 || totalNew < 0 || totalDuplicates < 0) {
            throw new IllegalArgumentException("Counters must not be negative: raw=%d parsed=%d new=%d dups=%d"
                    .formatted(totalRaw, totalParsed, totalNew, totalDuplicates));
        }
    }

    public long unparsed() {
        return Math.max(0, totalRaw - totalParsed);
    }

    /** True when no value in {@code next} is lower than the matching value here. */
    public boolean allowsAdvanceTo(JobCounters next) {
        return next.totalRaw >= totalRaw
            && next.totalParsed >= totalParsed
            && next.totalNew >= totalNew
            && next.totalDuplicates >= totalDuplicates;
    }

    public JobCounters withRaw(long raw)              { return new JobCounters(raw, totalParsed, totalNew, totalDuplicates); }
    public JobCounters withParsed(long parsed)        { return new JobCounters(totalRaw, parsed, totalNew, totalDuplicates); }
    public JobCounters withUpserted(long nw, long dups) { return new JobCounters(totalRaw, totalParsed, nw, dups); }
}
