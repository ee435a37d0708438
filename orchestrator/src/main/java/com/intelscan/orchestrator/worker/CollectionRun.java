package com.intelscan.orchestrator.worker;

import java.util.List;

/**
 * One execution of a {@link CollectionTask}.
 *
 * The worker calls {@link #collect} once per work unit, checking for
 * pause/cancel between units. {@link #parse} and {@link #upsert} run once
 * each and cannot be paused.
 */
public interface CollectionRun {

    /** Work units for the collecting phase, e.g. one per target domain. */
    List<String> workUnits();

    /** Collect one unit. @return raw items found by this unit */
    long collect(String unit) throws Exception;

    /** Parse everything collected. @return total lines parsed */
    long parse() throws Exception;

    /** Store parsed records, deduplicating against known ones. */
    UpsertTotals upsert() throws Exception;

    record UpsertTotals(long inserted, long duplicates) {}
}
