package com.intelscan.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Persistent row behind a {@link JobRecord}.
 *
 * Phase changes never go through entity dirty-checking; they are issued as
 * guarded bulk updates by ScanJobRepository so that the check and the write
 * happen in one statement. This class is only loaded, inserted and mapped.
 *
 * DB table: scan_jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "scan_jobs")
public class ScanJob {

    // Assigned by the service, not the database: the id is part of the record from birth.
    @Id
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private JobKind kind;

    @Column(updatable = false)
    private String name;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String target;

    @Enumerated(EnumType.STRING)
    @Column(name = "time_filter", updatable = false)
    private TimeFilter timeFilter;

    // Plain string, not an enum: a newer worker may write phases we do not know yet.
    @Column(nullable = false)
    private String phase;

    @Column(name = "total_raw", nullable = false)
    private long totalRaw;

    @Column(name = "total_parsed", nullable = false)
    private long totalParsed;

    @Column(name = "total_new", nullable = false)
    private long totalNew;

    @Column(name = "total_duplicates", nullable = false)
    private long totalDuplicates;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected ScanJob() {}   // required by JPA

    public static ScanJob from(JobRecord r) {
        ScanJob row = new ScanJob();
        row.id              = r.id();
        row.kind            = r.kind();
        row.name            = r.name();
        row.target          = r.target();
        row.timeFilter      = r.timeFilter();
        row.phase           = r.phase();
        row.totalRaw        = r.counters().totalRaw();
        row.totalParsed     = r.counters().totalParsed();
        row.totalNew        = r.counters().totalNew();
        row.totalDuplicates = r.counters().totalDuplicates();
        row.createdAt       = r.createdAt();
        row.startedAt       = r.startedAt();
        row.completedAt     = r.completedAt();
        row.errorMessage    = r.error();
        row.updatedAt       = r.createdAt();
        return row;
    }

    public JobRecord toRecord() {
        return new JobRecord(id, kind, name, target, timeFilter, phase,
                new JobCounters(totalRaw, totalParsed, totalNew, totalDuplicates),
                createdAt, startedAt, completedAt, errorMessage);
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID    getId()        { return id; }
    public String  getPhase()     { return phase; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
