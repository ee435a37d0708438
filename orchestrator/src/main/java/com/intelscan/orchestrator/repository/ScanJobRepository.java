package com.intelscan.orchestrator.repository;

import com.intelscan.orchestrator.model.ScanJob;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Queries for the scan_jobs table.
 *
 * The write methods are single guarded UPDATE/DELETE statements: the WHERE
 * clause carries the precondition, and the returned row count tells the
 * caller whether the precondition still held. They must run inside a
 * transaction (JpaJobRecordStore is @Transactional).
 */
public interface ScanJobRepository extends JpaRepository<ScanJob, UUID> {

    List<ScanJob> findByPhase(String phase, Pageable pageable);

    /**
     * Compare-and-swap the phase. Returns 1 if the stored phase still equalled
     * {@code expected}, 0 otherwise.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ScanJob j
               SET j.phase        = :next,
                   j.startedAt    = :startedAt,
                   j.completedAt  = :completedAt,
                   j.errorMessage = :error,
                   j.updatedAt    = :now
             WHERE j.id = :id
               AND j.phase = :expected
            """)
    int swapPhase(@Param("id") UUID id,
                  @Param("expected") String expected,
                  @Param("next") String next,
                  @Param("startedAt") Instant startedAt,
                  @Param("completedAt") Instant completedAt,
                  @Param("error") String error,
                  @Param("now") Instant now);

    /** Overwrite counters unless the job already reached one of {@code terminal}. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ScanJob j
               SET j.totalRaw        = :raw,
                   j.totalParsed     = :parsed,
                   j.totalNew        = :fresh,
                   j.totalDuplicates = :duplicates,
                   j.updatedAt       = :now
             WHERE j.id = :id
               AND j.phase NOT IN :terminal
            """)
    int updateCounters(@Param("id") UUID id,
                       @Param("raw") long raw,
                       @Param("parsed") long parsed,
                       @Param("fresh") long fresh,
                       @Param("duplicates") long duplicates,
                       @Param("now") Instant now,
                       @Param("terminal") Collection<String> terminal);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM ScanJob j WHERE j.id = :id AND j.phase IN :terminal")
    int deleteIfIn(@Param("id") UUID id, @Param("terminal") Collection<String> terminal);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM ScanJob j WHERE j.phase IN :terminal")
    int deleteAllIn(@Param("terminal") Collection<String> terminal);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM ScanJob j WHERE j.phase IN :terminal AND j.completedAt < :cutoff")
    int deleteInCompletedBefore(@Param("terminal") Collection<String> terminal,
                                @Param("cutoff") Instant cutoff);
}
