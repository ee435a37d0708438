package com.intelscan.orchestrator.store;

import com.intelscan.orchestrator.model.JobCounters;
import com.intelscan.orchestrator.model.JobPhase;
import com.intelscan.orchestrator.model.JobRecord;
import com.intelscan.orchestrator.model.PhaseChange;
import com.intelscan.orchestrator.model.ScanJob;
import com.intelscan.orchestrator.repository.ScanJobRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Job store on top of Spring Data JPA (Postgres in production).
 *
 * The phase compare-and-swap is one UPDATE ... WHERE phase = :expected, so
 * two orchestrator instances writing the same row cannot both win.
 * Any {@link DataAccessException} is rethrown as
 * {@link JobStoreUnavailableException}.
 */
@Transactional
public class JpaJobRecordStore implements JobRecordStore {

    private static final List<String> TERMINAL = Arrays.stream(JobPhase.values())
            .filter(JobPhase::isTerminal)
            .map(JobPhase::wireName)
            .toList();

    private final ScanJobRepository repo;

    public JpaJobRecordStore(ScanJobRepository repo) {
        this.repo = repo;
    }

    @Override
    public JobRecord create(JobRecord record) {
        return guarded("create job " + record.id(),
                () -> repo.save(ScanJob.from(record)).toRecord());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<JobRecord> get(UUID id) {
        return guarded("load job " + id, () -> repo.findById(id).map(ScanJob::toRecord));
    }

    @Override
    @Transactional(readOnly = true)
    public List<JobRecord> list(JobQuery query) {
        Sort.Direction dir = query.order() == JobQuery.Order.NEWEST_FIRST
                ? Sort.Direction.DESC : Sort.Direction.ASC;
        PageRequest page = PageRequest.of(query.page(), query.size(),
                Sort.by(dir, "createdAt").and(Sort.by(dir, "id")));
        return guarded("list jobs", () -> {
            List<ScanJob> rows = query.phase() == null
                    ? repo.findAll(page).getContent()
                    : repo.findByPhase(query.phase(), page);
            return rows.stream().map(ScanJob::toRecord).toList();
        });
    }

    @Override
    public boolean compareAndSwapPhase(UUID id, PhaseChange change) {
        return guarded("swap phase of job " + id, () -> {
            Optional<JobRecord> current = repo.findById(id).map(ScanJob::toRecord);
            if (current.isEmpty() || !change.expected().wireName().equals(current.get().phase())) {
                return false;
            }
            // Derive timestamps/error from the loaded row; the WHERE clause re-checks the phase.
            JobRecord next = current.get().withPhaseChange(change);
            return repo.swapPhase(id, change.expected().wireName(), next.phase(),
                    next.startedAt(), next.completedAt(), next.error(), change.at()) == 1;
        });
    }

    @Override
    public boolean updateCounters(UUID id, JobCounters c) {
        return guarded("update counters of job " + id, () ->
                repo.updateCounters(id, c.totalRaw(), c.totalParsed(), c.totalNew(),
                        c.totalDuplicates(), Instant.now(), TERMINAL) == 1);
    }

    @Override
    public boolean deleteIfFinished(UUID id) {
        return guarded("delete job " + id, () -> repo.deleteIfIn(id, TERMINAL) == 1);
    }

    @Override
    public int deleteAllFinished() {
        return guarded("delete finished jobs", () -> repo.deleteAllIn(TERMINAL));
    }

    @Override
    public int deleteFinishedBefore(Instant cutoff) {
        return guarded("purge jobs finished before " + cutoff,
                () -> repo.deleteInCompletedBefore(TERMINAL, cutoff));
    }

    private static <T> T guarded(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new JobStoreUnavailableException("Job store failed to " + operation, e);
        }
    }
}
