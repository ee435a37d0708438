package com.intelscan.orchestrator.store;

import com.intelscan.orchestrator.model.JobCounters;
import com.intelscan.orchestrator.model.JobRecord;
import com.intelscan.orchestrator.model.PhaseChange;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Job store backed by a {@link ConcurrentHashMap}.
 *
 * Records are immutable, so each conditional write is a single
 * {@code compute} call on the map: atomic per key, independent across keys.
 * Contents are lost on restart; enable with {@code intelscan.store=memory}.
 */
public class InMemoryJobRecordStore implements JobRecordStore {

    private final ConcurrentHashMap<UUID, JobRecord> jobs = new ConcurrentHashMap<>();

    @Override
    public JobRecord create(JobRecord record) {
        JobRecord existing = jobs.putIfAbsent(record.id(), record);
        if (existing != null) {
            throw new IllegalArgumentException("Duplicate job id: " + record.id());
        }
        return record;
    }

    @Override
    public Optional<JobRecord> get(UUID id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public List<JobRecord> list(JobQuery query) {
        Comparator<JobRecord> byCreated = Comparator.comparing(JobRecord::createdAt)
                .thenComparing(r -> r.id().toString());
        if (query.order() == JobQuery.Order.NEWEST_FIRST) {
            byCreated = byCreated.reversed();
        }
        return jobs.values().stream()
                .filter(r -> query.phase() == null || query.phase().equals(r.phase()))
                .sorted(byCreated)
                .skip(query.offset())
                .limit(query.size())
                .toList();
    }

    @Override
    public boolean compareAndSwapPhase(UUID id, PhaseChange change) {
        AtomicBoolean swapped = new AtomicBoolean(false);
        jobs.computeIfPresent(id, (key, current) -> {
            if (!change.expected().wireName().equals(current.phase())) {
                return current;
            }
            swapped.set(true);
            return current.withPhaseChange(change);
        });
        return swapped.get();
    }

    @Override
    public boolean updateCounters(UUID id, JobCounters counters) {
        AtomicBoolean updated = new AtomicBoolean(false);
        jobs.computeIfPresent(id, (key, current) -> {
            if (current.isTerminal()) return current;
            updated.set(true);
            return current.withCounters(counters);
        });
        return updated.get();
    }

    @Override
    public boolean deleteIfFinished(UUID id) {
        AtomicBoolean deleted = new AtomicBoolean(false);
        jobs.computeIfPresent(id, (key, current) -> {
            if (!current.isTerminal()) return current;
            deleted.set(true);
            return null;
        });
        return deleted.get();
    }

    @Override
    public int deleteAllFinished() {
        return removeWhere(JobRecord::isTerminal);
    }

    @Override
    public int deleteFinishedBefore(Instant cutoff) {
        return removeWhere(r -> r.isTerminal()
                && r.completedAt() != null
                && r.completedAt().isBefore(cutoff));
    }

    // remove(key, value) only succeeds if the record was not replaced meanwhile
    private int removeWhere(Predicate<JobRecord> condition) {
        int removed = 0;
        for (Map.Entry<UUID, JobRecord> e : jobs.entrySet()) {
            if (condition.test(e.getValue()) && jobs.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        return removed;
    }
}
