package com.intelscan.orchestrator.store;

import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per job id.
 *
 * Worker ticks and user commands both run their read-decide-write sequence
 * inside {@link #withLock}, so transitions for a single job are totally
 * ordered. Different ids get different locks and never wait on each other.
 *
 * Entries are released once a job is terminal or deleted. Nothing is
 * written to a terminal job, so a caller that re-creates the entry
 * afterwards only ever observes the same final state.
 */
@Component
public class JobLockRegistry {

    private final ConcurrentHashMap<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(UUID jobId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(jobId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /** Drop the lock of a job that is terminal or gone from the store. */
    public void release(UUID jobId) {
        locks.remove(jobId);
    }

    int size() {
        return locks.size();
    }
}
