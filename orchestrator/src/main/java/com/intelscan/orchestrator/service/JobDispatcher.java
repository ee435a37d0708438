package com.intelscan.orchestrator.service;

import com.intelscan.orchestrator.model.JobKind;
import com.intelscan.orchestrator.model.JobPhase;
import com.intelscan.orchestrator.model.JobRecord;
import com.intelscan.orchestrator.statemachine.PhaseEvent;
import com.intelscan.orchestrator.store.JobQuery;
import com.intelscan.orchestrator.store.JobRecordStore;
import com.intelscan.orchestrator.worker.CollectionTask;
import com.intelscan.orchestrator.worker.JobWorker;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;

/**
 * Background dispatcher that feeds queued jobs to workers.
 *
 * Every tick it claims at most one QUEUED job whose kind has a registered
 * {@link CollectionTask} and runs it on a fixed worker pool. Claiming is the
 * START_COLLECTING compare-and-swap, so two dispatchers (or two pods) never
 * claim the same job.
 *
 * Jobs cancelled while still queued never had a worker to honor the
 * cancellation; the dispatcher lands those in CANCELLED itself.
 */
@Component
@ConditionalOnProperty(name = "intelscan.worker.enabled", havingValue = "true", matchIfMissing = true)
public class JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private static final int CLAIM_SCAN = 20;

    private final JobRecordStore           store;
    private final WorkerTickService        ticks;
    private final JobWorker                worker;
    private final Map<JobKind, CollectionTask> tasks = new EnumMap<>(JobKind.class);
    private final ExecutorService          workers;
    private final Semaphore                slots;

    public JobDispatcher(JobRecordStore store,
                         WorkerTickService ticks,
                         JobWorker worker,
                         ObjectProvider<CollectionTask> collectionTasks,
                         @Value("${intelscan.worker.max-concurrent-jobs:3}") int maxConcurrentJobs) {
        this.store   = store;
        this.ticks   = ticks;
        this.worker  = worker;
        this.workers = Executors.newFixedThreadPool(maxConcurrentJobs);
        this.slots   = new Semaphore(maxConcurrentJobs);
        for (CollectionTask task : collectionTasks.orderedStream().toList()) {
            CollectionTask previous = tasks.put(task.kind(), task);
            if (previous != null) {
                throw new IllegalStateException("Two collection tasks for kind " + task.kind());
            }
        }
        log.info("Job dispatcher ready: {} workers, tasks for {}", maxConcurrentJobs, tasks.keySet());
    }

    /**
     * Tick: settle unclaimed cancellations, then claim one queued job (if a
     * worker slot is free) and hand it to the pool.
     */
    @Scheduled(fixedDelayString = "${intelscan.worker.dispatch-delay-ms:2000}")
    public void tick() {
        settleUnclaimedCancellations();

        if (tasks.isEmpty() || !slots.tryAcquire()) return;

        Optional<JobRecord> claimed = claimNext();
        if (claimed.isEmpty()) {
            slots.release();
            return;
        }
        JobRecord job = claimed.get();
        CollectionTask task = tasks.get(job.kind());
        workers.submit(() -> {
            try {
                worker.run(job, task);
            } catch (Exception e) {
                log.error("Unhandled error in worker for job {}: {}", job.id(), e.getMessage(), e);
                ticks.fail(job.id(), "Unhandled exception: " + e.getMessage());
            } finally {
                slots.release();
            }
        });
    }

    Optional<JobRecord> claimNext() {
        for (JobRecord job : store.list(JobQuery.oldestInPhase(JobPhase.QUEUED.wireName(), CLAIM_SCAN))) {
            if (!tasks.containsKey(job.kind())) continue;
            if (ticks.advance(job.id(), PhaseEvent.START_COLLECTING).isAccepted()) {
                return store.get(job.id());
            }
        }
        return Optional.empty();
    }

    void settleUnclaimedCancellations() {
        for (JobRecord job : store.list(JobQuery.oldestInPhase(JobPhase.CANCELLING.wireName(), CLAIM_SCAN))) {
            // startedAt is set on the first entry to COLLECTING; null means no worker ever ran it.
            if (job.startedAt() == null) {
                ticks.advance(job.id(), PhaseEvent.ADVANCE_TO_CANCELLED);
            }
        }
    }

    @PreDestroy
    void shutdown() {
        workers.shutdownNow();
    }
}
