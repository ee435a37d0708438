package com.intelscan.orchestrator.worker;

import com.intelscan.orchestrator.model.JobCounters;
import com.intelscan.orchestrator.model.JobRecord;
import com.intelscan.orchestrator.service.CheckpointSignal;
import com.intelscan.orchestrator.service.WorkerTickService;
import com.intelscan.orchestrator.statemachine.PhaseEvent;
import com.intelscan.orchestrator.statemachine.TransitionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Runs one claimed job through collecting → parsing → upserting → completed.
 *
 * Cooperative control: before every work unit and before every phase advance
 * the worker asks {@link WorkerTickService#checkpoint} what to do.
 *
 *   CONTINUE  run the next unit
 *   PAUSE     hold this thread, re-checking every pause-poll-ms, until
 *             resumed (CONTINUE) or cancelled (CANCEL)
 *   CANCEL    report ADVANCE_TO_CANCELLED and return
 *   STOP      return without reporting (the job is already finished)
 *
 * A unit in progress is never interrupted; a pause or cancel issued during a
 * unit takes effect when the unit returns.
 */
@Component
public class JobWorker {

    private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

    private final WorkerTickService ticks;
    private final long              pausePollMs;

    public JobWorker(WorkerTickService ticks,
                     @Value("${intelscan.worker.pause-poll-ms:1000}") long pausePollMs) {
        this.ticks       = ticks;
        this.pausePollMs = pausePollMs;
    }

    /**
     * Run a job that has already been claimed (moved to COLLECTING).
     * Blocks until the job is completed, cancelled, failed or stopped.
     */
    public void run(JobRecord job, CollectionTask task) {
        UUID id = job.id();
        MDC.put("jobId", id.toString());
        try {
            log.info("Worker starting job {} (kind={}, target='{}')", id, job.kind(), job.target());

            CollectionRun run = task.open(job);
            JobCounters counters = job.counters();

            // --- collecting: one checkpoint per unit ---
            for (String unit : run.workUnits()) {
                if (!awaitClearance(id)) return;
                long found = run.collect(unit);
                counters = counters.withRaw(counters.totalRaw() + found);
                ticks.reportCounters(id, counters);
                log.debug("Job {} unit '{}' collected {} raw items", id, unit, found);
            }

            // --- parsing ---
            if (!advance(id, PhaseEvent.ADVANCE_TO_PARSING)) return;
            counters = counters.withParsed(run.parse());
            ticks.reportCounters(id, counters);

            // --- upserting ---
            if (!advance(id, PhaseEvent.ADVANCE_TO_UPSERTING)) return;
            CollectionRun.UpsertTotals totals = run.upsert();
            counters = counters.withUpserted(totals.inserted(), totals.duplicates());
            ticks.reportCounters(id, counters);

            if (advance(id, PhaseEvent.ADVANCE_TO_COMPLETED)) {
                log.info("Job {} completed: raw={} parsed={} unparsed={} new={} duplicates={}",
                        id, counters.totalRaw(), counters.totalParsed(), counters.unparsed(),
                        counters.totalNew(), counters.totalDuplicates());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker interrupted while running job {}", id);
            ticks.fail(id, "Worker interrupted");
        } catch (Exception e) {
            log.error("Job {} failed: {}", id, e.getMessage(), e);
            ticks.fail(id, describe(e));
        } finally {
            MDC.remove("jobId");
        }
    }

    // ------------------------------------------------------------------
    // Checkpoints
    // ------------------------------------------------------------------

    /**
     * Checkpoint, then advance. If a command lands between the two, the
     * advance is rejected and the checkpoint is consulted again.
     */
    private boolean advance(UUID id, PhaseEvent event) throws InterruptedException {
        while (true) {
            if (!awaitClearance(id)) return false;

            TransitionResult result = ticks.advance(id, event);
            if (result.isSuccess()) return result.isAccepted();

            if (ticks.checkpoint(id) == CheckpointSignal.CONTINUE) {
                // Nothing to honor, yet the edge does not exist: the store is not where we left it.
                ticks.fail(id, "Worker could not advance: " + result.message());
                return false;
            }
        }
    }

    /** @return true to continue, false if the worker must stop */
    private boolean awaitClearance(UUID id) throws InterruptedException {
        boolean paused = false;
        while (true) {
            CheckpointSignal signal = ticks.checkpoint(id);
            if (signal == CheckpointSignal.CONTINUE) {
                if (paused) log.info("Job {} resumed", id);
                return true;
            }
            if (signal == CheckpointSignal.CANCEL) {
                ticks.advance(id, PhaseEvent.ADVANCE_TO_CANCELLED);
                log.info("Job {} cancelled at checkpoint", id);
                return false;
            }
            if (signal == CheckpointSignal.STOP) {
                log.info("Job {} is no longer active, worker stopping", id);
                return false;
            }
            if (!paused) {
                log.info("Job {} paused at checkpoint", id);
                paused = true;
            }
            Thread.sleep(pausePollMs);
        }
    }

    private static String describe(Exception e) {
        String msg = e.getMessage();
        return (msg == null || msg.isBlank()) ? e.getClass().getSimpleName() : msg;
    }
}
