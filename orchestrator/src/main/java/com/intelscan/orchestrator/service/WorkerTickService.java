package com.intelscan.orchestrator.service;

import com.intelscan.orchestrator.model.JobCounters;
import com.intelscan.orchestrator.model.JobPhase;
import com.intelscan.orchestrator.model.JobRecord;
import com.intelscan.orchestrator.statemachine.PhaseEvent;
import com.intelscan.orchestrator.statemachine.TransitionResult;
import com.intelscan.orchestrator.store.JobLockRegistry;
import com.intelscan.orchestrator.store.JobNotFoundException;
import com.intelscan.orchestrator.store.JobRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * The API a collection worker uses to report progress.
 *
 * Phase advances share the per-job lock with user commands (through
 * {@link PhaseTransitions}), so a worker tick and a pause/cancel request for
 * the same job can never interleave.
 */
@Service
public class WorkerTickService {

    private static final Logger log = LoggerFactory.getLogger(WorkerTickService.class);

    private final JobRecordStore   store;
    private final JobLockRegistry  locks;
    private final PhaseTransitions transitions;

    public WorkerTickService(JobRecordStore store,
                             JobLockRegistry locks,
                             PhaseTransitions transitions) {
        this.store       = store;
        this.locks       = locks;
        this.transitions = transitions;
    }

    /**
     * Advance the pipeline. Only the worker events START_COLLECTING and
     * ADVANCE_TO_* are accepted here; use {@link #fail} for failures.
     */
    public TransitionResult advance(UUID jobId, PhaseEvent event) {
        if (event.isCommand() || event == PhaseEvent.FAIL) {
            throw new IllegalArgumentException(event + " is not a worker advance");
        }
        return transitions.apply(jobId, event, null);
    }

    /** Mark the job FAILED from any non-terminal phase. */
    public TransitionResult fail(UUID jobId, String reason) {
        return transitions.apply(jobId, PhaseEvent.FAIL, reason);
    }

    /**
     * Replace the job's counters. Values may only grow while the job is
     * active; a report lower than the stored value is rejected whole.
     */
    public CounterUpdate reportCounters(UUID jobId, JobCounters counters) {
        return locks.withLock(jobId, () -> {
            JobRecord current = store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            if (current.isTerminal()) {
                locks.release(jobId);
                return CounterUpdate.IGNORED_TERMINAL;
            }
            if (!current.counters().allowsAdvanceTo(counters)) {
                log.error("Job {} invariant violation: counters went backwards {} -> {}",
                        jobId, current.counters(), counters);
                return CounterUpdate.REJECTED_REGRESSION;
            }
            if (!store.updateCounters(jobId, counters)) {
                return CounterUpdate.IGNORED_TERMINAL;
            }
            log.debug("Job {} counters {}", jobId, counters);
            return CounterUpdate.APPLIED;
        });
    }

    /**
     * Ask whether the worker may run its next work unit.
     * Called between units only; the worker is never preempted mid-unit.
     */
    public CheckpointSignal checkpoint(UUID jobId) {
        Optional<JobPhase> phase = store.get(jobId).flatMap(JobRecord::knownPhase);
        if (phase.isEmpty()) {
            return CheckpointSignal.STOP;
        }
        return switch (phase.get()) {
            case PAUSED     -> CheckpointSignal.PAUSE;
            case CANCELLING -> CheckpointSignal.CANCEL;
            case COMPLETED, CANCELLED, FAILED -> CheckpointSignal.STOP;
            case QUEUED, COLLECTING, PARSING, UPSERTING -> CheckpointSignal.CONTINUE;
        };
    }
}
