package com.intelscan.orchestrator.service;

import com.intelscan.orchestrator.model.JobPhase;
import com.intelscan.orchestrator.model.JobRecord;
import com.intelscan.orchestrator.model.PhaseChange;
import com.intelscan.orchestrator.statemachine.PhaseEvent;
import com.intelscan.orchestrator.statemachine.PhaseStateMachine;
import com.intelscan.orchestrator.statemachine.TransitionResult;
import com.intelscan.orchestrator.store.JobLockRegistry;
import com.intelscan.orchestrator.store.JobNotFoundException;
import com.intelscan.orchestrator.store.JobRecordStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * The single write path for job phases.
 *
 * Both the command processor and the worker tick service come through here,
 * so check-and-transition is one atomic unit per job id:
 *
 *   1. take the job's lock (serializes everyone in this process)
 *   2. read the current phase from the store
 *   3. ask the state machine
 *   4. compare-and-swap the phase in the store (guards against other processes)
 *
 * If the swap loses to another process, the job is re-read and the event is
 * evaluated again against the phase that actually won.
 */
@Component
public class PhaseTransitions {

    private static final Logger log = LoggerFactory.getLogger(PhaseTransitions.class);

    // Another process would have to win this many consecutive races for us to give up.
    private static final int CAS_MAX = 8;

    private final JobRecordStore    store;
    private final JobLockRegistry   locks;
    private final PhaseStateMachine machine;
    private final MeterRegistry     meterRegistry;

    public PhaseTransitions(JobRecordStore store,
                            JobLockRegistry locks,
                            PhaseStateMachine machine,
                            MeterRegistry meterRegistry) {
        this.store         = store;
        this.locks         = locks;
        this.machine       = machine;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Evaluate and apply {@code event} against the job's current phase.
     *
     * @param error failure reason, only used for {@link PhaseEvent#FAIL}
     * @throws JobNotFoundException if the job does not exist
     */
    public TransitionResult apply(UUID jobId, PhaseEvent event, String error) {
        TransitionResult result = locks.withLock(jobId, () -> applyLocked(jobId, event, error));
        record(jobId, result);
        return result;
    }

    private TransitionResult applyLocked(UUID jobId, PhaseEvent event, String error) {
        for (int attempt = 1; attempt <= CAS_MAX; attempt++) {
            JobRecord current = store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));

            Optional<JobPhase> phase = current.knownPhase();
            if (phase.isEmpty()) {
                return TransitionResult.rejected(event, current.phase(),
                        "Unrecognized phase: " + current.phase());
            }

            TransitionResult decision = machine.transition(phase.get(), event);
            if (!decision.isAccepted()) {
                releaseIfTerminal(jobId, phase.get());
                return decision;
            }

            JobPhase next = decision.nextPhase();
            if (store.compareAndSwapPhase(jobId, new PhaseChange(phase.get(), next, Instant.now(), error))) {
                releaseIfTerminal(jobId, next);
                return decision;
            }
            log.debug("Job {} phase moved under us during {} (attempt {}/{}), re-reading",
                    jobId, event, attempt, CAS_MAX);
        }
        throw new IllegalStateException(
                "Job " + jobId + ": lost " + CAS_MAX + " consecutive phase races for " + event);
    }

    private void releaseIfTerminal(UUID jobId, JobPhase phase) {
        if (phase.isTerminal()) {
            locks.release(jobId);
        }
    }

    private void record(UUID jobId, TransitionResult result) {
        meterRegistry.counter("intelscan.job.transitions",
                "event", result.event().name(),
                "outcome", result.outcome().name()).increment();

        switch (result.outcome()) {
            case ACCEPTED -> log.info("Job {} {}: {}", jobId, result.event(), result.message());
            case NO_OP    -> log.debug("Job {} {} ignored: {}", jobId, result.event(), result.message());
            case REJECTED -> {
                if (result.event().isCommand()) {
                    log.warn("Job {} {} rejected: {}", jobId, result.event(), result.message());
                } else if (result.event() == PhaseEvent.START_COLLECTING) {
                    // Lost a claim race (another dispatcher, or a cancel while queued).
                    log.warn("Job {} claim lost: {}", jobId, result.message());
                } else {
                    // A worker asked for an edge that does not exist: the worker and the store disagree.
                    log.error("Job {} invariant violation on {}: {}", jobId, result.event(), result.message());
                }
            }
        }
    }
}
