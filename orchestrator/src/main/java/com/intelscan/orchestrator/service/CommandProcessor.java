package com.intelscan.orchestrator.service;

import com.intelscan.orchestrator.access.JobVisibilityFilter;
import com.intelscan.orchestrator.statemachine.PhaseEvent;
import com.intelscan.orchestrator.statemachine.TransitionResult;
import com.intelscan.orchestrator.store.JobNotFoundException;
import com.intelscan.orchestrator.store.JobRecordStore;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * User commands against a running job.
 *
 *   pause   only from COLLECTING (the one phase with a resumable checkpoint)
 *   resume  only from PAUSED
 *   cancel  from any non-terminal phase; no-op when already CANCELLING or finished
 *
 * Commands never touch the worker directly. They move the phase; the worker
 * sees the new phase at its next checkpoint (see {@link WorkerTickService#checkpoint}).
 *
 * A rejection carries the phase that was current when the command was
 * evaluated, which may differ from what the caller last saw.
 */
@Service
public class CommandProcessor {

    private final JobRecordStore      store;
    private final PhaseTransitions    transitions;
    private final JobVisibilityFilter visibility;

    public CommandProcessor(JobRecordStore store,
                            PhaseTransitions transitions,
                            JobVisibilityFilter visibility) {
        this.store       = store;
        this.transitions = transitions;
        this.visibility  = visibility;
    }

    public TransitionResult pause(UUID jobId) {
        return issue(jobId, PhaseEvent.PAUSE);
    }

    public TransitionResult resume(UUID jobId) {
        return issue(jobId, PhaseEvent.RESUME);
    }

    /**
     * Request cooperative cancellation. On success the job is CANCELLING
     * immediately; it reaches CANCELLED once the worker honors the request.
     */
    public TransitionResult cancel(UUID jobId) {
        return issue(jobId, PhaseEvent.CANCEL);
    }

    private TransitionResult issue(UUID jobId, PhaseEvent command) {
        boolean visible = store.get(jobId).map(visibility::isVisible).orElse(false);
        if (!visible) {
            throw new JobNotFoundException(jobId);
        }
        return transitions.apply(jobId, command, null);
    }
}
