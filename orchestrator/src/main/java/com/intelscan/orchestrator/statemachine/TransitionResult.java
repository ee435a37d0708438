package com.intelscan.orchestrator.statemachine;

import com.intelscan.orchestrator.model.JobPhase;

import java.util.Objects;

/**
 * Outcome of asking for a phase change.
 *
 * {@code phase} is always the phase the job is in after evaluation: the new
 * phase when ACCEPTED, the unchanged current phase otherwise. It is a raw
 * wire string because the stored phase may be one this build does not know.
 */
public record TransitionResult(
        Outcome    outcome,
        PhaseEvent event,
        String     previousPhase,
        String     phase,
        String     message
) {
    public enum Outcome {
        /** The job moved to a new phase. */
        ACCEPTED,
        /** Nothing to do: the job is terminal, or already where the event would take it. */
        NO_OP,
        /** The event is illegal from the current phase. Nothing changed. */
        REJECTED
    }

    public TransitionResult {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(event, "event");
    }

    public static TransitionResult accepted(PhaseEvent event, JobPhase from, JobPhase to) {
        return new TransitionResult(Outcome.ACCEPTED, event, from.wireName(), to.wireName(),
                from.wireName() + " -> " + to.wireName());
    }

    public static TransitionResult noOp(PhaseEvent event, String current, String message) {
        return new TransitionResult(Outcome.NO_OP, event, current, current, message);
    }

    public static TransitionResult rejected(PhaseEvent event, String current, String message) {
        return new TransitionResult(Outcome.REJECTED, event, current, current, message);
    }

    public boolean isAccepted() { return outcome == Outcome.ACCEPTED; }
    public boolean isRejected() { return outcome == Outcome.REJECTED; }

    /** Accepted or no-op: the caller's intent is satisfied. */
    public boolean isSuccess()  { return outcome != Outcome.REJECTED; }

    /** The target phase of an accepted transition. */
    public JobPhase nextPhase() {
        if (!isAccepted()) {
            throw new IllegalStateException("No next phase for a " + outcome + " transition");
        }
        return JobPhase.fromWire(phase).orElseThrow();
    }
}
