package com.intelscan.orchestrator.statemachine;

import com.intelscan.orchestrator.model.JobPhase;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.intelscan.orchestrator.model.JobPhase.*;

/**
 * Pure transition rules for the job pipeline. No I/O, no clock, no state.
 *
 * <pre>
 *   QUEUED → COLLECTING → PARSING → UPSERTING → COMPLETED
 *                ⇅ PAUSED
 *   {QUEUED, COLLECTING, PARSING, UPSERTING, PAUSED} → CANCELLING → CANCELLED
 *   any non-terminal → FAILED
 * </pre>
 *
 * Rules, in evaluation order:
 * <ol>
 *   <li>Terminal phases turn every event into a no-op. Duplicate deliveries
 *       after completion are expected and are not errors.</li>
 *   <li>FAIL is accepted from any non-terminal phase.</li>
 *   <li>Worker advances are accepted only from the phase immediately before
 *       their target. Anything else is rejected; the caller treats it as an
 *       invariant violation.</li>
 *   <li>PAUSE only from COLLECTING, RESUME only from PAUSED. CANCEL from any
 *       non-terminal phase, and a no-op when already CANCELLING.</li>
 * </ol>
 */
@Component
public class PhaseStateMachine {

    // Worker advance → the one phase it may be applied from.
    private static final Map<PhaseEvent, JobPhase> ADVANCE_SOURCE = Map.of(
            PhaseEvent.START_COLLECTING,     QUEUED,
            PhaseEvent.ADVANCE_TO_PARSING,   COLLECTING,
            PhaseEvent.ADVANCE_TO_UPSERTING, PARSING,
            PhaseEvent.ADVANCE_TO_COMPLETED, UPSERTING,
            PhaseEvent.ADVANCE_TO_CANCELLED, CANCELLING
    );

    public TransitionResult transition(JobPhase current, PhaseEvent event) {
        if (current.isTerminal()) {
            return TransitionResult.noOp(event, current.wireName(),
                    "Job already finished (" + current.wireName() + ")");
        }

        return switch (event) {
            case FAIL -> TransitionResult.accepted(event, current, FAILED);

            case START_COLLECTING,
                 ADVANCE_TO_PARSING,
                 ADVANCE_TO_UPSERTING,
                 ADVANCE_TO_COMPLETED,
                 ADVANCE_TO_CANCELLED -> advance(current, event);

            case PAUSE -> current == COLLECTING
                    ? TransitionResult.accepted(event, current, PAUSED)
                    : TransitionResult.rejected(event, current.wireName(),
                            "Job not pausable in phase: " + current.wireName());

            case RESUME -> current == PAUSED
                    ? TransitionResult.accepted(event, current, COLLECTING)
                    : TransitionResult.rejected(event, current.wireName(),
                            "Job is not paused (current phase: " + current.wireName() + ")");

            case CANCEL -> current == CANCELLING
                    ? TransitionResult.noOp(event, current.wireName(), "Cancellation already requested")
                    : TransitionResult.accepted(event, current, CANCELLING);
        };
    }

    /** The phase a worker advance leads to. */
    public static JobPhase targetOf(PhaseEvent advance) {
        return switch (advance) {
            case START_COLLECTING     -> COLLECTING;
            case ADVANCE_TO_PARSING   -> PARSING;
            case ADVANCE_TO_UPSERTING -> UPSERTING;
            case ADVANCE_TO_COMPLETED -> COMPLETED;
            case ADVANCE_TO_CANCELLED -> CANCELLED;
            default -> throw new IllegalArgumentException(advance + " is not a worker advance");
        };
    }

    private TransitionResult advance(JobPhase current, PhaseEvent event) {
        JobPhase required = ADVANCE_SOURCE.get(event);
        JobPhase target   = targetOf(event);
        if (current != required) {
            return TransitionResult.rejected(event, current.wireName(),
                    "Illegal advance %s -> %s (expected phase %s)"
                            .formatted(current.wireName(), target.wireName(), required.wireName()));
        }
        return TransitionResult.accepted(event, current, target);
    }
}
