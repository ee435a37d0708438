package com.intelscan.orchestrator.api.dto;

import com.intelscan.orchestrator.statemachine.TransitionResult;

import java.util.Locale;
import java.util.UUID;

/**
 * Response body for POST /jobs/{id}/pause|resume|cancel.
 *
 * outcome is accepted, no_op or rejected; phase is the job's phase after
 * the command was evaluated (unchanged on rejection).
 */
public record CommandResponse(UUID jobId, String outcome, String phase, String message) {

    public static CommandResponse from(UUID jobId, TransitionResult result) {
        return new CommandResponse(
                jobId,
                result.outcome().name().toLowerCase(Locale.ROOT),
                result.phase(),
                result.message());
    }
}
