package com.intelscan.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /jobs.
 *
 * Required: kind, target
 * Optional: name (display label), timeFilter (one of d1..y1; absent means all time)
 *
 * For BULK_TARGET the target is a comma-separated list.
 */
public record SubmitJobRequest(
        @NotBlank String kind,
        @NotBlank @Size(max = 4096) String target,
        @Size(max = 200) String name,
        String timeFilter
) {
}
