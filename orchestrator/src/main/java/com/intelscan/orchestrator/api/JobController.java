package com.intelscan.orchestrator.api;

import com.intelscan.orchestrator.api.dto.CommandResponse;
import com.intelscan.orchestrator.api.dto.JobResponse;
import com.intelscan.orchestrator.api.dto.SubmitJobRequest;
import com.intelscan.orchestrator.model.JobKind;
import com.intelscan.orchestrator.model.JobRecord;
import com.intelscan.orchestrator.model.TimeFilter;
import com.intelscan.orchestrator.service.CommandProcessor;
import com.intelscan.orchestrator.service.JobService;
import com.intelscan.orchestrator.statemachine.TransitionResult;
import com.intelscan.orchestrator.store.JobQuery;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for collection jobs.
 *
 * GET    /jobs               list visible jobs, newest first (phase, page, size optional)
 * GET    /jobs/{id}          one job
 * POST   /jobs               submit a new job
 * POST   /jobs/{id}/pause    pause a collecting job
 * POST   /jobs/{id}/resume   resume a paused job
 * POST   /jobs/{id}/cancel   request cancellation
 * DELETE /jobs/{id}          delete a finished job
 * DELETE /jobs               delete every finished job
 *
 * A rejected command answers 409 with the same body shape as a successful
 * one, so the caller always learns the phase that was actually current.
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobService       jobService;
    private final CommandProcessor commands;

    public JobController(JobService jobService, CommandProcessor commands) {
        this.jobService = jobService;
        this.commands   = commands;
    }

    @GetMapping
    public List<JobResponse> list(@RequestParam(required = false) String phase,
                                  @RequestParam(defaultValue = "0") int page,
                                  @RequestParam(defaultValue = "" + JobQuery.DEFAULT_SIZE) int size) {
        JobQuery query = new JobQuery(phase, page, size, JobQuery.Order.NEWEST_FIRST);
        return jobService.list(query).stream()
                .map(JobResponse::from)
                .toList();
    }

    /**
     * Returns 404 if the job is unknown or not visible to the caller.
     */
    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable UUID id) {
        return jobService.findById(id)
                .map(JobResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Job not found: " + id));
    }

    /**
     * Submit a new job. It starts in the queued phase.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"kind":"single_target","target":"example.com","timeFilter":"d7"}'
     */
    @PostMapping
    public ResponseEntity<JobResponse> submit(@Valid @RequestBody SubmitJobRequest req) {
        JobKind kind = JobKind.parse(req.kind());
        TimeFilter timeFilter = TimeFilter.parse(req.timeFilter()).orElse(null);
        JobRecord job = jobService.submit(kind, req.name(), req.target(), timeFilter);
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job));
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<CommandResponse> pause(@PathVariable UUID id) {
        return toResponse(id, commands.pause(id));
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<CommandResponse> resume(@PathVariable UUID id) {
        return toResponse(id, commands.resume(id));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<CommandResponse> cancel(@PathVariable UUID id) {
        return toResponse(id, commands.cancel(id));
    }

    /**
     * Delete a finished job. 409 while the job is still active; cancel it first.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        jobService.findById(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + id));
        if (!jobService.delete(id)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Job " + id + " is still active; cancel it before deleting");
        }
        return ResponseEntity.noContent().build();
    }

    /** Delete every completed, cancelled or failed job. */
    @DeleteMapping
    public Map<String, Integer> clearFinished() {
        return Map.of("deleted", jobService.clearFinished());
    }

    private static ResponseEntity<CommandResponse> toResponse(UUID id, TransitionResult result) {
        HttpStatus status = result.isRejected() ? HttpStatus.CONFLICT : HttpStatus.OK;
        return ResponseEntity.status(status).body(CommandResponse.from(id, result));
    }
}
