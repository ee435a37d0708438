package com.intelscan.orchestrator.access;

import com.intelscan.orchestrator.model.JobRecord;

/**
 * Decides which jobs the current caller may see and command.
 *
 * Access control proper lives outside the orchestrator; this is the seam it
 * plugs into. Implementations must be deterministic: the same record must
 * give the same answer for the same caller.
 */
@FunctionalInterface
public interface JobVisibilityFilter {

    boolean isVisible(JobRecord job);

    JobVisibilityFilter ALL = job -> true;
}
