package com.intelscan.orchestrator.worker;

import com.intelscan.orchestrator.model.JobKind;
import com.intelscan.orchestrator.model.JobRecord;

/**
 * Pluggable scan logic for one kind of job (intel source query, file parse, ...).
 *
 * Implementations are Spring beans; the dispatcher only claims jobs whose
 * kind has a registered task. The orchestrator owns phases, checkpoints and
 * counters; a task only does the work.
 */
public interface CollectionTask {

    JobKind kind();

    /** Prepare a run for {@code job}. Called once, on a worker thread. */
    CollectionRun open(JobRecord job) throws Exception;
}
