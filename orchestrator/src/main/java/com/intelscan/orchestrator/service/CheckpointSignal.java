package com.intelscan.orchestrator.service;

/**
 * What a worker must do at a checkpoint between two work units.
 */
public enum CheckpointSignal {
    /** Carry on with the next unit. */
    CONTINUE,
    /** The job is PAUSED: hold before the next unit until resumed or cancelled. */
    PAUSE,
    /** The job is CANCELLING: stop and report ADVANCE_TO_CANCELLED. */
    CANCEL,
    /** The job is finished or gone (e.g. failed or purged): stop without reporting. */
    STOP
}
