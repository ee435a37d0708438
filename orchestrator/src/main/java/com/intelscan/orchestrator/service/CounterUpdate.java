package com.intelscan.orchestrator.service;

/**
 * Outcome of a worker counter report.
 */
public enum CounterUpdate {
    APPLIED,
    /** The job is already terminal; counters are frozen. */
    IGNORED_TERMINAL,
    /** A counter went down. Stored values are left untouched. */
    REJECTED_REGRESSION
}
