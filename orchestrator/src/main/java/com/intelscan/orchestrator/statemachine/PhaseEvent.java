package com.intelscan.orchestrator.statemachine;

/**
 * Everything that can ask a job to change phase.
 *
 * Worker events come from the long-running collection worker; commands come
 * from users through the command processor.
 */
public enum PhaseEvent {
    // worker-driven
    START_COLLECTING(Source.WORKER),
    ADVANCE_TO_PARSING(Source.WORKER),
    ADVANCE_TO_UPSERTING(Source.WORKER),
    ADVANCE_TO_COMPLETED(Source.WORKER),
    ADVANCE_TO_CANCELLED(Source.WORKER),
    FAIL(Source.WORKER),

    // user commands
    PAUSE(Source.COMMAND),
    RESUME(Source.COMMAND),
    CANCEL(Source.COMMAND);

    public enum Source { WORKER, COMMAND }

    private final Source source;

    PhaseEvent(Source source) {
        this.source = source;
    }

    public Source source()      { return source; }
    public boolean isCommand()  { return source == Source.COMMAND; }
}
