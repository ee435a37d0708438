package com.intelscan.orchestrator.projection;

import com.intelscan.orchestrator.model.JobCounters;
import com.intelscan.orchestrator.model.JobPhase;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Maps a job's phase and counters to what an observer displays.
 *
 * Progress is a fixed value per phase:
 *
 *   queued      pending      0
 *   collecting  collecting  25
 *   parsing     parsing     60
 *   upserting   upserting   85
 *   completed   completed  100
 *   paused, cancelling, cancelled, failed   0
 *
 * The counters do not move the progress value. An observer learns where in
 * the pipeline a job is, not how much of it is done.
 *
 * An unknown phase (written by a newer worker) projects to pending/0 and
 * raises a warning plus the {@code intelscan.projector.unknown_phase}
 * counter. It never throws.
 */
@Component
public class ProgressProjector {

    private static final Logger log = LoggerFactory.getLogger(ProgressProjector.class);

    private final Counter unknownPhases;

    public ProgressProjector(MeterRegistry meterRegistry) {
        this.unknownPhases = meterRegistry.counter("intelscan.projector.unknown_phase");
    }

    public Projection project(String phase, JobCounters counters) {
        long unparsed = counters == null ? 0 : counters.unparsed();

        Optional<JobPhase> known = JobPhase.fromWire(phase);
        if (known.isEmpty()) {
            unknownPhases.increment();
            log.warn("Unknown job phase '{}', showing as pending", phase);
            return new Projection(DisplayStatus.PENDING, 0, unparsed, false);
        }

        return switch (known.get()) {
            case QUEUED     -> new Projection(DisplayStatus.PENDING,      0, unparsed, true);
            case COLLECTING -> new Projection(DisplayStatus.COLLECTING,  25, unparsed, true);
            case PARSING    -> new Projection(DisplayStatus.PARSING,     60, unparsed, true);
            case UPSERTING  -> new Projection(DisplayStatus.UPSERTING,   85, unparsed, true);
            case COMPLETED  -> new Projection(DisplayStatus.COMPLETED,  100, unparsed, true);
            case PAUSED     -> new Projection(DisplayStatus.PAUSED,       0, unparsed, true);
            case CANCELLING -> new Projection(DisplayStatus.CANCELLING,   0, unparsed, true);
            case CANCELLED  -> new Projection(DisplayStatus.CANCELLED,    0, unparsed, true);
            case FAILED     -> new Projection(DisplayStatus.FAILED,       0, unparsed, true);
        };
    }
}
