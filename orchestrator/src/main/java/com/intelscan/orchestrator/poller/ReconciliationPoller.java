package com.intelscan.orchestrator.poller;

import com.intelscan.orchestrator.projection.ProgressProjector;
import com.intelscan.orchestrator.projection.Projection;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps one observer's view of the job list eventually consistent with the server.
 *
 * Every {@code interval} it fetches the full visible set from a {@link JobFeed},
 * projects each record through the {@link ProgressProjector} and hands the
 * observer a new {@link ClientSnapshot} that replaces the previous one outright.
 *
 * Rules:
 *   - at most one fetch in flight; a tick that fires meanwhile is skipped, not queued
 *   - a failed or timed-out fetch keeps the previous entries and marks them stale
 *   - a record that cannot be projected is dropped, the rest of the batch still lands
 *   - anything that completes after {@link #detach()} is discarded
 */
public class ReconciliationPoller implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationPoller.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(3);

    private final JobFeed                  feed;
    private final ProgressProjector        projector;
    private final MeterRegistry            meters;
    private final Duration                 interval;
    private final Duration                 fetchTimeout;
    private final ScheduledExecutorService timer;
    private final Executor                 fetchExecutor;
    private final boolean                  ownsExecutors;
    private final Clock                    clock;

    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    private volatile SnapshotObserver observer;
    private volatile ClientSnapshot   snapshot = ClientSnapshot.EMPTY;
    private ScheduledFuture<?>        schedule;

    public ReconciliationPoller(JobFeed feed, ProgressProjector projector, MeterRegistry meters,
                                Duration interval, Duration fetchTimeout) {
        this(feed, projector, meters, interval, fetchTimeout,
                Executors.newSingleThreadScheduledExecutor(daemon("job-poller-timer")),
                Executors.newSingleThreadExecutor(daemon("job-poller-fetch")),
                true, Clock.systemUTC());
    }

    ReconciliationPoller(JobFeed feed, ProgressProjector projector, MeterRegistry meters,
                         Duration interval, Duration fetchTimeout,
                         ScheduledExecutorService timer, Executor fetchExecutor,
                         boolean ownsExecutors, Clock clock) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Poll interval must be positive: " + interval);
        }
        this.feed          = feed;
        this.projector     = projector;
        this.meters        = meters;
        this.interval      = interval;
        this.fetchTimeout  = fetchTimeout;
        this.timer         = timer;
        this.fetchExecutor = fetchExecutor;
        this.ownsExecutors = ownsExecutors;
        this.clock         = clock;
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────────

    /** Starts polling on behalf of {@code target}. The first tick fires immediately. */
    public synchronized void attach(SnapshotObserver target) {
        if (observer != null) {
            throw new IllegalStateException("Poller already has an observer attached");
        }
        observer = target;
        schedule = timer.scheduleWithFixedDelay(this::safeTick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Reconciliation poller attached (interval {} ms)", interval.toMillis());
    }

    /** Stops polling. A fetch already in flight is left to finish, its result dropped. */
    public synchronized void detach() {
        if (observer == null) return;
        observer = null;
        if (schedule != null) {
            schedule.cancel(false);
            schedule = null;
        }
        log.info("Reconciliation poller detached");
    }

    public boolean isAttached() {
        return observer != null;
    }

    public ClientSnapshot snapshot() {
        return snapshot;
    }

    @Override
    public void close() {
        detach();
        if (ownsExecutors) {
            timer.shutdownNow();
            if (fetchExecutor instanceof ExecutorService pool) {
                pool.shutdownNow();
            }
        }
    }

    // ── Tick ──────────────────────────────────────────────────────────────────

    /**
     * Starts one fetch unless the poller is detached or a fetch is still outstanding.
     *
     * @return true if a fetch was started
     */
    public boolean tick() {
        SnapshotObserver target = observer;
        if (target == null) return false;

        if (!inFlight.compareAndSet(false, true)) {
            log.debug("Previous job fetch still in flight, skipping tick");
            meters.counter("intelscan.poller.fetches", "status", "skipped").increment();
            return false;
        }

        CompletableFuture<List<FetchedJob>> fetch;
        try {
            fetch = CompletableFuture.supplyAsync(feed::fetchJobs, fetchExecutor)
                    .orTimeout(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            inFlight.set(false);
            handleFailure(target, e);
            return false;
        }

        fetch.whenComplete((jobs, error) -> {
            try {
                if (observer != target) {
                    log.debug("Discarding job fetch result that arrived after detach");
                    return;
                }
                if (error != null) {
                    handleFailure(target, unwrap(error));
                } else {
                    handleSuccess(target, jobs);
                }
            } finally {
                inFlight.set(false);
            }
        });
        return true;
    }

    private void safeTick() {
        // An exception escaping here would cancel the schedule.
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Reconciliation tick failed", e);
        }
    }

    private void handleSuccess(SnapshotObserver target, List<FetchedJob> jobs) {
        List<SnapshotEntry> entries = new ArrayList<>(jobs == null ? 0 : jobs.size());
        if (jobs != null) {
            for (FetchedJob job : jobs) {
                SnapshotEntry entry = projectOne(job);
                if (entry != null) entries.add(entry);
            }
        }

        ClientSnapshot next = ClientSnapshot.fresh(entries, clock.instant());
        snapshot = next;
        meters.counter("intelscan.poller.fetches", "status", "success").increment();
        notify(() -> target.onSnapshot(next));
    }

    private SnapshotEntry projectOne(FetchedJob job) {
        if (job == null || job.id() == null) {
            log.warn("Dropping job entry without an id");
            return null;
        }
        try {
            Projection p = projector.project(job.phase(), job.jobCounters());
            return new SnapshotEntry(
                    job.id(),
                    job.kind(),
                    job.target(),
                    job.timeFilter(),
                    p.status(),
                    p.progress(),
                    job.phase(),
                    job.jobCounters(),
                    p.unparsed(),
                    job.startedAt() != null ? job.startedAt() : job.createdAt(),
                    job.completedAt(),
                    job.error());
        } catch (RuntimeException e) {
            log.warn("Dropping job {} from snapshot: {}", job.id(), e.getMessage());
            return null;
        }
    }

    private void handleFailure(SnapshotObserver target, Throwable cause) {
        String reason = describe(cause);
        ClientSnapshot stale = snapshot.markStale(reason);
        snapshot = stale;
        meters.counter("intelscan.poller.fetches", "status", "failure").increment();
        log.warn("Job fetch failed, keeping {} jobs from the previous poll: {}", stale.size(), reason);
        notify(() -> target.onFetchFailed(stale, cause));
    }

    private void notify(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("Snapshot observer threw", e);
        }
    }

    private String describe(Throwable cause) {
        if (cause instanceof TimeoutException) {
            return "fetch timed out after " + fetchTimeout.toMillis() + " ms";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }
}
