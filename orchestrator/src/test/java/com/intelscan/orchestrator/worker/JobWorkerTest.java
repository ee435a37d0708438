package com.intelscan.orchestrator.worker;

import com.intelscan.orchestrator.JobFixtures;
import com.intelscan.orchestrator.access.JobVisibilityFilter;
import com.intelscan.orchestrator.model.JobCounters;
import com.intelscan.orchestrator.model.JobKind;
import com.intelscan.orchestrator.model.JobPhase;
import com.intelscan.orchestrator.model.JobRecord;
import com.intelscan.orchestrator.service.CommandProcessor;
import com.intelscan.orchestrator.service.PhaseTransitions;
import com.intelscan.orchestrator.service.WorkerTickService;
import com.intelscan.orchestrator.statemachine.PhaseStateMachine;
import com.intelscan.orchestrator.store.InMemoryJobRecordStore;
import com.intelscan.orchestrator.store.JobLockRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives JobWorker.run on the test thread against the real transition path.
 */
class JobWorkerTest {

    InMemoryJobRecordStore store;
    WorkerTickService      ticks;
    CommandProcessor       commands;
    JobWorker              worker;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobRecordStore();
        JobLockRegistry locks = new JobLockRegistry();
        PhaseTransitions transitions = new PhaseTransitions(store, locks, new PhaseStateMachine(),
                new SimpleMeterRegistry());
        ticks    = new WorkerTickService(store, locks, transitions);
        commands = new CommandProcessor(store, transitions, JobVisibilityFilter.ALL);
        worker   = new JobWorker(ticks, 5);
    }

    @Test
    void run_happyPath_completesWithCounters() {
        ScriptedCollectionTask task = new ScriptedCollectionTask(JobKind.BULK_TARGET, List.of("a.com", "b.com"), 50);
        task.parsed     = 80;
        task.inserted   = 60;
        task.duplicates = 20;
        JobRecord job = claimed();

        worker.run(job, task);

        JobRecord done = store.get(job.id()).orElseThrow();
        assertThat(done.phase()).isEqualTo("completed");
        assertThat(done.counters()).isEqualTo(new JobCounters(100, 80, 60, 20));
        assertThat(done.counters().unparsed()).isEqualTo(20);
        assertThat(done.completedAt()).isNotNull();
    }

    @Test
    void pausedBetweenUnits_waitsUntilResumed() throws Exception {
        ScriptedCollectionTask task = new ScriptedCollectionTask(JobKind.BULK_TARGET, List.of("a.com", "b.com"), 1);
        JobRecord job = claimed();
        AtomicReference<String> phaseSeenByResumer = new AtomicReference<>();
        Thread resumer = new Thread(() -> {
            try {
                Thread.sleep(100);
                phaseSeenByResumer.set(store.get(job.id()).orElseThrow().phase());
                commands.resume(job.id());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        task.onCollect = unit -> {
            if (unit.equals("a.com")) {
                commands.pause(job.id());
                resumer.start();
            }
        };

        worker.run(job, task);
        resumer.join(5_000);

        assertThat(phaseSeenByResumer.get()).isEqualTo("paused");
        assertThat(task.collected).containsExactly("a.com", "b.com");
        assertThat(store.get(job.id()).orElseThrow().phase()).isEqualTo("completed");
    }

    @Test
    void cancelledDuringUnit_stopsAtNextCheckpoint() {
        ScriptedCollectionTask task = new ScriptedCollectionTask(JobKind.BULK_TARGET,
                List.of("a.com", "b.com", "c.com"), 10);
        JobRecord job = claimed();
        task.onCollect = unit -> {
            if (unit.equals("a.com")) commands.cancel(job.id());
        };

        worker.run(job, task);

        JobRecord after = store.get(job.id()).orElseThrow();
        assertThat(after.phase()).isEqualTo("cancelled");
        assertThat(task.collected).containsExactly("a.com");
        assertThat(task.parseRan).isFalse();
        // the unit in progress still counts
        assertThat(after.counters().totalRaw()).isEqualTo(10);
    }

    @Test
    void cancelledDuringParse_landsCancelledBeforeUpsert() {
        ScriptedCollectionTask task = new ScriptedCollectionTask(JobKind.SINGLE_TARGET, List.of("a.com"), 10);
        JobRecord job = claimed();
        task.onParse = () -> commands.cancel(job.id());

        worker.run(job, task);

        assertThat(store.get(job.id()).orElseThrow().phase()).isEqualTo("cancelled");
    }

    @Test
    void cancelWhilePaused_workerReleasesAndCancels() {
        ScriptedCollectionTask task = new ScriptedCollectionTask(JobKind.BULK_TARGET, List.of("a.com", "b.com"), 1);
        JobRecord job = claimed();
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(50);
                commands.cancel(job.id());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        task.onCollect = unit -> {
            if (unit.equals("a.com")) {
                commands.pause(job.id());
                canceller.start();
            }
        };

        worker.run(job, task);

        assertThat(store.get(job.id()).orElseThrow().phase()).isEqualTo("cancelled");
        assertThat(task.collected).containsExactly("a.com");
    }

    @Test
    void taskFailure_marksJobFailedWithMessage() {
        ScriptedCollectionTask task = new ScriptedCollectionTask(JobKind.BULK_TARGET, List.of("a.com", "b.com"), 1);
        task.failOnUnit = "b.com";
        JobRecord job = claimed();

        worker.run(job, task);

        JobRecord after = store.get(job.id()).orElseThrow();
        assertThat(after.phase()).isEqualTo("failed");
        assertThat(after.error()).isEqualTo("source rejected b.com");
        assertThat(after.counters().totalRaw()).isEqualTo(1);
    }

    @Test
    void jobFailedElsewhere_workerStopsWithoutOverwriting() {
        ScriptedCollectionTask task = new ScriptedCollectionTask(JobKind.BULK_TARGET, List.of("a.com", "b.com"), 1);
        JobRecord job = claimed();
        task.onCollect = unit -> ticks.fail(job.id(), "operator abort");

        worker.run(job, task);

        JobRecord after = store.get(job.id()).orElseThrow();
        assertThat(after.phase()).isEqualTo("failed");
        assertThat(after.error()).isEqualTo("operator abort");
        assertThat(task.collected).containsExactly("a.com");
    }

    private JobRecord claimed() {
        UUID id = JobFixtures.jobIn(store, JobPhase.COLLECTING, JobKind.BULK_TARGET);
        return store.get(id).orElseThrow();
    }
}
