package com.intelscan.orchestrator.service;

import com.intelscan.orchestrator.JobFixtures;
import com.intelscan.orchestrator.access.JobVisibilityFilter;
import com.intelscan.orchestrator.model.JobKind;
import com.intelscan.orchestrator.model.JobPhase;
import com.intelscan.orchestrator.model.JobRecord;
import com.intelscan.orchestrator.statemachine.PhaseStateMachine;
import com.intelscan.orchestrator.store.InMemoryJobRecordStore;
import com.intelscan.orchestrator.store.JobLockRegistry;
import com.intelscan.orchestrator.worker.CollectionTask;
import com.intelscan.orchestrator.worker.JobWorker;
import com.intelscan.orchestrator.worker.ScriptedCollectionTask;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JobDispatcherTest {

    InMemoryJobRecordStore store;
    WorkerTickService      ticks;
    CommandProcessor       commands;
    JobWorker              worker;
    JobDispatcher          dispatcher;

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

    @AfterEach
    void tearDown() {
        if (dispatcher != null) dispatcher.shutdown();
    }

    @Test
    void claimNext_takesOldestQueuedJobOfSupportedKind() {
        dispatcher = dispatcher(new ScriptedCollectionTask(JobKind.SINGLE_TARGET, List.of(), 0));
        UUID unsupported = JobFixtures.jobIn(store, JobPhase.QUEUED, JobKind.FILE_PARSE);
        UUID first       = JobFixtures.jobIn(store, JobPhase.QUEUED, JobKind.SINGLE_TARGET);
        sleepAMoment();
        UUID second      = JobFixtures.jobIn(store, JobPhase.QUEUED, JobKind.SINGLE_TARGET);

        Optional<JobRecord> claimed = dispatcher.claimNext();

        assertThat(claimed).map(JobRecord::id).contains(first);
        assertThat(claimed.get().phase()).isEqualTo("collecting");
        assertThat(phaseOf(second)).isEqualTo("queued");
        assertThat(phaseOf(unsupported)).isEqualTo("queued");
    }

    @Test
    void claimNext_nothingQueued_returnsEmpty() {
        dispatcher = dispatcher(new ScriptedCollectionTask(JobKind.SINGLE_TARGET, List.of(), 0));
        JobFixtures.jobIn(store, JobPhase.COLLECTING);

        assertThat(dispatcher.claimNext()).isEmpty();
    }

    @Test
    void cancelWhileQueued_settledToCancelledWithoutWorker() {
        dispatcher = dispatcher(new ScriptedCollectionTask(JobKind.SINGLE_TARGET, List.of(), 0));
        UUID queued = JobFixtures.jobIn(store, JobPhase.QUEUED);
        UUID running = JobFixtures.jobIn(store, JobPhase.COLLECTING);
        commands.cancel(queued);
        commands.cancel(running);

        dispatcher.settleUnclaimedCancellations();

        assertThat(phaseOf(queued)).isEqualTo("cancelled");
        // a worker owns this one and lands it itself
        assertThat(phaseOf(running)).isEqualTo("cancelling");
    }

    @Test
    void tick_runsClaimedJobToCompletion() throws Exception {
        ScriptedCollectionTask task = new ScriptedCollectionTask(JobKind.SINGLE_TARGET, List.of("example.com"), 7);
        task.parsed = 7;
        task.inserted = 7;
        dispatcher = dispatcher(task);
        UUID id = JobFixtures.jobIn(store, JobPhase.QUEUED);

        dispatcher.tick();

        awaitPhase(id, "completed", Duration.ofSeconds(5));
        assertThat(store.get(id).orElseThrow().counters().totalNew()).isEqualTo(7);
    }

    @Test
    void duplicateTaskKinds_rejectedAtStartup() {
        assertThatThrownBy(() -> dispatcher(
                new ScriptedCollectionTask(JobKind.SINGLE_TARGET, List.of(), 0),
                new ScriptedCollectionTask(JobKind.SINGLE_TARGET, List.of(), 0)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("SINGLE_TARGET");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    @SuppressWarnings("unchecked")
    private JobDispatcher dispatcher(CollectionTask... tasks) {
        ObjectProvider<CollectionTask> provider = mock(ObjectProvider.class);
        when(provider.orderedStream()).thenAnswer(inv -> Stream.of(tasks));
        return new JobDispatcher(store, ticks, worker, provider, 1);
    }

    private String phaseOf(UUID id) {
        return store.get(id).orElseThrow().phase();
    }

    private void awaitPhase(UUID id, String phase, Duration timeout) throws InterruptedException {
        Instant deadline = Instant.now().plus(timeout);
        while (!phase.equals(phaseOf(id))) {
            if (Instant.now().isAfter(deadline)) {
                throw new AssertionError("Job " + id + " still " + phaseOf(id) + " after " + timeout);
            }
            Thread.sleep(10);
        }
    }

    // createdAt comes from the clock; keep consecutive jobs apart.
    private static void sleepAMoment() {
        try {
            Thread.sleep(5);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
