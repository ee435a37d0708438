package com.intelscan.orchestrator.service;

import com.intelscan.orchestrator.access.JobVisibilityFilter;
import com.intelscan.orchestrator.model.JobKind;
import com.intelscan.orchestrator.model.JobRecord;
import com.intelscan.orchestrator.model.TimeFilter;
import com.intelscan.orchestrator.store.JobLockRegistry;
import com.intelscan.orchestrator.store.JobQuery;
import com.intelscan.orchestrator.store.JobRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JobService.
 *
 * The store is mocked with Mockito: no Spring context, no database.
 */
@ExtendWith(MockitoExtension.class)
class JobServiceTest {

    @Mock JobRecordStore store;

    JobLockRegistry locks;
    JobService      service;

    @BeforeEach
    void setUp() {
        locks   = spy(new JobLockRegistry());
        service = new JobService(store, locks, JobVisibilityFilter.ALL);
    }

    // ------------------------------------------------------------------
    // submit()
    // ------------------------------------------------------------------

    @Test
    void submit_happyPath_createsQueuedJob() {
        when(store.create(any())).thenAnswer(inv -> inv.getArgument(0));

        JobRecord job = service.submit(JobKind.SINGLE_TARGET, "  nightly  ", " example.com ", TimeFilter.D7);

        ArgumentCaptor<JobRecord> captor = ArgumentCaptor.forClass(JobRecord.class);
        verify(store).create(captor.capture());
        assertThat(captor.getValue().phase()).isEqualTo("queued");
        assertThat(job.target()).isEqualTo("example.com");
        assertThat(job.name()).isEqualTo("nightly");
        assertThat(job.timeFilter()).isEqualTo(TimeFilter.D7);
    }

    @Test
    void submit_blankTarget_rejected() {
        assertThatThrownBy(() -> service.submit(JobKind.SINGLE_TARGET, null, "  ", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("target is required");
        verifyNoInteractions(store);
    }

    @Test
    void submit_missingKind_rejected() {
        assertThatThrownBy(() -> service.submit(null, null, "example.com", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // queries
    // ------------------------------------------------------------------

    @Test
    void findById_hiddenByVisibilityFilter() {
        JobRecord job = job();
        when(store.get(job.id())).thenReturn(Optional.of(job));
        JobService scoped = new JobService(store, locks, j -> false);

        assertThat(scoped.findById(job.id())).isEmpty();
        assertThat(service.findById(job.id())).contains(job);
    }

    @Test
    void list_filtersInvisibleJobs() {
        JobRecord mine   = job();
        JobRecord theirs = job();
        JobQuery  query  = JobQuery.newest(10);
        when(store.list(query)).thenReturn(List.of(mine, theirs));
        JobService scoped = new JobService(store, locks, j -> j.id().equals(mine.id()));

        assertThat(scoped.list(query)).containsExactly(mine);
    }

    // ------------------------------------------------------------------
    // disposal
    // ------------------------------------------------------------------

    @Test
    void delete_finishedJob_releasesLock() {
        UUID id = UUID.randomUUID();
        when(store.deleteIfFinished(id)).thenReturn(true);

        assertThat(service.delete(id)).isTrue();
        verify(locks).release(id);
    }

    @Test
    void delete_activeJob_returnsFalse() {
        UUID id = UUID.randomUUID();
        when(store.deleteIfFinished(id)).thenReturn(false);

        assertThat(service.delete(id)).isFalse();
        verify(locks, never()).release(any());
    }

    @Test
    void purgeFinishedBefore_delegatesCutoff() {
        Instant cutoff = Instant.parse("2026-01-01T00:00:00Z");
        when(store.deleteFinishedBefore(cutoff)).thenReturn(4);

        assertThat(service.purgeFinishedBefore(cutoff)).isEqualTo(4);
    }

    private static JobRecord job() {
        return JobRecord.queued(UUID.randomUUID(), JobKind.SINGLE_TARGET, null, "example.com", null, Instant.now());
    }
}
