package com.intelscan.orchestrator.health;

import com.intelscan.orchestrator.store.JobRecordStore;
import com.intelscan.orchestrator.store.JobStoreUnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JobStoreHealthIndicatorTest {

    private final JobRecordStore store = mock(JobRecordStore.class);
    private final JobStoreHealthIndicator health = new JobStoreHealthIndicator(store);

    @Test
    void listingWorks_up() {
        when(store.list(any())).thenReturn(List.of());

        assertThat(health.health().getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void storeUnavailable_down() {
        when(store.list(any())).thenThrow(new JobStoreUnavailableException("connection refused", null));

        assertThat(health.health().getStatus()).isEqualTo(Status.DOWN);
    }
}
