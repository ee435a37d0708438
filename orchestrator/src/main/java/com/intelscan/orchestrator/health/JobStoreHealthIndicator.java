package com.intelscan.orchestrator.health;

import com.intelscan.orchestrator.store.JobQuery;
import com.intelscan.orchestrator.store.JobRecordStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports DOWN when the job store cannot serve a one-row listing.
 * Exposed as {@code jobStore} under /actuator/health.
 */
@Component("jobStore")
public class JobStoreHealthIndicator implements HealthIndicator {

    private final JobRecordStore store;

    public JobStoreHealthIndicator(JobRecordStore store) {
        this.store = store;
    }

    @Override
    public Health health() {
        try {
            store.list(JobQuery.newest(1));
            return Health.up()
                    .withDetail("store", store.getClass().getSimpleName())
                    .build();
        } catch (RuntimeException e) {
            return Health.down(e)
                    .withDetail("store", store.getClass().getSimpleName())
                    .build();
        }
    }
}
