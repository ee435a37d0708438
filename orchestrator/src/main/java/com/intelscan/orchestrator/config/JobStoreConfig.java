package com.intelscan.orchestrator.config;

import com.intelscan.orchestrator.repository.ScanJobRepository;
import com.intelscan.orchestrator.store.InMemoryJobRecordStore;
import com.intelscan.orchestrator.store.JobRecordStore;
import com.intelscan.orchestrator.store.JpaJobRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Picks the job store implementation.
 *
 *   intelscan.store=jpa     (default) Postgres through Spring Data JPA
 *   intelscan.store=memory  in-process map, for local runs and demos
 */
@Configuration
public class JobStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(JobStoreConfig.class);

    @Bean
    @ConditionalOnProperty(name = "intelscan.store", havingValue = "jpa", matchIfMissing = true)
    JobRecordStore jpaJobRecordStore(ScanJobRepository repo) {
        log.info("Using JPA job store");
        return new JpaJobRecordStore(repo);
    }

    @Bean
    @ConditionalOnProperty(name = "intelscan.store", havingValue = "memory")
    JobRecordStore inMemoryJobRecordStore() {
        log.warn("Using in-memory job store: job state will not survive a restart");
        return new InMemoryJobRecordStore();
    }
}
