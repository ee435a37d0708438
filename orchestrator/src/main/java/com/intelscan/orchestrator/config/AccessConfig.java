package com.intelscan.orchestrator.config;

import com.intelscan.orchestrator.access.JobVisibilityFilter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default visibility: every job is visible. An access-control module
 * replaces this by declaring its own {@link JobVisibilityFilter} bean.
 */
@Configuration
public class AccessConfig {

    @Bean
    @ConditionalOnMissingBean
    JobVisibilityFilter jobVisibilityFilter() {
        return JobVisibilityFilter.ALL;
    }
}
