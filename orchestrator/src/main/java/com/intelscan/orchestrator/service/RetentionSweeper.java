package com.intelscan.orchestrator.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Disposes of finished jobs once they are older than the retention window.
 * Active jobs are never touched. A retention of 0 days disables the sweep.
 */
@Component
public class RetentionSweeper {

    private final JobService jobService;
    private final int        retentionDays;

    public RetentionSweeper(JobService jobService,
                            @Value("${intelscan.retention.days:90}") int retentionDays) {
        this.jobService    = jobService;
        this.retentionDays = retentionDays;
    }

    @Scheduled(cron = "${intelscan.retention.sweep-cron:0 0 3 * * *}")
    public int sweep() {
        if (retentionDays <= 0) return 0;
        return jobService.purgeFinishedBefore(Instant.now().minus(Duration.ofDays(retentionDays)));
    }
}
