package com.intelscan.orchestrator.poller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intelscan.orchestrator.projection.ProgressProjector;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds reconciliation pollers with the configured interval and fetch timeout.
 * Each caller owns the poller it gets and must close it.
 */
@Component
public class PollerFactory {

    private final ProgressProjector projector;
    private final MeterRegistry     meters;
    private final ObjectMapper      objectMapper;
    private final Duration          interval;
    private final Duration          fetchTimeout;

    public PollerFactory(
            ProgressProjector projector,
            MeterRegistry meters,
            ObjectMapper objectMapper,
            @Value("${intelscan.poller.interval-ms:3000}") long intervalMs,
            @Value("${intelscan.poller.fetch-timeout-ms:10000}") long fetchTimeoutMs) {
        this.projector    = projector;
        this.meters       = meters;
        this.objectMapper = objectMapper;
        this.interval     = Duration.ofMillis(intervalMs);
        this.fetchTimeout = Duration.ofMillis(fetchTimeoutMs);
    }

    public JobFeed httpFeed(String baseUrl, String bearerToken) {
        return new HttpJobFeed(baseUrl, bearerToken, fetchTimeout, objectMapper);
    }

    public ReconciliationPoller poller(JobFeed feed) {
        return new ReconciliationPoller(feed, projector, meters, interval, fetchTimeout);
    }

    public Duration interval() {
        return interval;
    }

    public Duration fetchTimeout() {
        return fetchTimeout;
    }
}
