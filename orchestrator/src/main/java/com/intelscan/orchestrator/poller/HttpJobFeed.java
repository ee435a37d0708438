package com.intelscan.orchestrator.poller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches the job list from the orchestrator's REST API.
 *
 * Uses java.net.http.HttpClient with a per-request timeout; a timeout, an
 * I/O error or any non-2xx status becomes a {@link JobFeedException}.
 *
 * Each array element is decoded on its own. A single malformed element is
 * logged and skipped instead of failing the whole batch.
 */
public class HttpJobFeed implements JobFeed {

    private static final Logger log = LoggerFactory.getLogger(HttpJobFeed.class);

    private static final int PAGE_SIZE = 200;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final URI          jobsUri;
    private final String       bearerToken;
    private final Duration     timeout;

    /**
     * @param baseUrl     orchestrator root, e.g. {@code http://localhost:8080}
     * @param bearerToken optional; sent as {@code Authorization: Bearer ...} when present
     * @param timeout     upper bound for one fetch
     */
    public HttpJobFeed(String baseUrl, String bearerToken, Duration timeout, ObjectMapper objectMapper) {
        String root = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.jobsUri     = URI.create(root + "/jobs?size=" + PAGE_SIZE);
        this.bearerToken = bearerToken;
        this.timeout     = timeout;
        this.json        = objectMapper;
        this.http        = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public List<FetchedJob> fetchJobs() {
        HttpResponse<String> resp;
        try {
            HttpRequest.Builder req = HttpRequest.newBuilder()
                    .uri(jobsUri)
                    .timeout(timeout)
                    .header("Accept", "application/json")
                    .GET();
            if (bearerToken != null && !bearerToken.isBlank()) {
                req.header("Authorization", "Bearer " + bearerToken);
            }
            resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobFeedException("Job fetch interrupted", e);
        } catch (Exception e) {
            throw new JobFeedException("Job fetch failed: " + e.getMessage(), e);
        }

        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new JobFeedException("Job fetch failed: HTTP " + resp.statusCode());
        }
        return decode(resp.body());
    }

    List<FetchedJob> decode(String body) {
        JsonNode root;
        try {
            root = json.readTree(body);
        } catch (JsonProcessingException e) {
            throw new JobFeedException("Job list is not valid JSON", e);
        }
        if (root == null || !root.isArray()) {
            throw new JobFeedException("Job list response is not a JSON array");
        }

        List<FetchedJob> jobs = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            try {
                jobs.add(json.treeToValue(node, FetchedJob.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Skipping malformed job entry {}: {}", node.path("id").asText("?"), e.getMessage());
            }
        }
        return jobs;
    }
}
