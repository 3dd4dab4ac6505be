package tech.compendium.sdk.client.resources;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import tech.compendium.sdk.client.CompendiumClient;
import tech.compendium.sdk.client.JobQueryApi;
import tech.compendium.sdk.dto.Job;
import tech.compendium.sdk.dto.JobFilters;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Resource for querying and managing jobs.
 */
public class Jobs implements JobQueryApi {

    private final CompendiumClient client;

    public Jobs(CompendiumClient client) {
        this.client = client;
    }

    @Override
    public CompletableFuture<List<Job>> listJobs(JobFilters filters) {
        Map<String, String> params = filters != null ? filters.toQueryParams() : Map.of();
        String query = params.isEmpty() ? "" : "?" + buildQuery(params);
        return client.request("GET", "/jobs" + query, null, new TypeReference<List<Job>>() {})
            .thenApply(jobs -> jobs != null ? jobs : List.of());
    }

    @Override
    public CompletableFuture<Job> getJob(String id) {
        return client.request("GET", "/jobs/" + id, null, new TypeReference<Job>() {});
    }

    @Override
    public CompletableFuture<Void> deleteJob(String id) {
        return client.requestVoid("DELETE", "/jobs/" + id, null);
    }

    @Override
    public CompletableFuture<Void> deleteJobs(Collection<String> ids) {
        return client.requestVoid("POST", "/jobs/bulk-delete", new BulkDeleteJobsRequest(List.copyOf(ids)));
    }

    @Override
    public CompletableFuture<Job> retryJob(String id) {
        return client.request("POST", "/jobs/" + id + "/retry", null, new TypeReference<Job>() {});
    }

    private String buildQuery(Map<String, String> params) {
        return params.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .reduce((a, b) -> a + "&" + b)
            .orElse("");
    }

    // Request DTOs

    public record BulkDeleteJobsRequest(
        @JsonProperty("job_ids") List<String> jobIds
    ) {}
}
