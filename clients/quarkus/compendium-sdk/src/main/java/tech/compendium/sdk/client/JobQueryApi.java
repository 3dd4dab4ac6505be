package tech.compendium.sdk.client;

import tech.compendium.sdk.dto.Job;
import tech.compendium.sdk.dto.JobFilters;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Query and mutation operations on jobs. The server is the source of truth.
 */
public interface JobQueryApi {

    CompletableFuture<List<Job>> listJobs(JobFilters filters);

    CompletableFuture<Job> getJob(String id);

    CompletableFuture<Void> deleteJob(String id);

    CompletableFuture<Void> deleteJobs(Collection<String> ids);

    /**
     * Ask the server to re-dispatch a failed job.
     *
     * @return the job as updated by the server
     */
    CompletableFuture<Job> retryJob(String id);
}
