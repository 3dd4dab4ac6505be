package tech.compendium.sdk.store;

import java.util.concurrent.CompletableFuture;

/**
 * Ownership of the one in-flight poll for a job. Later callers attach to {@link #result()}.
 *
 * @param jobId    the job being polled
 * @param sequence distinguishes successive polls of the same job
 * @param result   completes with the poll's outcome
 */
public record PollToken<T>(String jobId, long sequence, CompletableFuture<T> result) {}
