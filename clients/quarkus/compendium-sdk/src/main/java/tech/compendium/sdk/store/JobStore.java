package tech.compendium.sdk.store;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.compendium.sdk.client.CompendiumClient;
import tech.compendium.sdk.client.JobQueryApi;
import tech.compendium.sdk.dto.Job;
import tech.compendium.sdk.dto.JobFilters;
import tech.compendium.sdk.enums.JobStatus;
import tech.compendium.sdk.support.ErrorMessages;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Client-side cache of jobs, reconciled against the job API.
 *
 * <p>The server is authoritative: listings replace the local collection, single fetches
 * replace one entry in place or insert it at the front. Deletes are optimistic; the entries
 * disappear locally at once and the collection is reloaded from the server if the remote
 * delete fails.
 *
 * <p>Every operation is asynchronous and reports failure through its result rather than
 * an exceptional future; the user-facing reason is kept in {@link #error()}.
 * State is guarded by the store's monitor, since callbacks complete on HTTP client threads.
 */
@ApplicationScoped
public class JobStore {

    private static final Logger LOG = Logger.getLogger(JobStore.class);

    private final JobQueryApi api;
    private final InFlightPolls<Optional<Job>> polls = new InFlightPolls<>();
    private final List<JobStoreListener> listeners = new CopyOnWriteArrayList<>();

    private final List<Job> jobs = new ArrayList<>();
    private Job currentJob;
    private boolean loading;
    private String error;
    private JobFilters lastFilters = JobFilters.none();

    @Inject
    public JobStore(CompendiumClient client) {
        this(client.jobs());
    }

    public JobStore(JobQueryApi api) {
        this.api = api;
    }

    // Remote operations

    /**
     * Reload the collection with the last filters used.
     */
    public CompletableFuture<Boolean> fetchJobs() {
        JobFilters filters;
        synchronized (this) {
            filters = lastFilters;
        }
        return fetchJobs(filters);
    }

    /**
     * Replace the local collection with the server's listing. On failure the collection is
     * left as it was and the result is {@code false}.
     */
    public CompletableFuture<Boolean> fetchJobs(JobFilters filters) {
        JobFilters effective = filters != null ? filters : JobFilters.none();
        synchronized (this) {
            loading = true;
            error = null;
            lastFilters = effective;
        }

        return call(() -> api.listJobs(effective)).handle((listing, failure) -> {
            if (failure != null) {
                String message = ErrorMessages.extract(failure, "Failed to fetch jobs");
                LOG.warnf("Error fetching jobs: %s", message);
                synchronized (this) {
                    loading = false;
                    error = message;
                }
                return false;
            }

            List<Job> snapshot;
            synchronized (this) {
                jobs.clear();
                // A 2xx with an empty body is an empty listing
                if (listing != null) {
                    jobs.addAll(listing);
                }
                loading = false;
                snapshot = List.copyOf(jobs);
            }
            listeners.forEach(listener -> listener.onJobsReplaced(snapshot));
            return true;
        });
    }

    /**
     * Fetch one job, merge it into the collection and make it the current job.
     *
     * @return the job, or empty if the fetch failed
     */
    public CompletableFuture<Optional<Job>> fetchJob(String id) {
        return call(() -> api.getJob(id)).handle((job, failure) -> {
            if (failure != null || job == null) {
                String message = ErrorMessages.extract(failure, "Failed to fetch job");
                LOG.warnf("Error fetching job [%s]: %s", id, message);
                synchronized (this) {
                    error = message;
                }
                return Optional.<Job>empty();
            }
            merge(job, true);
            return Optional.of(job);
        });
    }

    /**
     * Fetch one job unless a fetch for it is already in flight, in which case the caller
     * shares that fetch's result.
     */
    public CompletableFuture<Optional<Job>> pollOne(String id) {
        return polls.acquireOrJoin(id, () -> fetchJob(id));
    }

    public CompletableFuture<Boolean> deleteJob(String id) {
        removeLocally(Set.of(id));
        return reconcile(call(() -> api.deleteJob(id)), "Failed to delete job");
    }

    public CompletableFuture<Boolean> deleteJobs(Collection<String> ids) {
        Set<String> toDelete = new LinkedHashSet<>(ids);
        removeLocally(toDelete);
        return reconcile(call(() -> api.deleteJobs(toDelete)), "Failed to delete jobs");
    }

    /**
     * Ask the server to retry a failed job and merge the job it returns.
     */
    public CompletableFuture<Optional<Job>> retryJob(String id) {
        return call(() -> api.retryJob(id)).handle((job, failure) -> {
            if (failure != null || job == null) {
                String message = ErrorMessages.extract(failure, "Failed to retry job");
                LOG.warnf("Error retrying job [%s]: %s", id, message);
                synchronized (this) {
                    error = message;
                }
                return Optional.<Job>empty();
            }
            merge(job, false);
            return Optional.of(job);
        });
    }

    // Local state

    private void merge(Job job, boolean makeCurrent) {
        Job previous = null;
        synchronized (this) {
            int index = indexOf(job.id());
            if (index >= 0) {
                previous = jobs.set(index, job);
            } else {
                jobs.add(0, job);
            }
            if (makeCurrent || (currentJob != null && currentJob.id().equals(job.id()))) {
                currentJob = job;
            }
        }
        Job replaced = previous;
        listeners.forEach(listener -> listener.onJobUpdated(replaced, job));
    }

    private void removeLocally(Set<String> ids) {
        Set<String> removed = new LinkedHashSet<>();
        synchronized (this) {
            jobs.removeIf(job -> {
                if (ids.contains(job.id())) {
                    removed.add(job.id());
                    return true;
                }
                return false;
            });
            if (currentJob != null && ids.contains(currentJob.id())) {
                currentJob = null;
            }
        }
        if (!removed.isEmpty()) {
            listeners.forEach(listener -> listener.onJobsRemoved(Set.copyOf(removed)));
        }
    }

    /**
     * After a failed remote mutation, reload from the server and record the mutation's error.
     */
    private CompletableFuture<Boolean> reconcile(CompletableFuture<Void> remote, String fallback) {
        return remote.handle((ignored, failure) -> {
            if (failure == null) {
                return CompletableFuture.completedFuture(true);
            }
            String message = ErrorMessages.extract(failure, fallback);
            LOG.warnf("%s, reloading jobs: %s", fallback, message);
            return fetchJobs().thenApply(reloaded -> {
                synchronized (this) {
                    error = message;
                }
                return false;
            });
        }).thenCompose(result -> result);
    }

    private int indexOf(String id) {
        for (int i = 0; i < jobs.size(); i++) {
            if (jobs.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    private static <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> request) {
        try {
            return request.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    // Views, recomputed on every read

    public synchronized List<Job> jobs() {
        return List.copyOf(jobs);
    }

    public List<Job> activeJobs() {
        return filter(Job::isActive);
    }

    public List<Job> completedJobs() {
        return filter(job -> job.statusOrUnknown() == JobStatus.COMPLETED);
    }

    public List<Job> failedJobs() {
        return filter(job -> job.statusOrUnknown() == JobStatus.FAILED);
    }

    public synchronized Optional<Job> findById(String id) {
        int index = indexOf(id);
        return index >= 0 ? Optional.of(jobs.get(index)) : Optional.empty();
    }

    private synchronized List<Job> filter(Predicate<Job> predicate) {
        return jobs.stream().filter(predicate).toList();
    }

    public synchronized Optional<Job> currentJob() {
        return Optional.ofNullable(currentJob);
    }

    public synchronized boolean isLoading() {
        return loading;
    }

    public synchronized Optional<String> error() {
        return Optional.ofNullable(error);
    }

    public boolean isPolling(String id) {
        return polls.isInFlight(id);
    }

    public synchronized void clearError() {
        error = null;
    }

    /**
     * Drop all local state, including the in-flight poll registry.
     */
    public void reset() {
        synchronized (this) {
            jobs.clear();
            currentJob = null;
            loading = false;
            error = null;
            lastFilters = JobFilters.none();
        }
        polls.clear();
        listeners.forEach(listener -> listener.onJobsReplaced(List.of()));
    }

    public void addListener(JobStoreListener listener) {
        listeners.add(listener);
    }

    public void removeListener(JobStoreListener listener) {
        listeners.remove(listener);
    }
}
