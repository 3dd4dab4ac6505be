package tech.compendium.sdk.store;

import org.jboss.logging.Logger;
import tech.compendium.sdk.dto.Job;
import tech.compendium.sdk.support.ErrorMessages;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Polls one job through {@link JobStore#pollOne(String)} until it completes or fails.
 *
 * <p>The first poll runs as soon as polling starts; each later poll is scheduled once the
 * previous one has finished, so polls of one poller never overlap. Failed polls are recorded
 * in {@link #error()} and polling carries on.
 */
public class JobPoller implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(JobPoller.class);

    private final JobStore store;
    private final String jobId;
    private final PollingOptions options;
    private final ScheduledExecutorService scheduler;

    private boolean polling;
    private long generation;
    private int pollCount;
    private Job job;
    private String error;
    private ScheduledFuture<?> next;

    public JobPoller(JobStore store, String jobId, PollingOptions options, ScheduledExecutorService scheduler) {
        this.store = store;
        this.jobId = jobId;
        this.options = options;
        this.scheduler = scheduler;
    }

    public synchronized void start() {
        if (polling) {
            return;
        }
        polling = true;
        pollCount = 0;
        generation++;
        LOG.debugf("Polling job [%s] every %s", jobId, options.interval());
        schedule(Duration.ZERO, generation);
    }

    public synchronized void stop() {
        if (!polling) {
            return;
        }
        polling = false;
        generation++;
        if (next != null) {
            next.cancel(false);
            next = null;
        }
        LOG.debugf("Stopped polling job [%s] after %d polls", jobId, pollCount);
    }

    /**
     * Stop and start again with a reset poll count, e.g. after the job was retried.
     */
    public synchronized void restart() {
        stop();
        start();
    }

    /**
     * Poll once now, outside the schedule.
     */
    public CompletableFuture<Optional<Job>> refresh() {
        return store.pollOne(jobId).thenApply(result -> {
            synchronized (this) {
                result.ifPresent(fetched -> job = fetched);
            }
            return result;
        });
    }

    @Override
    public void close() {
        stop();
    }

    private void schedule(Duration delay, long owner) {
        next = scheduler.schedule(() -> poll(owner), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void poll(long owner) {
        synchronized (this) {
            if (!polling || owner != generation) {
                return;
            }
        }
        store.pollOne(jobId).whenComplete((result, failure) -> onPolled(owner, result, failure));
    }

    private synchronized void onPolled(long owner, Optional<Job> result, Throwable failure) {
        if (!polling || owner != generation) {
            return;
        }
        pollCount++;

        if (failure == null && result.isPresent()) {
            job = result.get();
            error = null;
            if (job.isTerminal()) {
                LOG.infof("Job [%s] is %s, polling stopped", jobId, job.status().getValue());
                stop();
                return;
            }
        } else {
            error = failure != null
                ? ErrorMessages.extract(failure, "Failed to fetch job status")
                : store.error().orElse("Failed to fetch job status");
            LOG.debugf("Poll %d of job [%s] failed: %s", pollCount, jobId, error);
        }

        schedule(options.delayAfter(pollCount), owner);
    }

    public String jobId() {
        return jobId;
    }

    public synchronized boolean isPolling() {
        return polling;
    }

    public synchronized int pollCount() {
        return pollCount;
    }

    public synchronized Optional<Job> job() {
        return Optional.ofNullable(job);
    }

    public synchronized Optional<String> error() {
        return Optional.ofNullable(error);
    }
}
