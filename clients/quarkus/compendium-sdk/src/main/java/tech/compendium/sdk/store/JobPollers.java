package tech.compendium.sdk.store;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.compendium.sdk.config.CompendiumConfig;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Creates {@link JobPoller}s sharing one scheduler thread and the configured intervals.
 */
@ApplicationScoped
public class JobPollers {

    @Inject
    JobStore jobStore;

    @Inject
    CompendiumConfig config;

    private ScheduledExecutorService scheduler;

    @PostConstruct
    void init() {
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "compendium-job-poller");
            thread.setDaemon(true);
            return thread;
        });
    }

    public JobPoller forJob(String jobId) {
        return new JobPoller(jobStore, jobId, PollingOptions.from(config.polling()), scheduler);
    }

    @PreDestroy
    void shutdown() {
        scheduler.shutdownNow();
    }
}
