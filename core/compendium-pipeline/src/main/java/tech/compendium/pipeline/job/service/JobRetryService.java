package tech.compendium.pipeline.job.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.compendium.pipeline.dispatch.StageDispatcher;
import tech.compendium.pipeline.job.entity.Job;
import tech.compendium.pipeline.job.repository.JobRepository;
import tech.compendium.pipeline.job.statemachine.JobStateMachine;
import tech.compendium.pipeline.job.statemachine.TransitionException;
import tech.compendium.queue.DispatchException;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Operator-initiated retry of failed jobs.
 */
@ApplicationScoped
public class JobRetryService {

    private static final Logger LOG = Logger.getLogger(JobRetryService.class);

    @Inject
    JobRepository jobRepository;

    @Inject
    JobStateMachine stateMachine;

    @Inject
    StageDispatcher stageDispatcher;

    public JobRetryService() {
        // CDI will inject dependencies
    }

    public JobRetryService(JobRepository jobRepository, JobStateMachine stateMachine, StageDispatcher stageDispatcher) {
        this.jobRepository = jobRepository;
        this.stateMachine = stateMachine;
        this.stageDispatcher = stageDispatcher;
    }

    /**
     * Rearm a failed job and publish its failed stage again with a fresh attempt count.
     * If the publish fails the job is put back exactly as it was before the retry, so the
     * retry can be offered again.
     *
     * @return the rearmed job
     * @throws JobNotFoundException if the job does not exist
     * @throws JobRetryException if the job has not failed or has no retries left
     * @throws DispatchException if the failed stage could not be published
     */
    public Job retry(String jobId) {
        AtomicReference<Job> beforeRetry = new AtomicReference<>();
        Job rearmed;
        try {
            rearmed = jobRepository.update(jobId, failed -> {
                    beforeRetry.set(failed);
                    return stateMachine.rearmForRetry(failed);
                })
                .orElseThrow(() -> new JobNotFoundException(jobId));
        } catch (TransitionException e) {
            LOG.warnf("Retry of job [%s] refused: %s", jobId, e.getMessage());
            throw new JobRetryException(jobId, e.getMessage(), e);
        }

        LOG.infof("Retrying job [%s] from stage %d (retry %d/%d)",
            jobId, rearmed.currentStage(), rearmed.retryCount(), rearmed.maxRetries());
        try {
            stageDispatcher.dispatchNext(rearmed);
        } catch (DispatchException e) {
            LOG.errorf(e, "Retry of job [%s] could not publish stage %d, restoring the failed job",
                jobId, rearmed.currentStage());
            restore(rearmed, beforeRetry.get());
            throw e;
        }
        return rearmed;
    }

    /**
     * Put the pre-retry job back, unless something else changed the job in the meantime.
     */
    private void restore(Job rearmed, Job failed) {
        jobRepository.update(rearmed.id(), current -> current.version() == rearmed.version() ? failed : current);
    }
}
