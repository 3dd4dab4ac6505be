package tech.compendium.pipeline.job.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.compendium.pipeline.dispatch.StageDispatcher;
import tech.compendium.pipeline.job.dto.CreateJobRequest;
import tech.compendium.pipeline.job.entity.Job;
import tech.compendium.pipeline.job.repository.JobRepository;
import tech.compendium.pipeline.job.statemachine.JobStateMachine;

/**
 * Creates jobs and dispatches their first stage.
 */
@ApplicationScoped
public class JobSubmissionService {

    private static final Logger LOG = Logger.getLogger(JobSubmissionService.class);

    @Inject
    JobRepository jobRepository;

    @Inject
    JobStateMachine stateMachine;

    @Inject
    StageDispatcher stageDispatcher;

    public JobSubmissionService() {
        // CDI will inject dependencies
    }

    public JobSubmissionService(JobRepository jobRepository, JobStateMachine stateMachine, StageDispatcher stageDispatcher) {
        this.jobRepository = jobRepository;
        this.stateMachine = stateMachine;
        this.stageDispatcher = stageDispatcher;
    }

    /**
     * Store a new pending job and publish stage 1.
     *
     * <p>If the publish fails the {@link tech.compendium.queue.DispatchException} propagates;
     * the job stays stored as pending so the caller can see it and retry the submission.
     */
    public Job submit(CreateJobRequest request) {
        Job job = jobRepository.insert(stateMachine.create(request));
        LOG.infof("Created job [%s] for file [%s] (deck [%s])", job.id(), job.fileName(), job.deckName());

        stageDispatcher.dispatchNext(job);
        return job;
    }
}
