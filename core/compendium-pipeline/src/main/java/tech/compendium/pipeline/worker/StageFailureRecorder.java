package tech.compendium.pipeline.worker;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.compendium.messagerouter.handler.DeadLetterListener;
import tech.compendium.pipeline.dispatch.JobEventPublisher;
import tech.compendium.pipeline.job.entity.Job;
import tech.compendium.pipeline.job.model.PipelineStage;
import tech.compendium.pipeline.job.model.StageStatus;
import tech.compendium.pipeline.job.repository.JobRepository;
import tech.compendium.pipeline.job.statemachine.JobStateMachine;
import tech.compendium.pipeline.job.statemachine.StageOutcome;
import tech.compendium.pipeline.job.statemachine.TransitionException;
import tech.compendium.queue.WorkMessage;

import java.util.Optional;

/**
 * Marks the stage of a dead-lettered task failed, which fails its job, and announces the failure.
 */
@ApplicationScoped
public class StageFailureRecorder implements DeadLetterListener {

    private static final Logger LOG = Logger.getLogger(StageFailureRecorder.class);

    @Inject
    JobRepository jobRepository;

    @Inject
    JobStateMachine stateMachine;

    @Inject
    JobEventPublisher eventPublisher;

    public StageFailureRecorder() {
        // CDI will inject dependencies
    }

    public StageFailureRecorder(JobRepository jobRepository, JobStateMachine stateMachine, JobEventPublisher eventPublisher) {
        this.jobRepository = jobRepository;
        this.stateMachine = stateMachine;
        this.eventPublisher = eventPublisher;
    }

    @Override
    public void onDeadLetter(String queue, WorkMessage message, String reason) {
        Optional<Job> failed;
        try {
            failed = jobRepository.update(message.jobId(), job -> fail(job, message.stage(), reason));
        } catch (TransitionException e) {
            LOG.errorf("Dead-lettered stage %d of job [%s] from [%s] could not be recorded as failed: %s",
                message.stage(), message.jobId(), queue, e.getMessage());
            return;
        }

        if (failed.isEmpty()) {
            LOG.warnf("Dead-lettered message [%s] from [%s] belongs to deleted job [%s]",
                message.messageId(), queue, message.jobId());
            return;
        }

        Job job = failed.get();
        LOG.errorf("Job [%s] failed at stage %d (stage %d message dead-lettered after %d attempts): %s",
            job.id(), job.currentStage(), message.stage(), message.attempt() + 1, reason);
        eventPublisher.publishFailed(job);
    }

    /**
     * Fail the stage a dead-lettered message stands for. When that stage had already
     * completed and only the publish of the next stage kept failing, the job is parked on
     * the next stage, so that is the stage that fails.
     */
    private Job fail(Job job, int stage, String reason) {
        int target = stage;
        if (nextStageNeverDispatched(job, stage)) {
            target = stage + 1;
        }

        Job current = job;
        // The stage never got as far as starting; record the start so the failure is a legal transition
        if (!current.isTerminal() && current.currentStage() == target
                && current.stage(target).status() == StageStatus.PENDING) {
            current = stateMachine.apply(current, target, StageOutcome.started());
        }
        return stateMachine.apply(current, target, StageOutcome.failed(reason));
    }

    private static boolean nextStageNeverDispatched(Job job, int stage) {
        return !job.isTerminal()
            && stage >= 1 && stage < PipelineStage.COUNT
            && job.stage(stage).isCompleted()
            && job.currentStage() == stage + 1
            && job.stage(stage + 1).isPending();
    }
}
