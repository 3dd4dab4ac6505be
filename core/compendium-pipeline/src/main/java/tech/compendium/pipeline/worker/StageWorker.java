package tech.compendium.pipeline.worker;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.compendium.messagerouter.handler.WorkHandler;
import tech.compendium.messagerouter.model.DeliveryOutcome;
import tech.compendium.pipeline.dispatch.JobEventPublisher;
import tech.compendium.pipeline.dispatch.StageDispatcher;
import tech.compendium.pipeline.job.entity.Job;
import tech.compendium.pipeline.job.entity.Stage;
import tech.compendium.pipeline.job.model.JobStatus;
import tech.compendium.pipeline.job.model.PipelineStage;
import tech.compendium.pipeline.job.model.StageStatus;
import tech.compendium.pipeline.job.repository.JobRepository;
import tech.compendium.pipeline.job.statemachine.JobStateMachine;
import tech.compendium.pipeline.job.statemachine.StageOutcome;
import tech.compendium.pipeline.job.statemachine.TransitionException;
import tech.compendium.queue.DispatchException;
import tech.compendium.queue.WorkMessage;

import java.util.Optional;

/**
 * Handles task messages for every pipeline stage.
 *
 * <p>For a delivery of stage K the worker marks K started, runs the stage's executor,
 * marks K succeeded and then dispatches K+1 (or announces the finished job). Failures
 * are returned to the dispatch layer, which retries or dead-letters the delivery.
 *
 * <p>Deliveries are at-least-once, so the worker tolerates:
 * <ul>
 *   <li>messages for deleted jobs, acknowledged and dropped</li>
 *   <li>redeliveries of a completed stage, acknowledged; the next stage is dispatched
 *       again if it never started</li>
 *   <li>redeliveries of a stage already in processing, resumed without a second start</li>
 * </ul>
 */
@ApplicationScoped
public class StageWorker implements WorkHandler {

    private static final Logger LOG = Logger.getLogger(StageWorker.class);

    @Inject
    JobRepository jobRepository;

    @Inject
    JobStateMachine stateMachine;

    @Inject
    StageExecutorRegistry executors;

    @Inject
    StageDispatcher stageDispatcher;

    @Inject
    JobEventPublisher eventPublisher;

    public StageWorker() {
        // CDI will inject dependencies
    }

    public StageWorker(JobRepository jobRepository, JobStateMachine stateMachine, StageExecutorRegistry executors,
                StageDispatcher stageDispatcher, JobEventPublisher eventPublisher) {
        this.jobRepository = jobRepository;
        this.stateMachine = stateMachine;
        this.executors = executors;
        this.stageDispatcher = stageDispatcher;
        this.eventPublisher = eventPublisher;
    }

    @Override
    public DeliveryOutcome handle(WorkMessage message) {
        Optional<Job> found = jobRepository.findById(message.jobId());
        if (found.isEmpty()) {
            LOG.warnf("Job [%s] no longer exists, dropping stage %d message [%s]",
                message.jobId(), message.stage(), message.messageId());
            return DeliveryOutcome.success();
        }

        Job job = found.get();
        int stageNumber = message.stage();

        try {
            Stage stage = stageNumber >= 1 && stageNumber <= PipelineStage.COUNT ? job.stage(stageNumber) : null;

            if (stage != null && stage.isCompleted()) {
                return redeliveredCompletedStage(job, stageNumber);
            }

            if (stage != null && stage.status() == StageStatus.PROCESSING && !job.isTerminal()) {
                LOG.infof("Resuming job [%s] stage %d (attempt %d)", job.id(), stageNumber, message.attempt() + 1);
            } else {
                Optional<Job> started = transition(message, StageOutcome.started());
                if (started.isEmpty()) {
                    return deletedWhileRunning(message);
                }
                job = started.get();
            }

            PipelineStage definition = PipelineStage.of(stageNumber);
            StageResult result;
            try {
                result = executors.forStage(definition).execute(job, message);
            } catch (Exception e) {
                String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                LOG.warnf(e, "Stage %d (%s) of job [%s] failed on attempt %d: %s",
                    stageNumber, definition.getDisplayName(), job.id(), message.attempt() + 1, error);
                return DeliveryOutcome.failed(error);
            }

            Optional<Job> succeeded = transition(message,
                StageOutcome.succeeded(result != null ? result.deckId() : null));
            if (succeeded.isEmpty()) {
                return deletedWhileRunning(message);
            }
            advance(succeeded.get());
            return DeliveryOutcome.success();

        } catch (TransitionException e) {
            LOG.errorf(e, "Illegal transition for job [%s] stage %d: %s", message.jobId(), stageNumber, e.getMessage());
            return DeliveryOutcome.rejected(e.getMessage());
        } catch (DispatchException e) {
            LOG.warnf(e, "Stage %d of job [%s] completed but the next stage could not be dispatched",
                stageNumber, message.jobId());
            return DeliveryOutcome.failed(e.getMessage());
        }
    }

    private Optional<Job> transition(WorkMessage message, StageOutcome outcome) {
        return jobRepository.update(message.jobId(), current -> stateMachine.apply(current, message.stage(), outcome));
    }

    private void advance(Job job) {
        if (job.status() == JobStatus.COMPLETED) {
            LOG.infof("Job [%s] completed (deck [%s])", job.id(), job.deckId());
            eventPublisher.publishCompleted(job);
            return;
        }
        stageDispatcher.dispatchNext(job);
    }

    /**
     * The stage already completed, typically because the worker stopped between the
     * transition and the acknowledgement.
     */
    private DeliveryOutcome redeliveredCompletedStage(Job job, int stageNumber) {
        LOG.infof("Stage %d of job [%s] already completed, treating delivery as duplicate", stageNumber, job.id());

        boolean nextNeverStarted = !job.isTerminal()
            && job.currentStage() == stageNumber + 1
            && job.stage(job.currentStage()).isPending();
        if (nextNeverStarted) {
            stageDispatcher.dispatchNext(job);
        }
        return DeliveryOutcome.success();
    }

    private DeliveryOutcome deletedWhileRunning(WorkMessage message) {
        LOG.warnf("Job [%s] was deleted while stage %d was running", message.jobId(), message.stage());
        return DeliveryOutcome.success();
    }
}
