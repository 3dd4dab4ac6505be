package tech.compendium.pipeline.dispatch;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;
import tech.compendium.pipeline.job.entity.Job;
import tech.compendium.pipeline.job.entity.Stage;
import tech.compendium.pipeline.job.model.PipelineStage;
import tech.compendium.pipeline.job.statemachine.TransitionException;
import tech.compendium.queue.WorkDispatcher;
import tech.compendium.queue.WorkMessage;

/**
 * Publishes the work message for a job's current stage.
 *
 * <p>Stage K is only published when the job is not terminal, K is the current stage, stage K is
 * pending and every earlier stage has completed. A violation raises {@link TransitionException}
 * before anything reaches the broker.
 */
@ApplicationScoped
public class StageDispatcher {

    private static final Logger LOG = Logger.getLogger(StageDispatcher.class);

    @Inject
    @Named(PipelineDispatchers.TASKS)
    WorkDispatcher taskDispatcher;

    public StageDispatcher() {
        // CDI will inject dependencies
    }

    public StageDispatcher(WorkDispatcher taskDispatcher) {
        this.taskDispatcher = taskDispatcher;
    }

    /**
     * Publish a first-attempt message for the job's current stage, carrying the job's payload.
     *
     * @return the published message
     * @throws TransitionException if the stage may not be published yet
     * @throws tech.compendium.queue.DispatchException if the broker does not accept the message
     */
    public WorkMessage dispatchNext(Job job) {
        int stageNumber = job.currentStage();
        checkDispatchable(job, stageNumber);

        PipelineStage stage = PipelineStage.of(stageNumber);
        WorkMessage message = WorkMessage.fresh(job.id(), stageNumber, job.payload());
        taskDispatcher.publish(stage.getRoutingKey(), message);

        LOG.infof("Dispatched job [%s] stage %d (%s) to [%s]",
            job.id(), stageNumber, stage.getDisplayName(), stage.getRoutingKey());
        return message;
    }

    /**
     * @throws TransitionException if stage {@code stageNumber} of the job may not be published
     */
    public static void checkDispatchable(Job job, int stageNumber) {
        if (job.isTerminal()) {
            throw new TransitionException(job.id(), stageNumber,
                "Cannot dispatch stage " + stageNumber + " of " + job.status().getValue() + " job " + job.id());
        }
        if (stageNumber != job.currentStage()) {
            throw new TransitionException(job.id(), stageNumber,
                "Cannot dispatch stage " + stageNumber + " of job " + job.id() + ": current stage is " + job.currentStage());
        }
        Stage stage = job.stage(stageNumber);
        if (!stage.isPending()) {
            throw new TransitionException(job.id(), stageNumber,
                "Cannot dispatch stage " + stageNumber + " of job " + job.id() + ": stage is " + stage.status().getValue());
        }
        for (int earlier = 1; earlier < stageNumber; earlier++) {
            if (!job.stage(earlier).isCompleted()) {
                throw new TransitionException(job.id(), stageNumber,
                    "Cannot dispatch stage " + stageNumber + " of job " + job.id() + ": stage " + earlier + " is not completed");
            }
        }
    }
}
