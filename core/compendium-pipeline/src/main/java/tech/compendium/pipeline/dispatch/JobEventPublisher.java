package tech.compendium.pipeline.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;
import tech.compendium.pipeline.job.entity.Job;
import tech.compendium.pipeline.job.model.PipelineStage;
import tech.compendium.queue.WorkDispatcher;
import tech.compendium.queue.WorkMessage;
import tech.compendium.queue.topology.PipelineTopology;

/**
 * Publishes terminal job events to the {@code events} exchange.
 *
 * <p>The event travels as the payload of a work message so the notification consumer goes
 * through the same delivery path as the task queues. A failed publish is logged and reported
 * to the caller; it never undoes the job transition that preceded it.
 */
@ApplicationScoped
public class JobEventPublisher {

    private static final Logger LOG = Logger.getLogger(JobEventPublisher.class);

    @Inject
    @Named(PipelineDispatchers.EVENTS)
    WorkDispatcher eventDispatcher;

    @Inject
    ObjectMapper objectMapper;

    public JobEventPublisher() {
        // CDI will inject dependencies
    }

    public JobEventPublisher(WorkDispatcher eventDispatcher, ObjectMapper objectMapper) {
        this.eventDispatcher = eventDispatcher;
        this.objectMapper = objectMapper;
    }

    public boolean publishCompleted(Job job) {
        return publish(JobEvent.completed(job), PipelineTopology.NOTIFICATION_COMPLETED_KEY, PipelineStage.COUNT);
    }

    public boolean publishFailed(Job job) {
        return publish(JobEvent.failed(job), PipelineTopology.NOTIFICATION_FAILED_KEY, job.currentStage());
    }

    /**
     * @return true if the broker accepted the event
     */
    private boolean publish(JobEvent event, String routingKey, int stage) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            eventDispatcher.publish(routingKey, WorkMessage.fresh(event.jobId(), stage, payload));
            LOG.infof("Published [%s] event for job [%s]", event.type().getValue(), event.jobId());
            return true;
        } catch (Exception e) {
            LOG.errorf(e, "Failed to publish [%s] event for job [%s]", event.type().getValue(), event.jobId());
            return false;
        }
    }
}
