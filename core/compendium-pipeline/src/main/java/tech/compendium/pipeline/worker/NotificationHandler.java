package tech.compendium.pipeline.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.compendium.messagerouter.handler.WorkHandler;
import tech.compendium.messagerouter.model.DeliveryOutcome;
import tech.compendium.pipeline.dispatch.JobEvent;
import tech.compendium.queue.WorkMessage;

/**
 * Consumes the {@code notifications} queue and logs terminal job events.
 */
@ApplicationScoped
public class NotificationHandler implements WorkHandler {

    private static final Logger LOG = Logger.getLogger(NotificationHandler.class);

    @Inject
    ObjectMapper objectMapper;

    public NotificationHandler() {
        // CDI will inject dependencies
    }

    public NotificationHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public DeliveryOutcome handle(WorkMessage message) {
        if (message.payload() == null) {
            return DeliveryOutcome.rejected("Notification for job " + message.jobId() + " has no event");
        }

        JobEvent event;
        try {
            event = objectMapper.readValue(message.payload(), JobEvent.class);
        } catch (JsonProcessingException e) {
            LOG.warnf("Unreadable notification for job [%s]: %s", message.jobId(), e.getOriginalMessage());
            return DeliveryOutcome.rejected("Unreadable notification: " + e.getOriginalMessage());
        }

        if (event.type() == null) {
            return DeliveryOutcome.rejected("Notification for job " + message.jobId() + " has no event type");
        }

        switch (event.type()) {
            case COMPLETED -> LOG.infof("Notification: job [%s] (%s) completed, deck [%s]",
                event.jobId(), event.fileName(), event.deckId());
            case FAILED -> LOG.infof("Notification: job [%s] (%s) failed at stage %d: %s",
                event.jobId(), event.fileName(), event.failedStage(), event.error());
        }
        return DeliveryOutcome.success();
    }
}
