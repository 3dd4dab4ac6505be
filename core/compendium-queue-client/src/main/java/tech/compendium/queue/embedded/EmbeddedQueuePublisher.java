package tech.compendium.queue.embedded;

import org.jboss.logging.Logger;
import tech.compendium.queue.*;

/**
 * QueuePublisher backed by the in-process {@link EmbeddedBroker}.
 */
public class EmbeddedQueuePublisher implements QueuePublisher {

    private static final Logger LOG = Logger.getLogger(EmbeddedQueuePublisher.class);

    private final EmbeddedBroker broker;

    public EmbeddedQueuePublisher(EmbeddedBroker broker) {
        this.broker = broker;
    }

    @Override
    public QueuePublishResult publish(QueueMessage message) {
        try {
            int routed = broker.publish(message);
            LOG.debugf("Published message [%s] to embedded exchange [%s] with key [%s] (%d queue(s))",
                message.messageId(), message.exchange(), message.routingKey(), routed);
            return QueuePublishResult.success(message.messageId());
        } catch (Exception e) {
            LOG.errorf(e, "Failed to publish message [%s] to embedded broker", message.messageId());
            return QueuePublishResult.failure(message.messageId(), e.getMessage());
        }
    }

    @Override
    public QueueType getQueueType() {
        return QueueType.EMBEDDED;
    }

    @Override
    public boolean isHealthy() {
        return true;
    }
}
