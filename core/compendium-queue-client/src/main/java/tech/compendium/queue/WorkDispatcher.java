package tech.compendium.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * Publishes work messages to the task exchange.
 *
 * <p>A publish either returns after the broker accepted the message or throws
 * {@link DispatchException}. Failed publishes are never retried here.
 */
public class WorkDispatcher {

    private static final Logger LOG = Logger.getLogger(WorkDispatcher.class);

    private final QueuePublisher publisher;
    private final WorkMessageCodec codec;
    private final String exchange;

    public WorkDispatcher(QueuePublisher publisher, WorkMessageCodec codec, String exchange) {
        this.publisher = publisher;
        this.codec = codec;
        this.exchange = exchange;
    }

    /**
     * Publish a persistent work message.
     */
    public void publish(String routingKey, WorkMessage message) {
        publish(routingKey, message, true);
    }

    public void publish(String routingKey, WorkMessage message, boolean durable) {
        String body;
        try {
            body = codec.encode(message);
        } catch (JsonProcessingException e) {
            throw new DispatchException(message.messageId(), routingKey,
                "Failed to serialize work message for job " + message.jobId(), e);
        }

        QueueMessage queueMessage = new QueueMessage(
            message.messageId(),
            exchange,
            routingKey,
            body,
            durable,
            Map.of("x-attempt", message.attempt())
        );

        QueuePublishResult result = publisher.publish(queueMessage);
        if (!result.success()) {
            String error = result.errorMessage().orElse("Unknown error");
            LOG.errorf("Broker rejected work message [%s] for job [%s] stage %d on [%s]: %s",
                message.messageId(), message.jobId(), message.stage(), routingKey, error);
            throw new DispatchException(message.messageId(), routingKey,
                "Publish to " + exchange + "/" + routingKey + " failed: " + error);
        }

        LOG.debugf("Dispatched work message [%s] for job [%s] stage %d (attempt %d) to [%s]",
            message.messageId(), message.jobId(), message.stage(), message.attempt(), routingKey);
    }

    public String getExchange() {
        return exchange;
    }
}
