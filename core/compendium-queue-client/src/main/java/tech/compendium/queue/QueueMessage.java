package tech.compendium.queue;

import java.util.Map;

/**
 * A message to be published to an exchange.
 *
 * @param messageId Unique identifier for the message
 * @param exchange Target exchange; the empty string addresses the default exchange (routing key = queue name)
 * @param routingKey Routing key matched against binding patterns
 * @param body Message body content (typically JSON)
 * @param persistent Whether the broker should persist the message
 * @param headers Additional message headers
 */
public record QueueMessage(
    String messageId,
    String exchange,
    String routingKey,
    String body,
    boolean persistent,
    Map<String, Object> headers
) {
    public QueueMessage {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    /**
     * Create a persistent message with no extra headers.
     */
    public static QueueMessage durable(String messageId, String exchange, String routingKey, String body) {
        return new QueueMessage(messageId, exchange, routingKey, body, true, Map.of());
    }

    /**
     * Create a message addressed straight to a queue through the default exchange.
     */
    public static QueueMessage toQueue(String messageId, String queueName, String body) {
        return new QueueMessage(messageId, "", queueName, body, true, Map.of());
    }
}
