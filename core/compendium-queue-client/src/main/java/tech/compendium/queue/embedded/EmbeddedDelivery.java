package tech.compendium.queue.embedded;

import java.util.Map;

/**
 * A message as held by an embedded queue.
 *
 * @param deliveryTag Tag assigned when the message is handed to a consumer (0 while ready)
 * @param messageId Publisher-assigned message ID
 * @param exchange Exchange the message was published to
 * @param routingKey Routing key the message was published with
 * @param body Message body
 * @param headers Message headers
 * @param redelivered Whether the message was requeued after a previous delivery
 */
public record EmbeddedDelivery(
    long deliveryTag,
    String messageId,
    String exchange,
    String routingKey,
    String body,
    Map<String, Object> headers,
    boolean redelivered
) {
    EmbeddedDelivery withDeliveryTag(long tag) {
        return new EmbeddedDelivery(tag, messageId, exchange, routingKey, body, headers, redelivered);
    }

    EmbeddedDelivery asRedelivered() {
        return new EmbeddedDelivery(0, messageId, exchange, routingKey, body, headers, true);
    }
}
