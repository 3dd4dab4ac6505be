package tech.compendium.messagerouter.model;

import tech.compendium.queue.WorkMessage;

/**
 * A decoded work message together with where it came from.
 *
 * @param queue Queue the message was consumed from
 * @param deliveryId Broker delivery identifier (delivery tag), unique per delivery
 * @param exchange Exchange the message was originally published to
 * @param routingKey Routing key the message was originally published with
 * @param message The decoded work message
 * @param redelivered Whether the broker flagged this as a redelivery
 */
public record ConsumedMessage(
    String queue,
    String deliveryId,
    String exchange,
    String routingKey,
    WorkMessage message,
    boolean redelivered
) {
}
