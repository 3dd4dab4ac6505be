package tech.compendium.queue;

import java.util.Optional;

/**
 * Configuration for a queue publisher.
 *
 * @param queueType The type of broker (RabbitMQ, Embedded)
 * @param brokerUri AMQP URI of the broker (RabbitMQ only)
 * @param publisherConfirms Whether to wait for broker confirms before reporting success
 * @param confirmTimeoutMs How long to wait for a publisher confirm
 */
public record QueueConfig(
    QueueType queueType,
    Optional<String> brokerUri,
    boolean publisherConfirms,
    long confirmTimeoutMs
) {
    /**
     * Create config for a RabbitMQ publisher with confirms enabled.
     */
    public static QueueConfig rabbitMq(String brokerUri) {
        return new QueueConfig(
            QueueType.RABBITMQ,
            Optional.of(brokerUri),
            true,
            5_000
        );
    }

    /**
     * Create config for the in-process broker.
     */
    public static QueueConfig embedded() {
        return new QueueConfig(
            QueueType.EMBEDDED,
            Optional.empty(),
            false,
            0
        );
    }
}
