package tech.compendium.queue;

/**
 * Supported broker implementations.
 */
public enum QueueType {
    /** RabbitMQ over AMQP 0-9-1 */
    RABBITMQ,

    /** In-process broker with topic-exchange semantics, for development and tests */
    EMBEDDED
}
