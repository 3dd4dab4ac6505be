package tech.compendium.queue;

/**
 * Publishes messages to an exchange of the configured broker.
 *
 * <p>A publisher never retries. A failed publish is reported in the result and the
 * caller decides what to do with it.
 */
public interface QueuePublisher {

    /**
     * Returns once the broker has accepted the message, or with a failure result.
     */
    QueuePublishResult publish(QueueMessage message);

    QueueType getQueueType();

    /**
     * @return false when the publisher can no longer reach the broker
     */
    boolean isHealthy();

    /**
     * Release broker channels. Called on shutdown.
     */
    default void close() {
    }
}
