package tech.compendium.messagerouter.consumer;

import java.time.Instant;
import java.util.Optional;

/**
 * Receives deliveries from one queue and hands them to the consumer manager.
 */
public interface QueueConsumer {

    void start();

    /**
     * Stop taking new deliveries. Deliveries already handed out run to completion.
     */
    void stop();

    String queueName();

    /**
     * @return true once every consumer thread has terminated
     */
    boolean isFullyStopped();

    /**
     * @return the last time the broker showed signs of life to this consumer, empty before the first
     */
    Optional<Instant> lastHeartbeat();

    boolean isHealthy();
}
