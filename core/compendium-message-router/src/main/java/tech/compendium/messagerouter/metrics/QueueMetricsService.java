package tech.compendium.messagerouter.metrics;

import java.util.Map;

/**
 * Per-queue delivery counts and depth. Every method takes the queue name.
 */
public interface QueueMetricsService {

    void recordMessageReceived(String queueIdentifier);

    /**
     * One handler run finished.
     *
     * @param success false for a failed or rejected outcome
     */
    void recordMessageProcessed(String queueIdentifier, boolean success);

    /**
     * A failed message was republished with its attempt counter incremented.
     */
    void recordMessageRequeued(String queueIdentifier);

    void recordMessageDeadLettered(String queueIdentifier);

    /**
     * A delivery was acked without running because the same attempt is already in flight.
     */
    void recordMessageDuplicate(String queueIdentifier);

    /**
     * @param pendingMessages ready messages waiting in the queue
     * @param unackedMessages messages delivered but not yet settled
     */
    void recordQueueMetrics(String queueIdentifier, long pendingMessages, long unackedMessages);

    /**
     * @return the queue's counts, or empty counts for a queue never seen
     */
    QueueStats getQueueStats(String queueIdentifier);

    Map<String, QueueStats> getAllQueueStats();
}
