package tech.compendium.queue;

import java.util.UUID;

/**
 * A unit of work for one pipeline stage of one job.
 *
 * @param messageId Identifier shared by every delivery attempt of this unit of work
 * @param jobId The job the work belongs to
 * @param stage 1-indexed stage number
 * @param attempt Number of failed deliveries that preceded this one (0 for a fresh dispatch)
 * @param payload Opaque JSON payload, passed through to the stage executor
 */
public record WorkMessage(
    String messageId,
    String jobId,
    int stage,
    int attempt,
    String payload
) {
    /**
     * Create a first-attempt message with a generated message ID.
     */
    public static WorkMessage fresh(String jobId, int stage, String payload) {
        return new WorkMessage(UUID.randomUUID().toString(), jobId, stage, 0, payload);
    }

    /**
     * Copy of this message for the next delivery attempt.
     */
    public WorkMessage nextAttempt() {
        return new WorkMessage(messageId, jobId, stage, attempt + 1, payload);
    }

    /**
     * Key identifying one delivery attempt; redeliveries of the same attempt share it.
     */
    public String deliveryKey() {
        return messageId + ":" + attempt;
    }
}
