package tech.compendium.queue;

import java.util.Optional;

/**
 * Outcome of handing one message to the broker.
 *
 * @param messageId the message that was published
 * @param success true once the broker accepted the message
 * @param errorMessage why the broker did not accept it
 */
public record QueuePublishResult(
    String messageId,
    boolean success,
    Optional<String> errorMessage
) {

    public static QueuePublishResult success(String messageId) {
        return new QueuePublishResult(messageId, true, Optional.empty());
    }

    public static QueuePublishResult failure(String messageId, String error) {
        return new QueuePublishResult(messageId, false,
            Optional.of(error != null ? error : "Unknown error"));
    }
}
