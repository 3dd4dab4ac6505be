package tech.compendium.queue;

/**
 * Thrown when the broker does not accept a published work message.
 * Never retried by the dispatch layer; the caller decides what to do.
 */
public class DispatchException extends RuntimeException {

    private final String messageId;
    private final String routingKey;

    public DispatchException(String messageId, String routingKey, String message) {
        this(messageId, routingKey, message, null);
    }

    public DispatchException(String messageId, String routingKey, String message, Throwable cause) {
        super(message, cause);
        this.messageId = messageId;
        this.routingKey = routingKey;
    }

    public String getMessageId() {
        return messageId;
    }

    public String getRoutingKey() {
        return routingKey;
    }
}
