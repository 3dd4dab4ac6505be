package tech.compendium.messagerouter.callback;

/**
 * Settles a single broker delivery. Each delivery gets its own callback instance.
 */
public interface MessageCallback {

    /**
     * Acknowledge the delivery; the broker forgets the message.
     */
    void ack();

    /**
     * Negatively acknowledge the delivery.
     *
     * @param requeue true to return the message to its queue, false to dead-letter it
     */
    void nack(boolean requeue);
}
