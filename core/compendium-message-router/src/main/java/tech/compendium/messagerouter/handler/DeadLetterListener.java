package tech.compendium.messagerouter.handler;

import tech.compendium.queue.WorkMessage;

/**
 * Notified after a work message has been routed to its dead-letter queue.
 */
@FunctionalInterface
public interface DeadLetterListener {

    DeadLetterListener NONE = (queue, message, reason) -> { };

    /**
     * @param queue the queue the message was consumed from
     * @param message the dead-lettered message
     * @param reason the last handler error
     */
    void onDeadLetter(String queue, WorkMessage message, String reason);
}
