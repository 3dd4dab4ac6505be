package tech.compendium.messagerouter.handler;

import tech.compendium.messagerouter.model.DeliveryOutcome;
import tech.compendium.queue.WorkMessage;

/**
 * Processes work messages consumed from one queue.
 */
@FunctionalInterface
public interface WorkHandler {

    /**
     * Handle one delivery. Throwing is equivalent to returning {@link DeliveryOutcome#failed}.
     */
    DeliveryOutcome handle(WorkMessage message) throws Exception;
}
