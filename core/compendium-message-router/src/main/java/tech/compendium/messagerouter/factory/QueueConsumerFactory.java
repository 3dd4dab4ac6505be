package tech.compendium.messagerouter.factory;

import tech.compendium.messagerouter.consumer.QueueConsumer;
import tech.compendium.messagerouter.manager.ConsumerManager;

public interface QueueConsumerFactory {

    /**
     * Creates a consumer for the configured broker type
     *
     * @param queueName the queue to consume from
     * @param connections number of channels/pollers for this queue
     * @param consumerManager the manager deliveries are routed to
     * @return a queue consumer instance
     */
    QueueConsumer createConsumer(String queueName, int connections, ConsumerManager consumerManager);
}
