package tech.compendium.queue;

import com.rabbitmq.client.Connection;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.compendium.queue.embedded.EmbeddedBroker;
import tech.compendium.queue.embedded.EmbeddedQueuePublisher;
import tech.compendium.queue.rabbitmq.RabbitMqQueuePublisher;

/**
 * Factory for creating QueuePublisher instances based on configuration.
 */
@ApplicationScoped
public class QueuePublisherFactory {

    private static final Logger LOG = Logger.getLogger(QueuePublisherFactory.class);

    @Inject
    Instance<Connection> rabbitConnectionInstance;

    @Inject
    Instance<EmbeddedBroker> embeddedBrokerInstance;

    public QueuePublisherFactory() {
        // CDI will inject dependencies
    }

    QueuePublisherFactory(Instance<Connection> rabbitConnectionInstance, Instance<EmbeddedBroker> embeddedBrokerInstance) {
        this.rabbitConnectionInstance = rabbitConnectionInstance;
        this.embeddedBrokerInstance = embeddedBrokerInstance;
    }

    /**
     * Create a QueuePublisher based on the provided configuration.
     *
     * @param config Queue configuration
     * @return QueuePublisher instance
     * @throws IllegalStateException if the broker for the configured type is not available
     */
    public QueuePublisher create(QueueConfig config) {
        return switch (config.queueType()) {
            case RABBITMQ -> createRabbitMqPublisher(config);
            case EMBEDDED -> createEmbeddedPublisher();
        };
    }

    private QueuePublisher createRabbitMqPublisher(QueueConfig config) {
        if (rabbitConnectionInstance.isUnsatisfied()) {
            throw new IllegalStateException(
                "RabbitMQ Connection not available. Configure message-router.rabbitmq.uri.");
        }

        LOG.infof("Creating RabbitMQ publisher (confirms=%s)", config.publisherConfirms());
        return new RabbitMqQueuePublisher(rabbitConnectionInstance.get(), config);
    }

    private QueuePublisher createEmbeddedPublisher() {
        if (embeddedBrokerInstance.isUnsatisfied()) {
            throw new IllegalStateException("Embedded broker not available");
        }

        LOG.info("Creating embedded queue publisher");
        return new EmbeddedQueuePublisher(embeddedBrokerInstance.get());
    }
}
