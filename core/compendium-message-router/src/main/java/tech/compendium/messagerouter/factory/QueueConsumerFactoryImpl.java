package tech.compendium.messagerouter.factory;

import com.rabbitmq.client.Connection;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import tech.compendium.messagerouter.consumer.QueueConsumer;
import tech.compendium.messagerouter.consumer.RabbitMqQueueConsumer;
import tech.compendium.messagerouter.embedded.EmbeddedQueueConsumer;
import tech.compendium.messagerouter.manager.ConsumerManager;
import tech.compendium.messagerouter.metrics.QueueMetricsService;
import tech.compendium.queue.QueueType;
import tech.compendium.queue.WorkMessageCodec;
import tech.compendium.queue.embedded.EmbeddedBroker;

@ApplicationScoped
public class QueueConsumerFactoryImpl implements QueueConsumerFactory {

    private static final Logger LOG = Logger.getLogger(QueueConsumerFactoryImpl.class);

    @ConfigProperty(name = "message-router.queue-type", defaultValue = "RABBITMQ")
    QueueType queueType;

    @ConfigProperty(name = "message-router.rabbitmq.prefetch", defaultValue = "1")
    int rabbitPrefetch;

    @ConfigProperty(name = "message-router.metrics.poll-interval-seconds", defaultValue = "15")
    int metricsPollIntervalSeconds;

    @ConfigProperty(name = "message-router.embedded.receive-timeout-ms", defaultValue = "1000")
    int embeddedReceiveTimeoutMs;

    @Inject
    QueueMetricsService queueMetrics;

    @Inject
    WorkMessageCodec codec;

    @Inject
    Instance<Connection> rabbitConnection;

    @Inject
    Instance<EmbeddedBroker> embeddedBroker;

    @Override
    public QueueConsumer createConsumer(String queueName, int connections, ConsumerManager consumerManager) {
        LOG.infof("Creating %s consumer for queue [%s] with %d connections", queueType, queueName, connections);

        return switch (queueType) {
            case RABBITMQ -> new RabbitMqQueueConsumer(
                rabbitConnection.get(),
                queueName,
                connections,
                consumerManager,
                queueMetrics,
                codec,
                rabbitPrefetch,
                metricsPollIntervalSeconds
            );
            case EMBEDDED -> new EmbeddedQueueConsumer(
                embeddedBroker.get(),
                queueName,
                connections,
                consumerManager,
                queueMetrics,
                codec,
                embeddedReceiveTimeoutMs
            );
        };
    }
}
