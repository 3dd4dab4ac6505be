package tech.compendium.messagerouter.embedded;

import org.jboss.logging.Logger;
import tech.compendium.messagerouter.callback.MessageCallback;
import tech.compendium.messagerouter.consumer.AbstractQueueConsumer;
import tech.compendium.messagerouter.manager.ConsumerManager;
import tech.compendium.messagerouter.metrics.QueueMetricsService;
import tech.compendium.queue.WorkMessageCodec;
import tech.compendium.queue.embedded.EmbeddedBroker;
import tech.compendium.queue.embedded.EmbeddedDelivery;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Polling consumer for a queue on the in-process {@link EmbeddedBroker}.
 * Used for development and tests where no RabbitMQ server is available.
 */
public class EmbeddedQueueConsumer extends AbstractQueueConsumer {

    private static final Logger LOG = Logger.getLogger(EmbeddedQueueConsumer.class);
    private static final long METRICS_POLL_INTERVAL_MS = 5_000;

    private final EmbeddedBroker broker;
    private final int receiveTimeoutMs;

    public EmbeddedQueueConsumer(
            EmbeddedBroker broker,
            String queueName,
            int connections,
            ConsumerManager consumerManager,
            QueueMetricsService queueMetrics,
            WorkMessageCodec codec,
            int receiveTimeoutMs) {
        super(queueName, consumerManager, queueMetrics, codec, connections);
        this.broker = broker;
        this.receiveTimeoutMs = receiveTimeoutMs;
    }

    @Override
    protected void startConsumption() {
        for (int i = 0; i < connections; i++) {
            executorService.submit(this::consumeMessages);
        }
    }

    private void consumeMessages() {
        LOG.infof("Embedded queue consumer started for [%s]", queueName);

        while (running.get()) {
            updateHeartbeat();

            try {
                Optional<EmbeddedDelivery> received = broker.receive(queueName, receiveTimeoutMs, TimeUnit.MILLISECONDS);
                if (received.isEmpty()) {
                    continue;
                }

                EmbeddedDelivery delivery = received.get();
                processDelivery(new RawDelivery(
                    delivery.body(),
                    String.valueOf(delivery.deliveryTag()),
                    delivery.exchange(),
                    delivery.routingKey(),
                    delivery.redelivered(),
                    new EmbeddedMessageCallback(broker, queueName, delivery.deliveryTag())
                ));

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.info("Embedded queue consumer interrupted, exiting");
                break;
            } catch (Exception e) {
                LOG.errorf(e, "Error consuming from embedded queue [%s]", queueName);
                try {
                    Thread.sleep(1000); // Brief pause on error
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        LOG.infof("Embedded queue consumer stopped for [%s]", queueName);
    }

    @Override
    protected void pollQueueMetrics() {
        while (running.get()) {
            try {
                queueMetrics.recordQueueMetrics(queueName,
                    broker.messageCount(queueName), broker.unackedCount(queueName));
                sleepWhileRunning(METRICS_POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                LOG.errorf(e, "Error reading embedded queue metrics for [%s]", queueName);
                break;
            }
        }
    }

    /**
     * Settles a delivery held unacked by the embedded broker.
     */
    static class EmbeddedMessageCallback implements MessageCallback {
        private final EmbeddedBroker broker;
        private final String queueName;
        private final long deliveryTag;

        EmbeddedMessageCallback(EmbeddedBroker broker, String queueName, long deliveryTag) {
            this.broker = broker;
            this.queueName = queueName;
            this.deliveryTag = deliveryTag;
        }

        @Override
        public void ack() {
            if (!broker.ack(queueName, deliveryTag)) {
                LOG.warnf("Ack for unknown delivery %d on embedded queue [%s]", deliveryTag, queueName);
            }
        }

        @Override
        public void nack(boolean requeue) {
            if (!broker.reject(queueName, deliveryTag, requeue)) {
                LOG.warnf("Nack for unknown delivery %d on embedded queue [%s]", deliveryTag, queueName);
            }
        }
    }
}
