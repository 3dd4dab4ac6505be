package tech.compendium.messagerouter.consumer;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import org.jboss.logging.Logger;
import tech.compendium.messagerouter.callback.MessageCallback;
import tech.compendium.messagerouter.manager.ConsumerManager;
import tech.compendium.messagerouter.metrics.QueueMetricsService;
import tech.compendium.queue.WorkMessageCodec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Push consumer for a RabbitMQ queue.
 *
 * <p>Each connection slot gets its own channel with manual acknowledgement and a
 * prefetch of {@code prefetchCount}. Deliveries are processed on the client library's
 * dispatch thread for the channel, so a channel handles one delivery at a time.
 */
public class RabbitMqQueueConsumer extends AbstractQueueConsumer {

    private static final Logger LOG = Logger.getLogger(RabbitMqQueueConsumer.class);

    private final Connection connection;
    private final int prefetchCount;
    private final long metricsPollIntervalMs;
    private final List<Channel> channels = new CopyOnWriteArrayList<>();
    private final Map<Channel, String> consumerTags = new ConcurrentHashMap<>();
    private final AtomicInteger deliveriesInProgress = new AtomicInteger(0);

    public RabbitMqQueueConsumer(
            Connection connection,
            String queueName,
            int connections,
            ConsumerManager consumerManager,
            QueueMetricsService queueMetrics,
            WorkMessageCodec codec,
            int prefetchCount,
            int metricsPollIntervalSeconds) {
        super(queueName, consumerManager, queueMetrics, codec, connections);
        this.connection = connection;
        this.prefetchCount = prefetchCount;
        this.metricsPollIntervalMs = metricsPollIntervalSeconds * 1000L;
    }

    @Override
    protected void startConsumption() {
        for (int i = 0; i < connections; i++) {
            try {
                Channel channel = connection.createChannel();
                channel.basicQos(prefetchCount);
                String consumerTag = channel.basicConsume(queueName, false, new DeliveryConsumer(channel));
                channels.add(channel);
                consumerTags.put(channel, consumerTag);
                LOG.debugf("Registered RabbitMQ consumer [%s] on queue [%s] (prefetch=%d)",
                    consumerTag, queueName, prefetchCount);
            } catch (IOException e) {
                LOG.errorf(e, "Failed to start RabbitMQ consumer on queue [%s]", queueName);
                throw new IllegalStateException("Failed to consume from queue " + queueName, e);
            }
        }
        updateHeartbeat();
    }

    @Override
    protected void pollQueueMetrics() {
        while (running.get()) {
            try {
                Channel channel = channels.isEmpty() ? null : channels.get(0);
                if (channel != null && channel.isOpen()) {
                    long pending = channel.messageCount(queueName);
                    queueMetrics.recordQueueMetrics(queueName, pending, deliveriesInProgress.get());
                }
                sleepWhileRunning(metricsPollIntervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                if (running.get()) {
                    LOG.errorf(e, "Error polling RabbitMQ queue metrics for [%s]", queueName);
                    try {
                        sleepWhileRunning(metricsPollIntervalMs); // Back off on error
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        }
        LOG.debugf("RabbitMQ queue metrics polling for queue [%s] exited cleanly", queueName);
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }

        // Stop new deliveries; in-progress ones still settle on their channel
        consumerTags.forEach((channel, tag) -> {
            try {
                if (channel.isOpen()) {
                    channel.basicCancel(tag);
                }
            } catch (IOException e) {
                LOG.warnf(e, "Error cancelling RabbitMQ consumer [%s] on queue [%s]", tag, queueName);
            }
        });

        executorService.submit(this::closeChannelsWhenIdle);
        super.stop();
    }

    private void closeChannelsWhenIdle() {
        try {
            while (deliveriesInProgress.get() > 0) {
                Thread.sleep(50);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        for (Channel channel : channels) {
            try {
                if (channel.isOpen()) {
                    channel.close();
                }
            } catch (Exception e) {
                LOG.warnf(e, "Error closing RabbitMQ channel for queue [%s]", queueName);
            }
        }
        channels.clear();
        consumerTags.clear();
        LOG.infof("Closed RabbitMQ channels for queue [%s]", queueName);
    }

    @Override
    public boolean isHealthy() {
        // Push consumers may legitimately sit idle, so the heartbeat is not consulted
        if (!running.get() || !connection.isOpen()) {
            return false;
        }
        return !channels.isEmpty() && channels.stream().allMatch(Channel::isOpen);
    }

    @Override
    public boolean isFullyStopped() {
        return super.isFullyStopped() && deliveriesInProgress.get() == 0;
    }

    private class DeliveryConsumer extends DefaultConsumer {

        DeliveryConsumer(Channel channel) {
            super(channel);
        }

        @Override
        public void handleDelivery(String consumerTag, Envelope envelope,
                                   AMQP.BasicProperties properties, byte[] body) {
            updateHeartbeat();
            deliveriesInProgress.incrementAndGet();
            try {
                processDelivery(new RawDelivery(
                    new String(body, StandardCharsets.UTF_8),
                    consumerTag + ":" + envelope.getDeliveryTag(),
                    envelope.getExchange(),
                    envelope.getRoutingKey(),
                    envelope.isRedeliver(),
                    new RabbitMqMessageCallback(getChannel(), envelope.getDeliveryTag())
                ));
            } catch (Exception e) {
                // Leave the delivery unacked; the broker requeues it when the channel closes
                LOG.errorf(e, "Error processing delivery %d from queue [%s]", envelope.getDeliveryTag(), queueName);
            } finally {
                deliveriesInProgress.decrementAndGet();
            }
        }

        @Override
        public void handleCancel(String consumerTag) {
            LOG.warnf("RabbitMQ consumer [%s] on queue [%s] was cancelled by the broker", consumerTag, queueName);
        }
    }

    /**
     * Settles one delivery on the channel it arrived on.
     */
    static class RabbitMqMessageCallback implements MessageCallback {
        private final Channel channel;
        private final long deliveryTag;

        RabbitMqMessageCallback(Channel channel, long deliveryTag) {
            this.channel = channel;
            this.deliveryTag = deliveryTag;
        }

        @Override
        public void ack() {
            try {
                channel.basicAck(deliveryTag, false);
            } catch (IOException e) {
                LOG.errorf(e, "Error acknowledging delivery %d", deliveryTag);
            }
        }

        @Override
        public void nack(boolean requeue) {
            try {
                channel.basicNack(deliveryTag, false, requeue);
            } catch (IOException e) {
                LOG.errorf(e, "Error nacking delivery %d (requeue=%s)", deliveryTag, requeue);
            }
        }
    }
}
