package tech.compendium.queue.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import org.jboss.logging.Logger;
import tech.compendium.queue.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * RabbitMQ implementation of QueuePublisher.
 * Publishes on a single confirm-mode channel; a publish reports success only after the broker confirmed it.
 */
public class RabbitMqQueuePublisher implements QueuePublisher {

    private static final Logger LOG = Logger.getLogger(RabbitMqQueuePublisher.class);
    private static final int PERSISTENT = 2;
    private static final int NON_PERSISTENT = 1;

    private final Connection connection;
    private final QueueConfig config;

    // Channels are not thread-safe; guarded by this
    private Channel channel;

    public RabbitMqQueuePublisher(Connection connection, QueueConfig config) {
        this.connection = connection;
        this.config = config;
    }

    @Override
    public synchronized QueuePublishResult publish(QueueMessage message) {
        try {
            Channel ch = channel();

            AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .messageId(message.messageId())
                .contentType("application/json")
                .deliveryMode(message.persistent() ? PERSISTENT : NON_PERSISTENT)
                .headers(message.headers())
                .timestamp(new Date())
                .build();

            ch.basicPublish(
                message.exchange(),
                message.routingKey(),
                properties,
                message.body().getBytes(StandardCharsets.UTF_8)
            );

            if (config.publisherConfirms()) {
                ch.waitForConfirmsOrDie(config.confirmTimeoutMs());
            }

            LOG.debugf("Published message [%s] to RabbitMQ exchange [%s] with key [%s]",
                message.messageId(), message.exchange(), message.routingKey());

            return QueuePublishResult.success(message.messageId());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return QueuePublishResult.failure(message.messageId(), "Interrupted while waiting for publisher confirm");
        } catch (Exception e) {
            LOG.errorf(e, "Failed to publish message [%s] to RabbitMQ", message.messageId());
            discardChannel();
            return QueuePublishResult.failure(message.messageId(), e.getMessage());
        }
    }

    @Override
    public QueueType getQueueType() {
        return QueueType.RABBITMQ;
    }

    @Override
    public boolean isHealthy() {
        try {
            return connection.isOpen();
        } catch (Exception e) {
            LOG.warnf("RabbitMQ health check failed: %s", e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized void close() {
        // Connection is managed by the CDI producer, only the channel is ours
        discardChannel();
    }

    private Channel channel() throws IOException {
        if (channel == null || !channel.isOpen()) {
            channel = connection.createChannel();
            if (config.publisherConfirms()) {
                channel.confirmSelect();
            }
        }
        return channel;
    }

    private void discardChannel() {
        if (channel == null) {
            return;
        }
        try {
            if (channel.isOpen()) {
                channel.close();
            }
        } catch (Exception e) {
            LOG.debugf("Ignoring error while closing publisher channel: %s", e.getMessage());
        }
        channel = null;
    }
}
