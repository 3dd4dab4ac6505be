package tech.compendium.queue.rabbitmq;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import tech.compendium.queue.topology.BindingDeclaration;
import tech.compendium.queue.topology.ExchangeDeclaration;
import tech.compendium.queue.topology.QueueDeclaration;
import tech.compendium.queue.topology.TopologyAdmin;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Declares topology on a RabbitMQ broker.
 *
 * <p>Each declaration runs on its own short-lived channel, because a rejected declaration
 * (e.g. PRECONDITION_FAILED on a conflicting redeclare) closes the channel it ran on.
 */
public class RabbitMqTopologyAdmin implements TopologyAdmin {

    private final Connection connection;

    public RabbitMqTopologyAdmin(Connection connection) {
        this.connection = connection;
    }

    @Override
    public void declareExchange(ExchangeDeclaration exchange) throws IOException {
        withChannel(channel ->
            channel.exchangeDeclare(exchange.name(), exchange.type().getValue(), exchange.durable()));
    }

    @Override
    public void declareQueue(QueueDeclaration queue) throws IOException {
        withChannel(channel ->
            channel.queueDeclare(queue.name(), queue.durable(), false, queue.autoDelete(), queue.arguments()));
    }

    @Override
    public void bind(BindingDeclaration binding) throws IOException {
        withChannel(channel ->
            channel.queueBind(binding.queue(), binding.exchange(), binding.routingKey()));
    }

    private void withChannel(ChannelOperation operation) throws IOException {
        try (Channel channel = connection.createChannel()) {
            operation.run(channel);
        } catch (TimeoutException e) {
            throw new IOException("Timed out closing declaration channel", e);
        }
    }

    @FunctionalInterface
    private interface ChannelOperation {
        Object run(Channel channel) throws IOException;
    }
}
