package tech.compendium.messagerouter.consumer;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import tech.compendium.messagerouter.callback.MessageCallback;
import tech.compendium.messagerouter.manager.ConsumerManager;
import tech.compendium.messagerouter.metrics.QueueMetricsService;
import tech.compendium.messagerouter.model.ConsumedMessage;
import tech.compendium.queue.WorkMessage;
import tech.compendium.queue.WorkMessageCodec;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RabbitMqQueueConsumer against a mocked AMQP connection.
 */
class RabbitMqQueueConsumerTest {

    private Connection connection;
    private Channel channel;
    private ConsumerManager consumerManager;
    private QueueMetricsService metrics;
    private WorkMessageCodec codec;
    private RabbitMqQueueConsumer consumer;

    @BeforeEach
    void setUp() throws Exception {
        connection = mock(Connection.class);
        channel = mock(Channel.class);
        consumerManager = mock(ConsumerManager.class);
        metrics = mock(QueueMetricsService.class);
        codec = new WorkMessageCodec();

        when(connection.createChannel()).thenReturn(channel);
        when(connection.isOpen()).thenReturn(true);
        when(channel.isOpen()).thenReturn(true);
        when(channel.basicConsume(eq("pdf.processing"), eq(false), any(Consumer.class))).thenReturn("ctag-1");

        consumer = new RabbitMqQueueConsumer(connection, "pdf.processing", 1, consumerManager, metrics, codec, 1, 60);
    }

    @AfterEach
    void tearDown() {
        consumer.stop();
    }

    private Consumer startAndCaptureConsumer() throws Exception {
        consumer.start();
        ArgumentCaptor<Consumer> captor = ArgumentCaptor.forClass(Consumer.class);
        verify(channel).basicConsume(eq("pdf.processing"), eq(false), captor.capture());
        return captor.getValue();
    }

    @Test
    void start_usesManualAckWithPrefetch() throws Exception {
        startAndCaptureConsumer();

        verify(channel).basicQos(1);
        assertTrue(consumer.isHealthy());
    }

    @Test
    void delivery_isDecodedAndRouted() throws Exception {
        Consumer amqpConsumer = startAndCaptureConsumer();
        WorkMessage message = new WorkMessage("msg-1", "job-1", 1, 0, null);

        amqpConsumer.handleDelivery("ctag-1", new Envelope(42, false, "tasks", "pdf.process"),
            new AMQP.BasicProperties(), codec.encode(message).getBytes(StandardCharsets.UTF_8));

        ArgumentCaptor<ConsumedMessage> routed = ArgumentCaptor.forClass(ConsumedMessage.class);
        ArgumentCaptor<MessageCallback> callback = ArgumentCaptor.forClass(MessageCallback.class);
        verify(consumerManager).route(routed.capture(), callback.capture());

        assertEquals("pdf.processing", routed.getValue().queue());
        assertEquals("tasks", routed.getValue().exchange());
        assertEquals("pdf.process", routed.getValue().routingKey());
        assertEquals(message, routed.getValue().message());
        verify(metrics).recordMessageReceived("pdf.processing");

        callback.getValue().ack();
        verify(channel).basicAck(42, false);

        callback.getValue().nack(false);
        verify(channel).basicNack(42, false, false);
    }

    @Test
    void malformedDelivery_isNackedWithoutRequeue() throws Exception {
        Consumer amqpConsumer = startAndCaptureConsumer();

        amqpConsumer.handleDelivery("ctag-1", new Envelope(7, false, "tasks", "pdf.process"),
            new AMQP.BasicProperties(), "{\"jobId\":\"job-1\"}".getBytes(StandardCharsets.UTF_8));

        verify(channel).basicNack(7, false, false);
        verify(consumerManager, never()).route(any(), any());
        verify(metrics).recordMessageDeadLettered("pdf.processing");
    }

    @Test
    void stop_cancelsConsumer() throws Exception {
        startAndCaptureConsumer();

        consumer.stop();

        verify(channel).basicCancel("ctag-1");
        assertFalse(consumer.isHealthy());
    }

    @Test
    void closedChannel_isUnhealthy() throws Exception {
        startAndCaptureConsumer();
        when(channel.isOpen()).thenReturn(false);

        assertFalse(consumer.isHealthy());
    }
}
