package tech.compendium.queue.rabbitmq;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.compendium.queue.topology.BindingDeclaration;
import tech.compendium.queue.topology.ExchangeDeclaration;
import tech.compendium.queue.topology.QueueDeclaration;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RabbitMqTopologyAdminTest {

    private Connection mockConnection;
    private Channel mockChannel;
    private RabbitMqTopologyAdmin admin;

    @BeforeEach
    void setUp() throws IOException {
        mockConnection = mock(Connection.class);
        mockChannel = mock(Channel.class);
        when(mockConnection.createChannel()).thenReturn(mockChannel);
        admin = new RabbitMqTopologyAdmin(mockConnection);
    }

    @Test
    void declaresDurableTopicExchange() throws Exception {
        admin.declareExchange(ExchangeDeclaration.durableTopic("tasks"));

        verify(mockChannel).exchangeDeclare("tasks", "topic", true);
        verify(mockChannel).close();
    }

    @Test
    void declaresQueueWithDeadLetterArgument() throws Exception {
        admin.declareQueue(QueueDeclaration.durable("pdf.processing").withDeadLetterExchange("dlx"));

        verify(mockChannel).queueDeclare("pdf.processing", true, false, false,
            Map.of("x-dead-letter-exchange", "dlx"));
    }

    @Test
    void bindsQueue() throws Exception {
        admin.bind(new BindingDeclaration("notifications", "events", "notification.*"));

        verify(mockChannel).queueBind("notifications", "events", "notification.*");
    }

    @Test
    void propagatesBrokerRejection() throws Exception {
        when(mockChannel.exchangeDeclare(anyString(), anyString(), anyBoolean()))
            .thenThrow(new IOException("PRECONDITION_FAILED"));

        assertThrows(IOException.class, () -> admin.declareExchange(ExchangeDeclaration.durableTopic("tasks")));
        verify(mockChannel).close();
    }
}
