package tech.compendium.queue.topology;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.compendium.queue.embedded.EmbeddedBroker;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TopologyProvisionerTest {

    private EmbeddedBroker broker;
    private TopologyProvisioner provisioner;

    @BeforeEach
    void setUp() {
        broker = new EmbeddedBroker();
        provisioner = new TopologyProvisioner(broker);
    }

    @Test
    void provisionsPipelineTopology() {
        provisioner.provision(PipelineTopology.definition());

        var snapshot = broker.topologySnapshot();
        assertEquals(3, snapshot.exchanges().size());
        assertEquals(8, snapshot.queues().size());
        assertEquals(8, snapshot.bindings().size());

        assertTrue(snapshot.exchanges().contains(ExchangeDeclaration.durableTopic("tasks")));
        assertTrue(snapshot.exchanges().contains(ExchangeDeclaration.durableTopic("events")));
        assertTrue(snapshot.exchanges().contains(ExchangeDeclaration.durableTopic("dlx")));

        assertTrue(snapshot.bindings().contains(new BindingDeclaration("pdf.processing", "tasks", "pdf.process")));
        assertTrue(snapshot.bindings().contains(new BindingDeclaration("notifications", "events", "notification.*")));
        assertTrue(snapshot.bindings().contains(new BindingDeclaration("pdf.processing.dlq", "dlx", "pdf.process")));
        assertTrue(snapshot.bindings().contains(new BindingDeclaration("notifications.dlq", "dlx", "notification.*")));
    }

    @Test
    void primaryQueuesDeadLetterToDlx() {
        provisioner.provision(PipelineTopology.definition());

        var queues = broker.topologySnapshot().queues();
        var deckGeneration = queues.stream().filter(q -> q.name().equals("deck.generation")).findFirst().orElseThrow();
        var deckDlq = queues.stream().filter(q -> q.name().equals("deck.generation.dlq")).findFirst().orElseThrow();

        assertEquals(Map.of("x-dead-letter-exchange", "dlx"), deckGeneration.arguments());
        assertTrue(deckGeneration.durable());
        assertTrue(deckDlq.arguments().isEmpty(), "DLQs must not dead-letter further");
    }

    @Test
    void provisioningTwiceIsANoOp() {
        provisioner.provision(PipelineTopology.definition());
        var first = broker.topologySnapshot();

        assertDoesNotThrow(() -> provisioner.provision(PipelineTopology.definition()));

        assertEquals(first, broker.topologySnapshot());
    }

    @Test
    void conflictingRedeclareFailsProvisioning() throws IOException {
        broker.declareQueue(new QueueDeclaration("pdf.processing", false, true, Map.of()));

        var ex = assertThrows(TopologyProvisioningException.class,
            () -> provisioner.provision(PipelineTopology.definition()));

        assertEquals("queue:pdf.processing", ex.getResource());
        assertInstanceOf(IOException.class, ex.getCause());
    }

    @Test
    void brokerFailureStopsAtFirstResource() throws IOException {
        TopologyAdmin admin = mock(TopologyAdmin.class);
        doThrow(new IOException("Connection refused")).when(admin).declareExchange(any());

        var ex = assertThrows(TopologyProvisioningException.class,
            () -> new TopologyProvisioner(admin).provision(PipelineTopology.definition()));

        assertEquals("exchange:tasks", ex.getResource());
        assertTrue(ex.getMessage().contains("Connection refused"));
        verify(admin, never()).declareQueue(any());
        verify(admin, never()).bind(any());
    }

    @Test
    void declaresExchangesThenQueuesThenBindings() throws IOException {
        TopologyAdmin admin = mock(TopologyAdmin.class);
        var order = inOrder(admin);

        new TopologyProvisioner(admin).provision(PipelineTopology.definition());

        order.verify(admin, times(3)).declareExchange(any());
        order.verify(admin, times(8)).declareQueue(any());
        order.verify(admin, times(8)).bind(any());
    }
}
