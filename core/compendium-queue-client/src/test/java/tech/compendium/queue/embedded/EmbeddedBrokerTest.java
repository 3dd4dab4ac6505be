package tech.compendium.queue.embedded;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.compendium.queue.QueueMessage;
import tech.compendium.queue.topology.ExchangeDeclaration;
import tech.compendium.queue.topology.ExchangeType;
import tech.compendium.queue.topology.PipelineTopology;
import tech.compendium.queue.topology.TopologyProvisioner;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddedBrokerTest {

    private EmbeddedBroker broker;

    @BeforeEach
    void setUp() {
        broker = new EmbeddedBroker();
        new TopologyProvisioner(broker).provision(PipelineTopology.definition());
    }

    @Test
    void routesByTopicBinding() {
        assertEquals(1, broker.publish(QueueMessage.durable("m1", "tasks", "pdf.process", "a")));
        assertEquals(1, broker.publish(QueueMessage.durable("m2", "events", "notification.completed", "b")));

        assertEquals(List.of("a"), broker.messageBodies("pdf.processing"));
        assertEquals(List.of("b"), broker.messageBodies("notifications"));
        assertEquals(0, broker.messageCount("deck.generation"));
    }

    @Test
    void dropsUnroutableMessages() {
        assertEquals(0, broker.publish(QueueMessage.durable("m1", "tasks", "unknown.key", "a")));
        assertEquals(0, broker.publish(QueueMessage.durable("m2", "events", "notification.completed.extra", "b")));
    }

    @Test
    void rejectsPublishToMissingExchange() {
        assertThrows(IllegalStateException.class,
            () -> broker.publish(QueueMessage.durable("m1", "nope", "pdf.process", "a")));
    }

    @Test
    void defaultExchangeAddressesQueueByName() {
        assertEquals(1, broker.publish(QueueMessage.toQueue("m1", "deck.generation", "direct")));
        assertEquals(List.of("direct"), broker.messageBodies("deck.generation"));
    }

    @Test
    void deliversInFifoOrder() throws InterruptedException {
        for (int i = 1; i <= 3; i++) {
            broker.publish(QueueMessage.durable("m" + i, "tasks", "deck.generate", "body-" + i));
        }

        for (int i = 1; i <= 3; i++) {
            var delivery = broker.receive("deck.generation", 100, TimeUnit.MILLISECONDS).orElseThrow();
            assertEquals("body-" + i, delivery.body());
            assertTrue(broker.ack("deck.generation", delivery.deliveryTag()));
        }
        assertTrue(broker.receive("deck.generation", 10, TimeUnit.MILLISECONDS).isEmpty());
    }

    @Test
    void unackedDeliveryIsNotRedeliveredToOthers() throws InterruptedException {
        broker.publish(QueueMessage.durable("m1", "tasks", "pdf.process", "a"));

        var delivery = broker.receive("pdf.processing", 100, TimeUnit.MILLISECONDS).orElseThrow();

        assertEquals(0, broker.messageCount("pdf.processing"));
        assertEquals(1, broker.unackedCount("pdf.processing"));
        assertTrue(broker.receive("pdf.processing", 10, TimeUnit.MILLISECONDS).isEmpty());

        broker.ack("pdf.processing", delivery.deliveryTag());
        assertEquals(0, broker.unackedCount("pdf.processing"));
    }

    @Test
    void requeuedDeliveryReturnsToHeadMarkedRedelivered() throws InterruptedException {
        broker.publish(QueueMessage.durable("m1", "tasks", "pdf.process", "first"));
        broker.publish(QueueMessage.durable("m2", "tasks", "pdf.process", "second"));

        var first = broker.receive("pdf.processing", 100, TimeUnit.MILLISECONDS).orElseThrow();
        broker.reject("pdf.processing", first.deliveryTag(), true);

        var again = broker.receive("pdf.processing", 100, TimeUnit.MILLISECONDS).orElseThrow();
        assertEquals("first", again.body());
        assertTrue(again.redelivered());
        assertNotEquals(first.deliveryTag(), again.deliveryTag());
    }

    @Test
    void rejectedDeliveryIsDeadLetteredWithOriginalRoutingKey() throws InterruptedException {
        broker.publish(QueueMessage.durable("m1", "tasks", "embedding.generate", "poison"));

        var delivery = broker.receive("embedding.generation", 100, TimeUnit.MILLISECONDS).orElseThrow();
        assertTrue(broker.reject("embedding.generation", delivery.deliveryTag(), false));

        assertEquals(0, broker.messageCount("embedding.generation"));
        assertEquals(List.of("poison"), broker.messageBodies("embedding.generation.dlq"));

        var dead = broker.receive("embedding.generation.dlq", 100, TimeUnit.MILLISECONDS).orElseThrow();
        assertEquals("dlx", dead.exchange());
        assertEquals("embedding.generate", dead.routingKey());
        assertEquals("embedding.generation", dead.headers().get(EmbeddedBroker.DEATH_QUEUE_HEADER));
    }

    @Test
    void ackWithUnknownTagReturnsFalse() {
        assertFalse(broker.ack("pdf.processing", 999));
        assertFalse(broker.reject("pdf.processing", 999, false));
    }

    @Test
    void conflictingExchangeRedeclareFails() {
        var ex = assertThrows(IOException.class,
            () -> broker.declareExchange(new ExchangeDeclaration("tasks", ExchangeType.DIRECT, true)));
        assertTrue(ex.getMessage().startsWith("PRECONDITION_FAILED"));
    }

    @Test
    void receiveTimesOutOnEmptyQueue() throws InterruptedException {
        long start = System.nanoTime();
        assertTrue(broker.receive("notifications", 50, TimeUnit.MILLISECONDS).isEmpty());
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(40));
    }
}
