package tech.compendium.queue.embedded;

import org.jboss.logging.Logger;
import tech.compendium.queue.QueueMessage;
import tech.compendium.queue.topology.BindingDeclaration;
import tech.compendium.queue.topology.ExchangeDeclaration;
import tech.compendium.queue.topology.QueueDeclaration;
import tech.compendium.queue.topology.TopologyAdmin;

import java.io.IOException;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-process message broker with AMQP-style exchanges, bindings and dead-lettering.
 * Useful for development and single-node deployments, and as the broker in tests.
 *
 * Features:
 * - Topic, direct and fanout exchanges; the empty exchange name routes straight to a queue
 * - Per-queue FIFO with unacked tracking; requeued deliveries go back to the head
 * - Rejected (not requeued) deliveries are republished to the queue's x-dead-letter-exchange
 *   with their original routing key
 * - Idempotent declarations; a conflicting redeclare fails like PRECONDITION_FAILED
 *
 * Nothing is persisted; the broker lives as long as the JVM.
 */
public class EmbeddedBroker implements TopologyAdmin {

    private static final Logger LOG = Logger.getLogger(EmbeddedBroker.class);

    public static final String DEATH_QUEUE_HEADER = "x-first-death-queue";
    public static final String DEATH_REASON_HEADER = "x-first-death-reason";

    private final Map<String, ExchangeDeclaration> exchanges = new ConcurrentHashMap<>();
    private final Map<String, EmbeddedQueue> queues = new ConcurrentHashMap<>();
    private final Set<BindingDeclaration> bindings = ConcurrentHashMap.newKeySet();
    private final AtomicLong deliveryTags = new AtomicLong();

    @Override
    public synchronized void declareExchange(ExchangeDeclaration exchange) throws IOException {
        ExchangeDeclaration existing = exchanges.get(exchange.name());
        if (existing == null) {
            exchanges.put(exchange.name(), exchange);
            return;
        }
        if (!existing.equals(exchange)) {
            throw new IOException("PRECONDITION_FAILED - inequivalent arg for exchange '" + exchange.name()
                + "': declared " + exchange + " but found " + existing);
        }
    }

    @Override
    public synchronized void declareQueue(QueueDeclaration queue) throws IOException {
        EmbeddedQueue existing = queues.get(queue.name());
        if (existing == null) {
            queues.put(queue.name(), new EmbeddedQueue(queue, deliveryTags));
            return;
        }
        if (!existing.declaration().equals(queue)) {
            throw new IOException("PRECONDITION_FAILED - inequivalent arg for queue '" + queue.name()
                + "': declared " + queue + " but found " + existing.declaration());
        }
    }

    @Override
    public synchronized void bind(BindingDeclaration binding) throws IOException {
        if (!queues.containsKey(binding.queue())) {
            throw new IOException("NOT_FOUND - no queue '" + binding.queue() + "'");
        }
        if (!exchanges.containsKey(binding.exchange())) {
            throw new IOException("NOT_FOUND - no exchange '" + binding.exchange() + "'");
        }
        bindings.add(binding);
    }

    /**
     * Route a message to every queue whose binding matches its routing key.
     * Unroutable messages are dropped, as on a real broker without the mandatory flag.
     *
     * @return number of queues the message was delivered to
     * @throws IllegalStateException if the exchange does not exist
     */
    public int publish(QueueMessage message) {
        EmbeddedDelivery delivery = new EmbeddedDelivery(
            0,
            message.messageId(),
            message.exchange(),
            message.routingKey(),
            message.body(),
            message.headers(),
            false
        );
        return route(delivery);
    }

    private int route(EmbeddedDelivery delivery) {
        if (delivery.exchange().isEmpty()) {
            EmbeddedQueue queue = queues.get(delivery.routingKey());
            if (queue == null) {
                LOG.debugf("Dropping message [%s]: no queue named [%s]", delivery.messageId(), delivery.routingKey());
                return 0;
            }
            queue.enqueue(delivery);
            return 1;
        }

        ExchangeDeclaration exchange = exchanges.get(delivery.exchange());
        if (exchange == null) {
            throw new IllegalStateException("NOT_FOUND - no exchange '" + delivery.exchange() + "'");
        }

        Set<String> targets = new LinkedHashSet<>();
        for (BindingDeclaration binding : bindings) {
            if (binding.exchange().equals(exchange.name()) && matches(exchange, binding.routingKey(), delivery.routingKey())) {
                targets.add(binding.queue());
            }
        }

        for (String target : targets) {
            queues.get(target).enqueue(delivery);
        }

        if (targets.isEmpty()) {
            LOG.debugf("Dropping unroutable message [%s] on exchange [%s] with key [%s]",
                delivery.messageId(), delivery.exchange(), delivery.routingKey());
        }
        return targets.size();
    }

    private boolean matches(ExchangeDeclaration exchange, String pattern, String routingKey) {
        return switch (exchange.type()) {
            case TOPIC -> TopicMatcher.matches(pattern, routingKey);
            case DIRECT -> pattern.equals(routingKey);
            case FANOUT -> true;
        };
    }

    /**
     * Take the next ready message from a queue, waiting up to the timeout.
     * The message stays unacked until {@link #ack} or {@link #reject} is called with its tag.
     */
    public Optional<EmbeddedDelivery> receive(String queueName, long timeout, TimeUnit unit) throws InterruptedException {
        return queue(queueName).receive(timeout, unit);
    }

    public boolean ack(String queueName, long deliveryTag) {
        return queue(queueName).ack(deliveryTag).isPresent();
    }

    /**
     * Reject an unacked delivery. With {@code requeue} it returns to the head of its queue;
     * otherwise it is dead-lettered when the queue has a dead-letter exchange, or discarded.
     */
    public boolean reject(String queueName, long deliveryTag, boolean requeue) {
        EmbeddedQueue queue = queue(queueName);
        Optional<EmbeddedDelivery> rejected = queue.reject(deliveryTag, requeue);
        if (rejected.isEmpty()) {
            return false;
        }
        if (!requeue) {
            deadLetter(queue, rejected.get());
        }
        return true;
    }

    private void deadLetter(EmbeddedQueue queue, EmbeddedDelivery delivery) {
        Object dlx = queue.declaration().arguments().get(QueueDeclaration.DEAD_LETTER_EXCHANGE_ARG);
        if (dlx == null) {
            LOG.debugf("Discarding rejected message [%s] from [%s]: no dead-letter exchange",
                delivery.messageId(), queue.declaration().name());
            return;
        }

        Map<String, Object> headers = new HashMap<>(delivery.headers());
        headers.putIfAbsent(DEATH_QUEUE_HEADER, queue.declaration().name());
        headers.putIfAbsent(DEATH_REASON_HEADER, "rejected");

        EmbeddedDelivery deadLettered = new EmbeddedDelivery(
            0,
            delivery.messageId(),
            dlx.toString(),
            delivery.routingKey(),
            delivery.body(),
            Map.copyOf(headers),
            false
        );
        int routed = route(deadLettered);
        LOG.debugf("Dead-lettered message [%s] from [%s] via [%s] to %d queue(s)",
            delivery.messageId(), queue.declaration().name(), dlx, routed);
    }

    public boolean hasQueue(String queueName) {
        return queues.containsKey(queueName);
    }

    public int messageCount(String queueName) {
        return queue(queueName).readyCount();
    }

    public int unackedCount(String queueName) {
        return queue(queueName).unackedCount();
    }

    /**
     * Bodies of the ready messages of a queue, head first.
     */
    public List<String> messageBodies(String queueName) {
        return queue(queueName).readySnapshot().stream().map(EmbeddedDelivery::body).toList();
    }

    public synchronized TopologySnapshot topologySnapshot() {
        return new TopologySnapshot(
            Set.copyOf(exchanges.values()),
            queues.values().stream().map(EmbeddedQueue::declaration).collect(Collectors.toUnmodifiableSet()),
            Set.copyOf(bindings)
        );
    }

    private EmbeddedQueue queue(String queueName) {
        EmbeddedQueue queue = queues.get(queueName);
        if (queue == null) {
            throw new IllegalStateException("NOT_FOUND - no queue '" + queueName + "'");
        }
        return queue;
    }

    /**
     * Point-in-time view of the declared topology.
     */
    public record TopologySnapshot(
        Set<ExchangeDeclaration> exchanges,
        Set<QueueDeclaration> queues,
        Set<BindingDeclaration> bindings
    ) {}
}
