package tech.compendium.messagerouter.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.jboss.logging.Logger;
import tech.compendium.messagerouter.callback.MessageCallback;
import tech.compendium.messagerouter.manager.ConsumerManager;
import tech.compendium.messagerouter.metrics.QueueMetricsService;
import tech.compendium.messagerouter.model.ConsumedMessage;
import tech.compendium.queue.WorkMessage;
import tech.compendium.queue.WorkMessageCodec;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lifecycle, decoding and heartbeat shared by the broker-specific consumers.
 *
 * <p>Subclasses start receiving in {@link #startConsumption()} and pass each raw delivery
 * to {@link #processDelivery(RawDelivery)}. Consumer threads come from a cached pool that
 * {@link #stop()} shuts down.
 */
public abstract class AbstractQueueConsumer implements QueueConsumer {

    private static final Logger LOG = Logger.getLogger(AbstractQueueConsumer.class);

    /**
     * A running consumer with no heartbeat for this long is reported unhealthy.
     */
    static final Duration HEARTBEAT_STALE_AFTER = Duration.ofSeconds(60);

    private static final int LOGGED_BODY_CHARS = 100;

    protected final String queueName;
    protected final ConsumerManager consumerManager;
    protected final QueueMetricsService queueMetrics;
    protected final WorkMessageCodec codec;
    protected final int connections;
    protected final ExecutorService executorService = Executors.newCachedThreadPool();
    protected final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Instant lastHeartbeat;

    protected AbstractQueueConsumer(String queueName, ConsumerManager consumerManager,
                                    QueueMetricsService queueMetrics, WorkMessageCodec codec, int connections) {
        this.queueName = queueName;
        this.consumerManager = consumerManager;
        this.queueMetrics = queueMetrics;
        this.codec = codec;
        this.connections = connections;
    }

    @Override
    public String queueName() {
        return queueName;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        LOG.infof("Consumer for [%s] starting with %d connection(s)", queueName, connections);
        startConsumption();
        executorService.submit(this::pollQueueMetrics);
    }

    protected abstract void startConsumption();

    @Override
    public void stop() {
        LOG.infof("Consumer for [%s] stopping, deliveries in progress will finish", queueName);
        running.set(false);
        executorService.shutdown();
    }

    @Override
    public boolean isFullyStopped() {
        return executorService.isTerminated();
    }

    /**
     * Decode a delivery and route it. A body that is not a work message can never be
     * handled, so it is nacked without requeue and lands in the dead-letter queue.
     */
    protected void processDelivery(RawDelivery raw) {
        queueMetrics.recordMessageReceived(queueName);

        WorkMessage message;
        try {
            message = codec.decode(raw.body());
        } catch (JsonProcessingException e) {
            String body = raw.body();
            LOG.warnf(e, "Undecodable delivery on [%s] dead-lettered: %s",
                queueName, body.length() > LOGGED_BODY_CHARS ? body.substring(0, LOGGED_BODY_CHARS) + "..." : body);
            queueMetrics.recordMessageProcessed(queueName, false);
            queueMetrics.recordMessageDeadLettered(queueName);
            raw.callback().nack(false);
            return;
        }

        consumerManager.route(new ConsumedMessage(queueName, raw.deliveryId(), raw.exchange(),
            raw.routingKey(), message, raw.redelivered()), raw.callback());
    }

    /**
     * A delivery as the broker handed it over, before decoding.
     */
    public record RawDelivery(
        String body,
        String deliveryId,
        String exchange,
        String routingKey,
        boolean redelivered,
        MessageCallback callback
    ) {}

    /**
     * Runs on the consumer's pool until stopped. Brokers that can report depth override it.
     */
    protected void pollQueueMetrics() {
    }

    /**
     * Sleep in slices of at most 100ms so a stop is noticed promptly.
     *
     * @return false if the consumer stopped before the time was up
     */
    protected boolean sleepWhileRunning(long millis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + millis;
        while (running.get()) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return true;
            }
            Thread.sleep(Math.min(remaining, 100));
        }
        return false;
    }

    protected void updateHeartbeat() {
        lastHeartbeat = Instant.now();
    }

    @Override
    public Optional<Instant> lastHeartbeat() {
        return Optional.ofNullable(lastHeartbeat);
    }

    /**
     * Healthy while running, unless a heartbeat was seen and has gone stale. A consumer
     * that has not heard from the broker yet is still starting up.
     */
    @Override
    public boolean isHealthy() {
        if (!running.get()) {
            return false;
        }
        Instant heartbeat = lastHeartbeat;
        return heartbeat == null
            || Duration.between(heartbeat, Instant.now()).compareTo(HEARTBEAT_STALE_AFTER) < 0;
    }
}
