package tech.compendium.messagerouter.manager;

import io.quarkus.runtime.ShutdownEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;
import tech.compendium.messagerouter.callback.MessageCallback;
import tech.compendium.messagerouter.consumer.QueueConsumer;
import tech.compendium.messagerouter.factory.QueueConsumerFactory;
import tech.compendium.messagerouter.handler.DeadLetterListener;
import tech.compendium.messagerouter.handler.WorkHandler;
import tech.compendium.messagerouter.metrics.QueueMetricsService;
import tech.compendium.messagerouter.model.ConsumedMessage;
import tech.compendium.messagerouter.model.DeliveryOutcome;
import tech.compendium.messagerouter.outcome.OutcomeHandler;
import tech.compendium.queue.QueuePublisher;
import tech.compendium.queue.WorkMessage;
import tech.compendium.queue.WorkMessageCodec;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the consumers for every registered work queue and routes their deliveries
 * to the registered handler.
 *
 * <p>Each delivery is tracked while its handler runs. A delivery is settled exactly once:
 * by the {@link OutcomeHandler} when the handler returns, or by the shutdown cleanup if
 * the process stops first.
 */
@ApplicationScoped
public class ConsumerManager {

    private static final Logger LOG = Logger.getLogger(ConsumerManager.class);

    @ConfigProperty(name = "message-router.enabled", defaultValue = "true")
    boolean messageRouterEnabled;

    @ConfigProperty(name = "message-router.max-attempts", defaultValue = "3")
    int maxAttempts;

    @ConfigProperty(name = "message-router.connections", defaultValue = "1")
    int connections;

    @ConfigProperty(name = "message-router.shutdown-timeout-seconds", defaultValue = "30")
    long shutdownTimeoutSeconds;

    @Inject
    QueueConsumerFactory queueConsumerFactory;

    @Inject
    QueuePublisher queuePublisher;

    @Inject
    WorkMessageCodec codec;

    @Inject
    QueueMetricsService queueMetrics;

    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();
    private final Map<String, QueueConsumer> consumers = new ConcurrentHashMap<>();
    private final InFlightMessageTracker inFlightTracker = new InFlightMessageTracker();

    private volatile boolean started = false;
    private volatile boolean shutdownInProgress = false;

    private record Registration(WorkHandler handler, OutcomeHandler outcomeHandler) {}

    public ConsumerManager() {
        // CDI will inject dependencies
    }

    /**
     * Constructor for wiring outside CDI, e.g. in tests against the embedded broker.
     */
    public ConsumerManager(
        QueueConsumerFactory queueConsumerFactory,
        QueuePublisher queuePublisher,
        WorkMessageCodec codec,
        QueueMetricsService queueMetrics,
        int maxAttempts,
        int connections,
        long shutdownTimeoutSeconds
    ) {
        this.queueConsumerFactory = queueConsumerFactory;
        this.queuePublisher = queuePublisher;
        this.codec = codec;
        this.queueMetrics = queueMetrics;
        this.maxAttempts = maxAttempts;
        this.connections = connections;
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
        this.messageRouterEnabled = true;
    }

    /**
     * Register the handler for a queue.
     */
    public void register(String queue, WorkHandler handler) {
        register(queue, handler, DeadLetterListener.NONE);
    }

    /**
     * Register the handler for a queue, with a listener told about each message
     * the queue dead-letters. Registering after {@link #start()} starts a consumer at once.
     *
     * @throws IllegalStateException if the queue already has a handler
     */
    public void register(String queue, WorkHandler handler, DeadLetterListener deadLetterListener) {
        OutcomeHandler outcomeHandler = new OutcomeHandler(
            queue, queuePublisher, codec, queueMetrics, deadLetterListener, maxAttempts);

        if (registrations.putIfAbsent(queue, new Registration(handler, outcomeHandler)) != null) {
            throw new IllegalStateException("A handler is already registered for queue " + queue);
        }
        LOG.infof("Registered handler for queue [%s] (maxAttempts=%d)", queue, maxAttempts);

        if (started) {
            startConsumer(queue);
        }
    }

    /**
     * Start a consumer for every registered queue.
     */
    public synchronized void start() {
        if (!messageRouterEnabled) {
            LOG.info("Message router disabled - not starting consumers");
            return;
        }
        if (started) {
            return;
        }
        started = true;
        registrations.keySet().forEach(this::startConsumer);
        LOG.infof("Started %d queue consumer(s) on %s broker", consumers.size(), queuePublisher.getQueueType());
    }

    private void startConsumer(String queue) {
        consumers.computeIfAbsent(queue, q -> {
            QueueConsumer consumer = queueConsumerFactory.createConsumer(q, connections, this);
            consumer.start();
            return consumer;
        });
    }

    /**
     * Run the registered handler for a delivery and settle it.
     */
    public void route(ConsumedMessage delivery, MessageCallback callback) {
        WorkMessage message = delivery.message();
        Registration registration = registrations.get(delivery.queue());
        if (registration == null) {
            LOG.errorf("No handler registered for queue [%s], returning message [%s] to queue",
                delivery.queue(), message.messageId());
            callback.nack(true);
            return;
        }

        InFlightMessageTracker.TrackResult trackResult = inFlightTracker.track(delivery, callback);
        if (trackResult instanceof InFlightMessageTracker.TrackResult.Duplicate duplicate) {
            LOG.infof("Delivery of message [%s] attempt %d duplicates in-flight delivery [%s] - ACKing duplicate",
                message.messageId(), message.attempt(), duplicate.existingKey());
            queueMetrics.recordMessageDuplicate(delivery.queue());
            callback.ack();
            return;
        }

        String trackingKey = ((InFlightMessageTracker.TrackResult.Tracked) trackResult).trackingKey();
        MDC.put("messageId", message.messageId());
        MDC.put("jobId", message.jobId());
        MDC.put("queue", delivery.queue());
        try {
            DeliveryOutcome outcome;
            try {
                outcome = registration.handler().handle(message);
            } catch (Exception e) {
                LOG.warnf(e, "Handler for queue [%s] threw while processing message [%s]",
                    delivery.queue(), message.messageId());
                outcome = DeliveryOutcome.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }

            // Shutdown cleanup already nacked it
            if (inFlightTracker.remove(trackingKey).isEmpty()) {
                LOG.debugf("Message [%s] settled by shutdown cleanup, skipping outcome", message.messageId());
                return;
            }

            registration.outcomeHandler().handleOutcome(delivery, callback, outcome);
        } catch (Exception e) {
            LOG.errorf(e, "Error settling message [%s] from queue [%s]", message.messageId(), delivery.queue());
        } finally {
            inFlightTracker.remove(trackingKey);
            MDC.remove("messageId");
            MDC.remove("jobId");
            MDC.remove("queue");
        }
    }

    void onShutdown(@Observes ShutdownEvent event) {
        stop();
    }

    /**
     * Stop all consumers, wait for in-progress deliveries up to the shutdown timeout, and
     * return anything still in flight to its queue.
     */
    public synchronized void stop() {
        if (shutdownInProgress) {
            return;
        }
        shutdownInProgress = true;
        LOG.info("ConsumerManager shutting down...");

        consumers.values().forEach(QueueConsumer::stop);
        awaitConsumersStopped();
        cleanupRemainingMessages();
        consumers.clear();
        started = false;
        shutdownInProgress = false;
    }

    private void awaitConsumersStopped() {
        long deadline = System.currentTimeMillis() + shutdownTimeoutSeconds * 1000;
        try {
            while (System.currentTimeMillis() < deadline) {
                boolean allStopped = consumers.values().stream().allMatch(QueueConsumer::isFullyStopped);
                if (allStopped && inFlightTracker.size() == 0) {
                    LOG.info("All consumers stopped");
                    return;
                }
                Thread.sleep(100);
            }
            LOG.warnf("Consumers did not stop within %d seconds", shutdownTimeoutSeconds);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Nack every delivery still being handled so the broker redelivers it.
     */
    private void cleanupRemainingMessages() {
        int remaining = inFlightTracker.size();
        if (remaining == 0) {
            LOG.info("No remaining messages to clean up");
            return;
        }

        LOG.infof("Found %d messages in flight to return to their queues", remaining);
        int nackedCount = 0;
        int errorCount = 0;

        for (InFlightMessageTracker.InFlightDelivery tracked : inFlightTracker.clear()) {
            try {
                tracked.callback().nack(true);
                nackedCount++;
            } catch (Exception e) {
                errorCount++;
                LOG.errorf(e, "Error nacking message [%s] during shutdown", tracked.delivery().message().messageId());
            }
        }

        LOG.infof("Shutdown cleanup completed - nacked: %d, errors: %d", nackedCount, errorCount);
    }

    /**
     * @return true if the requeue publisher and every consumer are healthy, or if the router is disabled
     */
    public boolean isHealthy() {
        if (!messageRouterEnabled) {
            return true;
        }
        return queuePublisher.isHealthy() && consumers.values().stream().allMatch(QueueConsumer::isHealthy);
    }

    public int getInFlightCount() {
        return inFlightTracker.size();
    }

    public boolean isStarted() {
        return started;
    }
}
