package tech.compendium.messagerouter.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Queue metrics published to the Micrometer registry.
 *
 * <p>Each queue gets one counter per {@link DeliveryEvent}, named
 * {@code compendium.queue.messages.<event>}, and two gauges,
 * {@code compendium.queue.pending} and {@code compendium.queue.unacked}, all tagged
 * with {@code queue}.
 */
@ApplicationScoped
public class MicrometerQueueMetricsService implements QueueMetricsService {

    enum DeliveryEvent {
        RECEIVED("received", "Messages received from the queue"),
        CONSUMED("consumed", "Handler runs that succeeded"),
        FAILED("failed", "Handler runs that failed, retried or not"),
        REQUEUED("requeued", "Failed messages republished for another attempt"),
        DEAD_LETTERED("dead_lettered", "Messages routed to the dead-letter queue"),
        DUPLICATE("duplicate", "Deliveries dropped as duplicates of in-flight messages");

        private final String meterSuffix;
        private final String description;

        DeliveryEvent(String meterSuffix, String description) {
            this.meterSuffix = meterSuffix;
            this.description = description;
        }
    }

    @Inject
    MeterRegistry meterRegistry;

    private final Map<String, QueueMeters> meters = new ConcurrentHashMap<>();

    public MicrometerQueueMetricsService() {
        // CDI will inject dependencies
    }

    public MicrometerQueueMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordMessageReceived(String queueIdentifier) {
        count(queueIdentifier, DeliveryEvent.RECEIVED);
    }

    @Override
    public void recordMessageProcessed(String queueIdentifier, boolean success) {
        count(queueIdentifier, success ? DeliveryEvent.CONSUMED : DeliveryEvent.FAILED);
    }

    @Override
    public void recordMessageRequeued(String queueIdentifier) {
        count(queueIdentifier, DeliveryEvent.REQUEUED);
    }

    @Override
    public void recordMessageDeadLettered(String queueIdentifier) {
        count(queueIdentifier, DeliveryEvent.DEAD_LETTERED);
    }

    @Override
    public void recordMessageDuplicate(String queueIdentifier) {
        count(queueIdentifier, DeliveryEvent.DUPLICATE);
    }

    @Override
    public void recordQueueMetrics(String queueIdentifier, long pendingMessages, long unackedMessages) {
        QueueMeters queue = metersFor(queueIdentifier);
        queue.pending.set(pendingMessages);
        queue.unacked.set(unackedMessages);
    }

    @Override
    public QueueStats getQueueStats(String queueIdentifier) {
        QueueMeters queue = meters.get(queueIdentifier);
        return queue != null ? queue.snapshot(queueIdentifier) : QueueStats.empty(queueIdentifier);
    }

    @Override
    public Map<String, QueueStats> getAllQueueStats() {
        Map<String, QueueStats> all = new LinkedHashMap<>();
        meters.forEach((queue, queueMeters) -> all.put(queue, queueMeters.snapshot(queue)));
        return all;
    }

    private void count(String queueIdentifier, DeliveryEvent event) {
        metersFor(queueIdentifier).counters.get(event).increment();
    }

    private QueueMeters metersFor(String queueIdentifier) {
        return meters.computeIfAbsent(queueIdentifier, queue -> new QueueMeters(meterRegistry, queue));
    }

    private static final class QueueMeters {
        private final Map<DeliveryEvent, Counter> counters = new EnumMap<>(DeliveryEvent.class);
        // Held here because the registry keeps only a weak reference to gauge state
        private final AtomicLong pending;
        private final AtomicLong unacked;

        QueueMeters(MeterRegistry registry, String queue) {
            for (DeliveryEvent event : DeliveryEvent.values()) {
                counters.put(event, Counter.builder("compendium.queue.messages." + event.meterSuffix)
                    .tag("queue", queue)
                    .description(event.description)
                    .register(registry));
            }
            pending = registry.gauge("compendium.queue.pending", Tags.of("queue", queue), new AtomicLong());
            unacked = registry.gauge("compendium.queue.unacked", Tags.of("queue", queue), new AtomicLong());
        }

        long total(DeliveryEvent event) {
            return (long) counters.get(event).count();
        }

        QueueStats snapshot(String queue) {
            return new QueueStats(
                queue,
                total(DeliveryEvent.RECEIVED),
                total(DeliveryEvent.CONSUMED),
                total(DeliveryEvent.FAILED),
                total(DeliveryEvent.REQUEUED),
                total(DeliveryEvent.DEAD_LETTERED),
                total(DeliveryEvent.DUPLICATE),
                pending.get(),
                unacked.get()
            );
        }
    }
}
