package tech.compendium.messagerouter.manager;

import tech.compendium.messagerouter.callback.MessageCallback;
import tech.compendium.messagerouter.model.ConsumedMessage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Deliveries being handled in this process.
 *
 * <p>A delivery is identified two ways: by its tracking key (queue and broker delivery
 * tag) and by the work message's delivery key (message id and attempt). The second
 * catches the same attempt arriving again under a new delivery tag while the first copy
 * is still running. A later attempt of the same message is a different delivery key and
 * is tracked normally.
 */
public class InFlightMessageTracker {

    /**
     * @param trackingKey queue and broker delivery tag
     * @param deliveryKey message id and attempt
     * @param delivery the consumed message
     * @param callback ack/nack for the delivery
     * @param since when tracking started
     */
    public record InFlightDelivery(
        String trackingKey,
        String deliveryKey,
        ConsumedMessage delivery,
        MessageCallback callback,
        Instant since
    ) {}

    public sealed interface TrackResult permits TrackResult.Tracked, TrackResult.Duplicate {

        record Tracked(String trackingKey) implements TrackResult {}

        /**
         * @param existingKey tracking key of the copy already running
         * @param redelivery true when the copy arrived under a different delivery tag
         */
        record Duplicate(String existingKey, boolean redelivery) implements TrackResult {}
    }

    private final Map<String, InFlightDelivery> byTrackingKey = new HashMap<>();
    private final Map<String, String> trackingKeyByDeliveryKey = new HashMap<>();

    public synchronized TrackResult track(ConsumedMessage delivery, MessageCallback callback) {
        String trackingKey = trackingKey(delivery);
        if (byTrackingKey.containsKey(trackingKey)) {
            return new TrackResult.Duplicate(trackingKey, false);
        }

        String deliveryKey = delivery.message().deliveryKey();
        String running = trackingKeyByDeliveryKey.get(deliveryKey);
        if (running != null) {
            return new TrackResult.Duplicate(running, true);
        }

        byTrackingKey.put(trackingKey,
            new InFlightDelivery(trackingKey, deliveryKey, delivery, callback, Instant.now()));
        trackingKeyByDeliveryKey.put(deliveryKey, trackingKey);
        return new TrackResult.Tracked(trackingKey);
    }

    /**
     * Stop tracking a delivery.
     *
     * @return the delivery, or empty if it was not tracked (already settled or cleared)
     */
    public synchronized Optional<InFlightDelivery> remove(String trackingKey) {
        InFlightDelivery removed = byTrackingKey.remove(trackingKey);
        if (removed != null) {
            trackingKeyByDeliveryKey.remove(removed.deliveryKey(), trackingKey);
        }
        return Optional.ofNullable(removed);
    }

    public synchronized boolean isInFlight(String deliveryKey) {
        return trackingKeyByDeliveryKey.containsKey(deliveryKey);
    }

    public synchronized int size() {
        return byTrackingKey.size();
    }

    /**
     * Drop every tracked delivery, returning them so the caller can settle them.
     */
    public synchronized List<InFlightDelivery> clear() {
        List<InFlightDelivery> cleared = new ArrayList<>(byTrackingKey.values());
        byTrackingKey.clear();
        trackingKeyByDeliveryKey.clear();
        return cleared;
    }

    static String trackingKey(ConsumedMessage delivery) {
        return delivery.queue() + ":" + delivery.deliveryId();
    }
}
