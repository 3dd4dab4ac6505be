package tech.compendium.messagerouter.manager;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.compendium.messagerouter.callback.MessageCallback;
import tech.compendium.messagerouter.model.ConsumedMessage;
import tech.compendium.queue.WorkMessage;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class InFlightMessageTrackerTest {

    private InFlightMessageTracker tracker;
    private MessageCallback callback;

    @BeforeEach
    void setUp() {
        tracker = new InFlightMessageTracker();
        callback = mock(MessageCallback.class);
    }

    private ConsumedMessage delivery(String deliveryTag, String messageId, int attempt) {
        return new ConsumedMessage("pdf.processing", deliveryTag, "tasks", "pdf.process",
            new WorkMessage(messageId, "job-1", 1, attempt, null), false);
    }

    @Test
    void track_firstDelivery_isTrackedUnderQueueAndTag() {
        var result = tracker.track(delivery("7", "msg-1", 0), callback);

        var tracked = assertInstanceOf(InFlightMessageTracker.TrackResult.Tracked.class, result);
        assertEquals("pdf.processing:7", tracked.trackingKey());
        assertEquals(1, tracker.size());
        assertTrue(tracker.isInFlight("msg-1:0"));
    }

    @Test
    void track_sameTagTwice_isDuplicateButNotRedelivery() {
        tracker.track(delivery("7", "msg-1", 0), callback);

        var result = tracker.track(delivery("7", "msg-1", 0), callback);

        var duplicate = assertInstanceOf(InFlightMessageTracker.TrackResult.Duplicate.class, result);
        assertFalse(duplicate.redelivery());
        assertEquals(1, tracker.size());
    }

    @Test
    void track_sameAttemptUnderNewTag_isRedelivery() {
        tracker.track(delivery("7", "msg-1", 0), callback);

        var result = tracker.track(delivery("8", "msg-1", 0), callback);

        var duplicate = assertInstanceOf(InFlightMessageTracker.TrackResult.Duplicate.class, result);
        assertTrue(duplicate.redelivery());
        assertEquals("pdf.processing:7", duplicate.existingKey());
    }

    @Test
    void track_retryAttempt_isTrackedSeparately() {
        tracker.track(delivery("7", "msg-1", 0), callback);

        var result = tracker.track(delivery("8", "msg-1", 1), callback);

        assertInstanceOf(InFlightMessageTracker.TrackResult.Tracked.class, result);
        assertEquals(2, tracker.size());
    }

    @Test
    void remove_releasesDeliveryKey() {
        tracker.track(delivery("7", "msg-1", 0), callback);

        assertTrue(tracker.remove("pdf.processing:7").isPresent());

        assertEquals(0, tracker.size());
        assertFalse(tracker.isInFlight("msg-1:0"));
        assertTrue(tracker.remove("pdf.processing:7").isEmpty());
        // The same attempt may now be handled again
        assertInstanceOf(InFlightMessageTracker.TrackResult.Tracked.class,
            tracker.track(delivery("9", "msg-1", 0), callback));
    }

    @Test
    void clear_returnsEveryDeliveryWithItsCallback() {
        tracker.track(delivery("7", "msg-1", 0), callback);
        tracker.track(delivery("8", "msg-2", 0), callback);

        List<InFlightMessageTracker.InFlightDelivery> cleared = tracker.clear();

        assertEquals(2, cleared.size());
        assertTrue(cleared.stream().allMatch(d -> d.callback() == callback));
        assertEquals(0, tracker.size());
        assertFalse(tracker.isInFlight("msg-2:0"));
    }
}
