package tech.compendium.messagerouter.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MicrometerQueueMetricsService.
 */
class MicrometerQueueMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private MicrometerQueueMetricsService metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerQueueMetricsService(registry);
    }

    @Test
    void unknownQueue_returnsEmptyStats() {
        QueueStats stats = metrics.getQueueStats("nope");

        assertEquals(0, stats.totalMessages());
        assertEquals(1.0, stats.successRate());
    }

    @Test
    void countsAreAggregatedPerQueue() {
        metrics.recordMessageReceived("pdf.processing");
        metrics.recordMessageReceived("pdf.processing");
        metrics.recordMessageReceived("pdf.processing");
        metrics.recordMessageProcessed("pdf.processing", true);
        metrics.recordMessageProcessed("pdf.processing", false);
        metrics.recordMessageRequeued("pdf.processing");
        metrics.recordMessageDeadLettered("pdf.processing");
        metrics.recordMessageReceived("deck.generation");

        QueueStats stats = metrics.getQueueStats("pdf.processing");

        assertEquals(3, stats.totalMessages());
        assertEquals(1, stats.totalConsumed());
        assertEquals(1, stats.totalFailed());
        assertEquals(1, stats.totalRequeued());
        assertEquals(1, stats.totalDeadLettered());
        assertEquals(0.5, stats.successRate(), 0.0001);
        assertEquals(2, metrics.getAllQueueStats().size());
    }

    @Test
    void queueDepthIsExposedAsGauge() {
        metrics.recordQueueMetrics("pdf.processing", 12, 3);

        assertEquals(12.0, registry.get("compendium.queue.pending").tag("queue", "pdf.processing").gauge().value());
        assertEquals(3, metrics.getQueueStats("pdf.processing").unackedMessages());
    }

    @Test
    void countersAreRegisteredWithQueueTag() {
        metrics.recordMessageDuplicate("notifications");

        assertEquals(1.0, registry.get("compendium.queue.messages.duplicate")
            .tag("queue", "notifications").counter().count());
    }
}
