package tech.compendium.messagerouter.outcome;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import tech.compendium.messagerouter.callback.MessageCallback;
import tech.compendium.messagerouter.handler.DeadLetterListener;
import tech.compendium.messagerouter.metrics.QueueMetricsService;
import tech.compendium.messagerouter.model.ConsumedMessage;
import tech.compendium.messagerouter.model.DeliveryOutcome;
import tech.compendium.queue.QueueMessage;
import tech.compendium.queue.QueuePublishResult;
import tech.compendium.queue.QueuePublisher;
import tech.compendium.queue.WorkMessage;
import tech.compendium.queue.WorkMessageCodec;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for OutcomeHandler.
 */
class OutcomeHandlerTest {

    private static final String QUEUE = "pdf.processing";

    private OutcomeHandler handler;
    private QueuePublisher mockPublisher;
    private MessageCallback mockCallback;
    private QueueMetricsService mockMetrics;
    private DeadLetterListener mockListener;
    private WorkMessageCodec codec;

    @BeforeEach
    void setUp() {
        mockPublisher = mock(QueuePublisher.class);
        mockCallback = mock(MessageCallback.class);
        mockMetrics = mock(QueueMetricsService.class);
        mockListener = mock(DeadLetterListener.class);
        codec = new WorkMessageCodec();

        when(mockPublisher.publish(any())).thenAnswer(inv ->
            QueuePublishResult.success(inv.<QueueMessage>getArgument(0).messageId()));

        handler = new OutcomeHandler(QUEUE, mockPublisher, codec, mockMetrics, mockListener, 3);
    }

    private ConsumedMessage delivery(int attempt) {
        WorkMessage message = new WorkMessage("msg-1", "job-1", 1, attempt, "{}");
        return new ConsumedMessage(QUEUE, "7", "tasks", "pdf.process", message, false);
    }

    @Test
    void success_acksDelivery() {
        handler.handleOutcome(delivery(0), mockCallback, DeliveryOutcome.success());

        verify(mockCallback).ack();
        verify(mockCallback, never()).nack(anyBoolean());
        verify(mockMetrics).recordMessageProcessed(QUEUE, true);
        verifyNoInteractions(mockPublisher, mockListener);
    }

    @Test
    void failureOnFirstAttempt_republishesNextAttemptAndAcks() throws Exception {
        handler.handleOutcome(delivery(0), mockCallback, DeliveryOutcome.failed("boom"));

        ArgumentCaptor<QueueMessage> captor = ArgumentCaptor.forClass(QueueMessage.class);
        verify(mockPublisher).publish(captor.capture());
        QueueMessage republished = captor.getValue();

        assertEquals("tasks", republished.exchange());
        assertEquals("pdf.process", republished.routingKey());
        assertTrue(republished.persistent());
        assertEquals(1, republished.headers().get(OutcomeHandler.ATTEMPT_HEADER));

        WorkMessage decoded = codec.decode(republished.body());
        assertEquals("msg-1", decoded.messageId());
        assertEquals(1, decoded.attempt());

        verify(mockCallback).ack();
        verify(mockMetrics).recordMessageRequeued(QUEUE);
        verify(mockMetrics).recordMessageProcessed(QUEUE, false);
        verifyNoInteractions(mockListener);
    }

    @Test
    void failureOnSecondAttempt_stillRetries() {
        handler.handleOutcome(delivery(1), mockCallback, DeliveryOutcome.failed("boom"));

        verify(mockPublisher).publish(any());
        verify(mockCallback).ack();
    }

    @Test
    void failureOnLastAttempt_deadLettersWithoutRepublish() {
        handler.handleOutcome(delivery(2), mockCallback, DeliveryOutcome.failed("still broken"));

        verify(mockCallback).nack(false);
        verify(mockCallback, never()).ack();
        verify(mockPublisher, never()).publish(any());
        verify(mockMetrics).recordMessageDeadLettered(QUEUE);
        verify(mockListener).onDeadLetter(eq(QUEUE), argThat(m -> m.attempt() == 2), eq("still broken"));
    }

    @Test
    void rejected_deadLettersOnFirstAttempt() {
        handler.handleOutcome(delivery(0), mockCallback, DeliveryOutcome.rejected("invalid transition"));

        verify(mockCallback).nack(false);
        verify(mockPublisher, never()).publish(any());
        verify(mockListener).onDeadLetter(eq(QUEUE), any(), eq("invalid transition"));
    }

    @Test
    void republishFailure_returnsDeliveryToQueue() {
        doReturn(QueuePublishResult.failure("msg-1", "channel closed")).when(mockPublisher).publish(any());

        handler.handleOutcome(delivery(0), mockCallback, DeliveryOutcome.failed("boom"));

        verify(mockCallback).nack(true);
        verify(mockCallback, never()).ack();
        verify(mockMetrics, never()).recordMessageRequeued(any());
    }

    @Test
    void republishThrowing_returnsDeliveryToQueue() {
        doThrow(new IllegalStateException("NOT_FOUND - no exchange 'tasks'")).when(mockPublisher).publish(any());

        handler.handleOutcome(delivery(0), mockCallback, DeliveryOutcome.failed("boom"));

        verify(mockCallback).nack(true);
    }

    @Test
    void nullOutcome_treatedAsFailure() {
        handler.handleOutcome(delivery(0), mockCallback, null);

        verify(mockPublisher).publish(any());
        verify(mockCallback).ack();
        verify(mockMetrics).recordMessageProcessed(QUEUE, false);
    }

    @Test
    void listenerFailure_doesNotPreventNack() {
        doThrow(new RuntimeException("listener down")).when(mockListener).onDeadLetter(any(), any(), any());

        assertDoesNotThrow(() ->
            handler.handleOutcome(delivery(2), mockCallback, DeliveryOutcome.failed("boom")));

        verify(mockCallback).nack(false);
    }

    @Test
    void singleAttemptLimit_deadLettersFirstFailure() {
        OutcomeHandler strict = new OutcomeHandler(QUEUE, mockPublisher, codec, mockMetrics, mockListener, 1);

        strict.handleOutcome(delivery(0), mockCallback, DeliveryOutcome.failed("boom"));

        verify(mockCallback).nack(false);
        verify(mockPublisher, never()).publish(any());
    }

    @Test
    void maxAttemptsBelowOne_rejected() {
        assertThrows(IllegalArgumentException.class, () ->
            new OutcomeHandler(QUEUE, mockPublisher, codec, mockMetrics, mockListener, 0));
    }
}
