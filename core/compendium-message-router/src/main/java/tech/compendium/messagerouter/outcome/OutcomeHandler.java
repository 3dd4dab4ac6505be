package tech.compendium.messagerouter.outcome;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.jboss.logging.Logger;
import tech.compendium.messagerouter.callback.MessageCallback;
import tech.compendium.messagerouter.handler.DeadLetterListener;
import tech.compendium.messagerouter.metrics.QueueMetricsService;
import tech.compendium.messagerouter.model.ConsumedMessage;
import tech.compendium.messagerouter.model.DeliveryOutcome;
import tech.compendium.messagerouter.model.DeliveryResult;
import tech.compendium.queue.QueueMessage;
import tech.compendium.queue.QueuePublishResult;
import tech.compendium.queue.QueuePublisher;
import tech.compendium.queue.WorkMessage;
import tech.compendium.queue.WorkMessageCodec;

import java.util.Map;

/**
 * Settles deliveries from one queue according to the handler's outcome.
 *
 * <ul>
 *   <li>SUCCESS: ack</li>
 *   <li>FAILED below the attempt limit: republish with the attempt counter incremented, then ack</li>
 *   <li>FAILED on the last attempt: nack without requeue, so the broker dead-letters it</li>
 *   <li>REJECTED: nack without requeue immediately</li>
 * </ul>
 *
 * <p>Retries are republished to the exchange and routing key the message originally
 * arrived on, so a message dead-lettered after a retry keeps the routing key its
 * dead-letter queue is bound with.
 */
public class OutcomeHandler {

    private static final Logger LOG = Logger.getLogger(OutcomeHandler.class);

    public static final String ATTEMPT_HEADER = "x-attempt";

    private final String queue;
    private final QueuePublisher requeuePublisher;
    private final WorkMessageCodec codec;
    private final QueueMetricsService queueMetrics;
    private final DeadLetterListener deadLetterListener;
    private final int maxAttempts;

    /**
     * @param queue the queue whose deliveries this handler settles
     * @param requeuePublisher publisher used to republish retries
     * @param codec wire format for republished messages
     * @param queueMetrics the metrics service
     * @param deadLetterListener notified after each dead-letter
     * @param maxAttempts total deliveries allowed before a failing message is dead-lettered
     */
    public OutcomeHandler(
            String queue,
            QueuePublisher requeuePublisher,
            WorkMessageCodec codec,
            QueueMetricsService queueMetrics,
            DeadLetterListener deadLetterListener,
            int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        this.queue = queue;
        this.requeuePublisher = requeuePublisher;
        this.codec = codec;
        this.queueMetrics = queueMetrics;
        this.deadLetterListener = deadLetterListener != null ? deadLetterListener : DeadLetterListener.NONE;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Settle a delivery.
     *
     * @param delivery the consumed message
     * @param callback the delivery's ack/nack callback
     * @param outcome what the handler returned
     */
    public void handleOutcome(ConsumedMessage delivery, MessageCallback callback, DeliveryOutcome outcome) {
        if (outcome == null || outcome.result() == null) {
            LOG.errorf("Handler returned null outcome for message [%s] on [%s], treating as failure",
                delivery.message().messageId(), queue);
            outcome = DeliveryOutcome.failed("Handler returned no outcome");
        }

        DeliveryResult result = outcome.result();
        switch (result) {
            case SUCCESS -> handleSuccess(delivery, callback);
            case FAILED -> handleFailure(delivery, callback, outcome);
            case REJECTED -> handleRejected(delivery, callback, outcome);
        }
    }

    private void handleSuccess(ConsumedMessage delivery, MessageCallback callback) {
        LOG.debugf("Message [%s] processed successfully on [%s] - ACKing", delivery.message().messageId(), queue);
        queueMetrics.recordMessageProcessed(queue, true);
        callback.ack();
    }

    private void handleFailure(ConsumedMessage delivery, MessageCallback callback, DeliveryOutcome outcome) {
        queueMetrics.recordMessageProcessed(queue, false);
        WorkMessage message = delivery.message();
        int deliveriesSoFar = message.attempt() + 1;

        if (deliveriesSoFar >= maxAttempts) {
            LOG.warnf("Message [%s] for job [%s] failed on attempt %d/%d - dead-lettering: %s",
                message.messageId(), message.jobId(), deliveriesSoFar, maxAttempts, outcome.errorOrDefault());
            deadLetter(delivery, callback, outcome.errorOrDefault());
            return;
        }

        LOG.warnf("Message [%s] for job [%s] failed on attempt %d/%d - requeueing: %s",
            message.messageId(), message.jobId(), deliveriesSoFar, maxAttempts, outcome.errorOrDefault());
        requeue(delivery, callback);
    }

    private void handleRejected(ConsumedMessage delivery, MessageCallback callback, DeliveryOutcome outcome) {
        WorkMessage message = delivery.message();
        LOG.warnf("Message [%s] for job [%s] rejected by handler - dead-lettering without retry: %s",
            message.messageId(), message.jobId(), outcome.errorOrDefault());
        queueMetrics.recordMessageProcessed(queue, false);
        deadLetter(delivery, callback, outcome.errorOrDefault());
    }

    /**
     * Republish the next attempt, then ack this delivery. If the republish fails the
     * delivery is returned to the queue unchanged so the attempt is not lost.
     */
    private void requeue(ConsumedMessage delivery, MessageCallback callback) {
        WorkMessage next = delivery.message().nextAttempt();

        QueuePublishResult result;
        try {
            QueueMessage republished = new QueueMessage(
                next.messageId(),
                delivery.exchange(),
                delivery.routingKey(),
                codec.encode(next),
                true,
                Map.of(ATTEMPT_HEADER, next.attempt())
            );
            result = requeuePublisher.publish(republished);
        } catch (JsonProcessingException e) {
            result = QueuePublishResult.failure(next.messageId(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Error republishing message [%s] to [%s]", next.messageId(), delivery.routingKey());
            result = QueuePublishResult.failure(next.messageId(), e.getMessage());
        }

        if (result.success()) {
            callback.ack();
            queueMetrics.recordMessageRequeued(queue);
            return;
        }

        LOG.errorf("Failed to republish message [%s] attempt %d to [%s/%s]: %s - returning delivery to queue",
            next.messageId(), next.attempt(), delivery.exchange(), delivery.routingKey(),
            result.errorMessage().orElse("Unknown error"));
        callback.nack(true);
    }

    private void deadLetter(ConsumedMessage delivery, MessageCallback callback, String reason) {
        callback.nack(false);
        queueMetrics.recordMessageDeadLettered(queue);

        try {
            deadLetterListener.onDeadLetter(queue, delivery.message(), reason);
        } catch (Exception e) {
            LOG.errorf(e, "Dead-letter listener failed for message [%s] on [%s]",
                delivery.message().messageId(), queue);
        }
    }

    public String getQueue() {
        return queue;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
