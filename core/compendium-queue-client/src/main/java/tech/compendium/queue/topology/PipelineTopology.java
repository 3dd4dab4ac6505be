package tech.compendium.queue.topology;

/**
 * Names and default layout of the document pipeline's broker resources.
 */
public final class PipelineTopology {

    public static final String TASKS_EXCHANGE = "tasks";
    public static final String EVENTS_EXCHANGE = "events";
    public static final String DEAD_LETTER_EXCHANGE = "dlx";

    public static final String PDF_PROCESSING_QUEUE = "pdf.processing";
    public static final String EMBEDDING_GENERATION_QUEUE = "embedding.generation";
    public static final String DECK_GENERATION_QUEUE = "deck.generation";
    public static final String NOTIFICATIONS_QUEUE = "notifications";

    public static final String PDF_PROCESS_KEY = "pdf.process";
    public static final String EMBEDDING_GENERATE_KEY = "embedding.generate";
    public static final String DECK_GENERATE_KEY = "deck.generate";
    public static final String NOTIFICATION_PATTERN = "notification.*";
    public static final String NOTIFICATION_COMPLETED_KEY = "notification.completed";
    public static final String NOTIFICATION_FAILED_KEY = "notification.failed";

    private PipelineTopology() {
    }

    /**
     * Task queues on {@code tasks}, the notification queue on {@code events},
     * and a {@code .dlq} companion for each of them on {@code dlx}.
     */
    public static TopologyDefinition definition() {
        return TopologyDefinition.builder()
            .topicExchange(TASKS_EXCHANGE)
            .topicExchange(EVENTS_EXCHANGE)
            .deadLetterExchange(DEAD_LETTER_EXCHANGE)
            .boundQueue(PDF_PROCESSING_QUEUE, TASKS_EXCHANGE, PDF_PROCESS_KEY)
            .boundQueue(DECK_GENERATION_QUEUE, TASKS_EXCHANGE, DECK_GENERATE_KEY)
            .boundQueue(EMBEDDING_GENERATION_QUEUE, TASKS_EXCHANGE, EMBEDDING_GENERATE_KEY)
            .boundQueue(NOTIFICATIONS_QUEUE, EVENTS_EXCHANGE, NOTIFICATION_PATTERN)
            .build();
    }
}
