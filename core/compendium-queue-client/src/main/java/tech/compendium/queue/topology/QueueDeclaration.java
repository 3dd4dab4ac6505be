package tech.compendium.queue.topology;

import java.util.HashMap;
import java.util.Map;

/**
 * @param name Queue name
 * @param durable Whether the queue survives a broker restart
 * @param autoDelete Whether the queue is removed when its last consumer goes away
 * @param arguments Broker arguments such as {@code x-dead-letter-exchange}
 */
public record QueueDeclaration(
    String name,
    boolean durable,
    boolean autoDelete,
    Map<String, Object> arguments
) {
    public static final String DEAD_LETTER_EXCHANGE_ARG = "x-dead-letter-exchange";
    public static final String DEAD_LETTER_SUFFIX = ".dlq";

    public QueueDeclaration {
        arguments = arguments != null ? Map.copyOf(arguments) : Map.of();
    }

    public static QueueDeclaration durable(String name) {
        return new QueueDeclaration(name, true, false, Map.of());
    }

    /**
     * Copy of this declaration that dead-letters rejected messages to the given exchange.
     */
    public QueueDeclaration withDeadLetterExchange(String exchange) {
        Map<String, Object> args = new HashMap<>(arguments);
        args.put(DEAD_LETTER_EXCHANGE_ARG, exchange);
        return new QueueDeclaration(name, durable, autoDelete, args);
    }

    public boolean isDeadLetterQueue() {
        return name.endsWith(DEAD_LETTER_SUFFIX);
    }

    public String deadLetterQueueName() {
        return name + DEAD_LETTER_SUFFIX;
    }
}
