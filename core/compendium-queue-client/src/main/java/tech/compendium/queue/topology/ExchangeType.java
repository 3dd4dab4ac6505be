package tech.compendium.queue.topology;

/**
 * AMQP exchange types used by the pipeline.
 */
public enum ExchangeType {
    TOPIC("topic"),
    DIRECT("direct"),
    FANOUT("fanout");

    private final String value;

    ExchangeType(String value) {
        this.value = value;
    }

    /**
     * The name the broker uses for this type.
     */
    public String getValue() {
        return value;
    }
}
