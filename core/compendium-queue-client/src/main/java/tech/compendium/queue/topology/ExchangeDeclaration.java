package tech.compendium.queue.topology;

/**
 * @param name Exchange name
 * @param type Exchange type
 * @param durable Whether the exchange survives a broker restart
 */
public record ExchangeDeclaration(String name, ExchangeType type, boolean durable) {

    public static ExchangeDeclaration durableTopic(String name) {
        return new ExchangeDeclaration(name, ExchangeType.TOPIC, true);
    }
}
