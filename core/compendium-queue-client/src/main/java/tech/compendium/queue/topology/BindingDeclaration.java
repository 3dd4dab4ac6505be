package tech.compendium.queue.topology;

/**
 * Binds a queue to an exchange under a routing-key pattern.
 * For topic exchanges {@code *} matches exactly one word and {@code #} zero or more.
 */
public record BindingDeclaration(String queue, String exchange, String routingKey) {
}
