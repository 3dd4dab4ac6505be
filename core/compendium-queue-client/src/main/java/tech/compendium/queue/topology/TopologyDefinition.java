package tech.compendium.queue.topology;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declarative broker topology: exchanges, queues and the bindings between them.
 *
 * <p>When built with a dead-letter exchange, every primary queue {@code Q} is declared with
 * that exchange as its {@code x-dead-letter-exchange}, and gets a companion queue {@code Q.dlq}
 * bound to the dead-letter exchange under each of {@code Q}'s routing keys.
 */
public record TopologyDefinition(
    List<ExchangeDeclaration> exchanges,
    List<QueueDeclaration> queues,
    List<BindingDeclaration> bindings,
    Optional<String> deadLetterExchange
) {
    public TopologyDefinition {
        exchanges = List.copyOf(exchanges);
        queues = List.copyOf(queues);
        bindings = List.copyOf(bindings);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Primary (non dead-letter) queues.
     */
    public List<QueueDeclaration> primaryQueues() {
        return queues.stream().filter(q -> !q.isDeadLetterQueue()).toList();
    }

    public List<BindingDeclaration> bindingsFor(String queueName) {
        return bindings.stream().filter(b -> b.queue().equals(queueName)).toList();
    }

    public static class Builder {
        private final Map<String, ExchangeDeclaration> exchanges = new LinkedHashMap<>();
        private final Map<String, QueueDeclaration> queues = new LinkedHashMap<>();
        private final List<BindingDeclaration> bindings = new ArrayList<>();
        private String deadLetterExchange;

        public Builder exchange(ExchangeDeclaration exchange) {
            exchanges.put(exchange.name(), exchange);
            return this;
        }

        public Builder topicExchange(String name) {
            return exchange(ExchangeDeclaration.durableTopic(name));
        }

        public Builder queue(QueueDeclaration queue) {
            queues.put(queue.name(), queue);
            return this;
        }

        /**
         * Declare a durable queue bound to an exchange under one routing-key pattern.
         */
        public Builder boundQueue(String queue, String exchange, String routingKey) {
            queues.putIfAbsent(queue, QueueDeclaration.durable(queue));
            bindings.add(new BindingDeclaration(queue, exchange, routingKey));
            return this;
        }

        public Builder binding(String queue, String exchange, String routingKey) {
            bindings.add(new BindingDeclaration(queue, exchange, routingKey));
            return this;
        }

        public Builder deadLetterExchange(String name) {
            this.deadLetterExchange = name;
            return this;
        }

        public TopologyDefinition build() {
            if (deadLetterExchange == null) {
                return new TopologyDefinition(
                    List.copyOf(exchanges.values()),
                    List.copyOf(queues.values()),
                    bindings,
                    Optional.empty()
                );
            }

            List<ExchangeDeclaration> allExchanges = new ArrayList<>(exchanges.values());
            if (!exchanges.containsKey(deadLetterExchange)) {
                allExchanges.add(ExchangeDeclaration.durableTopic(deadLetterExchange));
            }

            List<QueueDeclaration> allQueues = new ArrayList<>();
            List<BindingDeclaration> allBindings = new ArrayList<>(bindings);

            for (QueueDeclaration queue : queues.values()) {
                if (queue.isDeadLetterQueue()) {
                    allQueues.add(queue);
                    continue;
                }
                allQueues.add(queue.withDeadLetterExchange(deadLetterExchange));

                String dlqName = queue.deadLetterQueueName();
                allQueues.add(QueueDeclaration.durable(dlqName));
                for (BindingDeclaration binding : bindings) {
                    if (binding.queue().equals(queue.name())) {
                        allBindings.add(new BindingDeclaration(dlqName, deadLetterExchange, binding.routingKey()));
                    }
                }
            }

            return new TopologyDefinition(allExchanges, allQueues, allBindings, Optional.of(deadLetterExchange));
        }
    }
}
