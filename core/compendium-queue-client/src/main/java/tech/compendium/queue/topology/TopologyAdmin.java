package tech.compendium.queue.topology;

import java.io.IOException;

/**
 * Broker-side declaration operations. Every operation creates the resource if absent,
 * is a no-op if an identical resource exists, and fails if an existing resource
 * has different properties.
 */
public interface TopologyAdmin {

    void declareExchange(ExchangeDeclaration exchange) throws IOException;

    void declareQueue(QueueDeclaration queue) throws IOException;

    void bind(BindingDeclaration binding) throws IOException;
}
