package tech.compendium.queue.topology;

import org.jboss.logging.Logger;

/**
 * Creates the exchanges, queues and bindings of a {@link TopologyDefinition}.
 *
 * <p>Safe to run on every startup: declarations are idempotent, so re-running with the same
 * definition leaves the broker unchanged. Exchanges are declared before queues, and queues
 * before bindings. The first failure aborts provisioning with
 * {@link TopologyProvisioningException}.
 */
public class TopologyProvisioner {

    private static final Logger LOG = Logger.getLogger(TopologyProvisioner.class);

    private final TopologyAdmin admin;

    public TopologyProvisioner(TopologyAdmin admin) {
        this.admin = admin;
    }

    public void provision(TopologyDefinition definition) {
        LOG.infof("Provisioning broker topology: %d exchanges, %d queues, %d bindings",
            definition.exchanges().size(), definition.queues().size(), definition.bindings().size());

        for (ExchangeDeclaration exchange : definition.exchanges()) {
            String resource = "exchange:" + exchange.name();
            try {
                admin.declareExchange(exchange);
                LOG.debugf("Declared %s exchange [%s] (durable=%s)",
                    exchange.type().getValue(), exchange.name(), exchange.durable());
            } catch (Exception e) {
                throw failure(resource, e);
            }
        }

        for (QueueDeclaration queue : definition.queues()) {
            String resource = "queue:" + queue.name();
            try {
                admin.declareQueue(queue);
                LOG.debugf("Declared queue [%s] (durable=%s, args=%s)",
                    queue.name(), queue.durable(), queue.arguments());
            } catch (Exception e) {
                throw failure(resource, e);
            }
        }

        for (BindingDeclaration binding : definition.bindings()) {
            String resource = "binding:" + binding.exchange() + "->" + binding.queue() + "[" + binding.routingKey() + "]";
            try {
                admin.bind(binding);
                LOG.debugf("Bound queue [%s] to [%s] with key [%s]",
                    binding.queue(), binding.exchange(), binding.routingKey());
            } catch (Exception e) {
                throw failure(resource, e);
            }
        }

        LOG.info("Broker topology provisioned");
    }

    private TopologyProvisioningException failure(String resource, Exception cause) {
        LOG.errorf(cause, "Failed to provision %s", resource);
        return new TopologyProvisioningException(resource,
            "Failed to provision " + resource + ": " + cause.getMessage(), cause);
    }
}
