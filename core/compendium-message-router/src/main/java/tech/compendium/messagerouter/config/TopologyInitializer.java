package tech.compendium.messagerouter.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import tech.compendium.queue.topology.TopologyAdmin;
import tech.compendium.queue.topology.TopologyDefinition;
import tech.compendium.queue.topology.TopologyProvisioner;
import tech.compendium.queue.topology.TopologyProvisioningException;

/**
 * Provisions the broker topology before any consumer starts.
 *
 * A provisioning failure is fatal: the exception propagates out of startup and no
 * consumer is started.
 */
@ApplicationScoped
public class TopologyInitializer {

    private static final Logger LOG = Logger.getLogger(TopologyInitializer.class);

    @ConfigProperty(name = "message-router.provision-topology", defaultValue = "true")
    boolean provisionTopology;

    @Inject
    TopologyAdmin topologyAdmin;

    private volatile boolean provisioned = false;

    public TopologyInitializer() {
        // CDI will inject dependencies
    }

    public TopologyInitializer(TopologyAdmin topologyAdmin, boolean provisionTopology) {
        this.topologyAdmin = topologyAdmin;
        this.provisionTopology = provisionTopology;
    }

    /**
     * @throws TopologyProvisioningException if any exchange, queue or binding cannot be declared
     */
    public void initialize(TopologyDefinition definition) {
        if (!provisionTopology) {
            LOG.info("Topology provisioning disabled - assuming broker resources already exist");
            provisioned = true;
            return;
        }

        try {
            new TopologyProvisioner(topologyAdmin).provision(definition);
            provisioned = true;
        } catch (TopologyProvisioningException e) {
            LOG.errorf("Broker topology could not be provisioned (%s); refusing to start consumers", e.getResource());
            throw e;
        }
    }

    public boolean isProvisioned() {
        return provisioned;
    }
}
