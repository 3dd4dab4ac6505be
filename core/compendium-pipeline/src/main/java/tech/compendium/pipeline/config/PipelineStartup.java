package tech.compendium.pipeline.config;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import tech.compendium.messagerouter.config.TopologyInitializer;
import tech.compendium.messagerouter.manager.ConsumerManager;
import tech.compendium.pipeline.worker.NotificationHandler;
import tech.compendium.pipeline.worker.StageFailureRecorder;
import tech.compendium.pipeline.worker.StageWorker;
import tech.compendium.queue.topology.PipelineTopology;

/**
 * Brings the worker up: provision the broker topology, register the queue handlers,
 * start consuming.
 */
@ApplicationScoped
public class PipelineStartup {

    private static final Logger LOG = Logger.getLogger(PipelineStartup.class);

    @ConfigProperty(name = "pipeline.consume-notifications", defaultValue = "true")
    boolean consumeNotifications;

    @Inject
    TopologyInitializer topologyInitializer;

    @Inject
    ConsumerManager consumerManager;

    @Inject
    StageWorker stageWorker;

    @Inject
    StageFailureRecorder stageFailureRecorder;

    @Inject
    NotificationHandler notificationHandler;

    void onStart(@Observes StartupEvent event) {
        start();
    }

    void start() {
        // Throws on failure, which aborts startup before any consumer exists
        topologyInitializer.initialize(PipelineTopology.definition());

        consumerManager.register(PipelineTopology.PDF_PROCESSING_QUEUE, stageWorker, stageFailureRecorder);
        consumerManager.register(PipelineTopology.EMBEDDING_GENERATION_QUEUE, stageWorker, stageFailureRecorder);
        consumerManager.register(PipelineTopology.DECK_GENERATION_QUEUE, stageWorker, stageFailureRecorder);
        if (consumeNotifications) {
            consumerManager.register(PipelineTopology.NOTIFICATIONS_QUEUE, notificationHandler);
        }

        consumerManager.start();
        LOG.info("Pipeline worker started");
    }
}
