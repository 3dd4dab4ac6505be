package tech.compendium.pipeline.worker;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.compendium.pipeline.job.entity.Job;
import tech.compendium.pipeline.job.model.PipelineStage;
import tech.compendium.queue.WorkMessage;

import java.util.EnumMap;
import java.util.Map;

/**
 * Looks up the executor for a stage. Stages without a registered executor pass straight
 * through, which keeps the pipeline runnable when the computation lives elsewhere.
 */
@ApplicationScoped
public class StageExecutorRegistry {

    private static final Logger LOG = Logger.getLogger(StageExecutorRegistry.class);

    @Inject
    Instance<StageExecutor> discovered;

    private final Map<PipelineStage, StageExecutor> executors = new EnumMap<>(PipelineStage.class);

    public StageExecutorRegistry() {
        // CDI will inject dependencies
    }

    public StageExecutorRegistry(Iterable<StageExecutor> executors) {
        executors.forEach(this::register);
    }

    @PostConstruct
    void init() {
        discovered.forEach(this::register);
        LOG.infof("Registered stage executors for %s", executors.keySet());
    }

    private void register(StageExecutor executor) {
        StageExecutor existing = executors.putIfAbsent(executor.stage(), executor);
        if (existing != null) {
            throw new IllegalStateException("Stage " + executor.stage() + " has two executors: "
                + existing.getClass().getName() + " and " + executor.getClass().getName());
        }
    }

    public StageExecutor forStage(PipelineStage stage) {
        StageExecutor executor = executors.get(stage);
        return executor != null ? executor : new PassThroughExecutor(stage);
    }

    public boolean hasExecutor(PipelineStage stage) {
        return executors.containsKey(stage);
    }

    /**
     * Completes its stage without doing any work.
     */
    static final class PassThroughExecutor implements StageExecutor {
        private final PipelineStage stage;

        PassThroughExecutor(PipelineStage stage) {
            this.stage = stage;
        }

        @Override
        public PipelineStage stage() {
            return stage;
        }

        @Override
        public StageResult execute(Job job, WorkMessage message) {
            LOG.debugf("No executor for stage %d (%s), passing job [%s] through",
                stage.getNumber(), stage.getDisplayName(), job.id());
            return StageResult.done();
        }
    }
}
