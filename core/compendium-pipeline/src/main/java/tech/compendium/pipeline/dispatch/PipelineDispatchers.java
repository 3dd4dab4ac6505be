package tech.compendium.pipeline.dispatch;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import tech.compendium.queue.QueuePublisher;
import tech.compendium.queue.WorkDispatcher;
import tech.compendium.queue.WorkMessageCodec;
import tech.compendium.queue.topology.PipelineTopology;

/**
 * Produces one {@link WorkDispatcher} per pipeline exchange.
 */
@ApplicationScoped
public class PipelineDispatchers {

    public static final String TASKS = "tasks";
    public static final String EVENTS = "events";

    @Produces
    @Singleton
    @Named(TASKS)
    public WorkDispatcher taskDispatcher(QueuePublisher publisher, WorkMessageCodec codec) {
        return new WorkDispatcher(publisher, codec, PipelineTopology.TASKS_EXCHANGE);
    }

    @Produces
    @Singleton
    @Named(EVENTS)
    public WorkDispatcher eventDispatcher(QueuePublisher publisher, WorkMessageCodec codec) {
        return new WorkDispatcher(publisher, codec, PipelineTopology.EVENTS_EXCHANGE);
    }
}
