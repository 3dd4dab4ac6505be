package tech.compendium.pipeline.worker;

import tech.compendium.pipeline.job.entity.Job;
import tech.compendium.pipeline.job.model.PipelineStage;
import tech.compendium.queue.WorkMessage;

/**
 * Performs the computation of one pipeline stage. Implementations are CDI beans;
 * {@link StageExecutorRegistry} picks them up by {@link #stage()}.
 *
 * <p>Delivery is at-least-once: a stage may run again after a worker crash or a failed
 * attempt, so executors must be idempotent.
 */
public interface StageExecutor {

    PipelineStage stage();

    /**
     * @param job the job, with this stage in processing
     * @param message the delivery being handled; {@code attempt} counts earlier failures
     * @throws Exception to fail this attempt; the delivery is retried or dead-lettered
     */
    StageResult execute(Job job, WorkMessage message) throws Exception;
}
