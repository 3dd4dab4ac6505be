package tech.compendium.pipeline.job.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.With;
import tech.compendium.pipeline.job.model.PipelineStage;
import tech.compendium.pipeline.job.model.StageStatus;

import java.time.Instant;

/**
 * One step of a job's pipeline.
 *
 * @param stage 1-indexed position within the job
 * @param name display name
 * @param status current status
 * @param startTime set once, when the stage starts
 * @param endTime set once, when the stage completes or fails
 * @param error present only when the stage failed
 */
@Builder(toBuilder = true)
@With
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Stage(
    int stage,
    String name,
    StageStatus status,
    Instant startTime,
    Instant endTime,
    String error
) {
    public static Stage pending(PipelineStage definition) {
        return new Stage(definition.getNumber(), definition.getDisplayName(), StageStatus.PENDING, null, null, null);
    }

    public boolean isCompleted() {
        return status == StageStatus.COMPLETED;
    }

    public boolean isPending() {
        return status == StageStatus.PENDING;
    }
}
