package tech.compendium.pipeline.job.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.With;
import tech.compendium.pipeline.job.model.JobStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A document processing job and the state of each of its stages.
 *
 * <p>Jobs are immutable values. Every change goes through
 * {@link tech.compendium.pipeline.job.statemachine.JobStateMachine}, which returns a new
 * job; the repository stores it with a compare-and-update on {@link #version}.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code COMPLETED} iff the current stage is the last and every stage completed</li>
 *   <li>{@code FAILED} implies exactly one failed stage, every stage before it completed
 *       and every stage after it pending</li>
 *   <li>{@code progress} and {@code currentStage} never decrease while processing</li>
 * </ul>
 *
 * @see tech.compendium.pipeline.job.statemachine.JobInvariants
 */
@Builder(toBuilder = true)
@With
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Job(
    String id,
    JobStatus status,
    int progress,
    int currentStage,
    List<Stage> stages,

    /** Original upload file name */
    String fileName,

    /** Name of the deck being generated */
    String deckName,

    Integer pageCount,

    /** Opaque JSON handed to every stage executor */
    String payload,

    /** Set by the packaging stage when it produced a deck */
    String deckId,

    /** Error of the failed stage, present only when the job failed */
    String errorMessage,

    int retryCount,
    int maxRetries,

    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Instant updatedAt,

    /** Incremented on every stored change */
    @JsonIgnore long version
) {
    public static final int DEFAULT_MAX_RETRIES = 3;

    public Job {
        stages = stages != null ? List.copyOf(stages) : List.of();
    }

    /**
     * The stage with the given 1-indexed number.
     *
     * @throws IllegalArgumentException if the job has no such stage
     */
    public Stage stage(int number) {
        if (number < 1 || number > stages.size()) {
            throw new IllegalArgumentException("Job " + id + " has no stage " + number);
        }
        return stages.get(number - 1);
    }

    /**
     * Copy of this job with one stage replaced.
     */
    public Job withStage(Stage stage) {
        var updated = new ArrayList<>(stages);
        updated.set(stage.stage() - 1, stage);
        return withStages(updated);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    @JsonIgnore
    public boolean canRetry() {
        return status == JobStatus.FAILED && retryCount < maxRetries;
    }
}
