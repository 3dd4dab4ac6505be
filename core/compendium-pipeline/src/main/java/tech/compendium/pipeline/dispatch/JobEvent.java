package tech.compendium.pipeline.dispatch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import tech.compendium.pipeline.job.entity.Job;

import java.time.Instant;

/**
 * Notification that a job reached a terminal state.
 *
 * @param type completed or failed
 * @param jobId the job
 * @param fileName the job's upload file name
 * @param deckId produced deck, for completed jobs that have one
 * @param failedStage stage that failed, for failed jobs
 * @param error the failed stage's error, for failed jobs
 * @param occurredAt when the job reached the state
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobEvent(
    Type type,
    String jobId,
    String fileName,
    String deckId,
    Integer failedStage,
    String error,
    Instant occurredAt
) {
    public enum Type {
        COMPLETED("completed"),
        FAILED("failed");

        private final String value;

        Type(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    public static JobEvent completed(Job job) {
        return new JobEvent(Type.COMPLETED, job.id(), job.fileName(), job.deckId(), null, null, job.completedAt());
    }

    public static JobEvent failed(Job job) {
        return new JobEvent(Type.FAILED, job.id(), job.fileName(), null, job.currentStage(),
            job.errorMessage(), job.updatedAt());
    }
}
