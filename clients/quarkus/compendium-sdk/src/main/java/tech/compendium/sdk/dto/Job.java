package tech.compendium.sdk.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Builder;
import tech.compendium.sdk.enums.JobStatus;

import java.time.Instant;
import java.util.List;

/**
 * A document-processing job as returned by the job API.
 *
 * <p>The server may use either snake_case or camelCase field names.
 */
@Builder(toBuilder = true)
public record Job(
    String id,
    @JsonAlias("user_id") String userId,
    @JsonAlias("deck_name") String deckName,
    @JsonAlias({"file_name", "source_filename"}) String fileName,
    @JsonAlias("page_count") Integer pageCount,
    JobStatus status,
    Integer progress,
    @JsonAlias("current_stage") Integer currentStage,
    @JsonAlias("stage_name") String stageName,
    List<JobStage> stages,
    @JsonAlias("error_message") String errorMessage,
    @JsonAlias("deck_id") String deckId,
    @JsonAlias("retry_count") Integer retryCount,
    @JsonAlias("created_at") Instant createdAt,
    @JsonAlias("started_at") Instant startedAt,
    @JsonAlias("completed_at") Instant completedAt,
    @JsonAlias("updated_at") Instant updatedAt
) {

    /**
     * The status, with a missing value read as {@link JobStatus#UNKNOWN}.
     */
    public JobStatus statusOrUnknown() {
        return status != null ? status : JobStatus.UNKNOWN;
    }

    public boolean isActive() {
        return statusOrUnknown().isActive();
    }

    public boolean isTerminal() {
        return statusOrUnknown().isTerminal();
    }

    public List<JobStage> stagesOrEmpty() {
        return stages != null ? stages : List.of();
    }
}
