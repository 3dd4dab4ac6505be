package tech.compendium.sdk.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * A generated flashcard deck.
 */
@Builder(toBuilder = true)
public record Deck(
    String id,
    @JsonAlias("user_id") String userId,
    String name,
    @JsonAlias("card_count") int cardCount,
    List<String> tags,
    @JsonAlias("file_name") String fileName,
    @JsonAlias("job_id") String jobId,
    @JsonAlias("file_size") Long fileSize,
    @JsonAlias("download_url") String downloadUrl,
    @JsonAlias("created_at") Instant createdAt,
    @JsonAlias("updated_at") Instant updatedAt
) {}
