package tech.compendium.pipeline.job.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request to submit a document for processing.
 *
 * @param fileName original upload file name, required
 * @param deckName name of the deck to generate; defaults to the file name without extension
 * @param pageCount number of pages, when known
 * @param payload opaque JSON passed to every stage executor (e.g. storage location, card settings)
 */
public record CreateJobRequest(
    @JsonProperty("file_name") String fileName,
    @JsonProperty("deck_name") String deckName,
    @JsonProperty("page_count") Integer pageCount,
    @JsonProperty("payload") String payload
) {
    public CreateJobRequest {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("fileName is required");
        }
        if (pageCount != null && pageCount < 1) {
            throw new IllegalArgumentException("pageCount must be positive: " + pageCount);
        }
        if (deckName == null || deckName.isBlank()) {
            int dot = fileName.lastIndexOf('.');
            deckName = dot > 0 ? fileName.substring(0, dot) : fileName;
        }
    }

    public static CreateJobRequest of(String fileName) {
        return new CreateJobRequest(fileName, null, null, null);
    }
}
