package tech.compendium.pipeline.job.model;

import tech.compendium.queue.topology.PipelineTopology;

/**
 * The fixed sequence of stages every job passes through, with the routing key
 * its work is published on.
 */
public enum PipelineStage {
    EXTRACT_TEXT(1, "Extracting text from PDF", PipelineTopology.PDF_PROCESS_KEY),
    CHUNK_CONTENT(2, "Chunking content", PipelineTopology.EMBEDDING_GENERATE_KEY),
    IDENTIFY_TOPICS(3, "Identifying topics", PipelineTopology.DECK_GENERATE_KEY),
    REFINE_TOPICS(4, "Refining topics", PipelineTopology.DECK_GENERATE_KEY),
    GENERATE_TAGS(5, "Generating tags", PipelineTopology.DECK_GENERATE_KEY),
    CREATE_QUESTIONS(6, "Creating questions", PipelineTopology.DECK_GENERATE_KEY),
    GENERATE_ANSWERS(7, "Generating answers", PipelineTopology.DECK_GENERATE_KEY),
    BUILD_DECK(8, "Building Anki deck", PipelineTopology.DECK_GENERATE_KEY);

    /** Number of stages in a job */
    public static final int COUNT = values().length;

    private final int number;
    private final String displayName;
    private final String routingKey;

    PipelineStage(int number, String displayName, String routingKey) {
        this.number = number;
        this.displayName = displayName;
        this.routingKey = routingKey;
    }

    public int getNumber() {
        return number;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    public boolean isLast() {
        return number == COUNT;
    }

    /**
     * @throws IllegalArgumentException if the number is outside 1..COUNT
     */
    public static PipelineStage of(int number) {
        if (number < 1 || number > COUNT) {
            throw new IllegalArgumentException("Stage out of range: " + number + " (expected 1.." + COUNT + ")");
        }
        return values()[number - 1];
    }
}
