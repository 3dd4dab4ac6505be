package tech.compendium.pipeline.worker;

/**
 * What a stage executor produced.
 *
 * @param deckId identifier of the generated deck; only the packaging stage sets it
 */
public record StageResult(String deckId) {

    public static StageResult done() {
        return new StageResult(null);
    }

    public static StageResult withDeck(String deckId) {
        return new StageResult(deckId);
    }
}
