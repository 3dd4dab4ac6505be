package tech.compendium.pipeline.job.statemachine;

/**
 * What happened to a stage, as reported by the worker that owns it.
 */
public sealed interface StageOutcome {

    record Started() implements StageOutcome {}

    /**
     * @param deckId identifier of the produced deck; only the packaging stage sets it
     */
    record Succeeded(String deckId) implements StageOutcome {}

    record Failed(String error) implements StageOutcome {
        public Failed {
            if (error == null || error.isBlank()) {
                error = "Unknown error";
            }
        }
    }

    static StageOutcome started() {
        return new Started();
    }

    static StageOutcome succeeded() {
        return new Succeeded(null);
    }

    static StageOutcome succeeded(String deckId) {
        return new Succeeded(deckId);
    }

    static StageOutcome failed(String error) {
        return new Failed(error);
    }
}
