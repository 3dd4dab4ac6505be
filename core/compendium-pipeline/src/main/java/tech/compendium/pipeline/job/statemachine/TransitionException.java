package tech.compendium.pipeline.job.statemachine;

/**
 * An illegal job or stage transition. Never retried: the delivery that caused it
 * is dead-lettered.
 */
public class TransitionException extends RuntimeException {

    private final String jobId;
    private final int stage;

    public TransitionException(String jobId, int stage, String message) {
        super(message);
        this.jobId = jobId;
        this.stage = stage;
    }

    public String getJobId() {
        return jobId;
    }

    public int getStage() {
        return stage;
    }
}
