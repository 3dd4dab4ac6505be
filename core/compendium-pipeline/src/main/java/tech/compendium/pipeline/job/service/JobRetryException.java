package tech.compendium.pipeline.job.service;

/**
 * A retry was requested for a job that cannot be retried: it has not failed,
 * or it has used up its retries.
 */
public class JobRetryException extends RuntimeException {

    private final String jobId;

    public JobRetryException(String jobId, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
