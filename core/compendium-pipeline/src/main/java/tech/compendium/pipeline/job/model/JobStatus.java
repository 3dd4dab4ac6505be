package tech.compendium.pipeline.job.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a processing job.
 *
 * Lifecycle:
 * <pre>
 * PENDING → PROCESSING → COMPLETED
 *                ↓
 *             FAILED  → (operator retry) → PENDING
 * </pre>
 */
public enum JobStatus {
    /** Created, waiting for its first stage to start */
    PENDING("pending"),

    /** A stage has started and the job is not yet finished */
    PROCESSING("processing"),

    /** Every stage completed */
    COMPLETED("completed"),

    /** One stage failed; later stages never ran */
    FAILED("failed");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static JobStatus fromValue(String value) {
        for (JobStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown JobStatus: " + value);
    }
}
