package tech.compendium.pipeline.job.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of one stage within a job. Stages only move forward:
 * pending → processing → completed | failed.
 */
public enum StageStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    StageStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static StageStatus fromValue(String value) {
        for (StageStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown StageStatus: " + value);
    }
}
