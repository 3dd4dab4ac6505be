package tech.compendium.sdk.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a job as reported by the server.
 *
 * <p>{@link #UNKNOWN} stands in for any value this client does not recognise.
 */
public enum JobStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed"),
    UNKNOWN("unknown");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Pending or processing.
     */
    public boolean isActive() {
        return this == PENDING || this == PROCESSING;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonCreator
    public static JobStatus fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (JobStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
