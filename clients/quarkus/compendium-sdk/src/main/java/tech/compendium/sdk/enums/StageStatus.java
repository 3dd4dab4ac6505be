package tech.compendium.sdk.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of one stage of a job. Unrecognised values map to {@link #UNKNOWN}.
 */
public enum StageStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed"),
    UNKNOWN("unknown");

    private final String value;

    StageStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static StageStatus fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (StageStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
