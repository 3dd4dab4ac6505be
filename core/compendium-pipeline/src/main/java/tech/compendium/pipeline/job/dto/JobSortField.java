package tech.compendium.pipeline.job.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fields a job listing can be ordered by.
 */
public enum JobSortField {
    /** Creation time */
    DATE("date"),
    STATUS("status"),
    /** Deck name, falling back to the file name */
    NAME("name");

    private final String value;

    JobSortField(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static JobSortField fromValue(String value) {
        for (JobSortField field : values()) {
            if (field.value.equalsIgnoreCase(value)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown JobSortField: " + value);
    }
}
