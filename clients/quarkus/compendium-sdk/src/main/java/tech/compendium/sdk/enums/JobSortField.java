package tech.compendium.sdk.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JobSortField {
    DATE("date"),
    STATUS("status"),
    NAME("name");

    private final String value;

    JobSortField(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
