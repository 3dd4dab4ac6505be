package tech.compendium.pipeline.job.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SortOrder {
    ASC("asc"),
    DESC("desc");

    private final String value;

    SortOrder(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static SortOrder fromValue(String value) {
        for (SortOrder order : values()) {
            if (order.value.equalsIgnoreCase(value)) {
                return order;
            }
        }
        throw new IllegalArgumentException("Unknown SortOrder: " + value);
    }
}
