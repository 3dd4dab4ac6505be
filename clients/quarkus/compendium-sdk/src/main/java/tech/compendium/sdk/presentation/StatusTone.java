package tech.compendium.sdk.presentation;

/**
 * Severity used to colour a status.
 */
public enum StatusTone {
    PENDING("pending"),
    INFO("info"),
    SUCCESS("success"),
    DANGER("danger"),
    UNKNOWN("unknown");

    private final String token;

    StatusTone(String token) {
        this.token = token;
    }

    /**
     * Style token, e.g. for a CSS class suffix.
     */
    public String getToken() {
        return token;
    }
}
