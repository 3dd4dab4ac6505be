package tech.compendium.sdk.exception;

import java.io.IOException;
import java.util.Map;

/**
 * Base exception for Compendium SDK errors.
 *
 * <p>The context holds the decoded error body returned by the server, if any.
 */
public class CompendiumException extends RuntimeException {

    private final int statusCode;
    private final Map<String, Object> context;

    public CompendiumException(String message) {
        this(message, 0, null, Map.of());
    }

    public CompendiumException(String message, int statusCode) {
        this(message, statusCode, null, Map.of());
    }

    public CompendiumException(String message, Throwable cause) {
        this(message, 0, cause, Map.of());
    }

    public CompendiumException(String message, int statusCode, Throwable cause, Map<String, Object> context) {
        super(message, cause);
        this.statusCode = statusCode;
        this.context = context != null ? context : Map.of();
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    /**
     * True when no response was received, e.g. the connection was refused or timed out.
     */
    public boolean isNetworkError() {
        return statusCode == 0 && getCause() instanceof IOException;
    }
}
