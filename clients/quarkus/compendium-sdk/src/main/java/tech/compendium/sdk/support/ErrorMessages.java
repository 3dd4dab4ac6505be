package tech.compendium.sdk.support;

import tech.compendium.sdk.exception.CompendiumException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

/**
 * Turns any failure into a message fit to show a user.
 *
 * <p>Sources are tried richest first: structured validation detail, a {@code detail}
 * string, the body's {@code message} then {@code error} field, the exception's own
 * message unless it is a generic transport message, a network-error message, a canned
 * message for the HTTP status, and finally the fallback.
 */
public final class ErrorMessages {

    public static final String DEFAULT_FALLBACK = "An unexpected error occurred";

    static final String NETWORK_ERROR =
        "Network error: Unable to reach the server. Please check your connection.";

    private ErrorMessages() {
    }

    public static String extract(Throwable error) {
        return extract(error, DEFAULT_FALLBACK);
    }

    public static String extract(Throwable error, String fallback) {
        Throwable cause = unwrap(error);
        if (cause == null) {
            return fallback;
        }

        Map<String, Object> body = cause instanceof CompendiumException ce ? ce.getContext() : Map.of();

        Object detail = body.get("detail");
        if (detail instanceof String text && !text.isBlank()) {
            return text;
        }
        if (detail instanceof List<?> entries && !entries.isEmpty()) {
            return validationMessage(entries.get(0));
        }

        if (body.get("message") instanceof String message && !message.isBlank()) {
            return message;
        }

        if (body.containsKey("error")) {
            return body.get("error") instanceof String text && !text.isBlank() ? text : fallback;
        }

        String message = cause.getMessage();
        if (message != null && !message.isBlank() && !isGeneric(message)) {
            return message;
        }

        if (cause instanceof CompendiumException ce) {
            if (ce.isNetworkError()) {
                return NETWORK_ERROR;
            }
            if (ce.getStatusCode() > 0) {
                return forStatus(ce.getStatusCode(), fallback);
            }
        }

        return fallback;
    }

    private static String validationMessage(Object entry) {
        if (entry instanceof Map<?, ?> first && first.get("msg") != null) {
            String location = first.get("loc") instanceof List<?> loc && !loc.isEmpty()
                ? loc.stream().map(String::valueOf).collect(Collectors.joining("."))
                : "Validation error";
            return location + ": " + first.get("msg");
        }
        return "Validation error occurred";
    }

    private static boolean isGeneric(String message) {
        return message.startsWith("Request failed")
            || message.startsWith("Network Error")
            || message.equals("Validation failed");
    }

    static String forStatus(int status, String fallback) {
        return switch (status) {
            case 400 -> "Bad request: Please check your input and try again";
            case 401 -> "Unauthorized: Please log in again";
            case 403 -> "Forbidden: You don't have permission to perform this action";
            case 404 -> "Not found: The requested resource doesn't exist";
            case 409 -> "Conflict: This resource already exists or is in use";
            case 422 -> "Validation error: Please check your input";
            case 429 -> "Too many requests: Please try again later";
            case 500 -> "Server error: Something went wrong on our end";
            case 502 -> "Bad gateway: The server is temporarily unavailable";
            case 503 -> "Service unavailable: Please try again later";
            case 504 -> "Gateway timeout: The request took too long";
            default -> "Error " + status + ": " + fallback;
        };
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
