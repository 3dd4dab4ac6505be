package tech.compendium.sdk.exception;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Exception thrown when the server rejects a request as invalid (HTTP 422).
 */
public class ValidationException extends CompendiumException {

    private final List<ValidationError> errors;

    public ValidationException(String message, List<ValidationError> errors, Map<String, Object> context) {
        super(message, 422, null, context);
        this.errors = errors;
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    /**
     * Build from an error body of the form {@code {"detail": [{"loc": [...], "msg": "...", "type": "..."}]}}.
     */
    public static ValidationException fromResponse(Map<String, Object> response) {
        Object detail = response.get("detail");
        List<ValidationError> errors = List.of();
        if (detail instanceof List<?> entries) {
            errors = entries.stream()
                .filter(Map.class::isInstance)
                .map(entry -> ValidationError.from((Map<?, ?>) entry))
                .toList();
        }
        return new ValidationException("Validation failed", errors, response);
    }

    public record ValidationError(List<String> location, String message, String type) {

        static ValidationError from(Map<?, ?> entry) {
            List<String> location = entry.get("loc") instanceof List<?> loc
                ? loc.stream().map(String::valueOf).collect(Collectors.toList())
                : List.of();
            Object msg = entry.get("msg");
            Object type = entry.get("type");
            return new ValidationError(location,
                msg != null ? msg.toString() : null,
                type != null ? type.toString() : null);
        }

        /**
         * Location joined with dots, e.g. {@code body.deck_name}.
         */
        public String path() {
            return String.join(".", location);
        }
    }
}
