package tech.compendium.sdk.exception;

import java.util.Map;

/**
 * Exception thrown when the server rejects the request's credentials.
 */
public class AuthenticationException extends CompendiumException {

    public AuthenticationException(String message, Map<String, Object> context) {
        super(message, 401, null, context);
    }

    public static AuthenticationException fromResponse(Map<String, Object> response) {
        return new AuthenticationException("Request failed with status 401", response);
    }
}
