package tech.compendium.sdk.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

/**
 * Configuration for the Compendium SDK.
 *
 * <p>Configure in application.properties:
 * <pre>
 * compendium.base-url=https://compendium.example.com/api/v1
 * compendium.api-token=your_token
 * compendium.polling.interval-ms=5000
 * </pre>
 */
@ConfigMapping(prefix = "compendium")
public interface CompendiumConfig {

    /**
     * Base URL for the Compendium job API.
     */
    @WithName("base-url")
    @WithDefault("http://localhost:8000/api/v1")
    String baseUrl();

    /**
     * Bearer token sent with every request.
     */
    @WithName("api-token")
    Optional<String> apiToken();

    /**
     * HTTP client configuration.
     */
    HttpConfig http();

    /**
     * Job polling configuration.
     */
    PollingConfig polling();

    interface HttpConfig {
        /**
         * Request timeout in seconds.
         */
        @WithDefault("30")
        int timeout();
    }

    interface PollingConfig {
        /**
         * Delay between polls of one job, in milliseconds.
         */
        @WithName("interval-ms")
        @WithDefault("5000")
        long intervalMs();

        /**
         * Upper bound for the backed-off interval, in milliseconds.
         */
        @WithName("max-interval-ms")
        @WithDefault("60000")
        long maxIntervalMs();

        /**
         * Double the interval every ten polls, up to the maximum.
         */
        @WithName("exponential-backoff")
        @WithDefault("false")
        boolean exponentialBackoff();
    }
}
