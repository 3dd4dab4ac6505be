package tech.compendium.sdk.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.compendium.sdk.client.resources.Decks;
import tech.compendium.sdk.client.resources.Jobs;
import tech.compendium.sdk.config.CompendiumConfig;
import tech.compendium.sdk.exception.AuthenticationException;
import tech.compendium.sdk.exception.CompendiumException;
import tech.compendium.sdk.exception.ValidationException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Asynchronous client for the Compendium job API.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Inject
 * CompendiumClient client;
 *
 * client.jobs().listJobs(JobFilters.byStatus(JobStatus.FAILED))
 *     .thenAccept(jobs -> jobs.forEach(job -> client.jobs().retryJob(job.id())));
 * }</pre>
 *
 * <p>Every request completes exceptionally with a {@link CompendiumException}:
 * {@link AuthenticationException} for 401, {@link ValidationException} for 422.
 */
@ApplicationScoped
public class CompendiumClient {

    private static final Logger LOG = Logger.getLogger(CompendiumClient.class);

    private final String baseUrl;
    private final String apiToken;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private Jobs jobs;
    private Decks decks;

    @Inject
    public CompendiumClient(CompendiumConfig config) {
        this(config.baseUrl(), config.apiToken().orElse(null), Duration.ofSeconds(config.http().timeout()));
    }

    public CompendiumClient(String baseUrl, String apiToken, Duration timeout) {
        this.baseUrl = baseUrl.replaceAll("/$", "");
        this.apiToken = apiToken;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .build();
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * Get the Jobs resource.
     */
    public synchronized Jobs jobs() {
        if (jobs == null) {
            jobs = new Jobs(this);
        }
        return jobs;
    }

    /**
     * Get the Decks resource.
     */
    public synchronized Decks decks() {
        if (decks == null) {
            decks = new Decks(this);
        }
        return decks;
    }

    /**
     * Send a request and decode the response body.
     */
    public <T> CompletableFuture<T> request(String method, String endpoint, Object body, TypeReference<T> responseType) {
        HttpRequest request;
        try {
            request = buildRequest(method, endpoint, body);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new CompendiumException("Failed to encode request body", e));
        }

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .handle((response, error) -> {
                if (error != null) {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                    LOG.debugf("%s %s failed: %s", method, endpoint, cause.getMessage());
                    throw new CompendiumException("Network Error: " + cause.getMessage(), cause);
                }
                return handleResponse(response, responseType);
            });
    }

    /**
     * Send a request whose response body is not needed.
     */
    public CompletableFuture<Void> requestVoid(String method, String endpoint, Object body) {
        return request(method, endpoint, body, new TypeReference<Map<String, Object>>() {})
            .thenApply(ignored -> null);
    }

    private HttpRequest buildRequest(String method, String endpoint, Object body) throws IOException {
        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + endpoint))
            .header("Accept", "application/json")
            .header("Content-Type", "application/json")
            .timeout(timeout);

        if (apiToken != null && !apiToken.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiToken);
        }

        if (body != null) {
            String jsonBody = objectMapper.writeValueAsString(body);
            requestBuilder.method(method, HttpRequest.BodyPublishers.ofString(jsonBody));
        } else {
            requestBuilder.method(method, HttpRequest.BodyPublishers.noBody());
        }
        return requestBuilder.build();
    }

    private <T> T handleResponse(HttpResponse<String> response, TypeReference<T> responseType) {
        int status = response.statusCode();
        String body = response.body();

        if (status >= 400) {
            Map<String, Object> data = readErrorBody(body);
            if (status == 401) {
                throw AuthenticationException.fromResponse(data);
            }
            if (status == 422) {
                throw ValidationException.fromResponse(data);
            }
            throw new CompendiumException("Request failed with status " + status, status, null, data);
        }

        if (body == null || body.isBlank()) {
            return null;
        }

        try {
            return objectMapper.readValue(body, responseType);
        } catch (IOException e) {
            throw new CompendiumException("Failed to parse response", status, e, Map.of());
        }
    }

    private Map<String, Object> readErrorBody(String body) {
        if (body == null || body.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(body, new TypeReference<>() {});
        } catch (IOException e) {
            // Non-JSON error pages carry nothing the caller can use
            LOG.debugf("Ignoring non-JSON error body: %s", e.getMessage());
            return Map.of();
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
