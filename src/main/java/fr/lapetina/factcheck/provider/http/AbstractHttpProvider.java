package fr.lapetina.factcheck.provider.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.factcheck.domain.exception.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

/**
 * Shared JSON-over-HTTP plumbing for provider adapters.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Every failure leaves this class as an
 * {@link UpstreamException}:
 * - non-2xx status: HTTP_STATUS with the status, Retry-After and the provider's error message
 * - timeouts: TIMEOUT
 * - other I/O failures: NETWORK
 * - unparseable 2xx body: MALFORMED_RESPONSE
 */
public abstract class AbstractHttpProvider {

    private static final Logger log = LoggerFactory.getLogger(AbstractHttpProvider.class);

    protected final HttpClient httpClient;
    protected final ObjectMapper objectMapper;
    protected final Duration requestTimeout;
    private final String providerName;

    protected AbstractHttpProvider(String providerName, Duration connectTimeout, Duration requestTimeout) {
        this.providerName = providerName;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Sends a request and parses the 2xx body as JSON.
     */
    protected CompletableFuture<JsonNode> sendJson(HttpRequest request, String requestId) {
        Instant startTime = Instant.now();
        log.debug("Sending request: provider={}, requestId={}, uri={}", providerName, requestId, request.uri());

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    long latencyMs = Duration.between(startTime, Instant.now()).toMillis();
                    if (error != null) {
                        throw toUpstreamException(error, requestId, latencyMs);
                    }
                    return handleResponse(response, requestId, latencyMs);
                });
    }

    protected String toJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw UpstreamException.malformed(providerName, "Failed to encode request: " + e.getMessage(), e);
        }
    }

    protected String providerName() {
        return providerName;
    }

    private JsonNode handleResponse(HttpResponse<String> response, String requestId, long latencyMs) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            log.debug("Request successful: provider={}, requestId={}, status={}, latencyMs={}",
                    providerName, requestId, status, latencyMs);
            try {
                return objectMapper.readTree(response.body());
            } catch (JsonProcessingException e) {
                throw UpstreamException.malformed(providerName,
                        displayName() + " returned an unreadable body: " + e.getOriginalMessage(), e);
            }
        }

        Duration retryAfter = parseRetryAfter(response).orElse(null);
        String message = displayName() + " API error (" + status + "): " + extractErrorMessage(response);
        log.warn("Request failed with HTTP error: provider={}, requestId={}, status={}, retryAfter={}, latencyMs={}",
                providerName, requestId, status, retryAfter, latencyMs);
        throw UpstreamException.httpStatus(providerName, status, message, retryAfter);
    }

    private UpstreamException toUpstreamException(Throwable error, String requestId, long latencyMs) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();

        if (cause instanceof UpstreamException) {
            return (UpstreamException) cause;
        }
        if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
            log.error("Request timeout: provider={}, requestId={}, latencyMs={}, error={}",
                    providerName, requestId, latencyMs, message);
            return UpstreamException.timeout(providerName, displayName() + " request timeout: " + message, cause);
        }
        if (cause instanceof IOException) {
            log.error("Provider connection error: provider={}, requestId={}, errorType={}, error={}",
                    providerName, requestId, cause.getClass().getSimpleName(), message);
            return UpstreamException.network(providerName, displayName() + " network error: " + message, cause);
        }
        log.error("Request failed unexpectedly: provider={}, requestId={}, errorType={}",
                providerName, requestId, cause.getClass().getSimpleName(), cause);
        return UpstreamException.network(providerName, displayName() + " request failed: " + message, cause);
    }

    private String extractErrorMessage(HttpResponse<String> response) {
        String fallback = "HTTP " + response.statusCode();
        String body = response.body();
        if (body == null || body.isBlank()) {
            return fallback;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode error = node.path("error");
            if (error.isTextual()) {
                return error.asText();
            }
            if (error.path("message").isTextual()) {
                return error.path("message").asText();
            }
            if (node.path("message").isTextual()) {
                return node.path("message").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: provider={}, status={}", providerName, response.statusCode());
        }
        return fallback;
    }

    /**
     * Retry-After in delta-seconds form. HTTP-date values are ignored.
     */
    static Optional<Duration> parseRetryAfter(HttpResponse<?> response) {
        return response.headers().firstValue("Retry-After").flatMap(value -> {
            try {
                long seconds = Long.parseLong(value.trim());
                return seconds >= 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.empty();
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        });
    }

    /**
     * Human-readable provider name used in error messages.
     */
    protected abstract String displayName();
}
