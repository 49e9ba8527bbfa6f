package fr.lapetina.factcheck.provider.http;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.factcheck.domain.exception.UpstreamException;
import fr.lapetina.factcheck.domain.model.ModelRequest;
import fr.lapetina.factcheck.domain.model.ModelTier;
import fr.lapetina.factcheck.provider.ModelProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Anthropic messages API adapter.
 */
public final class AnthropicModelProvider extends AbstractHttpProvider implements ModelProvider {

    private static final Logger log = LoggerFactory.getLogger(AnthropicModelProvider.class);

    public static final String NAME = "anthropic";
    public static final URI DEFAULT_ENDPOINT = URI.create("https://api.anthropic.com/v1/messages");
    static final String API_VERSION = "2023-06-01";

    private final String apiKey;
    private final URI endpoint;
    private final Map<ModelTier, String> models;

    public AnthropicModelProvider(
            String apiKey,
            URI endpoint,
            Map<ModelTier, String> models,
            Duration connectTimeout,
            Duration requestTimeout
    ) {
        super(NAME, connectTimeout, requestTimeout);
        this.apiKey = Objects.requireNonNull(apiKey, "API key is required");
        this.endpoint = endpoint != null ? endpoint : DEFAULT_ENDPOINT;
        this.models = new EnumMap<>(defaultModels());
        if (models != null) {
            this.models.putAll(models);
        }
        log.info("Anthropic provider created: endpoint={}, models={}", this.endpoint, this.models);
    }

    public static Map<ModelTier, String> defaultModels() {
        Map<ModelTier, String> defaults = new EnumMap<>(ModelTier.class);
        defaults.put(ModelTier.EXTRACTION, "claude-3-5-haiku-latest");
        defaults.put(ModelTier.FAST, "claude-3-5-haiku-latest");
        defaults.put(ModelTier.STANDARD, "claude-3-7-sonnet-latest");
        defaults.put(ModelTier.PREMIUM, "claude-3-opus-latest");
        return defaults;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String mapModel(ModelTier tier) {
        return models.get(tier);
    }

    @Override
    public CompletableFuture<String> call(ModelRequest request) {
        Map<String, Object> body = Map.of(
                "model", request.model(),
                "max_tokens", request.maxTokens(),
                "messages", List.of(Map.of("role", "user", "content", request.prompt()))
        );

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("x-api-key", apiKey)
                .header("anthropic-version", API_VERSION)
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body)))
                .build();

        return sendJson(httpRequest, request.requestId()).thenApply(this::extractText);
    }

    private String extractText(JsonNode response) {
        JsonNode first = response.path("content").path(0);
        if (!"text".equals(first.path("type").asText()) || !first.path("text").isTextual()) {
            throw UpstreamException.malformed(NAME, "Anthropic response has no text content", null);
        }
        return first.path("text").asText().trim();
    }

    @Override
    protected String displayName() {
        return "Anthropic";
    }
}
