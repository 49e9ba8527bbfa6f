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
 * OpenAI chat completions adapter.
 */
public final class OpenAiModelProvider extends AbstractHttpProvider implements ModelProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiModelProvider.class);

    public static final String NAME = "openai";
    public static final URI DEFAULT_ENDPOINT = URI.create("https://api.openai.com/v1/chat/completions");

    private final String apiKey;
    private final URI endpoint;
    private final Map<ModelTier, String> models;

    public OpenAiModelProvider(
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
        log.info("OpenAI provider created: endpoint={}, models={}", this.endpoint, this.models);
    }

    public static Map<ModelTier, String> defaultModels() {
        Map<ModelTier, String> defaults = new EnumMap<>(ModelTier.class);
        defaults.put(ModelTier.EXTRACTION, "gpt-4o-mini");
        defaults.put(ModelTier.FAST, "gpt-4o-mini");
        defaults.put(ModelTier.STANDARD, "gpt-4o-mini");
        defaults.put(ModelTier.PREMIUM, "gpt-4o");
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
                "messages", List.of(Map.of("role", "user", "content", request.prompt())),
                "max_tokens", request.maxTokens()
        );

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .header("X-Request-ID", request.requestId())
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body)))
                .build();

        return sendJson(httpRequest, request.requestId()).thenApply(this::extractContent);
    }

    private String extractContent(JsonNode response) {
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw UpstreamException.malformed(NAME, "OpenAI response has no message content", null);
        }
        return content.asText().trim();
    }

    @Override
    protected String displayName() {
        return "OpenAI";
    }
}
