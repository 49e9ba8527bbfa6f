package fr.lapetina.factcheck.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A single prompt to be sent to a model provider.
 * Immutable and thread-safe.
 */
public record ModelRequest(
        String requestId,
        String model,
        String prompt,
        int maxTokens,
        Instant createdAt
) {
    public ModelRequest {
        Objects.requireNonNull(model, "Model is required");
        Objects.requireNonNull(prompt, "Prompt is required");
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public static ModelRequest of(String model, String prompt, int maxTokens) {
        return new ModelRequest(null, model, prompt, maxTokens, null);
    }
}
