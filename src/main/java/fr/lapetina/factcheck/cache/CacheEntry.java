package fr.lapetina.factcheck.cache;

import java.time.Instant;
import java.util.Objects;

/**
 * A memoized upstream response. Never mutated; replaced or evicted.
 *
 * @param query exact prompt the response belongs to, compared on lookup
 * @param model exact provider model id, compared on lookup
 */
public record CacheEntry(
        String key,
        String query,
        String model,
        String response,
        Instant timestamp
) {
    public CacheEntry {
        Objects.requireNonNull(key, "Key is required");
        Objects.requireNonNull(query, "Query is required");
        Objects.requireNonNull(model, "Model is required");
        Objects.requireNonNull(response, "Response is required");
        Objects.requireNonNull(timestamp, "Timestamp is required");
    }

    public boolean matches(String prompt, String modelId) {
        return query.equals(prompt) && model.equals(modelId);
    }
}
