package fr.lapetina.factcheck.provider;

import fr.lapetina.factcheck.cache.CacheStats;
import fr.lapetina.factcheck.cache.ResponseCache;
import fr.lapetina.factcheck.domain.model.ModelRequest;
import fr.lapetina.factcheck.domain.model.ModelTier;
import fr.lapetina.factcheck.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.factcheck.queue.CancellationToken;
import fr.lapetina.factcheck.queue.RequestQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Model calls through the response cache and the model request queue.
 *
 * A cache hit returns without touching the queue. A miss is enqueued, and a
 * successful response is stored under the exact prompt and provider model id.
 */
public final class ModelClient {

    private static final Logger log = LoggerFactory.getLogger(ModelClient.class);

    private final ModelProvider provider;
    private final RequestQueue queue;
    private final ResponseCache cache;
    private final MetricsRegistry metrics;
    private final Clock clock;

    /**
     * @param cache   null disables caching
     * @param metrics null disables metrics
     */
    public ModelClient(ModelProvider provider, RequestQueue queue, ResponseCache cache, MetricsRegistry metrics, Clock clock) {
        this.provider = Objects.requireNonNull(provider, "Provider is required");
        this.queue = Objects.requireNonNull(queue, "Queue is required");
        this.cache = cache;
        this.metrics = metrics;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public ModelClient(ModelProvider provider, RequestQueue queue, ResponseCache cache, MetricsRegistry metrics) {
        this(provider, queue, cache, metrics, Clock.systemUTC());
    }

    public CompletableFuture<String> call(String prompt, ModelTier tier, int maxTokens, boolean useCache) {
        return call(prompt, tier, maxTokens, useCache, CancellationToken.none());
    }

    /**
     * Sends a prompt to the provider model serving {@code tier}.
     */
    public CompletableFuture<String> call(
            String prompt,
            ModelTier tier,
            int maxTokens,
            boolean useCache,
            CancellationToken token
    ) {
        String model = modelFor(tier);
        if (model == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException(
                    "No model configured for tier " + tier + " on provider " + provider.name()));
        }

        boolean cached = useCache && cache != null;
        if (cached) {
            Optional<String> hit = cache.lookup(prompt, model, maxTokens);
            if (hit.isPresent()) {
                log.debug("Model response served from cache: provider={}, model={}, tier={}",
                        provider.name(), model, tier);
                return CompletableFuture.completedFuture(hit.get());
            }
        }

        Instant start = clock.instant();
        ModelRequest request = ModelRequest.of(model, prompt, maxTokens);
        log.debug("Model call enqueued: provider={}, model={}, tier={}, requestId={}, promptLength={}",
                provider.name(), model, tier, request.requestId(), prompt.length());

        return queue.enqueue(() -> provider.call(request), token)
                .whenComplete((response, error) -> {
                    Duration latency = Duration.between(start, clock.instant());
                    if (metrics != null) {
                        metrics.recordModelCall(tier, error == null ? "success" : "failure", latency);
                    }
                    if (error == null && cached) {
                        cache.put(prompt, model, maxTokens, response);
                    }
                });
    }

    public String modelFor(ModelTier tier) {
        return provider.mapModel(tier);
    }

    public String providerName() {
        return provider.name();
    }

    public CacheStats cacheStats() {
        return cache != null ? cache.stats() : CacheStats.of(0, 0, 0, 0);
    }

    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    /**
     * Changes the model queue's per-minute limit. Values below 1 are raised to 1.
     */
    public void setRateLimit(int limitPerMinute) {
        queue.setRateLimit(Math.max(1, limitPerMinute));
    }

    public int getRateLimit() {
        return queue.getRateLimit();
    }
}
