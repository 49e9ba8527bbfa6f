package fr.lapetina.factcheck;

import fr.lapetina.factcheck.cache.FileCacheStore;
import fr.lapetina.factcheck.cache.ResponseCache;
import fr.lapetina.factcheck.domain.model.ModelTier;
import fr.lapetina.factcheck.domain.model.Urgency;
import fr.lapetina.factcheck.infrastructure.config.ConfigLoader;
import fr.lapetina.factcheck.infrastructure.config.FactCheckConfig;
import fr.lapetina.factcheck.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.factcheck.orchestrator.CheckSettings;
import fr.lapetina.factcheck.orchestrator.FactCheckOrchestrator;
import fr.lapetina.factcheck.provider.ModelClient;
import fr.lapetina.factcheck.provider.ModelProvider;
import fr.lapetina.factcheck.provider.SearchProvider;
import fr.lapetina.factcheck.provider.http.AnthropicModelProvider;
import fr.lapetina.factcheck.provider.http.BraveSearchProvider;
import fr.lapetina.factcheck.provider.http.OpenAiModelProvider;
import fr.lapetina.factcheck.queue.BackoffPolicy;
import fr.lapetina.factcheck.queue.RequestQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Factory for creating a fully-wired orchestrator from configuration.
 * Owns every component it creates and closes them in reverse order.
 *
 * <p>Usage:
 * <pre>{@code
 * try (FactCheckFactory factory = FactCheckFactory.create("factcheck.yaml")) {
 *     CheckResult result = factory.getOrchestrator().check(text).join();
 * }
 * }</pre>
 */
public class FactCheckFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FactCheckFactory.class);

    public static final String MODEL_QUEUE = "model";
    public static final String SEARCH_QUEUE = "search";

    private final ConfigLoader configLoader;
    private final FactCheckConfig config;
    private final MetricsRegistry metricsRegistry;
    private final RequestQueue modelQueue;
    private final RequestQueue searchQueue;
    private final ResponseCache cache;
    private final ModelClient modelClient;
    private final FactCheckOrchestrator orchestrator;

    /**
     * @param modelOverride  replaces the configured AI provider (tests), or null
     * @param searchOverride replaces the configured search provider (tests), or null
     */
    protected FactCheckFactory(String configPath, ModelProvider modelOverride, SearchProvider searchOverride) {
        log.info("Initializing FactCheckFactory from config: {}", configPath);

        // Load configuration
        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        // Initialize metrics
        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : null;

        // Upstream adapters (allow override for testing)
        ModelProvider modelProvider = modelOverride != null ? modelOverride : createModelProvider();
        SearchProvider searchProvider = searchOverride != null ? searchOverride : createSearchProvider();

        // One queue per upstream service
        this.modelQueue = createQueue(MODEL_QUEUE, config.getQueues().getModel());
        this.searchQueue = searchProvider != null ? createQueue(SEARCH_QUEUE, config.getQueues().getSearch()) : null;

        this.cache = config.getCache().isEnabled() ? createCache() : null;
        this.modelClient = new ModelClient(modelProvider, modelQueue, cache, metricsRegistry);

        FactCheckOrchestrator.Builder builder = FactCheckOrchestrator.builder(modelClient)
                .settings(checkSettings(config))
                .maxClaims(config.getSearch().getMaxClaims())
                .maxClaimLength(config.getSearch().getMaxClaimLength())
                .metricsRegistry(metricsRegistry);
        if (searchProvider != null) {
            builder.search(searchProvider, searchQueue);
        }
        this.orchestrator = builder.build();

        // Register config change listener
        configLoader.addListener(this::onConfigChanged);

        log.info("FactCheckFactory initialized: provider={}, search={}, cache={}",
                modelProvider.name(),
                searchProvider != null ? searchProvider.name() : "disabled",
                cache != null ? "enabled" : "disabled");
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static FactCheckFactory create(String configPath) {
        return new FactCheckFactory(configPath, null, null);
    }

    /**
     * Creates a factory from the default configuration (factcheck.yaml).
     */
    public static FactCheckFactory create() {
        return create("factcheck.yaml");
    }

    /**
     * Starts watching the configuration file.
     */
    public FactCheckFactory start() {
        configLoader.startWatching();
        log.info("FactCheckFactory started");
        return this;
    }

    public FactCheckOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public ModelClient getModelClient() {
        return modelClient;
    }

    public RequestQueue getModelQueue() {
        return modelQueue;
    }

    /**
     * @return the search queue, or null when search is disabled
     */
    public RequestQueue getSearchQueue() {
        return searchQueue;
    }

    /**
     * @return the metrics registry, or null when metrics are disabled
     */
    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public FactCheckConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    /**
     * Maps the {@code check}, {@code provider} and {@code retry} sections onto pipeline settings.
     */
    public static CheckSettings checkSettings(FactCheckConfig config) {
        FactCheckConfig.CheckConfig check = config.getCheck();
        FactCheckConfig.RetryConfig retry = config.getRetry();
        return CheckSettings.builder()
                .multiModel(check.isMultiModel())
                .costSensitive(check.isCostSensitive())
                .urgency(urgency(check.getUrgency()))
                .fingerprintPrefixLength(check.getFingerprintPrefixLength())
                .emergencyInputLength(check.getEmergencyInputLength())
                .queryExtractionThreshold(check.getQueryExtractionThreshold())
                .maxTokens(config.getProvider().getMaxTokens())
                .extractionMaxTokens(config.getProvider().getExtractionMaxTokens())
                .callRetry(retrySettings(retry.getCall()))
                .checkRetry(retrySettings(retry.getCheck()))
                .build();
    }

    private static CheckSettings.RetrySettings retrySettings(FactCheckConfig.RetryPolicyConfig policy) {
        return new CheckSettings.RetrySettings(
                policy.getMaxRetries(),
                Duration.ofMillis(policy.getInitialBackoffMs()),
                Duration.ofMillis(policy.getMaxBackoffMs()));
    }

    private static Urgency urgency(String value) {
        return Urgency.valueOf(value.toUpperCase(Locale.ROOT));
    }

    private ModelProvider createModelProvider() {
        FactCheckConfig.ProviderConfig provider = config.getProvider();
        String apiKey = provider.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigLoader.ConfigurationException("provider.apiKey is required for " + provider.getType());
        }
        URI endpoint = provider.getBaseUrl() != null && !provider.getBaseUrl().isBlank()
                ? URI.create(provider.getBaseUrl())
                : null;
        Duration connectTimeout = Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs());
        Duration requestTimeout = Duration.ofMillis(config.getTimeouts().getRequestTimeoutMs());

        return switch (provider.getType().toLowerCase(Locale.ROOT)) {
            case AnthropicModelProvider.NAME -> new AnthropicModelProvider(
                    apiKey, endpoint, modelOverrides(provider), connectTimeout, requestTimeout);
            case OpenAiModelProvider.NAME -> new OpenAiModelProvider(
                    apiKey, endpoint, modelOverrides(provider), connectTimeout, requestTimeout);
            default -> throw new ConfigLoader.ConfigurationException("Unknown provider type: " + provider.getType());
        };
    }

    private static Map<ModelTier, String> modelOverrides(FactCheckConfig.ProviderConfig provider) {
        Map<ModelTier, String> models = new EnumMap<>(ModelTier.class);
        putIfSet(models, ModelTier.EXTRACTION, provider.getExtractionModel());
        putIfSet(models, ModelTier.FAST, provider.getFastModel());
        putIfSet(models, ModelTier.STANDARD, provider.getStandardModel());
        putIfSet(models, ModelTier.PREMIUM, provider.getPremiumModel());
        return models;
    }

    private static void putIfSet(Map<ModelTier, String> models, ModelTier tier, String model) {
        if (model != null && !model.isBlank()) {
            models.put(tier, model);
        }
    }

    private SearchProvider createSearchProvider() {
        FactCheckConfig.SearchConfig search = config.getSearch();
        if (!search.isEnabled()) {
            return null;
        }
        if (search.getApiKey() == null || search.getApiKey().isBlank()) {
            log.warn("Search enabled but search.apiKey is not set, checks will run without references");
            return null;
        }
        URI endpoint = search.getBaseUrl() != null && !search.getBaseUrl().isBlank()
                ? URI.create(search.getBaseUrl())
                : null;
        return new BraveSearchProvider(
                search.getApiKey(),
                endpoint,
                search.getResultsCount(),
                Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()),
                Duration.ofMillis(config.getTimeouts().getRequestTimeoutMs()));
    }

    private RequestQueue createQueue(String name, FactCheckConfig.QueueConfig queue) {
        return RequestQueue.builder(name)
                .rateLimitPerMinute(queue.getRateLimitPerMinute())
                .backoffPolicy(BackoffPolicy.ofMillis(
                        queue.getBaseBackoffMs(), queue.getMaxBackoffMs(), queue.getBackoffFactor()))
                .rateLimitRecheck(Duration.ofMillis(queue.getRateLimitRecheckMs()))
                .metricsRegistry(metricsRegistry)
                .build();
    }

    private ResponseCache createCache() {
        FactCheckConfig.CacheConfig cacheConfig = config.getCache();
        ResponseCache.Builder builder = ResponseCache.builder()
                .maxSize(cacheConfig.getMaxSize())
                .ttl(Duration.ofHours(cacheConfig.getTtlHours()))
                .namespace(cacheConfig.getNamespace())
                .persistDebounce(Duration.ofMillis(cacheConfig.getPersistDebounceMs()))
                .metricsRegistry(metricsRegistry);
        if (cacheConfig.isPersist()) {
            builder.store(new FileCacheStore(Paths.get(cacheConfig.getDirectory())));
        }
        return builder.build();
    }

    private void onConfigChanged(FactCheckConfig oldConfig, FactCheckConfig newConfig) {
        log.info("Configuration changed, applying updates...");

        int rateLimit = newConfig.getQueues().getModel().getRateLimitPerMinute();
        if (oldConfig == null || oldConfig.getQueues().getModel().getRateLimitPerMinute() != rateLimit) {
            modelClient.setRateLimit(rateLimit);
        }

        FactCheckConfig.CheckConfig check = newConfig.getCheck();
        orchestrator.updateSettings(orchestrator.getSettings().withToggles(
                check.isMultiModel(), check.isCostSensitive(), urgency(check.getUrgency())));

        log.info("Configuration updates applied");
    }

    @Override
    public void close() {
        log.info("Shutting down FactCheckFactory...");

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        if (searchQueue != null) {
            try {
                searchQueue.close();
            } catch (Exception e) {
                log.warn("Error closing search queue", e);
            }
        }

        try {
            modelQueue.close();
        } catch (Exception e) {
            log.warn("Error closing model queue", e);
        }

        if (cache != null) {
            try {
                cache.close();
            } catch (Exception e) {
                log.warn("Error closing response cache", e);
            }
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        log.info("FactCheckFactory shut down");
    }
}
