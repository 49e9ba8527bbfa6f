package fr.lapetina.factcheck.infrastructure.config;

/**
 * Root configuration object for the fact-check service.
 * Designed to be populated from YAML.
 */
public class FactCheckConfig {

    private ServerConfig server = new ServerConfig();
    private ProviderConfig provider = new ProviderConfig();
    private SearchConfig search = new SearchConfig();
    private QueuesConfig queues = new QueuesConfig();
    private RetryConfig retry = new RetryConfig();
    private CacheConfig cache = new CacheConfig();
    private CheckConfig check = new CheckConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public ProviderConfig getProvider() { return provider; }
    public void setProvider(ProviderConfig provider) { this.provider = provider; }

    public SearchConfig getSearch() { return search; }
    public void setSearch(SearchConfig search) { this.search = search; }

    public QueuesConfig getQueues() { return queues; }
    public void setQueues(QueuesConfig queues) { this.queues = queues; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }

    public CheckConfig getCheck() { return check; }
    public void setCheck(CheckConfig check) { this.check = check; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int workerThreads = 16;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    /**
     * AI provider configuration. Model ids left empty use the provider's defaults.
     */
    public static class ProviderConfig {
        private String type = "openai";
        private String apiKey;
        private String baseUrl;
        private String extractionModel;
        private String fastModel;
        private String standardModel;
        private String premiumModel;
        private int maxTokens = 500;
        private int extractionMaxTokens = 300;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getExtractionModel() { return extractionModel; }
        public void setExtractionModel(String extractionModel) { this.extractionModel = extractionModel; }

        public String getFastModel() { return fastModel; }
        public void setFastModel(String fastModel) { this.fastModel = fastModel; }

        public String getStandardModel() { return standardModel; }
        public void setStandardModel(String standardModel) { this.standardModel = standardModel; }

        public String getPremiumModel() { return premiumModel; }
        public void setPremiumModel(String premiumModel) { this.premiumModel = premiumModel; }

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

        public int getExtractionMaxTokens() { return extractionMaxTokens; }
        public void setExtractionMaxTokens(int extractionMaxTokens) { this.extractionMaxTokens = extractionMaxTokens; }
    }

    /**
     * Web search configuration.
     */
    public static class SearchConfig {
        private boolean enabled = true;
        private String apiKey;
        private String baseUrl;
        private int resultsCount = 5;
        private int maxClaims = 2;
        private int maxClaimLength = 80;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public int getResultsCount() { return resultsCount; }
        public void setResultsCount(int resultsCount) { this.resultsCount = resultsCount; }

        public int getMaxClaims() { return maxClaims; }
        public void setMaxClaims(int maxClaims) { this.maxClaims = maxClaims; }

        public int getMaxClaimLength() { return maxClaimLength; }
        public void setMaxClaimLength(int maxClaimLength) { this.maxClaimLength = maxClaimLength; }
    }

    /**
     * One request queue per upstream service.
     */
    public static class QueuesConfig {
        private QueueConfig model = new QueueConfig(5, 1000, 15000);
        private QueueConfig search = new QueueConfig(60, 1000, 10000);

        public QueueConfig getModel() { return model; }
        public void setModel(QueueConfig model) { this.model = model; }

        public QueueConfig getSearch() { return search; }
        public void setSearch(QueueConfig search) { this.search = search; }
    }

    /**
     * Rate limit and backoff of a request queue.
     */
    public static class QueueConfig {
        private int rateLimitPerMinute;
        private long baseBackoffMs;
        private long maxBackoffMs;
        private double backoffFactor = 2.0;
        private long rateLimitRecheckMs = 1000;

        public QueueConfig() {
            this(5, 1000, 15000);
        }

        public QueueConfig(int rateLimitPerMinute, long baseBackoffMs, long maxBackoffMs) {
            this.rateLimitPerMinute = rateLimitPerMinute;
            this.baseBackoffMs = baseBackoffMs;
            this.maxBackoffMs = maxBackoffMs;
        }

        public int getRateLimitPerMinute() { return rateLimitPerMinute; }
        public void setRateLimitPerMinute(int rateLimitPerMinute) { this.rateLimitPerMinute = rateLimitPerMinute; }

        public long getBaseBackoffMs() { return baseBackoffMs; }
        public void setBaseBackoffMs(long baseBackoffMs) { this.baseBackoffMs = baseBackoffMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }

        public double getBackoffFactor() { return backoffFactor; }
        public void setBackoffFactor(double backoffFactor) { this.backoffFactor = backoffFactor; }

        public long getRateLimitRecheckMs() { return rateLimitRecheckMs; }
        public void setRateLimitRecheckMs(long rateLimitRecheckMs) { this.rateLimitRecheckMs = rateLimitRecheckMs; }
    }

    /**
     * Retry of single model calls and of whole checks.
     */
    public static class RetryConfig {
        private RetryPolicyConfig call = new RetryPolicyConfig(3, 1000, 15000);
        private RetryPolicyConfig check = new RetryPolicyConfig(2, 2000, 30000);

        public RetryPolicyConfig getCall() { return call; }
        public void setCall(RetryPolicyConfig call) { this.call = call; }

        public RetryPolicyConfig getCheck() { return check; }
        public void setCheck(RetryPolicyConfig check) { this.check = check; }
    }

    public static class RetryPolicyConfig {
        private int maxRetries;
        private long initialBackoffMs;
        private long maxBackoffMs;

        public RetryPolicyConfig() {
            this(3, 1000, 15000);
        }

        public RetryPolicyConfig(int maxRetries, long initialBackoffMs, long maxBackoffMs) {
            this.maxRetries = maxRetries;
            this.initialBackoffMs = initialBackoffMs;
            this.maxBackoffMs = maxBackoffMs;
        }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }
    }

    /**
     * Response cache configuration.
     */
    public static class CacheConfig {
        private boolean enabled = true;
        private int maxSize = 100;
        private long ttlHours = 24;
        private boolean persist = false;
        private String directory = ".factcheck-cache";
        private String namespace = "apiCache";
        private long persistDebounceMs = 5000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }

        public long getTtlHours() { return ttlHours; }
        public void setTtlHours(long ttlHours) { this.ttlHours = ttlHours; }

        public boolean isPersist() { return persist; }
        public void setPersist(boolean persist) { this.persist = persist; }

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public String getNamespace() { return namespace; }
        public void setNamespace(String namespace) { this.namespace = namespace; }

        public long getPersistDebounceMs() { return persistDebounceMs; }
        public void setPersistDebounceMs(long persistDebounceMs) { this.persistDebounceMs = persistDebounceMs; }
    }

    /**
     * Check pipeline toggles. {@code multiModel}, {@code costSensitive} and {@code urgency}
     * are applied on reload.
     */
    public static class CheckConfig {
        private boolean multiModel = true;
        private boolean costSensitive = true;
        private String urgency = "medium";
        private int fingerprintPrefixLength = 1000;
        private int emergencyInputLength = 1000;
        private int queryExtractionThreshold = 300;
        private int maxTextLength = 50000;
        private long requestTimeoutMs = 120000;

        public boolean isMultiModel() { return multiModel; }
        public void setMultiModel(boolean multiModel) { this.multiModel = multiModel; }

        public boolean isCostSensitive() { return costSensitive; }
        public void setCostSensitive(boolean costSensitive) { this.costSensitive = costSensitive; }

        public String getUrgency() { return urgency; }
        public void setUrgency(String urgency) { this.urgency = urgency; }

        public int getFingerprintPrefixLength() { return fingerprintPrefixLength; }
        public void setFingerprintPrefixLength(int length) { this.fingerprintPrefixLength = length; }

        public int getEmergencyInputLength() { return emergencyInputLength; }
        public void setEmergencyInputLength(int emergencyInputLength) { this.emergencyInputLength = emergencyInputLength; }

        public int getQueryExtractionThreshold() { return queryExtractionThreshold; }
        public void setQueryExtractionThreshold(int threshold) { this.queryExtractionThreshold = threshold; }

        public int getMaxTextLength() { return maxTextLength; }
        public void setMaxTextLength(int maxTextLength) { this.maxTextLength = maxTextLength; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * Upstream HTTP timeouts.
     */
    public static class TimeoutsConfig {
        private long requestTimeoutMs = 60000;
        private long connectTimeoutMs = 10000;

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "factcheck";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
