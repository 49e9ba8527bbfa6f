package fr.lapetina.factcheck.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.factcheck.api.dto.CheckRequestDto;
import fr.lapetina.factcheck.api.dto.CheckResponseDto;
import fr.lapetina.factcheck.cache.CacheStats;
import fr.lapetina.factcheck.domain.model.CheckResult;
import fr.lapetina.factcheck.domain.model.CheckStatus;
import fr.lapetina.factcheck.domain.model.ErrorCategory;
import fr.lapetina.factcheck.infrastructure.config.ConfigLoader;
import fr.lapetina.factcheck.infrastructure.config.FactCheckConfig;
import fr.lapetina.factcheck.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.factcheck.orchestrator.FactCheckOrchestrator;
import fr.lapetina.factcheck.provider.ModelClient;
import fr.lapetina.factcheck.queue.CancellationToken;
import fr.lapetina.factcheck.queue.RequestQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /api/check - Fact-check a text
 * - GET /api/cache/stats - Response cache statistics
 * - DELETE /api/cache - Clear the response cache
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 * - POST /admin/reload - Reload configuration
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final FactCheckOrchestrator orchestrator;
    private final ModelClient modelClient;
    private final RequestQueue modelQueue;
    private final RequestQueue searchQueue;
    private final MetricsRegistry metricsRegistry;
    private final ConfigLoader configLoader;
    private final Duration requestTimeout;
    private final int maxTextLength;

    /**
     * @param searchQueue     null when search is disabled
     * @param metricsRegistry null when metrics are disabled
     */
    public HttpServer(
            FactCheckConfig.ServerConfig serverConfig,
            FactCheckOrchestrator orchestrator,
            ModelClient modelClient,
            RequestQueue modelQueue,
            RequestQueue searchQueue,
            MetricsRegistry metricsRegistry,
            ConfigLoader configLoader,
            Duration requestTimeout,
            int maxTextLength
    ) throws IOException {
        this.orchestrator = orchestrator;
        this.modelClient = modelClient;
        this.modelQueue = modelQueue;
        this.searchQueue = searchQueue;
        this.metricsRegistry = metricsRegistry;
        this.configLoader = configLoader;
        this.requestTimeout = requestTimeout;
        this.maxTextLength = maxTextLength;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(serverConfig.getHost(), serverConfig.getPort()), serverConfig.getBacklog()
        );

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, serverConfig.getWorkerThreads()), r -> {
            Thread t = new Thread(r, "http-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        // Register handlers
        server.createContext("/api/check", new CheckHandler());
        server.createContext("/api/cache", new CacheHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("HTTP server configured on {}:{}", serverConfig.getHost(), serverConfig.getPort());
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(5);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== CHECK HANDLER ====================

    private class CheckHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String checkId = UUID.randomUUID().toString();
            MDC.put("checkId", checkId);
            CancellationToken token = CancellationToken.create();

            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                CheckRequestDto request;
                try (InputStream is = exchange.getRequestBody()) {
                    request = objectMapper.readValue(is, CheckRequestDto.class);
                } catch (JsonProcessingException e) {
                    sendError(exchange, 400, "Invalid JSON body: " + e.getOriginalMessage());
                    return;
                }

                if (request.getCheckId() != null && !request.getCheckId().isBlank()) {
                    checkId = request.getCheckId();
                    MDC.put("checkId", checkId);
                }
                String text = request.getText();
                if (text == null || text.isBlank()) {
                    sendError(exchange, 400, "Missing 'text' field");
                    return;
                }
                if (text.length() > maxTextLength) {
                    sendError(exchange, 413, "Text exceeds maximum length of " + maxTextLength + " characters");
                    return;
                }

                log.info("Check request received: textLength={}", text.length());
                CheckResult result = orchestrator.check(text, token)
                        .get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
                sendJson(exchange, mapStatus(result), CheckResponseDto.fromCheckResult(checkId, result));

            } catch (TimeoutException e) {
                token.cancel();
                log.warn("Check timed out after {} ms", requestTimeout.toMillis());
                sendError(exchange, 504, "Fact check timed out");
            } catch (InterruptedException e) {
                token.cancel();
                Thread.currentThread().interrupt();
                sendError(exchange, 503, "Interrupted");
            } catch (ExecutionException e) {
                log.error("Error handling check request", e.getCause());
                sendError(exchange, 500, "Internal server error: " + e.getCause().getMessage());
            } finally {
                MDC.clear();
            }
        }

        private int mapStatus(CheckResult result) {
            if (result.status() != CheckStatus.FAILED) {
                return 200;
            }
            ErrorCategory category = result.errorCategory();
            if (category == null) return 500;
            return switch (category) {
                case RATE_LIMIT -> 429;
                case AUTH_ERROR, TEMPORARY -> 502;
                case CONTENT_POLICY, CONTEXT_LENGTH -> 422;
                default -> 500;
            };
        }
    }

    // ==================== CACHE HANDLER ====================

    private class CacheHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            if (path.equals("/api/cache/stats") && "GET".equals(method)) {
                sendJson(exchange, 200, cacheStats(modelClient.cacheStats()));
            } else if (path.equals("/api/cache") && "DELETE".equals(method)) {
                modelClient.clearCache();
                log.info("Response cache cleared");
                sendJson(exchange, 200, Map.of("message", "Cache cleared"));
            } else {
                sendError(exchange, 404, "Not Found");
            }
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", modelQueue.getConsecutiveErrors() > 0 ? "DEGRADED" : "UP");
            health.put("timestamp", System.currentTimeMillis());
            health.put("provider", modelClient.providerName());
            health.put("searchEnabled", orchestrator.isSearchEnabled());
            health.put("pendingChecks", orchestrator.getPendingChecks());

            Map<String, Object> queues = new LinkedHashMap<>();
            queues.put(modelQueue.getName(), queueInfo(modelQueue));
            if (searchQueue != null) {
                queues.put(searchQueue.getName(), queueInfo(searchQueue));
            }
            health.put("queues", queues);
            health.put("cache", cacheStats(modelClient.cacheStats()));

            sendJson(exchange, 200, health);
        }

        private Map<String, Object> queueInfo(RequestQueue queue) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("depth", queue.getDepth());
            info.put("rateLimitPerMinute", queue.getRateLimit());
            info.put("consecutiveErrors", queue.getConsecutiveErrors());
            info.put("draining", queue.isDraining());
            return info;
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            if (metricsRegistry == null) {
                sendError(exchange, 404, "Metrics are disabled");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                if (path.equals("/admin/reload") && "POST".equals(method)) {
                    handleReloadConfig(exchange);
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (RuntimeException e) {
                log.error("Error in admin handler", e);
                sendError(exchange, 500, e.getMessage());
            }
        }

        private void handleReloadConfig(HttpExchange exchange) throws IOException {
            FactCheckConfig newConfig = configLoader.reload();
            sendJson(exchange, 200, Map.of(
                    "message", "Configuration reloaded",
                    "multiModel", newConfig.getCheck().isMultiModel(),
                    "modelRateLimitPerMinute", newConfig.getQueues().getModel().getRateLimitPerMinute()
            ));
        }
    }

    // ==================== HELPER METHODS ====================

    private static Map<String, Object> cacheStats(CacheStats stats) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("size", stats.size());
        info.put("hits", stats.hits());
        info.put("misses", stats.misses());
        info.put("evictions", stats.evictions());
        info.put("hitRate", stats.hitRate());
        return info;
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message != null ? message : "Unknown error");
        sendJson(exchange, statusCode, error);
    }
}
