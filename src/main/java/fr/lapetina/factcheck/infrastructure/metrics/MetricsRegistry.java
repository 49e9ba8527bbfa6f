package fr.lapetina.factcheck.infrastructure.metrics;

import fr.lapetina.factcheck.domain.model.CheckStatus;
import fr.lapetina.factcheck.domain.model.ErrorCategory;
import fr.lapetina.factcheck.domain.model.ModelTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Check outcome counters and latency
 * - Model call latency per tier and outcome
 * - Cache hit/miss/eviction counters and size gauge
 * - Queue dispatch outcomes, depth gauges and rate-limit waits
 * - Retry and error counters by category
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> checkTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> modelCallTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    private final AtomicInteger inFlightChecks = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_checks_inflight", inFlightChecks, AtomicInteger::get)
                .description("Fact checks currently executing")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("factcheck");
    }

    /**
     * Records a finished check by terminal status.
     */
    public void recordCheck(CheckStatus status, Duration latency) {
        checkTimers.computeIfAbsent(status.name(), k ->
                Timer.builder(prefix + "_check_latency")
                        .description("End-to-end fact check latency")
                        .tag("status", status.name())
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Counts a check that joined an identical in-flight check instead of running.
     */
    public void incrementDeduplicated() {
        counter("_checks_deduplicated_total", "Checks served by an identical in-flight check").increment();
    }

    public void recordModelCall(ModelTier tier, String outcome, Duration latency) {
        String key = tier.name() + ":" + outcome;
        modelCallTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_model_call_latency")
                        .description("Model call latency including queueing")
                        .tag("tier", tier.name())
                        .tag("outcome", outcome)
                        .register(registry)
        ).record(latency);
    }

    public void incrementCacheLookup(String result) {
        counter("_cache_lookups_total", "Cache lookups", "result", result).increment();
    }

    public void incrementCacheEvictions(int count) {
        counter("_cache_evictions_total", "Cache entries evicted").increment(count);
    }

    public void registerCacheSize(Supplier<Number> size) {
        Gauge.builder(prefix + "_cache_size", size, s -> s.get().doubleValue())
                .description("Entries in the response cache")
                .register(registry);
    }

    public void incrementQueueDispatch(String queue, String outcome) {
        counter("_queue_dispatch_total", "Queue dispatch outcomes", "queue", queue, "outcome", outcome).increment();
    }

    public void incrementRateLimitWait(String queue) {
        counter("_queue_rate_limit_waits_total", "Dispatches deferred by the rate window", "queue", queue).increment();
    }

    public void registerQueueDepth(String queue, Supplier<Number> depth) {
        Gauge.builder(prefix + "_queue_depth", depth, s -> s.get().doubleValue())
                .description("Requests waiting in a queue")
                .tag("queue", queue)
                .register(registry);
    }

    public void incrementRetry(String operation, ErrorCategory category) {
        counter("_retries_total", "Retries by operation and error category",
                "operation", operation, "category", category.name()).increment();
    }

    public void incrementErrorCount(ErrorCategory category) {
        counter("_errors_total", "Classified errors", "category", category.name()).increment();
    }

    public void checkStarted() {
        inFlightChecks.incrementAndGet();
    }

    public void checkFinished() {
        inFlightChecks.decrementAndGet();
    }

    private Counter counter(String suffix, String description, String... tags) {
        String key = suffix + ":" + String.join(":", tags);
        return counters.computeIfAbsent(key, k ->
                Counter.builder(prefix + suffix)
                        .description(description)
                        .tags(tags)
                        .register(registry)
        );
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
