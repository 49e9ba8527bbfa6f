package fr.lapetina.factcheck.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.factcheck.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Content-addressed memo of (prompt, model, token budget) to upstream response.
 *
 * KEYS:
 *
 * {@code model:maxTokens:hash}, where hash is the first 50 hex characters of
 * SHA-256(prompt + model). A truncated hash can collide, so every lookup through
 * {@link #lookup(String, String, int)} also compares the stored prompt and model
 * exactly before returning a response.
 *
 * EVICTION:
 *
 * Once a write pushes the size above {@code maxSize}, entries are sorted by
 * timestamp and the oldest removed until exactly {@code maxSize} remain. Entries
 * older than the TTL are dropped when read and when loaded from the store.
 *
 * PERSISTENCE:
 *
 * When a {@link CacheStore} is configured, writes schedule a snapshot after a
 * debounce window; further writes inside the window push it back, so a burst of
 * writes produces a single snapshot. The stored payload maps each key to
 * {@code {value: {query, model, response}, timestamp}}.
 *
 * All public methods are thread-safe.
 */
public final class ResponseCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    static final int HASH_LENGTH = 50;

    private final int maxSize;
    private final Duration ttl;
    private final Clock clock;
    private final CacheStore store;
    private final String namespace;
    private final Duration persistDebounce;
    private final MetricsRegistry metrics;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService persistScheduler;

    private final Map<String, CacheEntry> entries = new LinkedHashMap<>();
    private long hits;
    private long misses;
    private long evictions;
    private ScheduledFuture<?> pendingPersist;

    private ResponseCache(Builder builder) {
        this.maxSize = builder.maxSize;
        this.ttl = builder.ttl;
        this.clock = builder.clock;
        this.store = builder.store;
        this.namespace = builder.namespace;
        this.persistDebounce = builder.persistDebounce;
        this.metrics = builder.metricsRegistry;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        if (store != null) {
            this.persistScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "cache-persist-" + namespace);
                t.setDaemon(true);
                return t;
            });
            load();
        } else {
            this.persistScheduler = null;
        }

        if (metrics != null) {
            metrics.registerCacheSize(this::size);
        }

        log.info("ResponseCache initialized: maxSize={}, ttlHours={}, persistent={}, namespace={}, entries={}",
                maxSize, ttl.toHours(), store != null, namespace, size());
    }

    /**
     * Builds the cache key for a prompt under a model and token budget.
     */
    public static String generateKey(String prompt, String model, int maxTokens) {
        Objects.requireNonNull(prompt, "Prompt is required");
        Objects.requireNonNull(model, "Model is required");
        return model + ":" + maxTokens + ":" + hash(prompt + model);
    }

    static String hash(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Returns the live entry for a key, dropping it if it has expired.
     * Does not update hit/miss counters.
     */
    public synchronized Optional<CacheEntry> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry.timestamp())) {
            entries.remove(key);
            log.debug("Cache entry expired: key={}", abbreviate(key));
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    /**
     * Looks up a response by exact prompt and model. Counts a hit or a miss.
     */
    public Optional<String> lookup(String prompt, String model, int maxTokens) {
        String key = generateKey(prompt, model, maxTokens);
        Optional<String> response;
        synchronized (this) {
            response = get(key).filter(entry -> entry.matches(prompt, model)).map(CacheEntry::response);
            if (response.isPresent()) {
                hits++;
            } else {
                misses++;
            }
        }
        if (response.isPresent()) {
            log.debug("Cache hit: key={}", abbreviate(key));
        }
        if (metrics != null) {
            metrics.incrementCacheLookup(response.isPresent() ? "hit" : "miss");
        }
        return response;
    }

    /**
     * Stores a response for a prompt and model, replacing any previous entry for the key.
     */
    public void put(String prompt, String model, int maxTokens, String response) {
        String key = generateKey(prompt, model, maxTokens);
        set(key, new CacheEntry(key, prompt, model, response, clock.instant()));
    }

    public void set(String key, CacheEntry entry) {
        int evicted;
        synchronized (this) {
            entries.put(key, entry);
            evicted = enforceLimit();
            evictions += evicted;
        }
        if (evicted > 0) {
            log.debug("Evicted oldest cache entries: count={}, maxSize={}", evicted, maxSize);
            if (metrics != null) {
                metrics.incrementCacheEvictions(evicted);
            }
        }
        schedulePersist();
    }

    private int enforceLimit() {
        if (entries.size() <= maxSize) {
            return 0;
        }
        List<CacheEntry> byAge = new ArrayList<>(entries.values());
        byAge.sort(Comparator.comparing(CacheEntry::timestamp));
        int toRemove = entries.size() - maxSize;
        for (int i = 0; i < toRemove; i++) {
            entries.remove(byAge.get(i).key());
        }
        return toRemove;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized CacheStats stats() {
        return CacheStats.of(entries.size(), hits, misses, evictions);
    }

    /**
     * Removes every entry and the persisted snapshot.
     */
    public void clear() {
        synchronized (this) {
            entries.clear();
            if (pendingPersist != null) {
                pendingPersist.cancel(false);
                pendingPersist = null;
            }
        }
        if (store != null) {
            try {
                store.remove(namespace);
            } catch (RuntimeException e) {
                log.warn("Failed to remove persisted cache: namespace={}", namespace, e);
            }
        }
        log.info("Cache cleared: namespace={}", namespace);
    }

    private void schedulePersist() {
        if (store == null) {
            return;
        }
        synchronized (this) {
            if (pendingPersist != null) {
                pendingPersist.cancel(false);
            }
            try {
                pendingPersist = persistScheduler.schedule(
                        this::flush, persistDebounce.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("Persist not scheduled, cache closing: namespace={}", namespace);
            }
        }
    }

    /**
     * Writes a snapshot to the store now. Failures are logged, never thrown.
     */
    public void flush() {
        if (store == null) {
            return;
        }
        Map<String, PersistedEntry> snapshot = new LinkedHashMap<>();
        synchronized (this) {
            if (pendingPersist != null) {
                pendingPersist.cancel(false);
                pendingPersist = null;
            }
            for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
                CacheEntry entry = e.getValue();
                snapshot.put(e.getKey(), new PersistedEntry(
                        new PersistedValue(entry.query(), entry.model(), entry.response()),
                        entry.timestamp()));
            }
        }
        try {
            store.set(namespace, objectMapper.writeValueAsBytes(snapshot));
            log.debug("Persisted cache entries: namespace={}, count={}", namespace, snapshot.size());
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to persist cache: namespace={}", namespace, e);
        }
    }

    private void load() {
        Optional<byte[]> payload;
        try {
            payload = store.get(namespace);
        } catch (RuntimeException e) {
            log.warn("Failed to read persisted cache, starting empty: namespace={}", namespace, e);
            return;
        }
        if (payload.isEmpty()) {
            return;
        }
        Map<String, PersistedEntry> stored;
        try {
            stored = objectMapper.readValue(payload.get(), new TypeReference<LinkedHashMap<String, PersistedEntry>>() {});
        } catch (IOException e) {
            log.warn("Corrupt persisted cache, starting empty: namespace={}", namespace, e);
            return;
        }
        int skipped = 0;
        synchronized (this) {
            for (Map.Entry<String, PersistedEntry> e : stored.entrySet()) {
                PersistedEntry persisted = e.getValue();
                if (persisted == null || persisted.value() == null || persisted.timestamp() == null
                        || isExpired(persisted.timestamp())) {
                    skipped++;
                    continue;
                }
                PersistedValue value = persisted.value();
                if (value.query() == null || value.model() == null || value.response() == null) {
                    skipped++;
                    continue;
                }
                entries.put(e.getKey(), new CacheEntry(
                        e.getKey(), value.query(), value.model(), value.response(), persisted.timestamp()));
            }
            enforceLimit();
        }
        log.info("Loaded cache entries from store: namespace={}, loaded={}, skipped={}",
                namespace, size(), skipped);
    }

    private boolean isExpired(Instant timestamp) {
        return Duration.between(timestamp, clock.instant()).compareTo(ttl) > 0;
    }

    private static String abbreviate(String key) {
        return key.length() > 20 ? key.substring(0, 20) + "..." : key;
    }

    /**
     * Flushes any pending snapshot and stops the persist scheduler.
     */
    @Override
    public void close() {
        if (persistScheduler == null) {
            return;
        }
        boolean dirty;
        synchronized (this) {
            dirty = pendingPersist != null;
            if (pendingPersist != null) {
                pendingPersist.cancel(false);
            }
        }
        persistScheduler.shutdown();
        try {
            persistScheduler.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (dirty) {
            flush();
        }
    }

    public record PersistedValue(String query, String model, String response) {
    }

    public record PersistedEntry(PersistedValue value, Instant timestamp) {
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ResponseCache.
     */
    public static final class Builder {
        private int maxSize = 100;
        private Duration ttl = Duration.ofHours(24);
        private Clock clock = Clock.systemUTC();
        private CacheStore store;
        private String namespace = "apiCache";
        private Duration persistDebounce = Duration.ofSeconds(5);
        private MetricsRegistry metricsRegistry;

        public Builder maxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Enables persistence. Without a store the cache lives only in memory.
         */
        public Builder store(CacheStore store) {
            this.store = store;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder persistDebounce(Duration debounce) {
            this.persistDebounce = debounce;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public ResponseCache build() {
            if (maxSize < 1) {
                throw new IllegalStateException("maxSize must be >= 1");
            }
            if (ttl == null || ttl.isNegative() || ttl.isZero()) {
                throw new IllegalStateException("TTL must be positive");
            }
            if (clock == null) {
                throw new IllegalStateException("Clock is required");
            }
            if (namespace == null || namespace.isBlank()) {
                throw new IllegalStateException("Namespace is required");
            }
            if (persistDebounce == null || persistDebounce.isNegative()) {
                throw new IllegalStateException("Persist debounce must be >= 0");
            }
            return new ResponseCache(this);
        }
    }
}
