package fr.lapetina.factcheck.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Configuration loader with hot-reload support.
 *
 * Supports:
 * - Loading from file system, then classpath
 * - {@code ${VAR}} and {@code ${VAR:default}} references resolved from the environment
 * - File watching for automatic reload
 * - Listener notification on changes
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Pattern ENV_REFERENCE = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)(?::([^}]*))?}");
    private static final Set<String> PROVIDER_TYPES = Set.of("openai", "anthropic");
    private static final Set<String> URGENCIES = Set.of("low", "medium", "high");

    private final AtomicReference<FactCheckConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Function<String, String> environment;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this(configPath, System::getenv);
    }

    /**
     * @param environment resolves {@code ${VAR}} references; returns null for unset variables
     */
    public ConfigLoader(String configPath, Function<String, String> environment) {
        this.configPath = Paths.get(configPath);
        this.environment = environment;
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public FactCheckConfig load() {
        FactCheckConfig config = loadFromPath();
        FactCheckConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private FactCheckConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private FactCheckConfig loadFromFile(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            log.info("Loading configuration from file: {}", path);
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public FactCheckConfig loadFromStream(InputStream inputStream) {
        FactCheckConfig config;
        try {
            config = parse(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration stream", e);
        }
        FactCheckConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private FactCheckConfig parse(InputStream inputStream) throws IOException {
        String raw = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        Yaml yaml = new Yaml(new Constructor(FactCheckConfig.class, new LoaderOptions()));
        FactCheckConfig config;
        try {
            config = yaml.load(resolveEnvironment(raw));
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
        if (config == null) {
            config = createDefault();
        }
        validate(config);
        return config;
    }

    /**
     * Replaces {@code ${VAR}} with the variable value, or with the default after the colon.
     * An unset variable without default resolves to an empty value.
     */
    String resolveEnvironment(String raw) {
        Matcher matcher = ENV_REFERENCE.matcher(raw);
        StringBuilder resolved = new StringBuilder();
        while (matcher.find()) {
            String value = environment.apply(matcher.group(1));
            if (value == null) {
                value = matcher.group(2) != null ? matcher.group(2) : "";
                if (matcher.group(2) == null) {
                    log.warn("Environment variable not set: {}", matcher.group(1));
                }
            }
            matcher.appendReplacement(resolved, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(resolved);
        return resolved.toString();
    }

    static void validate(FactCheckConfig config) {
        String type = config.getProvider().getType();
        if (type == null || !PROVIDER_TYPES.contains(type.toLowerCase(Locale.ROOT))) {
            throw new ConfigurationException("Unknown provider type: " + type + " (expected openai or anthropic)");
        }
        String urgency = config.getCheck().getUrgency();
        if (urgency == null || !URGENCIES.contains(urgency.toLowerCase(Locale.ROOT))) {
            throw new ConfigurationException("Unknown urgency: " + urgency + " (expected low, medium or high)");
        }
        if (config.getProvider().getMaxTokens() < 1 || config.getProvider().getExtractionMaxTokens() < 1) {
            throw new ConfigurationException("provider.maxTokens and provider.extractionMaxTokens must be >= 1");
        }
        validateQueue("queues.model", config.getQueues().getModel());
        validateQueue("queues.search", config.getQueues().getSearch());
        if (config.getCache().getMaxSize() < 1) {
            throw new ConfigurationException("cache.maxSize must be >= 1");
        }
        if (config.getRetry().getCall().getMaxRetries() < 0 || config.getRetry().getCheck().getMaxRetries() < 0) {
            throw new ConfigurationException("retry maxRetries must be >= 0");
        }
    }

    private static void validateQueue(String name, FactCheckConfig.QueueConfig queue) {
        if (queue.getRateLimitPerMinute() < 0) {
            throw new ConfigurationException(name + ".rateLimitPerMinute must be >= 0");
        }
        if (queue.getBaseBackoffMs() < 0 || queue.getMaxBackoffMs() < queue.getBaseBackoffMs()) {
            throw new ConfigurationException(name + " backoff must satisfy 0 <= baseBackoffMs <= maxBackoffMs");
        }
        if (queue.getBackoffFactor() < 1.0) {
            throw new ConfigurationException(name + ".backoffFactor must be >= 1");
        }
    }

    /**
     * Returns the current configuration.
     */
    public FactCheckConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Starts watching the configuration file for changes.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent == null) {
                parent = Paths.get(".");
            }
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });

            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);

        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                Path changed = (Path) event.context();
                if (changed.equals(configPath.getFileName())) {
                    // Debounce - check if file actually changed
                    long newLastModified = Files.getLastModifiedTime(configPath).toMillis();
                    if (newLastModified > lastModified) {
                        log.info("Configuration file changed, reloading...");
                        reload();
                    }
                }
            }

            key.reset();
        } catch (Exception e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a configuration reload. An invalid file keeps the current configuration.
     */
    public FactCheckConfig reload() {
        try {
            return load();
        } catch (Exception e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(FactCheckConfig oldConfig, FactCheckConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    /**
     * Creates a default configuration.
     */
    public static FactCheckConfig createDefault() {
        return new FactCheckConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
