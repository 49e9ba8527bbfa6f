package fr.lapetina.factcheck.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static ConfigLoader loader(Map<String, String> environment) {
        return new ConfigLoader("unused.yaml", environment::get);
    }

    private static FactCheckConfig parse(ConfigLoader loader, String yaml) {
        return loader.loadFromStream(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Nested
    @DisplayName("loading")
    class Loading {

        @Test
        @DisplayName("should load the classpath configuration over defaults")
        void shouldLoadFromClasspath() {
            try (ConfigLoader loader = new ConfigLoader("test-factcheck.yaml", name -> null)) {
                FactCheckConfig config = loader.load();

                assertThat(config.getServer().getPort()).isZero();
                assertThat(config.getServer().getWorkerThreads()).isEqualTo(2);
                assertThat(config.getProvider().getType()).isEqualTo("anthropic");
                assertThat(config.getProvider().getApiKey()).isEqualTo("test-key");
                assertThat(config.getProvider().getPremiumModel()).isEqualTo("claude-test-premium");
                assertThat(config.getProvider().getMaxTokens()).isEqualTo(400);
                assertThat(config.getSearch().isEnabled()).isFalse();
                assertThat(config.getQueues().getModel().getBaseBackoffMs()).isEqualTo(10);
                assertThat(config.getRetry().getCheck().getMaxRetries()).isZero();
                assertThat(config.getCheck().getUrgency()).isEqualTo("high");
                assertThat(config.getMetrics().getPrefix()).isEqualTo("factcheck_test");
                assertThat(loader.getCurrentConfig()).isSameAs(config);
            }
        }

        @Test
        @DisplayName("should keep defaults for sections the file leaves out")
        void shouldKeepDefaults() {
            FactCheckConfig config = parse(loader(Map.of()), "provider:\n  type: openai\n");

            assertThat(config.getServer().getPort()).isEqualTo(8080);
            assertThat(config.getQueues().getModel().getRateLimitPerMinute()).isEqualTo(5);
            assertThat(config.getQueues().getSearch().getRateLimitPerMinute()).isEqualTo(60);
            assertThat(config.getRetry().getCall().getMaxRetries()).isEqualTo(3);
            assertThat(config.getCache().getMaxSize()).isEqualTo(100);
            assertThat(config.getCache().getTtlHours()).isEqualTo(24);
            assertThat(config.getCheck().isMultiModel()).isTrue();
        }

        @Test
        @DisplayName("should use defaults for an empty document")
        void shouldHandleEmptyDocument() {
            FactCheckConfig config = parse(loader(Map.of()), "");

            assertThat(config.getProvider().getType()).isEqualTo("openai");
        }

        @Test
        @DisplayName("should fail when the file exists nowhere")
        void shouldFailWhenMissing() {
            ConfigLoader loader = new ConfigLoader("does-not-exist.yaml", name -> null);

            assertThatThrownBy(loader::load)
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("not found");
        }
    }

    @Nested
    @DisplayName("environment references")
    class EnvironmentReferences {

        @Test
        @DisplayName("should substitute set variables")
        void shouldSubstituteVariables() {
            FactCheckConfig config = parse(loader(Map.of("KEY", "sk-live", "PROVIDER", "anthropic")),
                    "provider:\n  type: ${PROVIDER}\n  apiKey: ${KEY}\n");

            assertThat(config.getProvider().getType()).isEqualTo("anthropic");
            assertThat(config.getProvider().getApiKey()).isEqualTo("sk-live");
        }

        @Test
        @DisplayName("should fall back to the default after the colon")
        void shouldUseDefaults() {
            ConfigLoader loader = loader(Map.of());

            assertThat(loader.resolveEnvironment("a: ${MISSING:fallback}")).isEqualTo("a: fallback");
            assertThat(loader.resolveEnvironment("a: ${MISSING:}")).isEqualTo("a: ");
        }

        @Test
        @DisplayName("should resolve an unset variable without default to an empty value")
        void shouldResolveUnsetToEmpty() {
            assertThat(loader(Map.of()).resolveEnvironment("key: ${UNSET}")).isEqualTo("key: ");
        }

        @Test
        @DisplayName("should keep dollar signs in substituted values")
        void shouldQuoteReplacement() {
            assertThat(loader(Map.of("KEY", "a$1b")).resolveEnvironment("${KEY}")).isEqualTo("a$1b");
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("should reject an unknown provider type")
        void shouldRejectUnknownProvider() {
            assertThatThrownBy(() -> parse(loader(Map.of()), "provider:\n  type: cohere\n"))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("Unknown provider type");
        }

        @Test
        @DisplayName("should reject an unknown urgency")
        void shouldRejectUnknownUrgency() {
            assertThatThrownBy(() -> parse(loader(Map.of()), "check:\n  urgency: asap\n"))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("Unknown urgency");
        }

        @Test
        @DisplayName("should reject inverted backoff bounds")
        void shouldRejectInvertedBackoff() {
            String yaml = "queues:\n  model:\n    baseBackoffMs: 5000\n    maxBackoffMs: 100\n";

            assertThatThrownBy(() -> parse(loader(Map.of()), yaml))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("queues.model");
        }

        @Test
        @DisplayName("should reject a cache without room")
        void shouldRejectEmptyCache() {
            assertThatThrownBy(() -> parse(loader(Map.of()), "cache:\n  maxSize: 0\n"))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class);
        }

        @Test
        @DisplayName("should report malformed YAML as a configuration error")
        void shouldRejectMalformedYaml() {
            assertThatThrownBy(() -> parse(loader(Map.of()), "server:\n  port: [not a number\n"))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("reload")
    class Reload {

        @TempDir
        Path dir;

        @Test
        @DisplayName("should notify listeners with the previous and new configuration")
        void shouldNotifyListeners() throws Exception {
            Path file = dir.resolve("factcheck.yaml");
            Files.writeString(file, "queues:\n  model:\n    rateLimitPerMinute: 5\n");
            List<int[]> changes = new ArrayList<>();

            try (ConfigLoader loader = new ConfigLoader(file.toString(), name -> null)) {
                loader.load();
                loader.addListener((previous, current) -> changes.add(new int[]{
                        previous.getQueues().getModel().getRateLimitPerMinute(),
                        current.getQueues().getModel().getRateLimitPerMinute()}));

                Files.writeString(file, "queues:\n  model:\n    rateLimitPerMinute: 20\n");
                FactCheckConfig reloaded = loader.reload();

                assertThat(reloaded.getQueues().getModel().getRateLimitPerMinute()).isEqualTo(20);
                assertThat(changes).singleElement().satisfies(change -> assertThat(change).containsExactly(5, 20));
            }
        }

        @Test
        @DisplayName("should keep the current configuration when the new file is invalid")
        void shouldKeepConfigOnInvalidReload() throws Exception {
            Path file = dir.resolve("factcheck.yaml");
            Files.writeString(file, "check:\n  urgency: low\n");

            try (ConfigLoader loader = new ConfigLoader(file.toString(), name -> null)) {
                FactCheckConfig original = loader.load();

                Files.writeString(file, "check:\n  urgency: whenever\n");
                FactCheckConfig afterReload = loader.reload();

                assertThat(afterReload).isSameAs(original);
                assertThat(loader.getCurrentConfig().getCheck().getUrgency()).isEqualTo("low");
            }
        }

        @Test
        @DisplayName("should stop notifying a removed listener")
        void shouldRemoveListener() throws Exception {
            Path file = dir.resolve("factcheck.yaml");
            Files.writeString(file, "server:\n  port: 9000\n");
            List<FactCheckConfig> seen = new ArrayList<>();
            ConfigChangeListener listener = (previous, current) -> seen.add(current);

            try (ConfigLoader loader = new ConfigLoader(file.toString(), name -> null)) {
                loader.addListener(listener);
                loader.load();
                loader.removeListener(listener);
                loader.reload();
            }

            assertThat(seen).hasSize(1);
            assertThat(seen.get(0).getServer().getPort()).isEqualTo(9000);
        }
    }
}
