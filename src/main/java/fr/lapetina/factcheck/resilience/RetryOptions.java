package fr.lapetina.factcheck.resilience;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Settings for one {@link RetryExecutor#retry} call.
 *
 * @param maxRetries  retries after the first attempt; 0 means a single attempt
 * @param shouldRetry receives the unwrapped failure
 * @param minDelay    lower bound of the wait after a given failure; {@code maxDelay} still caps it
 */
public record RetryOptions(
        int maxRetries,
        Duration initialDelay,
        Duration maxDelay,
        Predicate<Throwable> shouldRetry,
        BiConsumer<Throwable, RetryInfo> onRetry,
        Function<Throwable, Duration> minDelay
) {
    public RetryOptions {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        Objects.requireNonNull(initialDelay, "Initial delay is required");
        Objects.requireNonNull(maxDelay, "Max delay is required");
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (shouldRetry == null) {
            shouldRetry = error -> true;
        }
        if (onRetry == null) {
            onRetry = (error, info) -> { };
        }
        if (minDelay == null) {
            minDelay = error -> Duration.ZERO;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxRetries = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private Predicate<Throwable> shouldRetry;
        private BiConsumer<Throwable, RetryInfo> onRetry;
        private Function<Throwable, Duration> minDelay;

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder shouldRetry(Predicate<Throwable> shouldRetry) {
            this.shouldRetry = shouldRetry;
            return this;
        }

        public Builder onRetry(BiConsumer<Throwable, RetryInfo> onRetry) {
            this.onRetry = onRetry;
            return this;
        }

        public Builder minDelay(Function<Throwable, Duration> minDelay) {
            this.minDelay = minDelay;
            return this;
        }

        public RetryOptions build() {
            return new RetryOptions(maxRetries, initialDelay, maxDelay, shouldRetry, onRetry, minDelay);
        }
    }
}
