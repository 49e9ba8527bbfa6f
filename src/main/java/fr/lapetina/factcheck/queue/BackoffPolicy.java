package fr.lapetina.factcheck.queue;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff: {@code delay(n) = min(base * factor^n, max)}.
 *
 * {@link #jitteredDelay(int)} multiplies the raw delay by a factor in [0.85, 1.15]
 * before clamping, so callers sharing an upstream do not retry in lockstep.
 */
public final class BackoffPolicy {

    public static final double MIN_JITTER = 0.85;
    public static final double MAX_JITTER = 1.15;

    private final Duration base;
    private final Duration max;
    private final double factor;
    private final DoubleSupplier jitter;

    public BackoffPolicy(Duration base, Duration max, double factor) {
        this(base, max, factor, () -> ThreadLocalRandom.current().nextDouble(MIN_JITTER, MAX_JITTER));
    }

    /**
     * @param jitter source of multiplicative jitter; values outside [0.85, 1.15] are clamped
     */
    public BackoffPolicy(Duration base, Duration max, double factor, DoubleSupplier jitter) {
        this.base = Objects.requireNonNull(base, "Base delay is required");
        this.max = Objects.requireNonNull(max, "Max delay is required");
        this.jitter = Objects.requireNonNull(jitter, "Jitter source is required");
        if (base.isNegative() || max.isNegative()) {
            throw new IllegalArgumentException("Delays must not be negative");
        }
        if (max.compareTo(base) < 0) {
            throw new IllegalArgumentException("Max delay must be >= base delay");
        }
        if (factor < 1.0) {
            throw new IllegalArgumentException("Backoff factor must be >= 1");
        }
        this.factor = factor;
    }

    public static BackoffPolicy ofMillis(long baseMs, long maxMs, double factor) {
        return new BackoffPolicy(Duration.ofMillis(baseMs), Duration.ofMillis(maxMs), factor);
    }

    public Duration delay(int consecutiveErrors) {
        return scaled(consecutiveErrors, 1.0);
    }

    public Duration jitteredDelay(int consecutiveErrors) {
        double j = Math.max(MIN_JITTER, Math.min(MAX_JITTER, jitter.getAsDouble()));
        return scaled(consecutiveErrors, j);
    }

    private Duration scaled(int consecutiveErrors, double multiplier) {
        if (consecutiveErrors < 0) {
            throw new IllegalArgumentException("consecutiveErrors must be >= 0");
        }
        double raw = base.toMillis() * Math.pow(factor, consecutiveErrors) * multiplier;
        long maxMs = max.toMillis();
        // pow overflows to Infinity for large n; the clamp below still holds
        return Duration.ofMillis(raw >= maxMs ? maxMs : Math.round(raw));
    }

    public Duration getBase() {
        return base;
    }

    public Duration getMax() {
        return max;
    }

    public double getFactor() {
        return factor;
    }

    @Override
    public String toString() {
        return "BackoffPolicy{base=" + base.toMillis() + "ms, max=" + max.toMillis()
                + "ms, factor=" + factor + '}';
    }
}
