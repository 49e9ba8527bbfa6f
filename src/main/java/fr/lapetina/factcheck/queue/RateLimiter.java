package fr.lapetina.factcheck.queue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Sliding-window limiter over the trailing 60 seconds.
 *
 * Not thread-safe: owned by a single {@link RequestQueue} and only touched from its
 * dispatch thread. The limit itself is volatile so it can be changed from elsewhere.
 * A limit of 0 disables limiting.
 */
public final class RateLimiter {

    static final Duration WINDOW = Duration.ofSeconds(60);

    private final Clock clock;
    private final Deque<Instant> timestamps = new ArrayDeque<>();
    private volatile int limitPerMinute;

    public RateLimiter(int limitPerMinute, Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        setLimit(limitPerMinute);
    }

    public RateLimiter(int limitPerMinute) {
        this(limitPerMinute, Clock.systemUTC());
    }

    /**
     * True if fewer than {@code limit} dispatches happened in the trailing window.
     * Only prunes expired timestamps; never records.
     */
    public boolean allow() {
        int limit = limitPerMinute;
        if (limit == 0) {
            return true;
        }
        prune();
        return timestamps.size() < limit;
    }

    public void record() {
        timestamps.addLast(clock.instant());
    }

    /**
     * Time until the oldest timestamp leaves the window, or zero when dispatch is allowed.
     */
    public Duration timeUntilAllowed() {
        if (allow() || timestamps.isEmpty()) {
            return Duration.ZERO;
        }
        Duration elapsed = Duration.between(timestamps.peekFirst(), clock.instant());
        Duration remaining = WINDOW.minus(elapsed);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public int countInWindow() {
        prune();
        return timestamps.size();
    }

    public int getLimit() {
        return limitPerMinute;
    }

    public void setLimit(int limitPerMinute) {
        if (limitPerMinute < 0) {
            throw new IllegalArgumentException("Rate limit must be >= 0");
        }
        this.limitPerMinute = limitPerMinute;
    }

    private void prune() {
        Instant now = clock.instant();
        while (!timestamps.isEmpty()
                && Duration.between(timestamps.peekFirst(), now).compareTo(WINDOW) >= 0) {
            timestamps.pollFirst();
        }
    }
}
