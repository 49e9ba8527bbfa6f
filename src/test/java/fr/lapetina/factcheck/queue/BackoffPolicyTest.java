package fr.lapetina.factcheck.queue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    private final BackoffPolicy policy = BackoffPolicy.ofMillis(1000, 15000, 2.0);

    @Test
    @DisplayName("should double the delay per consecutive error")
    void shouldGrowExponentially() {
        assertThat(policy.delay(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delay(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delay(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.delay(3)).isEqualTo(Duration.ofSeconds(8));
    }

    @Test
    @DisplayName("should be non-decreasing and never exceed max")
    void shouldBeMonotonicAndClamped() {
        Duration previous = Duration.ZERO;
        for (int n = 0; n < 200; n++) {
            Duration delay = policy.delay(n);
            assertThat(delay).isGreaterThanOrEqualTo(previous);
            assertThat(delay).isLessThanOrEqualTo(Duration.ofSeconds(15));
            previous = delay;
        }
        assertThat(policy.delay(10)).isEqualTo(Duration.ofSeconds(15));
    }

    @Test
    @DisplayName("should apply jitter and clamp it to [0.85, 1.15]")
    void shouldApplyClampedJitter() {
        BackoffPolicy low = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(15), 2.0, () -> 0.5);
        BackoffPolicy high = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(15), 2.0, () -> 1.15);

        assertThat(low.jitteredDelay(1)).isEqualTo(Duration.ofMillis(1700));
        assertThat(high.jitteredDelay(1)).isEqualTo(Duration.ofMillis(2300));
        assertThat(high.jitteredDelay(5)).isEqualTo(Duration.ofSeconds(15));
    }

    @Test
    @DisplayName("should keep random jitter within bounds")
    void shouldKeepRandomJitterWithinBounds() {
        for (int i = 0; i < 50; i++) {
            assertThat(policy.jitteredDelay(2).toMillis()).isBetween(3400L, 4600L);
        }
    }

    @Test
    @DisplayName("should reject invalid parameters")
    void shouldRejectInvalidParameters() {
        assertThatThrownBy(() -> BackoffPolicy.ofMillis(2000, 1000, 2.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BackoffPolicy.ofMillis(1000, 2000, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> policy.delay(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
