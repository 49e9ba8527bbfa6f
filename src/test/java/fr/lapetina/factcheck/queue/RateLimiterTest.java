package fr.lapetina.factcheck.queue;

import fr.lapetina.factcheck.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    private MutableClock clock;
    private RateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        limiter = new RateLimiter(3, clock);
    }

    @Test
    @DisplayName("should allow until the window holds limit timestamps")
    void shouldAllowUntilLimitReached() {
        for (int i = 0; i < 3; i++) {
            assertThat(limiter.allow()).isTrue();
            limiter.record();
        }

        assertThat(limiter.allow()).isFalse();
        assertThat(limiter.countInWindow()).isEqualTo(3);
    }

    @Test
    @DisplayName("should not record on a denied check")
    void shouldNotRecordOnDenied() {
        limiter.record();
        limiter.record();
        limiter.record();

        limiter.allow();
        limiter.allow();

        assertThat(limiter.countInWindow()).isEqualTo(3);
    }

    @Test
    @DisplayName("should allow again once the oldest timestamp is 60s old")
    void shouldAllowAfterWindowSlides() {
        limiter.record();
        clock.advance(Duration.ofSeconds(20));
        limiter.record();
        limiter.record();
        assertThat(limiter.allow()).isFalse();

        clock.advance(Duration.ofSeconds(39));
        assertThat(limiter.allow()).isFalse();
        assertThat(limiter.timeUntilAllowed()).isEqualTo(Duration.ofSeconds(1));

        clock.advance(Duration.ofSeconds(1));
        assertThat(limiter.allow()).isTrue();
        assertThat(limiter.countInWindow()).isEqualTo(2);
    }

    @Test
    @DisplayName("should treat limit 0 as unlimited")
    void shouldTreatZeroAsUnlimited() {
        limiter.setLimit(0);
        for (int i = 0; i < 100; i++) {
            limiter.record();
        }

        assertThat(limiter.allow()).isTrue();
        assertThat(limiter.timeUntilAllowed()).isZero();
    }

    @Test
    @DisplayName("should apply a lowered limit immediately")
    void shouldApplyLoweredLimit() {
        limiter.record();
        limiter.record();
        assertThat(limiter.allow()).isTrue();

        limiter.setLimit(2);

        assertThat(limiter.allow()).isFalse();
    }

    @Test
    @DisplayName("should reject a negative limit")
    void shouldRejectNegativeLimit() {
        assertThatThrownBy(() -> limiter.setLimit(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
