package fr.lapetina.factcheck.resilience;

import fr.lapetina.factcheck.domain.exception.UpstreamException;
import fr.lapetina.factcheck.queue.CancellationToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryExecutorTest {

    private final RetryExecutor executor = new RetryExecutor(() -> 1.0, ForkJoinPool.commonPool());

    private static RetryOptions.Builder fastOptions(int maxRetries) {
        return RetryOptions.builder()
                .maxRetries(maxRetries)
                .initialDelay(Duration.ofMillis(5))
                .maxDelay(Duration.ofMillis(20));
    }

    private static CompletableFuture<String> failing(String message) {
        return CompletableFuture.failedFuture(UpstreamException.network("stub", message, null));
    }

    @Test
    @DisplayName("should return the first successful result after transient failures")
    void shouldSucceedAfterFailures() throws Exception {
        AtomicInteger attempts = new AtomicInteger();

        String result = executor.retry(() -> attempts.incrementAndGet() < 3
                                ? failing("reset")
                                : CompletableFuture.completedFuture("ok"),
                        fastOptions(3).build())
                .get(5, TimeUnit.SECONDS);

        assertThat(result).isEqualTo("ok");
        assertThat(attempts.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("should rethrow the last failure once retries are used up")
    void shouldGiveUpAfterMaxRetries() {
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = executor.retry(() -> {
            attempts.incrementAndGet();
            return failing("attempt " + attempts.get());
        }, fastOptions(2).build());

        assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(UpstreamException.class)
                .hasRootCauseMessage("attempt 3");
        assertThat(attempts.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("should not retry when the predicate rejects the failure")
    void shouldStopOnNonRetryableFailure() {
        AtomicInteger attempts = new AtomicInteger();
        RetryOptions options = fastOptions(5)
                .shouldRetry(error -> !(error instanceof IllegalArgumentException))
                .build();

        CompletableFuture<String> result = executor.retry(() -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(new IllegalArgumentException("bad input"));
        }, options);

        assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("should fold a throwing operation into a retryable failure")
    void shouldCatchThrowingOperation() throws Exception {
        AtomicInteger attempts = new AtomicInteger();

        String result = executor.retry(() -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("boom");
            }
            return CompletableFuture.completedFuture("recovered");
        }, fastOptions(1).build()).get(5, TimeUnit.SECONDS);

        assertThat(result).isEqualTo("recovered");
    }

    @Test
    @DisplayName("should report each retry with a doubling delay")
    void shouldReportRetries() throws Exception {
        List<RetryInfo> retries = new CopyOnWriteArrayList<>();
        RetryOptions options = RetryOptions.builder()
                .maxRetries(3)
                .initialDelay(Duration.ofMillis(5))
                .maxDelay(Duration.ofMillis(15))
                .onRetry((error, info) -> retries.add(info))
                .build();
        AtomicInteger attempts = new AtomicInteger();

        executor.retry(() -> attempts.incrementAndGet() <= 3
                        ? failing("reset")
                        : CompletableFuture.completedFuture("done"), options)
                .get(5, TimeUnit.SECONDS);

        assertThat(retries).extracting(RetryInfo::retryCount).containsExactly(1, 2, 3);
        assertThat(retries).extracting(RetryInfo::delay)
                .containsExactly(Duration.ofMillis(5), Duration.ofMillis(10), Duration.ofMillis(15));
        assertThat(retries).allMatch(info -> info.maxRetries() == 3);
    }

    @Test
    @DisplayName("should wait at least the failure's minimum delay, capped by the max delay")
    void shouldApplyMinimumDelay() throws Exception {
        List<RetryInfo> retries = new CopyOnWriteArrayList<>();
        RetryOptions options = RetryOptions.builder()
                .maxRetries(2)
                .initialDelay(Duration.ofMillis(5))
                .maxDelay(Duration.ofMillis(40))
                .minDelay(error -> error.getMessage().equals("slow down")
                        ? Duration.ofSeconds(5)
                        : Duration.ofMillis(12))
                .onRetry((error, info) -> retries.add(info))
                .build();
        AtomicInteger attempts = new AtomicInteger();

        executor.retry(() -> switch (attempts.incrementAndGet()) {
                    case 1 -> failing("reset");
                    case 2 -> failing("slow down");
                    default -> CompletableFuture.completedFuture("done");
                }, options)
                .get(5, TimeUnit.SECONDS);

        assertThat(retries).extracting(RetryInfo::delay)
                .containsExactly(Duration.ofMillis(12), Duration.ofMillis(40));
    }

    @Test
    @DisplayName("should make a single attempt when maxRetries is zero")
    void shouldAttemptOnceWithZeroRetries() {
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = executor.retry(() -> {
            attempts.incrementAndGet();
            return failing("down");
        }, fastOptions(0).build());

        assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS)).isInstanceOf(ExecutionException.class);
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("should never retry a cancellation")
    void shouldNotRetryCancellation() {
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = executor.retry(() -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(new CancellationException("cancelled"));
        }, fastOptions(3).build());

        assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
                .isInstanceOf(CancellationException.class);
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("should stop before the next attempt once the token is cancelled")
    void shouldStopWhenTokenCancelled() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = executor.retry(() -> {
            attempts.incrementAndGet();
            token.cancel();
            return failing("reset");
        }, fastOptions(3).build(), token);

        assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
                .isInstanceOf(CancellationException.class);
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("should not start at all with an already cancelled token")
    void shouldNotStartWhenAlreadyCancelled() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = executor.retry(() -> {
            attempts.incrementAndGet();
            return CompletableFuture.completedFuture("never");
        }, fastOptions(3).build(), token);

        assertThat(result).isCompletedExceptionally();
        assertThat(attempts.get()).isZero();
    }

    @Test
    @DisplayName("should reject a max delay shorter than the initial delay")
    void shouldRejectInvalidOptions() {
        assertThatThrownBy(() -> RetryOptions.builder()
                .initialDelay(Duration.ofSeconds(2))
                .maxDelay(Duration.ofSeconds(1))
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
