package fr.lapetina.factcheck.resilience;

import fr.lapetina.factcheck.domain.policy.ErrorClassifier;
import fr.lapetina.factcheck.queue.BackoffPolicy;
import fr.lapetina.factcheck.queue.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Runs an asynchronous operation with jittered exponential backoff.
 *
 * The n-th wait (n from 0) is {@code min(initialDelay * 2^n * jitter, maxDelay)}, raised to
 * the failure's {@code minDelay} but never above {@code maxDelay}.
 * A failure is rethrown once {@code maxRetries} retries are used up or when
 * {@code shouldRetry} rejects it. Waits are scheduled, not slept.
 *
 * Independent of any upstream: callers usually wrap a {@link fr.lapetina.factcheck.queue.RequestQueue}
 * enqueue, so a retry re-enters the queue behind newer requests.
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);
    private static final double BACKOFF_FACTOR = 2.0;

    private final DoubleSupplier jitter;
    private final Executor executor;

    public RetryExecutor() {
        this(() -> ThreadLocalRandom.current().nextDouble(BackoffPolicy.MIN_JITTER, BackoffPolicy.MAX_JITTER),
                ForkJoinPool.commonPool());
    }

    /**
     * @param jitter   multiplicative jitter source, clamped to [0.85, 1.15]
     * @param executor runs delayed attempts once their wait is over
     */
    public RetryExecutor(DoubleSupplier jitter, Executor executor) {
        this.jitter = Objects.requireNonNull(jitter, "Jitter source is required");
        this.executor = Objects.requireNonNull(executor, "Executor is required");
    }

    public <T> CompletableFuture<T> retry(Supplier<CompletableFuture<T>> operation, RetryOptions options) {
        return retry(operation, options, CancellationToken.none());
    }

    /**
     * Runs {@code operation} until it succeeds, a failure is not retryable, or retries run out.
     * The token is checked before every attempt, including the first one after a wait.
     *
     * @return future of the first successful result, or of the last unwrapped failure
     */
    public <T> CompletableFuture<T> retry(
            Supplier<CompletableFuture<T>> operation,
            RetryOptions options,
            CancellationToken token
    ) {
        Objects.requireNonNull(operation, "Operation is required");
        Objects.requireNonNull(options, "Options are required");
        CancellationToken effectiveToken = token != null ? token : CancellationToken.none();
        BackoffPolicy backoff = new BackoffPolicy(
                options.initialDelay(), options.maxDelay(), BACKOFF_FACTOR, jitter);

        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(operation, options, backoff, effectiveToken, 0, result);
        return result;
    }

    private <T> void attempt(
            Supplier<CompletableFuture<T>> operation,
            RetryOptions options,
            BackoffPolicy backoff,
            CancellationToken token,
            int retries,
            CompletableFuture<T> result
    ) {
        if (token.isCancelled()) {
            result.completeExceptionally(new CancellationException("Retry cancelled after " + retries + " retries"));
            return;
        }

        CompletableFuture<T> call;
        try {
            call = operation.get();
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        call.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            Throwable cause = ErrorClassifier.unwrap(error);
            if (cause instanceof CancellationException
                    || retries >= options.maxRetries()
                    || !isRetryable(options, cause)) {
                result.completeExceptionally(cause);
                return;
            }

            Duration delay = delayFor(options, backoff, retries, cause);
            RetryInfo info = new RetryInfo(retries + 1, delay, options.maxRetries());
            log.warn("Retrying operation: retry={}/{}, delayMs={}, error={}",
                    info.retryCount(), info.maxRetries(), delay.toMillis(), cause.getMessage());
            try {
                options.onRetry().accept(cause, info);
            } catch (RuntimeException e) {
                log.warn("Retry callback failed", e);
            }

            Executor delayed = CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS, executor);
            delayed.execute(() -> attempt(operation, options, backoff, token, retries + 1, result));
        });
    }

    private static Duration delayFor(RetryOptions options, BackoffPolicy backoff, int retries, Throwable cause) {
        Duration delay = backoff.jitteredDelay(retries);
        Duration floor = options.minDelay().apply(cause);
        if (floor != null && floor.compareTo(delay) > 0) {
            delay = floor;
        }
        return delay.compareTo(options.maxDelay()) > 0 ? options.maxDelay() : delay;
    }

    private static boolean isRetryable(RetryOptions options, Throwable cause) {
        try {
            return options.shouldRetry().test(cause);
        } catch (RuntimeException e) {
            log.warn("Retry predicate failed, not retrying", e);
            return false;
        }
    }
}
