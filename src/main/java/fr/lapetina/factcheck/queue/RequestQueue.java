package fr.lapetina.factcheck.queue;

import fr.lapetina.factcheck.domain.exception.UpstreamException;
import fr.lapetina.factcheck.domain.policy.ErrorClassifier;
import fr.lapetina.factcheck.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * FIFO dispatch queue in front of one upstream service.
 *
 * THREADING MODEL:
 *
 * Every piece of mutable state (pending deque, draining flag, error counter,
 * rate window) is confined to a single scheduler thread. Callers enqueue from any
 * thread by handing a task to that scheduler; upstream completions hop back onto it
 * before they touch state. Delays are scheduled tasks, never sleeps, so the thread
 * is free while the queue waits.
 *
 * Because enqueue and the "queue is empty, stop draining" decision run on the same
 * thread, a request can never arrive unseen between the last iteration and the
 * idle transition.
 *
 * DRAIN LOOP (Idle -> Draining -> Idle):
 *
 * 1. Rate window full: recheck after {@code rateLimitRecheck}.
 * 2. consecutiveErrors > 0: wait {@code backoff.delay(consecutiveErrors)}.
 * 3. Pop head, record a dispatch timestamp, call upstream.
 * 4. Success resets consecutiveErrors.
 * 5. HTTP 429 puts the request back at the head and waits Retry-After,
 *    or twice the backoff computed before the call.
 * 6. Any other failure fails that request only.
 *
 * The error counter is shared by every request in the queue.
 */
public final class RequestQueue implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RequestQueue.class);

    private final String name;
    private final RateLimiter rateLimiter;
    private final BackoffPolicy backoffPolicy;
    private final Duration rateLimitRecheck;
    private final Clock clock;
    private final MetricsRegistry metrics;
    private final ScheduledExecutorService scheduler;

    private final Deque<QueuedRequest<?>> pending = new ArrayDeque<>();
    private final AtomicInteger depth = new AtomicInteger(0);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Set<QueuedRequest<?>> outstanding = ConcurrentHashMap.newKeySet();
    private volatile boolean draining;
    private volatile int consecutiveErrors;

    private RequestQueue(Builder builder) {
        this.name = builder.name;
        this.clock = builder.clock;
        this.rateLimiter = new RateLimiter(builder.rateLimitPerMinute, builder.clock);
        this.backoffPolicy = builder.backoffPolicy;
        this.rateLimitRecheck = builder.rateLimitRecheck;
        this.metrics = builder.metricsRegistry;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "queue-" + name);
            t.setDaemon(true);
            return t;
        });

        if (metrics != null) {
            metrics.registerQueueDepth(name, depth::get);
        }

        log.info("RequestQueue created: name={}, rateLimitPerMinute={}, backoff={}, rateLimitRecheckMs={}",
                name, builder.rateLimitPerMinute, backoffPolicy, rateLimitRecheck.toMillis());
    }

    public <T> CompletableFuture<T> enqueue(Supplier<CompletableFuture<T>> call) {
        return enqueue(call, CancellationToken.none());
    }

    /**
     * Appends a call to the tail of the queue.
     *
     * @param call  starts the upstream call; invoked on the queue thread, possibly more
     *              than once when the upstream answers 429
     * @param token cancellation before dispatch drops the request and fails its future
     *              with {@link java.util.concurrent.CancellationException}
     * @return future completed with the upstream result or failure
     */
    public <T> CompletableFuture<T> enqueue(Supplier<CompletableFuture<T>> call, CancellationToken token) {
        QueuedRequest<T> request = new QueuedRequest<>(
                UUID.randomUUID().toString(), call, clock.instant(), token);

        if (closed.get()) {
            request.fail(new IllegalStateException("Queue closed: " + name));
            return request.future();
        }

        outstanding.add(request);
        request.future().whenComplete((result, error) -> outstanding.remove(request));
        try {
            scheduler.execute(() -> accept(request));
        } catch (RejectedExecutionException e) {
            request.fail(new IllegalStateException("Queue closed: " + name, e));
        }
        return request.future();
    }

    private void accept(QueuedRequest<?> request) {
        pending.addLast(request);
        depth.set(pending.size());
        log.debug("Request enqueued: queue={}, requestId={}, depth={}", name, request.id(), pending.size());
        if (!draining) {
            draining = true;
            drain();
        }
    }

    private void drain() {
        if (closed.get()) {
            return;
        }
        if (pending.isEmpty()) {
            draining = false;
            log.debug("Queue idle: queue={}", name);
            return;
        }
        if (!rateLimiter.allow()) {
            log.debug("Rate window full, waiting: queue={}, inWindow={}, limit={}, untilFreeMs={}",
                    name, rateLimiter.countInWindow(), rateLimiter.getLimit(),
                    rateLimiter.timeUntilAllowed().toMillis());
            if (metrics != null) {
                metrics.incrementRateLimitWait(name);
            }
            schedule(this::drain, rateLimitRecheck);
            return;
        }
        Duration backoff = backoffPolicy.delay(consecutiveErrors);
        if (consecutiveErrors > 0) {
            log.debug("Backing off before dispatch: queue={}, consecutiveErrors={}, delayMs={}",
                    name, consecutiveErrors, backoff.toMillis());
            schedule(() -> dispatchHead(backoff), backoff);
            return;
        }
        dispatchHead(backoff);
    }

    private void dispatchHead(Duration currentBackoff) {
        if (closed.get()) {
            return;
        }
        QueuedRequest<?> request = pending.pollFirst();
        depth.set(pending.size());
        if (request == null) {
            draining = false;
            return;
        }
        if (request.isCancelled()) {
            log.debug("Dropping cancelled request: queue={}, requestId={}", name, request.id());
            request.cancel();
            recordOutcome("cancelled");
            drain();
            return;
        }
        rateLimiter.record();
        dispatch(request, currentBackoff);
    }

    private <T> void dispatch(QueuedRequest<T> request, Duration currentBackoff) {
        log.debug("Request dispatched: queue={}, requestId={}, attempt={}, waitedMs={}",
                name, request.id(), request.attempts() + 1,
                Duration.between(request.enqueueTime(), clock.instant()).toMillis());

        request.invoke().whenCompleteAsync(
                (result, error) -> onSettled(request, result, error, currentBackoff),
                scheduler
        );
    }

    private <T> void onSettled(QueuedRequest<T> request, T result, Throwable error, Duration currentBackoff) {
        if (error == null) {
            consecutiveErrors = 0;
            request.complete(result);
            recordOutcome("success");
            drain();
            return;
        }

        Throwable cause = ErrorClassifier.unwrap(error);
        consecutiveErrors++;

        if (cause instanceof UpstreamException && ((UpstreamException) cause).isRateLimited()) {
            Duration wait = ((UpstreamException) cause).getRetryAfter().orElse(currentBackoff.multipliedBy(2));
            pending.addFirst(request);
            depth.set(pending.size());
            recordOutcome("rate_limited");
            log.warn("Upstream rate limited, re-queued at head: queue={}, requestId={}, consecutiveErrors={}, waitMs={}",
                    name, request.id(), consecutiveErrors, wait.toMillis());
            schedule(this::drain, wait);
            return;
        }

        log.warn("Upstream call failed: queue={}, requestId={}, consecutiveErrors={}, error={}",
                name, request.id(), consecutiveErrors, cause.getMessage());
        request.fail(cause);
        recordOutcome("failure");
        drain();
    }

    private void schedule(Runnable task, Duration delay) {
        try {
            scheduler.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler rejected task during shutdown: queue={}", name);
        }
    }

    private void recordOutcome(String outcome) {
        if (metrics != null) {
            metrics.incrementQueueDispatch(name, outcome);
        }
    }

    /**
     * Changes the per-minute limit at runtime. 0 disables limiting.
     */
    public void setRateLimit(int limitPerMinute) {
        int previous = rateLimiter.getLimit();
        rateLimiter.setLimit(limitPerMinute);
        log.info("Rate limit changed: queue={}, {} -> {}", name, previous, limitPerMinute);
    }

    public int getRateLimit() {
        return rateLimiter.getLimit();
    }

    public int getDepth() {
        return depth.get();
    }

    public int getConsecutiveErrors() {
        return consecutiveErrors;
    }

    public boolean isDraining() {
        return draining;
    }

    public String getName() {
        return name;
    }

    /**
     * Stops dispatching and fails every request that has not completed.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down RequestQueue: name={}", name);
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("RequestQueue scheduler did not terminate in time: name={}", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        // requests still inside un-run scheduler tasks are only reachable through outstanding
        List<QueuedRequest<?>> abandoned = new ArrayList<>(outstanding);
        pending.clear();
        depth.set(0);
        IllegalStateException error = new IllegalStateException("Queue closed: " + name);
        for (QueuedRequest<?> request : abandoned) {
            request.fail(error);
        }
        if (!abandoned.isEmpty()) {
            log.warn("RequestQueue closed with unfinished requests: name={}, count={}", name, abandoned.size());
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Builder for RequestQueue.
     */
    public static final class Builder {
        private final String name;
        private int rateLimitPerMinute = 5;
        private BackoffPolicy backoffPolicy = BackoffPolicy.ofMillis(1000, 15000, 2.0);
        private Duration rateLimitRecheck = Duration.ofSeconds(1);
        private Clock clock = Clock.systemUTC();
        private MetricsRegistry metricsRegistry;

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Queue name is required");
            }
            this.name = name;
        }

        public Builder rateLimitPerMinute(int limit) {
            this.rateLimitPerMinute = limit;
            return this;
        }

        public Builder backoffPolicy(BackoffPolicy policy) {
            this.backoffPolicy = policy;
            return this;
        }

        public Builder rateLimitRecheck(Duration recheck) {
            this.rateLimitRecheck = recheck;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public RequestQueue build() {
            if (backoffPolicy == null) {
                throw new IllegalStateException("BackoffPolicy is required");
            }
            if (clock == null) {
                throw new IllegalStateException("Clock is required");
            }
            if (rateLimitRecheck == null || rateLimitRecheck.isNegative()) {
                throw new IllegalStateException("Rate limit recheck interval must be >= 0");
            }
            return new RequestQueue(this);
        }
    }
}
