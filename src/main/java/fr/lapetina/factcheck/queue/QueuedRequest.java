package fr.lapetina.factcheck.queue;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * A unit of work waiting in a {@link RequestQueue}.
 *
 * Owned by its queue while pending; the caller only sees {@link #future()}.
 *
 * @param <T> upstream response type
 */
final class QueuedRequest<T> {

    private final String id;
    private final Supplier<CompletableFuture<T>> call;
    private final CompletableFuture<T> future = new CompletableFuture<>();
    private final Instant enqueueTime;
    private final CancellationToken token;
    private int attempts;

    QueuedRequest(String id, Supplier<CompletableFuture<T>> call, Instant enqueueTime, CancellationToken token) {
        this.id = Objects.requireNonNull(id, "Id is required");
        this.call = Objects.requireNonNull(call, "Call is required");
        this.enqueueTime = Objects.requireNonNull(enqueueTime, "Enqueue time is required");
        this.token = token != null ? token : CancellationToken.none();
    }

    /**
     * Starts the upstream call. Synchronous failures are folded into the returned future.
     */
    CompletableFuture<T> invoke() {
        attempts++;
        try {
            CompletableFuture<T> result = call.get();
            return result != null
                    ? result
                    : CompletableFuture.failedFuture(new IllegalStateException("Upstream call returned no future"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    void complete(T value) {
        future.complete(value);
    }

    void fail(Throwable error) {
        future.completeExceptionally(error);
    }

    void cancel() {
        future.completeExceptionally(new CancellationException("Request cancelled before dispatch: " + id));
    }

    boolean isCancelled() {
        return token.isCancelled() || future.isCancelled();
    }

    CompletableFuture<T> future() {
        return future;
    }

    CancellationToken token() {
        return token;
    }

    String id() {
        return id;
    }

    Instant enqueueTime() {
        return enqueueTime;
    }

    int attempts() {
        return attempts;
    }
}
