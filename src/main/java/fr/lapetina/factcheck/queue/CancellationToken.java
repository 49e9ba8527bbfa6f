package fr.lapetina.factcheck.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared by a caller and the components working on its behalf.
 *
 * Cancelling never interrupts an upstream call that is already in flight; it only
 * stops work that has not started yet (queued dispatches, pending retries).
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private static final CancellationToken NONE = new CancellationToken(false);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private final boolean cancellable;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * A token that can never be cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Requests cancellation and runs the registered callbacks once. Idempotent; a no-op on {@link #none()}.
     */
    public void cancel() {
        if (cancellable && cancelled.compareAndSet(false, true)) {
            for (Runnable callback : callbacks) {
                runOnce(callback);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Runs {@code callback} when the token is cancelled, right away if it already is.
     * Ignored on {@link #none()}.
     */
    public void onCancel(Runnable callback) {
        if (!cancellable) {
            return;
        }
        callbacks.add(callback);
        if (cancelled.get()) {
            runOnce(callback);
        }
    }

    private void runOnce(Runnable callback) {
        // remove() succeeds for exactly one of cancel() and onCancel()
        if (!callbacks.remove(callback)) {
            return;
        }
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed", e);
        }
    }
}
