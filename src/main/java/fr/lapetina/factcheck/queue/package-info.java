/**
 * Rate-limited, backoff-aware dispatch queues.
 *
 * <p>One {@link fr.lapetina.factcheck.queue.RequestQueue} exists per upstream service. Each
 * owns its own {@link fr.lapetina.factcheck.queue.RateLimiter} window and error counter;
 * nothing is coordinated across queues or processes.
 *
 * <p>{@link fr.lapetina.factcheck.queue.CancellationToken} is the cancellation signal threaded
 * from the orchestrator down to queued dispatches.
 */
package fr.lapetina.factcheck.queue;
