/**
 * Response memoization.
 *
 * <p>{@link fr.lapetina.factcheck.cache.ResponseCache} is bounded, TTL-aware and optionally
 * persisted through a {@link fr.lapetina.factcheck.cache.CacheStore}.
 */
package fr.lapetina.factcheck.cache;
