package fr.lapetina.factcheck.resilience;

import java.time.Duration;

/**
 * Passed to retry callbacks before each wait.
 *
 * @param retryCount 1 for the first retry
 * @param delay      wait before the next attempt
 */
public record RetryInfo(int retryCount, Duration delay, int maxRetries) {
}
