package fr.lapetina.factcheck.domain.model;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * What to do after a failure of a given {@link ErrorCategory}.
 *
 * @param fallbackModel tier to downgrade to, or null when no downgrade applies
 */
public record RecoveryStrategy(
        boolean retry,
        Duration waitTime,
        int maxRetries,
        ModelTier fallbackModel,
        boolean reducePromptSize,
        String userMessage
) {
    public RecoveryStrategy {
        Objects.requireNonNull(waitTime, "Wait time is required");
        Objects.requireNonNull(userMessage, "User message is required");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
    }

    public Optional<ModelTier> fallback() {
        return Optional.ofNullable(fallbackModel);
    }

    public RecoveryStrategy withFallbackModel(ModelTier tier) {
        return new RecoveryStrategy(retry, waitTime, maxRetries, tier, reducePromptSize, userMessage);
    }
}
