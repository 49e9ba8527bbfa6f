package fr.lapetina.factcheck.domain.policy;

import fr.lapetina.factcheck.domain.model.ErrorCategory;
import fr.lapetina.factcheck.domain.model.ModelTier;
import fr.lapetina.factcheck.domain.model.RecoveryStrategy;

import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Fixed recovery table: one strategy per {@link ErrorCategory}.
 *
 * Categories that allow a downgrade get their fallback tier filled in from the
 * tier that was in use when the failure happened. The downgrade chain
 * PREMIUM -> STANDARD -> FAST terminates after at most two steps.
 */
public final class RecoveryPolicy {

    private static final Map<ErrorCategory, RecoveryStrategy> STRATEGIES = new EnumMap<>(ErrorCategory.class);
    private static final Set<ErrorCategory> DOWNGRADABLE = EnumSet.of(
            ErrorCategory.CONTENT_POLICY,
            ErrorCategory.CONTEXT_LENGTH,
            ErrorCategory.UNKNOWN
    );

    static {
        STRATEGIES.put(ErrorCategory.RATE_LIMIT, new RecoveryStrategy(
                true, Duration.ofSeconds(5), 3, null, false,
                "Rate limit exceeded. Retrying after a short delay..."));
        STRATEGIES.put(ErrorCategory.TEMPORARY, new RecoveryStrategy(
                true, Duration.ofSeconds(2), 3, null, false,
                "Temporary error occurred. Retrying..."));
        STRATEGIES.put(ErrorCategory.AUTH_ERROR, new RecoveryStrategy(
                false, Duration.ZERO, 0, null, false,
                "Authentication error. Please check your API keys."));
        STRATEGIES.put(ErrorCategory.CONTENT_POLICY, new RecoveryStrategy(
                false, Duration.ZERO, 0, null, true,
                "Content policy violation. Trying a different approach..."));
        STRATEGIES.put(ErrorCategory.CONTEXT_LENGTH, new RecoveryStrategy(
                true, Duration.ZERO, 1, null, true,
                "Content too long. Reducing size and retrying..."));
        STRATEGIES.put(ErrorCategory.UNKNOWN, new RecoveryStrategy(
                true, Duration.ofSeconds(1), 2, null, false,
                "An error occurred. Trying again..."));
    }

    /**
     * Returns the strategy for a category, with the fallback tier resolved against {@code currentTier}.
     *
     * @param currentTier tier in use when the failure happened; null is treated as unknown
     */
    public RecoveryStrategy recoveryFor(ErrorCategory category, ModelTier currentTier) {
        ErrorCategory effective = category != null ? category : ErrorCategory.UNKNOWN;
        RecoveryStrategy base = STRATEGIES.get(effective);
        if (DOWNGRADABLE.contains(effective)) {
            return base.withFallbackModel(selectFallbackModel(currentTier));
        }
        return base;
    }

    /**
     * Next tier down for a fallback attempt. FAST is the floor and maps to itself.
     */
    public ModelTier selectFallbackModel(ModelTier currentTier) {
        if (currentTier == ModelTier.FAST) {
            return ModelTier.FAST;
        }
        if (currentTier == ModelTier.PREMIUM) {
            return ModelTier.STANDARD;
        }
        return ModelTier.FAST;
    }

    /**
     * User-facing message for a category.
     */
    public String userMessage(ErrorCategory category) {
        return recoveryFor(category, null).userMessage();
    }
}
