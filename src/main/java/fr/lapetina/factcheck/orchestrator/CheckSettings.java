package fr.lapetina.factcheck.orchestrator;

import fr.lapetina.factcheck.domain.model.Urgency;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of the check pipeline.
 *
 * The orchestrator swaps the whole instance on reload; {@code fingerprintPrefixLength}
 * is read once at construction and is not reloadable.
 *
 * @param multiModel               run the two-prompt analysis instead of a single prompt
 * @param queryExtractionThreshold input longer than this is condensed before searching
 * @param callRetry                caps the retries and waits of a single model call; the recovery table decides which failures retry
 * @param checkRetry               retries of the whole pipeline on temporary errors
 */
public record CheckSettings(
        boolean multiModel,
        boolean costSensitive,
        Urgency urgency,
        int fingerprintPrefixLength,
        int emergencyInputLength,
        int queryExtractionThreshold,
        int maxTokens,
        int extractionMaxTokens,
        RetrySettings callRetry,
        RetrySettings checkRetry
) {
    public CheckSettings {
        Objects.requireNonNull(urgency, "Urgency is required");
        Objects.requireNonNull(callRetry, "Call retry settings are required");
        Objects.requireNonNull(checkRetry, "Check retry settings are required");
        if (fingerprintPrefixLength < 1 || emergencyInputLength < 1) {
            throw new IllegalArgumentException("Prefix and emergency input lengths must be >= 1");
        }
        if (maxTokens < 1 || extractionMaxTokens < 1) {
            throw new IllegalArgumentException("Token budgets must be >= 1");
        }
    }

    public static CheckSettings defaults() {
        return builder().build();
    }

    public CheckSettings withToggles(boolean multiModel, boolean costSensitive, Urgency urgency) {
        return new CheckSettings(multiModel, costSensitive, urgency, fingerprintPrefixLength,
                emergencyInputLength, queryExtractionThreshold, maxTokens, extractionMaxTokens,
                callRetry, checkRetry);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param maxRetries retries after the first attempt
     */
    public record RetrySettings(int maxRetries, Duration initialDelay, Duration maxDelay) {
        public RetrySettings {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0");
            }
            Objects.requireNonNull(initialDelay, "Initial delay is required");
            Objects.requireNonNull(maxDelay, "Max delay is required");
        }
    }

    public static final class Builder {
        private boolean multiModel = true;
        private boolean costSensitive = true;
        private Urgency urgency = Urgency.MEDIUM;
        private int fingerprintPrefixLength = 1000;
        private int emergencyInputLength = 1000;
        private int queryExtractionThreshold = 300;
        private int maxTokens = 500;
        private int extractionMaxTokens = 300;
        private RetrySettings callRetry = new RetrySettings(3, Duration.ofSeconds(1), Duration.ofSeconds(15));
        private RetrySettings checkRetry = new RetrySettings(2, Duration.ofSeconds(2), Duration.ofSeconds(30));

        public Builder multiModel(boolean multiModel) {
            this.multiModel = multiModel;
            return this;
        }

        public Builder costSensitive(boolean costSensitive) {
            this.costSensitive = costSensitive;
            return this;
        }

        public Builder urgency(Urgency urgency) {
            this.urgency = urgency;
            return this;
        }

        public Builder fingerprintPrefixLength(int fingerprintPrefixLength) {
            this.fingerprintPrefixLength = fingerprintPrefixLength;
            return this;
        }

        public Builder emergencyInputLength(int emergencyInputLength) {
            this.emergencyInputLength = emergencyInputLength;
            return this;
        }

        public Builder queryExtractionThreshold(int queryExtractionThreshold) {
            this.queryExtractionThreshold = queryExtractionThreshold;
            return this;
        }

        public Builder maxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder extractionMaxTokens(int extractionMaxTokens) {
            this.extractionMaxTokens = extractionMaxTokens;
            return this;
        }

        public Builder callRetry(RetrySettings callRetry) {
            this.callRetry = callRetry;
            return this;
        }

        public Builder checkRetry(RetrySettings checkRetry) {
            this.checkRetry = checkRetry;
            return this;
        }

        public CheckSettings build() {
            return new CheckSettings(multiModel, costSensitive, urgency, fingerprintPrefixLength,
                    emergencyInputLength, queryExtractionThreshold, maxTokens, extractionMaxTokens,
                    callRetry, checkRetry);
        }
    }
}
