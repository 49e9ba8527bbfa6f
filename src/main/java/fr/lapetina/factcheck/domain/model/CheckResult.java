package fr.lapetina.factcheck.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a fact check. Always produced, even when every strategy failed.
 * Immutable and thread-safe.
 *
 * @param rating     aggregate accuracy score 0-100, or null when none could be obtained
 * @param confidence agreement between ratings, or null when no rating exists
 */
public record CheckResult(
        String result,
        String queryText,
        Integer rating,
        Confidence confidence,
        CheckStatus status,
        String model,
        List<SearchResult> references,
        ErrorCategory errorCategory,
        Instant completedAt
) {
    public CheckResult {
        Objects.requireNonNull(result, "Result text is required");
        Objects.requireNonNull(status, "Status is required");
        if (queryText == null) {
            queryText = "";
        }
        references = references != null ? List.copyOf(references) : List.of();
        if (completedAt == null) {
            completedAt = Instant.now();
        }
    }

    /**
     * Creates a terminal failure result carrying a user-facing message.
     */
    public static CheckResult failed(String message, String queryText, ErrorCategory category) {
        return new CheckResult(
                "Error: " + message, queryText, null, null,
                CheckStatus.FAILED, null, List.of(), category, Instant.now()
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String result;
        private String queryText;
        private Integer rating;
        private Confidence confidence;
        private CheckStatus status = CheckStatus.COMPLETE;
        private String model;
        private List<SearchResult> references;
        private ErrorCategory errorCategory;
        private Instant completedAt;

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder queryText(String queryText) {
            this.queryText = queryText;
            return this;
        }

        public Builder rating(Integer rating) {
            this.rating = rating;
            return this;
        }

        public Builder confidence(Confidence confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder status(CheckStatus status) {
            this.status = status;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder references(List<SearchResult> references) {
            this.references = references;
            return this;
        }

        public Builder errorCategory(ErrorCategory errorCategory) {
            this.errorCategory = errorCategory;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public CheckResult build() {
            return new CheckResult(
                    result, queryText, rating, confidence, status,
                    model, references, errorCategory, completedAt
            );
        }
    }
}
