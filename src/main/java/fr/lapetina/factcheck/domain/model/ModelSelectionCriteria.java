package fr.lapetina.factcheck.domain.model;

import java.util.Objects;

/**
 * Inputs to model tier selection.
 */
public record ModelSelectionCriteria(
        String provider,
        int textLength,
        Complexity complexity,
        Urgency urgency,
        boolean costSensitive,
        TaskType task
) {
    public ModelSelectionCriteria {
        Objects.requireNonNull(complexity, "Complexity is required");
        Objects.requireNonNull(urgency, "Urgency is required");
        Objects.requireNonNull(task, "Task is required");
        if (provider == null) {
            provider = "openai";
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String provider = "openai";
        private int textLength;
        private Complexity complexity = Complexity.MEDIUM;
        private Urgency urgency = Urgency.MEDIUM;
        private boolean costSensitive = true;
        private TaskType task = TaskType.FACT_CHECK;

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder textLength(int textLength) {
            this.textLength = textLength;
            return this;
        }

        public Builder complexity(Complexity complexity) {
            this.complexity = complexity;
            return this;
        }

        public Builder urgency(Urgency urgency) {
            this.urgency = urgency;
            return this;
        }

        public Builder costSensitive(boolean costSensitive) {
            this.costSensitive = costSensitive;
            return this;
        }

        public Builder task(TaskType task) {
            this.task = task;
            return this;
        }

        public ModelSelectionCriteria build() {
            return new ModelSelectionCriteria(provider, textLength, complexity, urgency, costSensitive, task);
        }
    }
}
