package fr.lapetina.factcheck.domain.policy;

import fr.lapetina.factcheck.domain.model.Complexity;
import fr.lapetina.factcheck.domain.model.ModelSelectionCriteria;
import fr.lapetina.factcheck.domain.model.ModelTier;
import fr.lapetina.factcheck.domain.model.TaskType;
import fr.lapetina.factcheck.domain.model.Urgency;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ModelPolicyTest {

    private final ModelPolicy policy = new ModelPolicy();

    @Nested
    @DisplayName("complexity")
    class ComplexityEstimation {

        @Test
        @DisplayName("should rate short plain text as low")
        void shouldRateShortTextLow() {
            assertThat(policy.estimateComplexity("The sky is blue.")).isEqualTo(Complexity.LOW);
        }

        @Test
        @DisplayName("should rate blank and null text as low")
        void shouldRateBlankLow() {
            assertThat(policy.estimateComplexity("   ")).isEqualTo(Complexity.LOW);
            assertThat(policy.estimateComplexity(null)).isEqualTo(Complexity.LOW);
        }

        @Test
        @DisplayName("should rate dense technical vocabulary as medium")
        void shouldRateDenseVocabularyMedium() {
            String text = "Quantum mechanism. ".repeat(10);

            assertThat(policy.estimateComplexity(text)).isEqualTo(Complexity.MEDIUM);
        }

        @Test
        @DisplayName("should rate long technical text as high")
        void shouldRateLongTechnicalHigh() {
            String text = "Quantum algorithm analysis. ".repeat(200);

            assertThat(policy.estimateComplexity(text)).isEqualTo(Complexity.HIGH);
        }

        @Test
        @DisplayName("should count long sentences toward complexity")
        void shouldScoreSentenceLength() {
            String longSentence = "word ".repeat(30).trim() + ".";

            assertThat(policy.estimateComplexity(longSentence)).isEqualTo(Complexity.MEDIUM);
        }
    }

    @Nested
    @DisplayName("tier selection")
    class TierSelection {

        private ModelSelectionCriteria.Builder criteria() {
            return ModelSelectionCriteria.builder()
                    .textLength(500)
                    .complexity(Complexity.LOW)
                    .urgency(Urgency.MEDIUM)
                    .costSensitive(true);
        }

        @Test
        @DisplayName("should always use the extraction tier for claim extraction")
        void shouldUseExtractionTier() {
            ModelSelectionCriteria c = criteria()
                    .task(TaskType.CLAIM_EXTRACTION)
                    .complexity(Complexity.HIGH)
                    .costSensitive(false)
                    .build();

            assertThat(policy.selectOptimalModel(c)).isEqualTo(ModelTier.EXTRACTION);
        }

        @Test
        @DisplayName("should use the fast tier for search queries and urgent checks")
        void shouldUseFastTier() {
            assertThat(policy.selectOptimalModel(criteria().task(TaskType.SEARCH_QUERY).build()))
                    .isEqualTo(ModelTier.FAST);
            assertThat(policy.selectOptimalModel(criteria()
                    .urgency(Urgency.HIGH).complexity(Complexity.HIGH).textLength(5000).costSensitive(false).build()))
                    .isEqualTo(ModelTier.FAST);
        }

        @Test
        @DisplayName("should use premium only for long complex unhurried checks when cost does not matter")
        void shouldUsePremium() {
            ModelSelectionCriteria premium = criteria()
                    .complexity(Complexity.HIGH)
                    .textLength(3500)
                    .urgency(Urgency.LOW)
                    .costSensitive(false)
                    .build();

            assertThat(policy.selectOptimalModel(premium)).isEqualTo(ModelTier.PREMIUM);
            assertThat(policy.selectOptimalModel(criteria()
                    .complexity(Complexity.HIGH).textLength(3500).urgency(Urgency.LOW).costSensitive(true).build()))
                    .isEqualTo(ModelTier.FAST);
        }

        @Test
        @DisplayName("should use standard for medium complexity or medium length")
        void shouldUseStandard() {
            assertThat(policy.selectOptimalModel(criteria().complexity(Complexity.MEDIUM).costSensitive(false).build()))
                    .isEqualTo(ModelTier.STANDARD);
            assertThat(policy.selectOptimalModel(criteria().textLength(2000).costSensitive(false).build()))
                    .isEqualTo(ModelTier.STANDARD);
        }

        @Test
        @DisplayName("should fall back to fast when cost sensitive")
        void shouldPreferFastWhenCostSensitive() {
            assertThat(policy.selectOptimalModel(criteria().complexity(Complexity.MEDIUM).build()))
                    .isEqualTo(ModelTier.FAST);
        }

        @Test
        @DisplayName("should pick the same tier for identical criteria")
        void shouldBeDeterministic() {
            ModelSelectionCriteria c = criteria().complexity(Complexity.MEDIUM).costSensitive(false).build();

            assertThat(policy.selectOptimalModel(c)).isEqualTo(policy.selectOptimalModel(c));
        }
    }

    @Test
    @DisplayName("should take secondary opinions one tier down with FAST as the floor")
    void shouldPickSecondaryTier() {
        assertThat(policy.secondaryTier(ModelTier.PREMIUM)).isEqualTo(ModelTier.STANDARD);
        assertThat(policy.secondaryTier(ModelTier.STANDARD)).isEqualTo(ModelTier.FAST);
        assertThat(policy.secondaryTier(ModelTier.FAST)).isEqualTo(ModelTier.FAST);
    }
}
