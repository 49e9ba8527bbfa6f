package fr.lapetina.factcheck.orchestrator;

import fr.lapetina.factcheck.domain.model.Confidence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RatingAggregatorTest {

    private final RatingAggregator aggregator = new RatingAggregator();

    @Nested
    @DisplayName("aggregation")
    class Aggregation {

        @Test
        @DisplayName("should report high confidence when ratings agree")
        void shouldReportHighConfidence() {
            RatingAggregator.Verdict verdict = aggregator.aggregate(List.of(90, 92, 88));

            assertThat(verdict.rating()).isEqualTo(90);
            assertThat(verdict.confidence()).isEqualTo(Confidence.HIGH);
            assertThat(verdict.spread()).isEqualTo(4);
            assertThat(verdict.ratingCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("should report moderate confidence for a spread up to 30")
        void shouldReportModerateConfidence() {
            RatingAggregator.Verdict verdict = aggregator.aggregate(List.of(60, 85));

            assertThat(verdict.rating()).isEqualTo(73);
            assertThat(verdict.confidence()).isEqualTo(Confidence.MODERATE);
        }

        @Test
        @DisplayName("should report low confidence when ratings disagree")
        void shouldReportLowConfidence() {
            RatingAggregator.Verdict verdict = aggregator.aggregate(List.of(10, 90));

            assertThat(verdict.rating()).isEqualTo(50);
            assertThat(verdict.confidence()).isEqualTo(Confidence.LOW);
        }

        @Test
        @DisplayName("should report low confidence for a single rating")
        void shouldReportLowForSingleRating() {
            RatingAggregator.Verdict verdict = aggregator.aggregate(List.of(95));

            assertThat(verdict.rating()).isEqualTo(95);
            assertThat(verdict.confidence()).isEqualTo(Confidence.LOW);
        }

        @Test
        @DisplayName("should default to 50 with low confidence when nothing is usable")
        void shouldDefaultWhenEmpty() {
            assertThat(aggregator.aggregate(List.of()))
                    .isEqualTo(new RatingAggregator.Verdict(50, Confidence.LOW, 0, 0));
            assertThat(aggregator.aggregate(Arrays.asList(null, 150, -1)).rating()).isEqualTo(50);
        }
    }

    @Nested
    @DisplayName("extraction")
    class Extraction {

        @Test
        @DisplayName("should read the first rating regardless of case")
        void shouldExtractRating() {
            assertThat(RatingExtractor.extract("rating: 72\nExplanation: fine\nRating: 10")).contains(72);
        }

        @Test
        @DisplayName("should ignore missing and out-of-range ratings")
        void shouldIgnoreInvalidRatings() {
            assertThat(RatingExtractor.extract("No score here")).isEmpty();
            assertThat(RatingExtractor.extract("Rating: 250")).isEmpty();
            assertThat(RatingExtractor.extract(null)).isEmpty();
        }

        @Test
        @DisplayName("should read the explanation up to the next blank line")
        void shouldExtractExplanation() {
            String response = "Rating: 80\nExplanation: Mostly supported by sources.\n\nLimitations: few.";

            assertThat(RatingExtractor.explanation(response)).contains("Mostly supported by sources.");
            assertThat(RatingExtractor.explanation("Rating: 80")).isEmpty();
        }
    }
}
