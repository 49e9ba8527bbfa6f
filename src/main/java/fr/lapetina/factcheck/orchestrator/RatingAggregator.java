package fr.lapetina.factcheck.orchestrator;

import fr.lapetina.factcheck.domain.model.Confidence;

import java.util.List;

/**
 * Combines several 0-100 ratings into one verdict.
 *
 * - rating: rounded mean, 50 when there is nothing to average
 * - confidence: spread (max - min) of at most 15 is HIGH, at most 30 MODERATE, otherwise LOW
 * - fewer than two ratings is always LOW
 */
public final class RatingAggregator {

    static final int DEFAULT_RATING = 50;
    static final int HIGH_AGREEMENT_SPREAD = 15;
    static final int MODERATE_AGREEMENT_SPREAD = 30;

    public Verdict aggregate(List<Integer> ratings) {
        List<Integer> valid = ratings.stream()
                .filter(r -> r != null && r >= 0 && r <= 100)
                .toList();
        if (valid.isEmpty()) {
            return new Verdict(DEFAULT_RATING, Confidence.LOW, 0, 0);
        }

        int min = valid.stream().mapToInt(Integer::intValue).min().orElse(0);
        int max = valid.stream().mapToInt(Integer::intValue).max().orElse(0);
        double mean = valid.stream().mapToInt(Integer::intValue).average().orElse(DEFAULT_RATING);
        int spread = max - min;

        Confidence confidence;
        if (valid.size() < 2) {
            confidence = Confidence.LOW;
        } else if (spread <= HIGH_AGREEMENT_SPREAD) {
            confidence = Confidence.HIGH;
        } else if (spread <= MODERATE_AGREEMENT_SPREAD) {
            confidence = Confidence.MODERATE;
        } else {
            confidence = Confidence.LOW;
        }
        return new Verdict((int) Math.round(mean), confidence, valid.size(), spread);
    }

    /**
     * @param ratingCount ratings that took part in the mean
     */
    public record Verdict(int rating, Confidence confidence, int ratingCount, int spread) {
    }
}
