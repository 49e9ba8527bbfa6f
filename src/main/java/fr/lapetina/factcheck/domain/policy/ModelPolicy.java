package fr.lapetina.factcheck.domain.policy;

import fr.lapetina.factcheck.domain.model.Complexity;
import fr.lapetina.factcheck.domain.model.ModelSelectionCriteria;
import fr.lapetina.factcheck.domain.model.ModelTier;
import fr.lapetina.factcheck.domain.model.TaskType;
import fr.lapetina.factcheck.domain.model.Urgency;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic model tier selection.
 *
 * Complexity is scored on three axes, each worth 0-3 points:
 * - average words per sentence
 * - raw text length
 * - density of technical vocabulary per 100 characters
 *
 * A total of 6 or more is HIGH, 3 or more is MEDIUM, anything else LOW.
 */
public final class ModelPolicy {

    static final int PREMIUM_LENGTH_THRESHOLD = 3000;
    static final int STANDARD_LENGTH_THRESHOLD = 1000;

    private static final List<String> TECHNICAL_TERMS = List.of(
            "quantum", "algorithm", "methodology", "statistical", "molecular",
            "hypothesis", "correlation", "causation", "analysis", "synthesis",
            "theoretical", "empirical", "paradigm", "mechanism", "infrastructure"
    );

    private static final List<Pattern> TERM_PATTERNS = TECHNICAL_TERMS.stream()
            .map(term -> Pattern.compile("\\b" + term + "\\w*\\b", Pattern.CASE_INSENSITIVE))
            .toList();

    private static final Pattern SENTENCE_SPLIT = Pattern.compile("[.!?]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public Complexity estimateComplexity(String text) {
        if (text == null || text.isBlank()) {
            return Complexity.LOW;
        }
        int score = sentenceLengthScore(text) + lengthScore(text.length()) + termDensityScore(text);
        if (score >= 6) {
            return Complexity.HIGH;
        }
        if (score >= 3) {
            return Complexity.MEDIUM;
        }
        return Complexity.LOW;
    }

    /**
     * Picks a tier for the given criteria. Pure: identical criteria always give the same tier.
     */
    public ModelTier selectOptimalModel(ModelSelectionCriteria criteria) {
        if (criteria.task() == TaskType.CLAIM_EXTRACTION) {
            return ModelTier.EXTRACTION;
        }
        if (criteria.task() == TaskType.SEARCH_QUERY) {
            return ModelTier.FAST;
        }
        if (criteria.urgency() == Urgency.HIGH) {
            return ModelTier.FAST;
        }
        if (criteria.complexity() == Complexity.HIGH
                && criteria.textLength() > PREMIUM_LENGTH_THRESHOLD
                && criteria.urgency() == Urgency.LOW
                && !criteria.costSensitive()) {
            return ModelTier.PREMIUM;
        }
        boolean mediumLength = criteria.textLength() > STANDARD_LENGTH_THRESHOLD
                && criteria.textLength() <= PREMIUM_LENGTH_THRESHOLD;
        if ((criteria.complexity() == Complexity.MEDIUM || mediumLength) && !criteria.costSensitive()) {
            return ModelTier.STANDARD;
        }
        return ModelTier.FAST;
    }

    /**
     * Tier used for secondary opinions in multi-model mode: one step below primary, never below FAST.
     */
    public ModelTier secondaryTier(ModelTier primary) {
        return switch (primary) {
            case PREMIUM -> ModelTier.STANDARD;
            case STANDARD, FAST, EXTRACTION -> ModelTier.FAST;
        };
    }

    private static int sentenceLengthScore(String text) {
        int sentences = 0;
        int words = 0;
        for (String sentence : SENTENCE_SPLIT.split(text)) {
            String trimmed = sentence.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            sentences++;
            words += WHITESPACE.split(trimmed).length;
        }
        if (sentences == 0) {
            return 0;
        }
        double average = (double) words / sentences;
        if (average > 25) {
            return 3;
        }
        if (average > 18) {
            return 2;
        }
        return average > 12 ? 1 : 0;
    }

    private static int lengthScore(int length) {
        if (length > 5000) {
            return 3;
        }
        if (length > 2000) {
            return 2;
        }
        return length > 800 ? 1 : 0;
    }

    private static int termDensityScore(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        int count = 0;
        for (Pattern pattern : TERM_PATTERNS) {
            Matcher matcher = pattern.matcher(lower);
            while (matcher.find()) {
                count++;
            }
        }
        double density = count / (text.length() / 100.0);
        if (density > 0.5) {
            return 3;
        }
        if (density > 0.2) {
            return 2;
        }
        return density > 0.1 ? 1 : 0;
    }
}
