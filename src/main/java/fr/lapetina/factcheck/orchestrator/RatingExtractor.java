package fr.lapetina.factcheck.orchestrator;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the first {@code Rating: N} out of a model response.
 */
final class RatingExtractor {

    private static final Pattern RATING = Pattern.compile("Rating:\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXPLANATION = Pattern.compile("Explanation:(.*?)(?:$|\\n\\n)", Pattern.DOTALL);

    private RatingExtractor() {
    }

    /**
     * @return the rating if present and within 0-100
     */
    static Optional<Integer> extract(String response) {
        if (response == null) {
            return Optional.empty();
        }
        Matcher matcher = RATING.matcher(response);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            int rating = Integer.parseInt(matcher.group(1));
            return rating <= 100 ? Optional.of(rating) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Text after {@code Explanation:} up to the next blank line, or empty.
     */
    static Optional<String> explanation(String response) {
        if (response == null) {
            return Optional.empty();
        }
        Matcher matcher = EXPLANATION.matcher(response);
        if (matcher.find()) {
            String text = matcher.group(1).trim();
            return text.isEmpty() ? Optional.empty() : Optional.of(text);
        }
        return Optional.empty();
    }
}
