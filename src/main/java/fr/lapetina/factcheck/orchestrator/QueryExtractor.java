package fr.lapetina.factcheck.orchestrator;

import fr.lapetina.factcheck.domain.model.ModelTier;
import fr.lapetina.factcheck.provider.ModelClient;
import fr.lapetina.factcheck.queue.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Condenses long input into a search query made of its main claims.
 *
 * Input up to the threshold is used unchanged. Longer input goes through a cached
 * claim-extraction call on the EXTRACTION tier. The returned future never fails:
 * a short answer falls back to the first three sentences, a failed call to the
 * first two.
 */
final class QueryExtractor {

    private static final Logger log = LoggerFactory.getLogger(QueryExtractor.class);

    static final int EXTRACTION_INPUT_LENGTH = 2000;
    static final int MAX_QUERY_LENGTH = 300;
    static final int MIN_EXTRACTED_LENGTH = 10;

    private static final Pattern SENTENCE_SPLIT = Pattern.compile("[.!?]+");

    private final ModelClient modelClient;

    QueryExtractor(ModelClient modelClient) {
        this.modelClient = modelClient;
    }

    CompletableFuture<String> extract(String text, int threshold, int maxTokens, CancellationToken token) {
        if (text.length() <= threshold) {
            return CompletableFuture.completedFuture(text);
        }

        String input = text.length() > EXTRACTION_INPUT_LENGTH ? text.substring(0, EXTRACTION_INPUT_LENGTH) : text;
        return modelClient.call(PromptTemplates.claimExtraction(input), ModelTier.EXTRACTION, maxTokens, true, token)
                .handle((claims, error) -> {
                    if (error != null) {
                        log.warn("Claim extraction failed, using leading sentences: error={}", error.getMessage());
                        return leadingSentences(text, 2);
                    }
                    String trimmed = claims.trim();
                    if (trimmed.length() > MIN_EXTRACTED_LENGTH) {
                        log.debug("Claims extracted: queryLength={}", trimmed.length());
                        return trimmed;
                    }
                    return leadingSentences(text, 3);
                });
    }

    static String leadingSentences(String text, int count) {
        String[] sentences = SENTENCE_SPLIT.split(text);
        if (sentences.length == 0 || sentences[0].trim().isEmpty()) {
            return truncate(text.trim());
        }
        String joined = Arrays.stream(sentences)
                .map(String::trim)
                .filter(sentence -> !sentence.isEmpty())
                .limit(count)
                .collect(Collectors.joining(". "));
        return truncate(joined);
    }

    private static String truncate(String value) {
        return value.length() > MAX_QUERY_LENGTH ? value.substring(0, MAX_QUERY_LENGTH) : value;
    }
}
