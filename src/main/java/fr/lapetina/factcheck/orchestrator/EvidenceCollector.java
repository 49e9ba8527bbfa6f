package fr.lapetina.factcheck.orchestrator;

import fr.lapetina.factcheck.domain.model.SearchResult;
import fr.lapetina.factcheck.provider.SearchProvider;
import fr.lapetina.factcheck.queue.CancellationToken;
import fr.lapetina.factcheck.queue.RequestQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Searches the main claims of a query and turns the results into model context.
 *
 * Each claim is searched through the search queue in parallel. Failed searches
 * are skipped; the returned future never fails. Results are de-duplicated by URL
 * and ranked: fact-checking sources first, then dated results newest first, then
 * undated ones.
 */
final class EvidenceCollector {

    private static final Logger log = LoggerFactory.getLogger(EvidenceCollector.class);

    static final int MIN_CLAIM_LENGTH = 10;

    private static final Pattern CLAIM_SPLIT = Pattern.compile("[;.]");
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^\\w\\s.,'\"]");

    private final SearchProvider searchProvider;
    private final RequestQueue searchQueue;
    private final int maxClaims;
    private final int maxClaimLength;

    EvidenceCollector(SearchProvider searchProvider, RequestQueue searchQueue, int maxClaims, int maxClaimLength) {
        this.searchProvider = Objects.requireNonNull(searchProvider, "Search provider is required");
        this.searchQueue = Objects.requireNonNull(searchQueue, "Search queue is required");
        if (maxClaims < 1 || maxClaimLength < 1) {
            throw new IllegalArgumentException("maxClaims and maxClaimLength must be >= 1");
        }
        this.maxClaims = maxClaims;
        this.maxClaimLength = maxClaimLength;
    }

    CompletableFuture<Evidence> collect(String query, CancellationToken token) {
        List<String> claims = claimQueries(query);
        if (claims.isEmpty()) {
            return CompletableFuture.completedFuture(Evidence.none("No references available."));
        }

        List<CompletableFuture<List<SearchResult>>> searches = new ArrayList<>();
        for (String claim : claims) {
            searches.add(searchQueue.enqueue(() -> searchProvider.search(claim), token)
                    .handle((results, error) -> {
                        if (error != null) {
                            log.warn("Search failed, skipping claim: provider={}, error={}",
                                    searchProvider.name(), error.getMessage());
                            return List.<SearchResult>of();
                        }
                        return results != null ? results : List.<SearchResult>of();
                    }));
        }

        return CompletableFuture.allOf(searches.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<SearchResult> all = new ArrayList<>();
                    for (CompletableFuture<List<SearchResult>> search : searches) {
                        all.addAll(search.join());
                    }
                    return build(all);
                });
    }

    List<String> claimQueries(String query) {
        List<String> claims = new ArrayList<>();
        for (String part : CLAIM_SPLIT.split(query)) {
            String trimmed = part.trim();
            if (trimmed.length() <= MIN_CLAIM_LENGTH) {
                continue;
            }
            String sanitized = UNSAFE_CHARS.matcher(trimmed).replaceAll(" ").trim();
            claims.add(sanitized.length() > maxClaimLength ? sanitized.substring(0, maxClaimLength) : sanitized);
            if (claims.size() == maxClaims) {
                break;
            }
        }
        return claims;
    }

    static Evidence build(List<SearchResult> results) {
        if (results.isEmpty()) {
            return Evidence.none("No references available.");
        }

        Map<String, SearchResult> byUrl = new LinkedHashMap<>();
        for (SearchResult result : results) {
            byUrl.putIfAbsent(result.url(), result);
        }
        List<SearchResult> ranked = new ArrayList<>(byUrl.values());
        ranked.sort(RANKING);

        StringBuilder context = new StringBuilder();
        StringBuilder references = new StringBuilder(Evidence.REFERENCES_HEADER);
        for (SearchResult result : ranked) {
            if (context.length() > 0) {
                context.append("\n\n");
            }
            context.append("Source: ").append(result.title()).append(" (").append(result.domain()).append(')');
            if (result.hasDate()) {
                context.append(" [").append(result.date()).append(']');
            }
            context.append("\nContent: ").append(result.description());

            references.append("- ");
            if (EvidenceDomains.isFactCheck(result)) {
                references.append("Fact-Check: ");
            } else if (EvidenceDomains.isCredible(result)) {
                references.append("Credible: ");
            }
            references.append(result.title()).append(" (").append(result.url()).append(")\n");
        }

        log.debug("Evidence built: results={}, unique={}", results.size(), ranked.size());
        return new Evidence(context.toString(), ranked, references.toString().stripTrailing());
    }

    private static final Comparator<SearchResult> RANKING = Comparator
            .comparing((SearchResult r) -> !EvidenceDomains.isFactCheck(r))
            .thenComparing(r -> parseDate(r.date()).isEmpty())
            .thenComparing(r -> parseDate(r.date()).orElse(Instant.EPOCH), Comparator.reverseOrder());

    private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
            date -> OffsetDateTime.parse(date).toInstant(),
            date -> LocalDateTime.parse(date).toInstant(ZoneOffset.UTC),
            date -> LocalDate.parse(date).atStartOfDay().toInstant(ZoneOffset.UTC)
    );

    static Optional<Instant> parseDate(String date) {
        if (date == null || date.isBlank()) {
            return Optional.empty();
        }
        for (Function<String, Instant> parser : DATE_PARSERS) {
            try {
                return Optional.of(parser.apply(date.trim()));
            } catch (DateTimeParseException e) {
                log.trace("Date format mismatch: date={}, error={}", date, e.getMessage());
            }
        }
        return Optional.empty();
    }
}
