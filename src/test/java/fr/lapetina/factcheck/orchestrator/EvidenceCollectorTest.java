package fr.lapetina.factcheck.orchestrator;

import fr.lapetina.factcheck.domain.exception.UpstreamException;
import fr.lapetina.factcheck.domain.model.SearchResult;
import fr.lapetina.factcheck.queue.CancellationToken;
import fr.lapetina.factcheck.queue.RequestQueue;
import fr.lapetina.factcheck.support.StubSearchProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class EvidenceCollectorTest {

    private static final SearchResult SNOPES = new SearchResult(
            "Did it happen?", "Snopes looked into it.", "https://www.snopes.com/fact-check/x", "snopes.com", "2023-01-10");
    private static final SearchResult REUTERS_OLD = new SearchResult(
            "Old report", "An older article.", "https://www.reuters.com/world/old", "reuters.com", "2021-05-01");
    private static final SearchResult REUTERS_NEW = new SearchResult(
            "New report", "A newer article.", "https://www.reuters.com/world/new", "reuters.com",
            "2024-02-01T08:30:00Z");
    private static final SearchResult BLOG = new SearchResult(
            "Some blog", "Opinions.", "https://blog.example.org/post", "blog.example.org", null);

    private RequestQueue queue;

    @BeforeEach
    void setUp() {
        queue = RequestQueue.builder("search-test").rateLimitPerMinute(0).build();
    }

    @AfterEach
    void tearDown() {
        queue.close();
    }

    @Nested
    @DisplayName("claim queries")
    class ClaimQueries {

        @Test
        @DisplayName("should split on sentence and claim separators and drop short fragments")
        void shouldSplitClaims() {
            EvidenceCollector collector = new EvidenceCollector(StubSearchProvider.returning(List.of()), queue, 5, 80);

            List<String> claims = collector.claimQueries(
                    "The Eiffel Tower is 330 metres tall; Paris. It was completed in 1889.");

            assertThat(claims).containsExactly("The Eiffel Tower is 330 metres tall", "It was completed in 1889");
        }

        @Test
        @DisplayName("should stop at the claim limit and truncate long claims")
        void shouldLimitClaims() {
            EvidenceCollector collector = new EvidenceCollector(StubSearchProvider.returning(List.of()), queue, 2, 20);

            List<String> claims = collector.claimQueries(
                    "First claim is rather long here; second claim is also long; third claim never searched");

            assertThat(claims).hasSize(2);
            assertThat(claims.get(0)).isEqualTo("First claim is rathe");
            assertThat(claims).allMatch(claim -> claim.length() <= 20);
        }

        @Test
        @DisplayName("should replace characters that are unsafe in a search query")
        void shouldSanitizeClaims() {
            EvidenceCollector collector = new EvidenceCollector(StubSearchProvider.returning(List.of()), queue, 2, 80);

            List<String> claims = collector.claimQueries("Prices rose 50% in 2022 (officially)");

            assertThat(claims).containsExactly("Prices rose 50  in 2022  officially");
        }
    }

    @Nested
    @DisplayName("collection")
    class Collection {

        @Test
        @DisplayName("should search each claim and merge the results")
        void shouldSearchEachClaim() throws Exception {
            StubSearchProvider search = new StubSearchProvider(query -> CompletableFuture.completedFuture(
                    query.startsWith("The moon") ? List.of(REUTERS_OLD) : List.of(SNOPES, REUTERS_OLD)));
            EvidenceCollector collector = new EvidenceCollector(search, queue, 2, 80);

            Evidence evidence = collector.collect(
                    "The moon landing happened in 1969. Astronauts walked on it", CancellationToken.none())
                    .get(5, TimeUnit.SECONDS);

            assertThat(search.queries()).containsExactly(
                    "The moon landing happened in 1969", "Astronauts walked on it");
            assertThat(evidence.references()).containsExactly(SNOPES, REUTERS_OLD);
        }

        @Test
        @DisplayName("should skip a failed search and keep the others")
        void shouldSkipFailedSearch() throws Exception {
            StubSearchProvider search = new StubSearchProvider(query -> query.startsWith("Broken")
                    ? CompletableFuture.failedFuture(UpstreamException.httpStatus("brave", 500, "down"))
                    : CompletableFuture.completedFuture(List.of(BLOG)));
            EvidenceCollector collector = new EvidenceCollector(search, queue, 2, 80);

            Evidence evidence = collector.collect("Broken search claim; Working search claim", CancellationToken.none())
                    .get(5, TimeUnit.SECONDS);

            assertThat(evidence.references()).containsExactly(BLOG);
        }

        @Test
        @DisplayName("should report no references when every search fails")
        void shouldHandleAllFailures() throws Exception {
            StubSearchProvider search = new StubSearchProvider(query ->
                    CompletableFuture.failedFuture(UpstreamException.network("brave", "reset", null)));
            EvidenceCollector collector = new EvidenceCollector(search, queue, 2, 80);

            Evidence evidence = collector.collect("A claim long enough to search", CancellationToken.none())
                    .get(5, TimeUnit.SECONDS);

            assertThat(evidence.context()).isEmpty();
            assertThat(evidence.referencesText()).isEqualTo("\n\nReferences:\nNo references available.");
        }

        @Test
        @DisplayName("should not search when no claim is long enough")
        void shouldSkipShortQueries() throws Exception {
            StubSearchProvider search = StubSearchProvider.returning(List.of(BLOG));
            EvidenceCollector collector = new EvidenceCollector(search, queue, 2, 80);

            Evidence evidence = collector.collect("Short.", CancellationToken.none()).get(5, TimeUnit.SECONDS);

            assertThat(search.queries()).isEmpty();
            assertThat(evidence.references()).isEmpty();
        }
    }

    @Nested
    @DisplayName("ranking and formatting")
    class Formatting {

        @Test
        @DisplayName("should rank fact-checks first, then dated results newest first, then undated")
        void shouldRankResults() {
            Evidence evidence = EvidenceCollector.build(List.of(BLOG, REUTERS_OLD, REUTERS_NEW, SNOPES));

            assertThat(evidence.references()).containsExactly(SNOPES, REUTERS_NEW, REUTERS_OLD, BLOG);
        }

        @Test
        @DisplayName("should keep one result per URL")
        void shouldDeduplicateByUrl() {
            Evidence evidence = EvidenceCollector.build(List.of(BLOG, BLOG, SNOPES));

            assertThat(evidence.references()).containsExactly(SNOPES, BLOG);
        }

        @Test
        @DisplayName("should keep the first result seen for a repeated URL")
        void shouldKeepFirstResultForUrl() {
            SearchResult repost = new SearchResult(
                    "Second title", "Reposted.", BLOG.url(), "blog.example.org", null);

            Evidence evidence = EvidenceCollector.build(List.of(BLOG, repost));

            assertThat(evidence.references()).singleElement()
                    .satisfies(result -> assertThat(result.title()).isEqualTo("Some blog"));
        }

        @Test
        @DisplayName("should label references by source kind")
        void shouldLabelReferences() {
            Evidence evidence = EvidenceCollector.build(List.of(SNOPES, REUTERS_NEW, BLOG));

            assertThat(evidence.referencesText()).isEqualTo("\n\nReferences:\n"
                    + "- Fact-Check: Did it happen? (https://www.snopes.com/fact-check/x)\n"
                    + "- Credible: New report (https://www.reuters.com/world/new)\n"
                    + "- Some blog (https://blog.example.org/post)");
        }

        @Test
        @DisplayName("should format context with source, date and content")
        void shouldFormatContext() {
            Evidence evidence = EvidenceCollector.build(List.of(SNOPES, BLOG));

            assertThat(evidence.context()).isEqualTo(
                    "Source: Did it happen? (snopes.com) [2023-01-10]\nContent: Snopes looked into it.\n\n"
                            + "Source: Some blog (blog.example.org)\nContent: Opinions.");
        }

        @Test
        @DisplayName("should parse offset, local and date-only timestamps")
        void shouldParseDates() {
            assertThat(EvidenceCollector.parseDate("2024-02-01T08:30:00Z"))
                    .contains(Instant.parse("2024-02-01T08:30:00Z"));
            assertThat(EvidenceCollector.parseDate("2024-02-01T08:30:00"))
                    .contains(Instant.parse("2024-02-01T08:30:00Z"));
            assertThat(EvidenceCollector.parseDate("2024-02-01")).contains(Instant.parse("2024-02-01T00:00:00Z"));
            assertThat(EvidenceCollector.parseDate("3 days ago")).isEmpty();
            assertThat(EvidenceCollector.parseDate("")).isEmpty();
        }
    }
}
