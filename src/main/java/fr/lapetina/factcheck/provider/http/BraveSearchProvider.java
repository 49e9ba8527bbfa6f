package fr.lapetina.factcheck.provider.http;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.factcheck.domain.model.SearchResult;
import fr.lapetina.factcheck.provider.SearchProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Brave web search adapter. Web and news results are merged into one flat list.
 */
public final class BraveSearchProvider extends AbstractHttpProvider implements SearchProvider {

    private static final Logger log = LoggerFactory.getLogger(BraveSearchProvider.class);

    public static final String NAME = "brave";
    public static final URI DEFAULT_ENDPOINT = URI.create("https://api.search.brave.com/res/v1/web/search");

    private final String apiKey;
    private final URI endpoint;
    private final int resultsCount;

    public BraveSearchProvider(
            String apiKey,
            URI endpoint,
            int resultsCount,
            Duration connectTimeout,
            Duration requestTimeout
    ) {
        super(NAME, connectTimeout, requestTimeout);
        this.apiKey = Objects.requireNonNull(apiKey, "API key is required");
        this.endpoint = endpoint != null ? endpoint : DEFAULT_ENDPOINT;
        if (resultsCount < 1) {
            throw new IllegalArgumentException("resultsCount must be >= 1");
        }
        this.resultsCount = resultsCount;
        log.info("Brave search provider created: endpoint={}, resultsCount={}", this.endpoint, resultsCount);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CompletableFuture<List<SearchResult>> search(String query) {
        String requestId = UUID.randomUUID().toString();
        URI uri = URI.create(endpoint + "?q=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
                + "&count=" + resultsCount);

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .header("X-Subscription-Token", apiKey)
                .GET()
                .build();

        return sendJson(httpRequest, requestId).thenApply(this::parseResults);
    }

    private List<SearchResult> parseResults(JsonNode response) {
        List<SearchResult> results = new ArrayList<>();
        collect(response.path("web").path("results"), results);
        collect(response.path("news").path("results"), results);
        log.debug("Search results parsed: provider={}, count={}", NAME, results.size());
        return results;
    }

    private void collect(JsonNode items, List<SearchResult> into) {
        if (!items.isArray()) {
            return;
        }
        for (JsonNode item : items) {
            String url = item.path("url").asText(null);
            String domain = hostOf(url);
            if (domain == null) {
                continue;
            }
            String description = item.path("description").asText(item.path("snippet").asText(""));
            into.add(new SearchResult(
                    item.path("title").asText(null),
                    description,
                    url,
                    domain,
                    item.path("published_date").asText(item.path("page_age").asText(""))
            ));
        }
    }

    private static String hostOf(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            log.debug("Skipping result with invalid URL: url={}", url);
            return null;
        }
    }

    @Override
    protected String displayName() {
        return "Brave search";
    }
}
