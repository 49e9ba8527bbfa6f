package fr.lapetina.factcheck.provider;

import fr.lapetina.factcheck.domain.model.SearchResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Web search used as an evidence source.
 */
public interface SearchProvider {

    String name();

    /**
     * Returns a flat list of results for one query. Ranking is left to the caller.
     */
    CompletableFuture<List<SearchResult>> search(String query);
}
