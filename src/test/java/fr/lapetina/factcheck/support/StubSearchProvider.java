package fr.lapetina.factcheck.support;

import fr.lapetina.factcheck.domain.model.SearchResult;
import fr.lapetina.factcheck.provider.SearchProvider;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Search provider answering from a function, recording every query.
 */
public final class StubSearchProvider implements SearchProvider {

    private final List<String> queries = new CopyOnWriteArrayList<>();
    private final Function<String, CompletableFuture<List<SearchResult>>> responder;

    public StubSearchProvider(Function<String, CompletableFuture<List<SearchResult>>> responder) {
        this.responder = responder;
    }

    public static StubSearchProvider returning(List<SearchResult> results) {
        return new StubSearchProvider(query -> CompletableFuture.completedFuture(results));
    }

    public List<String> queries() {
        return queries;
    }

    @Override
    public String name() {
        return "stub-search";
    }

    @Override
    public CompletableFuture<List<SearchResult>> search(String query) {
        queries.add(query);
        return responder.apply(query);
    }
}
