package fr.lapetina.factcheck.integration;

import fr.lapetina.factcheck.FactCheckFactory;
import fr.lapetina.factcheck.support.StubModelProvider;

import java.util.concurrent.CompletableFuture;

/**
 * Test extension of FactCheckFactory wired to a stub model provider.
 */
public final class TestFactCheckFactory extends FactCheckFactory {

    private final StubModelProvider modelProvider;

    private TestFactCheckFactory(String configPath, StubModelProvider modelProvider) {
        super(configPath, modelProvider, null);
        this.modelProvider = modelProvider;
    }

    /**
     * Creates a test factory from the default test configuration.
     */
    public static TestFactCheckFactory create() {
        return create("test-factcheck.yaml");
    }

    public static TestFactCheckFactory create(String configPath) {
        return new TestFactCheckFactory(configPath, StubModelProvider.answering("Rating: 50\nExplanation: Default."));
    }

    /**
     * Sets a fixed response for every model call.
     */
    public void setModelResponse(String response) {
        modelProvider.respondWith(request -> CompletableFuture.completedFuture(response));
    }

    /**
     * Fails every model call with the given exception.
     */
    public void setModelError(RuntimeException error) {
        modelProvider.respondWith(request -> CompletableFuture.failedFuture(error));
    }

    public StubModelProvider getModelProvider() {
        return modelProvider;
    }
}
