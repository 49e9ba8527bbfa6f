package fr.lapetina.factcheck.provider;

import fr.lapetina.factcheck.domain.model.ModelRequest;
import fr.lapetina.factcheck.domain.model.ModelTier;

import java.util.concurrent.CompletableFuture;

/**
 * Adapter to one AI completion provider.
 *
 * Implementations fail their futures with
 * {@link fr.lapetina.factcheck.domain.exception.UpstreamException} so that status,
 * Retry-After and transport failures reach the classifier intact.
 */
public interface ModelProvider {

    /**
     * Short provider identifier, e.g. "openai".
     */
    String name();

    /**
     * Sends a prompt to the model named in the request and returns the trimmed completion text.
     */
    CompletableFuture<String> call(ModelRequest request);

    /**
     * Provider model id serving the given tier.
     */
    String mapModel(ModelTier tier);
}
