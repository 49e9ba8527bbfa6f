package fr.lapetina.factcheck.cache;

import java.util.Optional;

/**
 * Durable byte store used to persist the response cache between restarts.
 *
 * Implementations report I/O problems as {@link java.io.UncheckedIOException}.
 */
public interface CacheStore {

    Optional<byte[]> get(String namespace);

    void set(String namespace, byte[] payload);

    void remove(String namespace);
}
