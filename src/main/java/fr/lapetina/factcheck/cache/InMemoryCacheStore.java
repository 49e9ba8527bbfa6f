package fr.lapetina.factcheck.cache;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store for tests. Without persistence the factory builds the cache with no store at all.
 */
public final class InMemoryCacheStore implements CacheStore {

    private final Map<String, byte[]> data = new ConcurrentHashMap<>();

    @Override
    public Optional<byte[]> get(String namespace) {
        byte[] payload = data.get(namespace);
        return payload != null ? Optional.of(payload.clone()) : Optional.empty();
    }

    @Override
    public void set(String namespace, byte[] payload) {
        data.put(namespace, payload.clone());
    }

    @Override
    public void remove(String namespace) {
        data.remove(namespace);
    }
}
