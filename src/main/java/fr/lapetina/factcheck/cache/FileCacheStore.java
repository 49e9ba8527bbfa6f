package fr.lapetina.factcheck.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores each namespace as {@code <directory>/<namespace>.json}.
 *
 * Writes go to a temporary sibling first and are moved into place, so a crash
 * mid-write leaves the previous snapshot intact.
 */
public final class FileCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(FileCacheStore.class);

    private final Path directory;

    public FileCacheStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "Directory is required");
    }

    @Override
    public Optional<byte[]> get(String namespace) {
        Path file = fileFor(namespace);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read cache file: " + file, e);
        }
    }

    @Override
    public void set(String namespace, byte[] payload) {
        Path file = fileFor(namespace);
        try {
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, "cache-" + namespace, ".tmp");
            Files.write(tmp, payload);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Cache snapshot written: file={}, bytes={}", file, payload.length);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write cache file: " + file, e);
        }
    }

    @Override
    public void remove(String namespace) {
        Path file = fileFor(namespace);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete cache file: " + file, e);
        }
    }

    private Path fileFor(String namespace) {
        return directory.resolve(namespace + ".json");
    }
}
