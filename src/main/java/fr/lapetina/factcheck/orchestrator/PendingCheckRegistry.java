package fr.lapetina.factcheck.orchestrator;

import fr.lapetina.factcheck.domain.model.CheckResult;
import fr.lapetina.factcheck.queue.CancellationToken;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-flight checks keyed by content fingerprint.
 *
 * At most one entry exists per fingerprint. The owner of an entry must call
 * {@link #remove} when its check settles, success or failure, before completing
 * the future, so a caller arriving after completion starts a fresh check.
 *
 * Each entry carries its own cancellation token, cancelled only once every
 * participant (owner and joiners) has cancelled its own token.
 */
final class PendingCheckRegistry {

    private final ConcurrentHashMap<String, Entry> pending = new ConcurrentHashMap<>();
    private final int prefixLength;

    PendingCheckRegistry(int prefixLength) {
        if (prefixLength < 1) {
            throw new IllegalArgumentException("Fingerprint prefix length must be >= 1");
        }
        this.prefixLength = prefixLength;
    }

    /**
     * SHA-256 of the first {@code prefixLength} characters, hex encoded.
     */
    String fingerprint(String text) {
        String prefix = text.length() > prefixLength ? text.substring(0, prefixLength) : text;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(prefix.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Joins the in-flight check for {@code fingerprint}, or registers a new one owned by the caller.
     *
     * @param participant the caller's own token
     */
    Registration register(String fingerprint, CancellationToken participant) {
        Entry candidate = new Entry();
        candidate.join(participant);
        Entry existing = pending.putIfAbsent(fingerprint, candidate);
        if (existing == null) {
            return new Registration(candidate, true);
        }
        existing.join(participant);
        return new Registration(existing, false);
    }

    void remove(String fingerprint, Entry entry) {
        pending.remove(fingerprint, entry);
    }

    int size() {
        return pending.size();
    }

    record Registration(Entry entry, boolean owner) {
    }

    static final class Entry {
        private final CompletableFuture<CheckResult> future = new CompletableFuture<>();
        private final CancellationToken token = CancellationToken.create();
        private int active;

        CompletableFuture<CheckResult> future() {
            return future;
        }

        /**
         * Token of the shared execution.
         */
        CancellationToken token() {
            return token;
        }

        synchronized int activeParticipants() {
            return active;
        }

        private synchronized void join(CancellationToken participant) {
            active++;
            participant.onCancel(this::leave);
        }

        private synchronized void leave() {
            active--;
            if (active == 0) {
                token.cancel();
            }
        }
    }
}
