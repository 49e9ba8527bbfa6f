package fr.lapetina.factcheck.domain.exception;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Failure reported by an upstream model or search provider.
 *
 * Raised at the provider boundary so the rest of the system never has to
 * inspect raw HTTP responses:
 * - HTTP_STATUS: provider answered with a non-2xx status
 * - NETWORK: connection could not be established or was reset
 * - TIMEOUT: provider did not answer in time
 * - MALFORMED_RESPONSE: provider answered 2xx with an unusable body
 */
public final class UpstreamException extends RuntimeException {

    private final ErrorKind kind;
    private final String provider;
    private final Integer status;
    private final Duration retryAfter;

    private UpstreamException(
            ErrorKind kind,
            String provider,
            Integer status,
            Duration retryAfter,
            String message,
            Throwable cause
    ) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "Kind is required");
        this.provider = provider != null ? provider : "unknown";
        this.status = status;
        this.retryAfter = retryAfter;
    }

    public static UpstreamException httpStatus(String provider, int status, String message, Duration retryAfter) {
        return new UpstreamException(ErrorKind.HTTP_STATUS, provider, status, retryAfter, message, null);
    }

    public static UpstreamException httpStatus(String provider, int status, String message) {
        return httpStatus(provider, status, message, null);
    }

    public static UpstreamException network(String provider, String message, Throwable cause) {
        return new UpstreamException(ErrorKind.NETWORK, provider, null, null, message, cause);
    }

    public static UpstreamException timeout(String provider, String message, Throwable cause) {
        return new UpstreamException(ErrorKind.TIMEOUT, provider, null, null, message, cause);
    }

    public static UpstreamException malformed(String provider, String message, Throwable cause) {
        return new UpstreamException(ErrorKind.MALFORMED_RESPONSE, provider, null, null, message, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getProvider() {
        return provider;
    }

    public Optional<Integer> getStatus() {
        return Optional.ofNullable(status);
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public boolean isStatus(int expected) {
        return status != null && status == expected;
    }

    public boolean isRateLimited() {
        return isStatus(429);
    }

    @Override
    public String toString() {
        return "UpstreamException{" +
                "kind=" + kind +
                ", provider='" + provider + '\'' +
                ", status=" + status +
                ", retryAfter=" + retryAfter +
                ", message='" + getMessage() + '\'' +
                '}';
    }

    public enum ErrorKind {
        HTTP_STATUS,
        NETWORK,
        TIMEOUT,
        MALFORMED_RESPONSE
    }
}
