package fr.lapetina.factcheck.domain.policy;

import fr.lapetina.factcheck.domain.exception.UpstreamException;
import fr.lapetina.factcheck.domain.model.ErrorCategory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpConnectTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps any failure to an {@link ErrorCategory}.
 *
 * Checks run in priority order: rate limit, auth, temporary, content policy,
 * context length. {@link UpstreamException} is inspected by kind and status;
 * other throwables are classified by type and message phrasing.
 * Stateless and thread-safe.
 */
public final class ErrorClassifier {

    private static final List<String> RATE_LIMIT_PHRASES = List.of(
            "rate limit", "too many requests", "quota exceeded");
    private static final List<String> AUTH_PHRASES = List.of(
            "unauthorized", "authentication", "invalid key", "invalid api key");
    private static final List<String> TEMPORARY_PHRASES = List.of(
            "timeout", "connection", "network", "temporarily", "unavailable", "overloaded");
    private static final List<String> CONTENT_POLICY_PHRASES = List.of(
            "content policy", "content filter", "violates", "inappropriate");
    private static final List<String> CONTEXT_LENGTH_PHRASES = List.of(
            "context length", "token limit", "too long");

    public ErrorCategory categorize(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause == null) {
            return ErrorCategory.UNKNOWN;
        }
        if (isRateLimitError(cause)) {
            return ErrorCategory.RATE_LIMIT;
        }
        if (isAuthError(cause)) {
            return ErrorCategory.AUTH_ERROR;
        }
        if (isTemporaryError(cause)) {
            return ErrorCategory.TEMPORARY;
        }
        String message = messageOf(cause);
        if (containsAny(message, CONTENT_POLICY_PHRASES)) {
            return ErrorCategory.CONTENT_POLICY;
        }
        if (containsAny(message, CONTEXT_LENGTH_PHRASES)) {
            return ErrorCategory.CONTEXT_LENGTH;
        }
        return ErrorCategory.UNKNOWN;
    }

    public boolean isRateLimitError(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause == null) {
            return false;
        }
        if (cause instanceof UpstreamException && ((UpstreamException) cause).isRateLimited()) {
            return true;
        }
        return containsAny(messageOf(cause), RATE_LIMIT_PHRASES);
    }

    public boolean isAuthError(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause == null) {
            return false;
        }
        if (cause instanceof UpstreamException) {
            UpstreamException upstream = (UpstreamException) cause;
            if (upstream.isStatus(401) || upstream.isStatus(403)) {
                return true;
            }
        }
        return containsAny(messageOf(cause), AUTH_PHRASES);
    }

    public boolean isTemporaryError(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause == null) {
            return false;
        }
        if (cause instanceof UpstreamException) {
            UpstreamException upstream = (UpstreamException) cause;
            boolean byKind = switch (upstream.getKind()) {
                case NETWORK, TIMEOUT -> true;
                case HTTP_STATUS -> upstream.getStatus().map(s -> s >= 500).orElse(false);
                case MALFORMED_RESPONSE -> false;
            };
            if (byKind) {
                return true;
            }
        } else if (cause instanceof TimeoutException
                || cause instanceof ConnectException
                || cause instanceof HttpConnectTimeoutException
                || cause instanceof IOException) {
            return true;
        }
        return containsAny(messageOf(cause), TEMPORARY_PHRASES);
    }

    /**
     * Strips future wrappers so the original failure is classified.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String messageOf(Throwable error) {
        String message = error.getMessage();
        return message != null ? message.toLowerCase(Locale.ROOT) : "";
    }

    private static boolean containsAny(String text, List<String> phrases) {
        for (String phrase : phrases) {
            if (text.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
