package com.jay.tradeledger.broker;

import java.util.List;
import java.util.Locale;

/**
 * A broker call failure, classified once at the transport boundary.
 */
public record ApiError(Kind kind, String code, String message) {

    public enum Kind {
        /** Session token expired or invalid; a refresh may fix it. */
        AUTH_EXPIRED,
        /** The broker refused the request itself. */
        REJECTED,
        /** Timeouts, throttling and gateway errors. */
        TRANSIENT,
        UNKNOWN
    }

    private static final List<String> AUTH_MARKERS =
        List.of("invalid token", "token expired", "session expired", "invalid jwt", "unauthorized", "2fa");
    private static final List<String> TRANSIENT_MARKERS =
        List.of("timeout", "timed out", "too many requests", "rate limit", "try again", "temporarily",
            "service unavailable", "gateway");

    public static ApiError authExpired(String message) {
        return new ApiError(Kind.AUTH_EXPIRED, null, message);
    }

    public static ApiError rejected(String code, String message) {
        return new ApiError(Kind.REJECTED, code, message);
    }

    public static ApiError transientError(String message) {
        return new ApiError(Kind.TRANSIENT, null, message);
    }

    /**
     * Classifies a broker error from its HTTP status and message text.
     *
     * @param httpStatus response status, or 0 when the request never got a response
     */
    public static ApiError classify(int httpStatus, String code, String message) {
        String text = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (httpStatus == 401 || httpStatus == 403 || containsAny(text, AUTH_MARKERS)) {
            return new ApiError(Kind.AUTH_EXPIRED, code, message);
        }
        if (httpStatus == 0 || httpStatus == 429 || httpStatus >= 500 || containsAny(text, TRANSIENT_MARKERS)) {
            return new ApiError(Kind.TRANSIENT, code, message);
        }
        if (httpStatus >= 400) {
            return new ApiError(Kind.REJECTED, code, message);
        }
        return new ApiError(Kind.UNKNOWN, code, message);
    }

    /** Classifies a free-text failure reason reported without an HTTP status. */
    public static ApiError fromReason(String reason) {
        String text = reason == null ? "" : reason.toLowerCase(Locale.ROOT);
        if (containsAny(text, AUTH_MARKERS)) return authExpired(reason);
        if (containsAny(text, TRANSIENT_MARKERS)) return transientError(reason);
        return new ApiError(Kind.UNKNOWN, null, reason);
    }

    public boolean isAuthExpired() {
        return kind == Kind.AUTH_EXPIRED;
    }

    public boolean isRetriable() {
        return kind == Kind.TRANSIENT;
    }

    private static boolean containsAny(String text, List<String> markers) {
        return markers.stream().anyMatch(text::contains);
    }

    @Override
    public String toString() {
        return kind + (code != null ? " [" + code + "]" : "") + ": " + message;
    }
}
