package com.makerhedge.exchange;

import java.util.List;
import java.util.Locale;
import lombok.Value;

/**
 * Error payload returned by the exchange API in place of a result.
 *
 * <p>{@code code} and {@code status} are the exchange's own numbers; status 0 means the call
 * never produced an HTTP response (network failure, client-side exception).
 */
@Value
public class ExchangeError {

    public static final int NO_STATUS = 0;

    private static final List<String> POST_ONLY_KEYWORDS = List.of("post", "maker", "would match", "taker");
    private static final List<String> ALREADY_CLOSED_KEYWORDS =
            List.of("not found", "does not exist", "already closed", "already canceled", "already cancelled");

    String code;
    int status;
    String message;

    public static ExchangeError of(String code, int status, String message) {
        return new ExchangeError(code, status, message);
    }

    public static ExchangeError network(String message) {
        return new ExchangeError("NETWORK", NO_STATUS, message);
    }

    /** Stale session or rejected API key; the caller should rebuild its client and retry once. */
    public boolean isAuthError() {
        String msg = lowerMessage();
        return status == 401 || "1000".equals(code) || msg.contains("authenticate") || msg.contains("unauthorized");
    }

    /** The order would have crossed the book and the exchange refused to rest it. */
    public boolean isPostOnlyViolation() {
        String msg = lowerMessage();
        return POST_ONLY_KEYWORDS.stream().anyMatch(msg::contains);
    }

    /** Cancel targeted an order that is already gone; treated as a successful cancel. */
    public boolean isAlreadyClosed() {
        String msg = lowerMessage();
        return ALREADY_CLOSED_KEYWORDS.stream().anyMatch(msg::contains);
    }

    /** Rate limit, server-side failure or no response at all. */
    public boolean isTransient() {
        return status == 429 || status >= 500 || (status == NO_STATUS && "NETWORK".equals(code));
    }

    private String lowerMessage() {
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "code=" + code + " status=" + status + " msg=" + message;
    }
}
