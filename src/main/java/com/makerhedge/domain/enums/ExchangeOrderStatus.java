package com.makerhedge.domain.enums;

import java.util.Locale;

/**
 * Lifecycle status of an order as reported by the exchange.
 * PENDING is the exchange's pre-book state; FILLED, CANCELLED and REJECTED are terminal.
 */
public enum ExchangeOrderStatus {
    PENDING,
    OPEN,
    FILLED,
    CANCELLED,
    REJECTED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED;
    }

    /** Maps an exchange status name; unknown or missing values are treated as OPEN. */
    public static ExchangeOrderStatus fromExchange(String value) {
        if (value == null || value.isBlank()) {
            return OPEN;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "PENDING" -> PENDING;
            case "FILLED" -> FILLED;
            case "CANCELLED", "CANCELED" -> CANCELLED;
            case "REJECTED" -> REJECTED;
            default -> OPEN;
        };
    }
}
