package com.makerhedge.domain.enums;

import java.util.Locale;

/** Buy or sell side of an order. Maps to the exchange's is-buying-asset flag. */
public enum OrderSide {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /** Signed direction of this side: +1 for BUY, -1 for SELL. */
    public int sign() {
        return this == BUY ? 1 : -1;
    }

    /**
     * Parses a side from configuration text ("buy"/"sell", any case).
     *
     * @throws IllegalArgumentException for any other value
     */
    public static OrderSide parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("side is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "buy" -> BUY;
            case "sell" -> SELL;
            default -> throw new IllegalArgumentException("Unknown side: " + value);
        };
    }
}
