package com.makerhedge.domain.enums;

import java.util.Locale;

/**
 * Direction in which a symbol's total position is being driven.
 *
 * <p>INCREASE seeds new exposure on both legs until the maximum total notional is hit.
 * DECREASE unwinds existing opposite-signed inventory until the minimum total is reached.
 */
public enum PositionMode {
    INCREASE,
    DECREASE;

    public static PositionMode parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("position mode is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "increase" -> INCREASE;
            case "decrease" -> DECREASE;
            default -> throw new IllegalArgumentException("Unknown position mode: " + value);
        };
    }
}
