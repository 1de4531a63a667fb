package com.makerhedge.domain.enums;

/**
 * Execution mode for the hedge engine.
 * LIVE sends signed orders through an exchange adapter. PAPER routes everything
 * through the in-memory simulated exchange.
 */
public enum TradingMode {
    LIVE,
    PAPER
}
