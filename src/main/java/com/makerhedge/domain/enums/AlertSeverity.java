package com.makerhedge.domain.enums;

/**
 * Severity level for hedge alerts.
 *
 * <p>Ordinal ordering is used by TelegramNotifier's priority queue
 * so that CRITICAL messages are sent first when rate-limited.
 */
public enum AlertSeverity {

    /** Exposure is at risk: margin ratio breached, hedge stuck, loop failing. */
    CRITICAL,

    /** Requires trader attention but the engine keeps running. */
    WARNING,

    /** Informational. */
    INFO
}
