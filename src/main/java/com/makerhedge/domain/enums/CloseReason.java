package com.makerhedge.domain.enums;

/** Why a managed order stopped counting as active. */
public enum CloseReason {
    FILLED,
    CANCELLED,
    REJECTED,
    /** Submitted but never confirmed with a real exchange id inside the provisional window. */
    PROVISIONAL_TIMEOUT,
    /** Cancelled because the leg had more active strategy orders than the current cap allows. */
    ORDER_CAP;

    public static CloseReason fromTerminalStatus(ExchangeOrderStatus status) {
        return switch (status) {
            case FILLED -> FILLED;
            case CANCELLED -> CANCELLED;
            case REJECTED -> REJECTED;
            default -> throw new IllegalArgumentException("Not a terminal status: " + status);
        };
    }
}
