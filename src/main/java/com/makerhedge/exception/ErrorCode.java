package com.makerhedge.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Stable error codes carried by {@link BaseException}. The code string is what ends up in
 * logs and alert text; the exit status is used when the failure aborts startup.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_CONFIGURATION("INVALID_CONFIGURATION", 2),
    MISSING_CREDENTIALS("MISSING_CREDENTIALS", 2),
    UNKNOWN_INSTRUMENT("UNKNOWN_INSTRUMENT", 2),
    EXCHANGE_ERROR("EXCHANGE_ERROR", 1),
    SIGNING_ERROR("SIGNING_ERROR", 1);

    private final String code;
    private final int exitStatus;
}
