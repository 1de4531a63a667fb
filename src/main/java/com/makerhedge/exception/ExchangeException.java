package com.makerhedge.exception;

import com.makerhedge.exchange.ExchangeError;
import lombok.Getter;

/**
 * Raised inside the exchange access layer when a call fails. Carries the typed
 * {@link ExchangeError} so retry policies can decide whether the failure is transient.
 * It never escapes {@link com.makerhedge.exchange.AccountRuntime}: callers get an
 * {@link com.makerhedge.exchange.ExchangeResult} instead.
 */
@Getter
public class ExchangeException extends BaseException {

    private final ExchangeError error;

    public ExchangeException(ExchangeError error) {
        super(ErrorCode.EXCHANGE_ERROR, error.toString());
        this.error = error;
    }

    public ExchangeException(String message, Throwable cause) {
        super(ErrorCode.EXCHANGE_ERROR, message, cause);
        this.error = ExchangeError.network(message);
    }
}
