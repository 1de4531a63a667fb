package com.makerhedge.exchange;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** A perpetual position as reported by the exchange. Size is signed: negative means short. */
@Value
@Builder
public class ExchangePosition {

    String instrument;
    BigDecimal size;
    BigDecimal markPrice;
    BigDecimal entryPrice;
}
