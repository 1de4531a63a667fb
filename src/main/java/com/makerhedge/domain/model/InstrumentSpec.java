package com.makerhedge.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Trading rules of an instrument: price tick, size quantum and minimum order size.
 * Cached per account after the first lookup.
 */
@Value
@Builder
public class InstrumentSpec {

    String instrument;
    BigDecimal tickSize;

    /** Smallest size increment the exchange accepts (10^-baseDecimals). */
    BigDecimal sizeStep;

    BigDecimal minSize;
}
