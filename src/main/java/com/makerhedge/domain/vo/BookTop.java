package com.makerhedge.domain.vo;

import java.math.BigDecimal;
import lombok.Value;

/** Best bid and best ask of an order book; both always positive. */
@Value
public class BookTop {

    BigDecimal bestBid;
    BigDecimal bestAsk;
}
