package com.makerhedge.exchange;

import com.makerhedge.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Post-only good-till-time limit order ready to be signed. */
@Value
@Builder
public class UnsignedOrder {

    public static final String GOOD_TILL_TIME = "GOOD_TILL_TIME";

    String subAccountId;
    String instrument;
    OrderSide side;
    BigDecimal limitPrice;
    BigDecimal size;
    boolean postOnly;
    boolean reduceOnly;

    @Builder.Default
    String timeInForce = GOOD_TILL_TIME;

    Instant expiration;
    long nonce;
    String clientOrderId;
    Instant createdAt;
}
