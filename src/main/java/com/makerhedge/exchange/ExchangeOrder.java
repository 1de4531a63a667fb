package com.makerhedge.exchange;

import com.makerhedge.domain.enums.ExchangeOrderStatus;
import com.makerhedge.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/**
 * Single-leg limit order as reported by the exchange, in open-order listings, single-order
 * lookups and submission acknowledgements.
 *
 * <p>{@code tradedSize} is cumulative; {@code bookSize} is the size still resting on the book.
 */
@Value
@Builder(toBuilder = true)
public class ExchangeOrder {

    String orderId;
    String clientOrderId;
    String instrument;
    OrderSide side;
    BigDecimal limitPrice;
    BigDecimal size;
    ExchangeOrderStatus status;

    @Builder.Default
    BigDecimal tradedSize = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal bookSize = BigDecimal.ZERO;

    BigDecimal avgFillPrice;
    Instant createdAt;

    /** Average fill price when the exchange reports a positive one. */
    public Optional<BigDecimal> avgFillPrice() {
        return Optional.ofNullable(avgFillPrice).filter(p -> p.signum() > 0);
    }

    /** Average fill price, falling back to the limit price. */
    public BigDecimal effectiveFillPrice() {
        return avgFillPrice().orElse(limitPrice == null ? BigDecimal.ZERO : limitPrice);
    }

    public Optional<Instant> createdAt() {
        return Optional.ofNullable(createdAt);
    }
}
