package com.makerhedge.domain.model;

import com.makerhedge.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.util.Optional;
import lombok.Value;

/**
 * Side the smaller leg must trade to close the imbalance, and the price it must not cross.
 * A missing guard lets the placer quote at top of book.
 */
@Value
public class HedgeTarget {

    OrderSide side;
    BigDecimal guardPrice;

    public Optional<BigDecimal> guard() {
        return Optional.ofNullable(guardPrice);
    }
}
