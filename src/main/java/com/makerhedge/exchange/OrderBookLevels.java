package com.makerhedge.exchange;

import com.makerhedge.domain.vo.BookTop;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import lombok.Value;

/** Order book snapshot, bids descending and asks ascending. */
@Value
public class OrderBookLevels {

    String instrument;
    List<PriceLevel> bids;
    List<PriceLevel> asks;

    /** Best bid and ask, or empty when either side is missing or not positive. */
    public Optional<BookTop> top() {
        if (bids == null || bids.isEmpty() || asks == null || asks.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal bid = bids.get(0).getPrice();
        BigDecimal ask = asks.get(0).getPrice();
        if (bid == null || ask == null || bid.signum() <= 0 || ask.signum() <= 0) {
            return Optional.empty();
        }
        return Optional.of(new BookTop(bid, ask));
    }
}
