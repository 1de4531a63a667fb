package com.makerhedge.domain.model;

import com.makerhedge.domain.enums.LegLabel;
import com.makerhedge.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Unmatched inventory contributed by one fill, waiting for an offsetting fill on the other leg.
 *
 * <p>{@code remainingNotional} only ever shrinks; the ledger drops a lot once it reaches zero.
 * Synthetic lots are seeded at startup from positions that existed before the process started
 * and are priced at the position's entry price.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FillLot {

    private LegLabel sourceLeg;
    private OrderSide sourceSide;
    private BigDecimal price;
    private BigDecimal remainingNotional;
    private Instant createdAt;
    private boolean synthetic;
}
