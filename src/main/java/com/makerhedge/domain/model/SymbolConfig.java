package com.makerhedge.domain.model;

import com.makerhedge.domain.enums.OrderSide;
import com.makerhedge.domain.enums.PositionMode;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Per-instrument hedge parameters, loaded once at startup from the symbols file
 * and read-only for the lifetime of the process.
 *
 * <p>All amounts are notionals in the settlement currency (USDT). Invariant enforced by
 * {@link com.makerhedge.config.SymbolConfigLoader}: {@code 0 <= minTotalPosition <= maxTotalPosition}.
 */
@Value
@Builder
public class SymbolConfig {

    String instrument;
    boolean enabled;

    /** Standard notional of every seeding order and the cap for hedge orders. */
    BigDecimal orderNotional;

    /** Drift between the legs tolerated before an open hedge is topped up. */
    BigDecimal imbalanceLimit;

    /** INCREASE mode stops seeding once |A| + |B| reaches this. */
    BigDecimal maxTotalPosition;

    /** DECREASE mode stops unwinding once |A| + |B| falls to this. */
    BigDecimal minTotalPosition;

    /** Side leg A takes when both legs are equal; leg B takes the opposite. */
    OrderSide tieBreakSide;

    PositionMode positionMode;
}
