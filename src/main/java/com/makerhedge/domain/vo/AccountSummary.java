package com.makerhedge.domain.vo;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import lombok.Value;

/** Aggregated equity and margin figures for one trading account. */
@Value
public class AccountSummary {

    BigDecimal equity;
    BigDecimal maintenanceMargin;
    BigDecimal availableBalance;

    /** Maintenance margin / equity; empty when equity is not positive. */
    public Optional<BigDecimal> maintenanceMarginRatio() {
        if (equity == null || equity.signum() <= 0 || maintenanceMargin == null) {
            return Optional.empty();
        }
        return Optional.of(maintenanceMargin.divide(equity, 8, RoundingMode.HALF_UP));
    }
}
