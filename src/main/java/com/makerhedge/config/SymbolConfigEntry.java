package com.makerhedge.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One element of the symbols file as written on disk. Absent fields stay null and take defaults. */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SymbolConfigEntry {

    private String instrument;
    private Boolean enabled;

    @JsonProperty("order_notional_usdt")
    private BigDecimal orderNotionalUsdt;

    @JsonProperty("imbalance_limit_usdt")
    private BigDecimal imbalanceLimitUsdt;

    @JsonProperty("max_total_position_usdt")
    private BigDecimal maxTotalPositionUsdt;

    @JsonProperty("min_total_position_usdt")
    private BigDecimal minTotalPositionUsdt;

    @JsonProperty("a_side_when_equal")
    private String tieBreakSide;

    @JsonProperty("position_mode")
    private String positionMode;
}
