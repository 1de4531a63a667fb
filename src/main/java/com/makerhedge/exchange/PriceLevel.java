package com.makerhedge.exchange;

import java.math.BigDecimal;
import lombok.Value;

@Value
public class PriceLevel {

    BigDecimal price;
    BigDecimal size;
}
