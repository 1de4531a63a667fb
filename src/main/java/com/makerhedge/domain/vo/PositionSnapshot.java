package com.makerhedge.domain.vo;

import java.math.BigDecimal;
import lombok.Value;

/**
 * Normalized view of one account's position in one instrument, rebuilt every poll.
 *
 * <p>Size is signed: positive = long, negative = short. Notional is valued at the mark
 * price; when the exchange reports a non-positive mark the entry price is used instead.
 */
@Value
public class PositionSnapshot {

    public static final PositionSnapshot FLAT =
            new PositionSnapshot(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);

    BigDecimal size;
    BigDecimal markPrice;
    BigDecimal entryPrice;
    BigDecimal signedNotional;
    BigDecimal absNotional;

    public static PositionSnapshot of(BigDecimal size, BigDecimal markPrice, BigDecimal entryPrice) {
        BigDecimal mark = markPrice.signum() > 0 ? markPrice : entryPrice;
        BigDecimal signed = size.multiply(mark);
        return new PositionSnapshot(size, mark, entryPrice, signed, signed.abs());
    }

    public boolean isLong() {
        return size.signum() > 0;
    }

    public boolean isShort() {
        return size.signum() < 0;
    }

    public boolean isFlat() {
        return size.signum() == 0;
    }
}
