package com.makerhedge.oms;

import com.makerhedge.domain.enums.LegLabel;
import com.makerhedge.domain.enums.OrderSide;
import java.util.concurrent.ThreadLocalRandom;
import org.springframework.stereotype.Component;

/**
 * Generates and recognises the client order ids that mark an order as strategy-owned.
 *
 * <p>The exchange only accepts numeric client order ids, so ownership is encoded in the high
 * bits of an unsigned 64-bit value:
 * <pre>
 *   bits 63..60  1110        strategy namespace
 *   bit  59      leg         0 = A, 1 = B
 *   bit  58      side        0 = BUY, 1 = SELL
 *   bits 57..0   entropy
 * </pre>
 * The value is rendered as an unsigned decimal string. Ids starting with {@code HEDGEV1_}
 * (the older text format) are recognised as strategy-owned too.
 *
 * <p>Anything else on the account (manual orders, other bots) is foreign and never touched.
 */
@Component
public class ClientOrderIdGenerator {

    static final long NAMESPACE_MASK = 0xF000000000000000L;
    static final long NAMESPACE_PREFIX = 0xE000000000000000L;
    static final String LEGACY_PREFIX = "HEDGEV1_";

    private static final long ENTROPY_MASK = (1L << 58) - 1;

    public String next(LegLabel leg, OrderSide side) {
        long legBit = leg == LegLabel.A ? 0L : 1L;
        long sideBit = side == OrderSide.BUY ? 0L : 1L;
        long entropy = (System.nanoTime() ^ ThreadLocalRandom.current().nextLong()) & ENTROPY_MASK;
        long value = NAMESPACE_PREFIX | (legBit << 59) | (sideBit << 58) | entropy;
        return Long.toUnsignedString(value);
    }

    public boolean isStrategyOrder(String clientOrderId) {
        if (clientOrderId == null || clientOrderId.isEmpty()) {
            return false;
        }
        if (clientOrderId.startsWith(LEGACY_PREFIX)) {
            return true;
        }
        if (!isUnsignedDecimal(clientOrderId)) {
            return false;
        }
        try {
            return (Long.parseUnsignedLong(clientOrderId) & NAMESPACE_MASK) == NAMESPACE_PREFIX;
        } catch (NumberFormatException e) {
            // more than 64 bits
            return false;
        }
    }

    private static boolean isUnsignedDecimal(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
