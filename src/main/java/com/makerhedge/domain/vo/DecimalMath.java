package com.makerhedge.domain.vo;

import com.makerhedge.domain.enums.OrderSide;
import com.makerhedge.domain.model.InstrumentSpec;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Tick/step quantization and notional rounding shared by the placement protocol
 * and the order tracker.
 *
 * <p>Prices are always rounded in the passive direction (ceiling for SELL, floor for BUY)
 * so that quantization can never turn a resting quote into a marketable one. Sizes are
 * always rounded down so an order never exceeds its target notional, except when the
 * instrument's minimum size forces it up.
 */
public final class DecimalMath {

    /** Notionals are carried with 6 decimal places, truncated. */
    public static final int NOTIONAL_SCALE = 6;

    /** Fallback size quantum when the instrument does not report one. */
    public static final BigDecimal DEFAULT_SIZE_QUANTUM = new BigDecimal("0.000001");

    private static final int DIVISION_SCALE = 18;

    private DecimalMath() {}

    /** size x price truncated to {@link #NOTIONAL_SCALE} decimals. */
    public static BigDecimal toNotional(BigDecimal size, BigDecimal price) {
        return size.multiply(price).setScale(NOTIONAL_SCALE, RoundingMode.DOWN);
    }

    /**
     * Quantizes a price to the instrument tick in the passive direction.
     * A non-positive tick leaves the price untouched.
     */
    public static BigDecimal quantizePrice(BigDecimal price, BigDecimal tick, OrderSide side) {
        if (tick == null || tick.signum() <= 0) {
            return price;
        }
        RoundingMode mode = side == OrderSide.SELL ? RoundingMode.CEILING : RoundingMode.DOWN;
        BigDecimal units = price.divide(tick, 0, mode);
        return units.multiply(tick).setScale(Math.max(0, tick.scale()), RoundingMode.UNNECESSARY);
    }

    /**
     * Converts a target notional into a tradable size.
     *
     * <p>The size is rounded down to the order step (the instrument minimum size when it
     * has one, never finer than the size quantum) and then forced up to the minimum size.
     * Returns zero when the notional or price is not positive.
     */
    public static BigDecimal sizeFromNotional(BigDecimal notional, BigDecimal price, InstrumentSpec instrument) {
        if (price.signum() <= 0 || notional.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal quantum = instrument.getSizeStep() != null && instrument.getSizeStep().signum() > 0
                ? instrument.getSizeStep()
                : DEFAULT_SIZE_QUANTUM;
        BigDecimal minSize = instrument.getMinSize() != null ? instrument.getMinSize() : BigDecimal.ZERO;

        BigDecimal step = minSize.signum() > 0 ? minSize : quantum;
        if (step.compareTo(quantum) < 0) {
            step = quantum;
        }

        BigDecimal rawSize = notional.divide(price, DIVISION_SCALE, RoundingMode.DOWN);
        BigDecimal steps = rawSize.divide(step, 0, RoundingMode.DOWN);
        BigDecimal size = steps.multiply(step).setScale(Math.max(0, quantum.scale()), RoundingMode.DOWN);
        if (size.compareTo(minSize) < 0) {
            size = minSize;
        }
        return size;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
