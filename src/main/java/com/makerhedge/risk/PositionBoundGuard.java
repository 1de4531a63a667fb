package com.makerhedge.risk;

import com.makerhedge.domain.enums.OrderSide;
import com.makerhedge.domain.enums.PositionMode;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Keeps a hedge order from pushing the symbol's total position (|A| + |B|) across its bound.
 *
 * <p>In INCREASE mode the bound is the maximum total and the projected total must stay at or
 * below it; in DECREASE mode the bound is the minimum total and the projected total must stay
 * at or above it. The candidate notional is stepped down in {@value #STEPS} equal steps and the
 * first one that satisfies the bound wins; if none does, the order is dropped (zero).
 */
@Component
public class PositionBoundGuard {

    static final int STEPS = 50;

    private static final BigDecimal STEP_DIVISOR = BigDecimal.valueOf(STEPS);

    /**
     * Largest candidate (from {@code notional} down, in 1/50 steps) whose projected total
     * respects the bound.
     *
     * @param signedNotional current signed notional of the leg that would trade
     * @param otherAbs absolute notional of the other leg, unchanged by this order
     * @return the clipped notional, or zero
     */
    public BigDecimal clipToTotalBound(
            OrderSide side,
            BigDecimal notional,
            BigDecimal signedNotional,
            BigDecimal otherAbs,
            PositionMode mode,
            BigDecimal bound) {
        if (notional.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal step = notional.divide(STEP_DIVISOR);
        BigDecimal candidate = notional;
        for (int i = 0; i <= STEPS; i++) {
            BigDecimal projectedTotal = otherAbs.add(projectAbsNotional(signedNotional, side, candidate));
            boolean withinBound = mode == PositionMode.INCREASE
                    ? projectedTotal.compareTo(bound) <= 0
                    : projectedTotal.compareTo(bound) >= 0;
            if (withinBound) {
                return candidate;
            }
            candidate = candidate.subtract(step);
            if (candidate.signum() <= 0) {
                return BigDecimal.ZERO;
            }
        }
        return BigDecimal.ZERO;
    }

    /** Absolute notional of a leg after an order of {@code notional} on {@code side} fills. */
    public static BigDecimal projectAbsNotional(BigDecimal signedNotional, OrderSide side, BigDecimal notional) {
        BigDecimal delta = side == OrderSide.BUY ? notional : notional.negate();
        return signedNotional.add(delta).abs();
    }
}
