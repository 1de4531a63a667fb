package com.makerhedge.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;

import com.makerhedge.domain.enums.OrderSide;
import com.makerhedge.domain.enums.PositionMode;
import com.makerhedge.risk.PositionBoundGuard;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PositionBoundGuardTest {

    private final PositionBoundGuard guard = new PositionBoundGuard();

    private static BigDecimal bd(String value) {
        return new BigDecimal(value);
    }

    @Nested
    @DisplayName("INCREASE mode")
    class IncreaseMode {

        @Test
        @DisplayName("Order that fits under the max total is returned unchanged")
        void fitsUnchanged() {
            BigDecimal clipped = guard.clipToTotalBound(
                    OrderSide.BUY, bd("1000"), bd("1000"), bd("1300"), PositionMode.INCREASE, bd("20000"));

            assertThat(clipped).isEqualByComparingTo("1000");
        }

        @Test
        @DisplayName("Order is stepped down until the projected total stays under the max")
        void steppedDown() {
            // other 9000 + |1000 + x| <= 10500  =>  x <= 500
            BigDecimal clipped = guard.clipToTotalBound(
                    OrderSide.BUY, bd("1000"), bd("1000"), bd("9000"), PositionMode.INCREASE, bd("10500"));

            assertThat(clipped).isEqualByComparingTo("500");
            assertThat(bd("9000").add(PositionBoundGuard.projectAbsNotional(bd("1000"), OrderSide.BUY, clipped)))
                    .isLessThanOrEqualTo(bd("10500"));
        }

        @Test
        @DisplayName("No room at all clips to zero")
        void noRoom() {
            BigDecimal clipped = guard.clipToTotalBound(
                    OrderSide.SELL, bd("1000"), bd("-5000"), bd("5000"), PositionMode.INCREASE, bd("10000"));

            assertThat(clipped).isZero();
        }

        @Test
        @DisplayName("Reducing order is never clipped in INCREASE mode")
        void reducingOrderPasses() {
            BigDecimal clipped = guard.clipToTotalBound(
                    OrderSide.SELL, bd("1000"), bd("5000"), bd("6000"), PositionMode.INCREASE, bd("10000"));

            assertThat(clipped).isEqualByComparingTo("1000");
        }
    }

    @Nested
    @DisplayName("DECREASE mode")
    class DecreaseMode {

        @Test
        @DisplayName("Unwind is stepped down so the total stays at or above the min")
        void unwindSteppedDown() {
            // 2000 + |3000 - x| >= 4600  =>  x <= 400
            BigDecimal clipped = guard.clipToTotalBound(
                    OrderSide.SELL, bd("1000"), bd("3000"), bd("2000"), PositionMode.DECREASE, bd("4600"));

            assertThat(clipped).isEqualByComparingTo("400");
        }

        @Test
        @DisplayName("Unwind that keeps the total above the min is untouched")
        void unwindUntouched() {
            BigDecimal clipped = guard.clipToTotalBound(
                    OrderSide.BUY, bd("1000"), bd("-3000"), bd("3000"), PositionMode.DECREASE, bd("0"));

            assertThat(clipped).isEqualByComparingTo("1000");
        }
    }

    @Test
    @DisplayName("Non-positive notional returns zero")
    void nonPositiveNotional() {
        assertThat(guard.clipToTotalBound(
                        OrderSide.BUY, BigDecimal.ZERO, bd("0"), bd("0"), PositionMode.INCREASE, bd("100")))
                .isZero();
    }
}
