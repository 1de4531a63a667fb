package com.makerhedge.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.makerhedge.domain.enums.OrderSide;
import com.makerhedge.domain.model.InstrumentSpec;
import com.makerhedge.domain.vo.DecimalMath;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DecimalMathTest {

    private static final InstrumentSpec BTC = InstrumentSpec.builder()
            .instrument("BTC_USDT_Perp")
            .tickSize(new BigDecimal("0.1"))
            .sizeStep(new BigDecimal("0.001"))
            .minSize(new BigDecimal("0.001"))
            .build();

    @Nested
    @DisplayName("Price quantization")
    class PriceQuantization {

        @Test
        @DisplayName("SELL rounds up to the tick")
        void sellRoundsUp() {
            assertThat(DecimalMath.quantizePrice(new BigDecimal("100.123"), new BigDecimal("0.01"), OrderSide.SELL))
                    .isEqualByComparingTo("100.13");
        }

        @Test
        @DisplayName("BUY rounds down to the tick")
        void buyRoundsDown() {
            assertThat(DecimalMath.quantizePrice(new BigDecimal("100.129"), new BigDecimal("0.01"), OrderSide.BUY))
                    .isEqualByComparingTo("100.12");
        }

        @Test
        @DisplayName("Price already on the tick is unchanged for both sides")
        void onTickUnchanged() {
            BigDecimal price = new BigDecimal("65000.5");
            assertThat(DecimalMath.quantizePrice(price, new BigDecimal("0.1"), OrderSide.SELL))
                    .isEqualByComparingTo(price);
            assertThat(DecimalMath.quantizePrice(price, new BigDecimal("0.1"), OrderSide.BUY))
                    .isEqualByComparingTo(price);
        }

        @Test
        @DisplayName("Missing tick leaves the price as is")
        void missingTick() {
            assertThat(DecimalMath.quantizePrice(new BigDecimal("1.23456"), null, OrderSide.BUY))
                    .isEqualByComparingTo("1.23456");
        }
    }

    @Nested
    @DisplayName("Size from notional")
    class SizeFromNotional {

        @Test
        @DisplayName("Rounds down to the size step")
        void roundsDownToStep() {
            assertThat(DecimalMath.sizeFromNotional(new BigDecimal("1000"), new BigDecimal("65000"), BTC))
                    .isEqualByComparingTo("0.015");
        }

        @Test
        @DisplayName("Small notional is forced up to the minimum size")
        void forcedUpToMinimum() {
            assertThat(DecimalMath.sizeFromNotional(new BigDecimal("10"), new BigDecimal("65000"), BTC))
                    .isEqualByComparingTo("0.001");
        }

        @Test
        @DisplayName("Non-positive price or notional gives zero")
        void nonPositiveInputs() {
            assertThat(DecimalMath.sizeFromNotional(BigDecimal.ZERO, new BigDecimal("65000"), BTC)).isZero();
            assertThat(DecimalMath.sizeFromNotional(new BigDecimal("1000"), BigDecimal.ZERO, BTC)).isZero();
        }
    }

    @Test
    @DisplayName("Notional is truncated to six decimals")
    void notionalTruncated() {
        assertThat(DecimalMath.toNotional(new BigDecimal("0.0153"), new BigDecimal("3.3333333")))
                .isEqualByComparingTo("0.050999");
    }
}
