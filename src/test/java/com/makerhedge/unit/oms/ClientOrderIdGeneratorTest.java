package com.makerhedge.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;

import com.makerhedge.domain.enums.LegLabel;
import com.makerhedge.domain.enums.OrderSide;
import com.makerhedge.oms.ClientOrderIdGenerator;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ClientOrderIdGeneratorTest {

    private final ClientOrderIdGenerator generator = new ClientOrderIdGenerator();

    @Test
    @DisplayName("Generated ids are unsigned decimals in the strategy namespace")
    void generatedIdsAreStrategyOwned() {
        String id = generator.next(LegLabel.B, OrderSide.SELL);

        assertThat(id).containsOnlyDigits();
        long value = Long.parseUnsignedLong(id);
        assertThat(value >>> 60).isEqualTo(0xEL);
        assertThat((value >>> 59) & 1).isEqualTo(1L);
        assertThat((value >>> 58) & 1).isEqualTo(1L);
        assertThat(generator.isStrategyOrder(id)).isTrue();
    }

    @Test
    @DisplayName("Leg and side bits are zero for A BUY")
    void legAndSideBits() {
        long value = Long.parseUnsignedLong(generator.next(LegLabel.A, OrderSide.BUY));

        assertThat((value >>> 59) & 1).isZero();
        assertThat((value >>> 58) & 1).isZero();
    }

    @Test
    @DisplayName("Ids do not repeat")
    void idsAreUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(generator.next(LegLabel.A, OrderSide.BUY));
        }
        assertThat(ids).hasSize(1000);
    }

    @Test
    @DisplayName("Legacy text ids are strategy-owned; manual and malformed ids are not")
    void recognition() {
        assertThat(generator.isStrategyOrder("HEDGEV1_A_BUY_123")).isTrue();
        assertThat(generator.isStrategyOrder("12345")).isFalse();
        assertThat(generator.isStrategyOrder("manual-order")).isFalse();
        assertThat(generator.isStrategyOrder("99999999999999999999999")).isFalse();
        assertThat(generator.isStrategyOrder("")).isFalse();
        assertThat(generator.isStrategyOrder(null)).isFalse();
    }
}
