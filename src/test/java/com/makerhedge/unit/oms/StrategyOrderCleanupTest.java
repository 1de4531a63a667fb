package com.makerhedge.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.makerhedge.config.HedgeProperties;
import com.makerhedge.domain.enums.LegLabel;
import com.makerhedge.domain.enums.OrderSide;
import com.makerhedge.exchange.AccountRuntime;
import com.makerhedge.exchange.ExchangeGateway;
import com.makerhedge.exchange.ExchangeOrder;
import com.makerhedge.exchange.HedgeAccounts;
import com.makerhedge.observability.HedgeMetrics;
import com.makerhedge.oms.ClientOrderIdGenerator;
import com.makerhedge.oms.StrategyOrderCleanup;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StrategyOrderCleanupTest {

    private static final String BTC = "BTC_USDT_Perp";

    private ExchangeGateway gateway;
    private AccountRuntime accountA;
    private AccountRuntime accountB;
    private HedgeProperties properties;
    private ClientOrderIdGenerator idGenerator;
    private StrategyOrderCleanup cleanup;

    @BeforeEach
    void setUp() {
        gateway = mock(ExchangeGateway.class);
        accountA = mock(AccountRuntime.class);
        accountB = mock(AccountRuntime.class);
        when(accountA.getLeg()).thenReturn(LegLabel.A);
        when(accountB.getLeg()).thenReturn(LegLabel.B);
        when(accountA.getName()).thenReturn("account1");
        when(accountB.getName()).thenReturn("account2");
        when(gateway.cancel(any(), anyString())).thenReturn(true);
        when(gateway.openOrders(accountB)).thenReturn(Optional.of(Map.of()));

        properties = new HedgeProperties();
        idGenerator = new ClientOrderIdGenerator();
        cleanup = new StrategyOrderCleanup(
                gateway,
                new HedgeAccounts(accountA, accountB),
                idGenerator,
                new HedgeMetrics(new SimpleMeterRegistry()),
                properties);
    }

    private ExchangeOrder order(String orderId, String clientOrderId, String createdAt) {
        return ExchangeOrder.builder()
                .orderId(orderId)
                .clientOrderId(clientOrderId)
                .instrument(BTC)
                .side(OrderSide.BUY)
                .limitPrice(new BigDecimal("100"))
                .size(BigDecimal.ONE)
                .createdAt(Instant.parse(createdAt))
                .build();
    }

    @Test
    @DisplayName("Cancels every strategy order and leaves foreign orders alone")
    void cancelsStrategyOrdersOnly() {
        when(gateway.openOrders(accountA))
                .thenReturn(Optional.of(Map.of(
                        BTC,
                        List.of(
                                order("0x1", idGenerator.next(LegLabel.A, OrderSide.BUY), "2026-01-01T00:00:00Z"),
                                order("0x2", "manual-42", "2026-01-01T00:00:01Z")))));

        int cancelled = cleanup.cancelStrategyOrders();

        assertThat(cancelled).isEqualTo(1);
        verify(gateway).cancel(accountA, "0x1");
        verify(gateway, never()).cancel(accountA, "0x2");
    }

    @Test
    @DisplayName("Keeps the newest N strategy orders per symbol")
    void keepsNewestOrders() {
        properties.setStopKeepStrategyOrders(1);
        when(gateway.openOrders(accountA))
                .thenReturn(Optional.of(Map.of(
                        BTC,
                        List.of(
                                order("0xold", idGenerator.next(LegLabel.A, OrderSide.BUY), "2026-01-01T00:00:00Z"),
                                order("0xnew", idGenerator.next(LegLabel.A, OrderSide.BUY), "2026-01-01T00:05:00Z")))));

        int cancelled = cleanup.cancelStrategyOrders();

        assertThat(cancelled).isEqualTo(1);
        verify(gateway).cancel(accountA, "0xold");
        verify(gateway, never()).cancel(accountA, "0xnew");
    }

    @Test
    @DisplayName("An account whose open orders cannot be listed is skipped")
    void unavailableAccountSkipped() {
        when(gateway.openOrders(accountA)).thenReturn(Optional.empty());

        assertThat(cleanup.cancelStrategyOrders()).isZero();
        verify(gateway, never()).cancel(any(), anyString());
    }

    @Test
    @DisplayName("Does nothing when cancel-on-stop is off")
    void disabled() {
        properties.setCancelOnStop(false);

        assertThat(cleanup.cancelStrategyOrders()).isZero();
        verify(gateway, never()).openOrders(any());
    }
}
