package com.makerhedge.unit.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.makerhedge.config.HedgeProperties;
import com.makerhedge.core.engine.RebalancingEngine;
import com.makerhedge.domain.enums.AlertSeverity;
import com.makerhedge.domain.enums.ExchangeOrderStatus;
import com.makerhedge.domain.enums.LegLabel;
import com.makerhedge.domain.enums.OrderSide;
import com.makerhedge.domain.enums.PositionMode;
import com.makerhedge.domain.model.AccountSnapshot;
import com.makerhedge.domain.model.FillLot;
import com.makerhedge.domain.model.HedgeTarget;
import com.makerhedge.domain.model.SymbolConfig;
import com.makerhedge.domain.model.SymbolState;
import com.makerhedge.domain.vo.PositionSnapshot;
import com.makerhedge.exchange.AccountRuntime;
import com.makerhedge.exchange.ExchangeError;
import com.makerhedge.exchange.ExchangeGateway;
import com.makerhedge.exchange.ExchangeOrder;
import com.makerhedge.exchange.ExchangeResult;
import com.makerhedge.exchange.HedgeAccounts;
import com.makerhedge.ledger.FillLotLedger;
import com.makerhedge.notification.AlertService;
import com.makerhedge.notification.TelegramNotifier;
import com.makerhedge.observability.HedgeMetrics;
import com.makerhedge.oms.ClientOrderIdGenerator;
import com.makerhedge.oms.ManagedOrderTracker;
import com.makerhedge.oms.PostOnlyOrderPlacer;
import com.makerhedge.risk.PositionBoundGuard;
import com.makerhedge.risk.UnhedgedExposureMonitor;
import com.makerhedge.support.MutableClock;
import com.makerhedge.support.TestStates;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RebalancingEngineTest {

    private static final String BTC = TestStates.BTC;

    private MutableClock clock;
    private ExchangeGateway gateway;
    private TelegramNotifier telegramNotifier;
    private PostOnlyOrderPlacer placer;
    private AccountRuntime accountA;
    private AccountRuntime accountB;
    private FillLotLedger ledger;
    private ManagedOrderTracker tracker;
    private ClientOrderIdGenerator idGenerator;
    private RebalancingEngine engine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-05T00:00:00Z");
        gateway = mock(ExchangeGateway.class);
        telegramNotifier = mock(TelegramNotifier.class);
        placer = mock(PostOnlyOrderPlacer.class);
        accountA = mock(AccountRuntime.class);
        accountB = mock(AccountRuntime.class);
        when(accountA.getLeg()).thenReturn(LegLabel.A);
        when(accountB.getLeg()).thenReturn(LegLabel.B);
        when(gateway.order(any(), anyString())).thenReturn(ExchangeResult.failure(ExchangeError.network("down")));
        when(gateway.cancel(any(), anyString())).thenReturn(true);

        HedgeProperties properties = new HedgeProperties();
        HedgeAccounts accounts = new HedgeAccounts(accountA, accountB);
        AlertService alertService = new AlertService(telegramNotifier, clock);
        idGenerator = new ClientOrderIdGenerator();
        ledger = new FillLotLedger(clock);
        tracker = new ManagedOrderTracker(
                gateway,
                accounts,
                ledger,
                idGenerator,
                alertService,
                new HedgeMetrics(new SimpleMeterRegistry()),
                properties,
                clock);
        engine = new RebalancingEngine(
                tracker,
                placer,
                ledger,
                new PositionBoundGuard(),
                new UnhedgedExposureMonitor(alertService, properties, clock),
                alertService,
                accounts,
                properties,
                clock);
    }

    private static BigDecimal bd(String value) {
        return new BigDecimal(value);
    }

    private static PositionSnapshot position(String size, String price) {
        return PositionSnapshot.of(bd(size), bd(price), bd(price));
    }

    private static AccountSnapshot snapshot(PositionSnapshot position, List<ExchangeOrder> orders) {
        return AccountSnapshot.of(
                Optional.of(Map.of(BTC, position)), Optional.of(Map.of(BTC, orders)), Optional.empty());
    }

    private static Map<LegLabel, AccountSnapshot> snapshots(AccountSnapshot a, AccountSnapshot b) {
        Map<LegLabel, AccountSnapshot> snapshots = new EnumMap<>(LegLabel.class);
        snapshots.put(LegLabel.A, a);
        snapshots.put(LegLabel.B, b);
        return snapshots;
    }

    private static Map<LegLabel, AccountSnapshot> positions(PositionSnapshot a, PositionSnapshot b) {
        return snapshots(snapshot(a, List.of()), snapshot(b, List.of()));
    }

    private ExchangeOrder liveStrategyOrder(LegLabel leg, OrderSide side, String orderId) {
        return ExchangeOrder.builder()
                .orderId(orderId)
                .clientOrderId(idGenerator.next(leg, side))
                .instrument(BTC)
                .side(side)
                .limitPrice(bd("100"))
                .size(bd("2"))
                .status(ExchangeOrderStatus.OPEN)
                .bookSize(bd("2"))
                .build();
    }

    @Nested
    @DisplayName("Balanced legs")
    class BalancedLegs {

        @Test
        @DisplayName("Both flat in INCREASE mode seeds A BUY and B SELL at the standard notional")
        void bothFlatSeedsBothLegs() {
            SymbolState state = TestStates.btcState();

            engine.process(state, positions(PositionSnapshot.FLAT, PositionSnapshot.FLAT));

            verify(placer).placeWithRetry(state, accountA, OrderSide.BUY, null, bd("1000"));
            verify(placer).placeWithRetry(state, accountB, OrderSide.SELL, null, bd("1000"));
        }

        @Test
        @DisplayName("At the max total with balanced legs nothing is placed and the alert goes out once")
        void maxTotalBlocksSeeding() {
            SymbolState state = TestStates.btcState();
            Map<LegLabel, AccountSnapshot> atLimit = positions(position("100", "100"), position("-100", "100"));

            engine.process(state, atLimit);
            engine.process(state, atLimit);

            verify(placer, never()).placeWithRetry(any(), any(), any(), any(), any());
            verify(telegramNotifier, times(1))
                    .send(argThat(m -> m.startsWith("Max total position exceeded")), eq(AlertSeverity.WARNING));
        }

        @Test
        @DisplayName("A leg already at its cap gets no new seeding order")
        void legAtCapSkipped() {
            SymbolState state = TestStates.btcState();
            Map<LegLabel, AccountSnapshot> snapshots = snapshots(
                    snapshot(PositionSnapshot.FLAT, List.of(liveStrategyOrder(LegLabel.A, OrderSide.BUY, "0xa1"))),
                    snapshot(PositionSnapshot.FLAT, List.of()));

            engine.process(state, snapshots);

            verify(placer, never()).placeWithRetry(any(), eq(accountA), any(), any(), any());
            verify(placer).placeWithRetry(state, accountB, OrderSide.SELL, null, bd("1000"));
        }
    }

    @Nested
    @DisplayName("Order cap")
    class OrderCap {

        @Test
        @DisplayName("Below the diff threshold each leg keeps at most one active order")
        void capOfOneEnforced() {
            SymbolState state = TestStates.btcState();
            List<ExchangeOrder> live = new ArrayList<>();
            live.add(liveStrategyOrder(LegLabel.A, OrderSide.BUY, "0xa1"));
            live.add(liveStrategyOrder(LegLabel.A, OrderSide.BUY, "0xa2"));
            live.add(liveStrategyOrder(LegLabel.A, OrderSide.BUY, "0xa3"));

            engine.process(
                    state,
                    snapshots(snapshot(position("10", "100"), live), snapshot(position("-10.1", "100"), List.of())));

            assertThat(tracker.activeOrderCount(state, LegLabel.A)).isEqualTo(1);
            verify(gateway, times(2)).cancel(eq(accountA), anyString());
        }

        @Test
        @DisplayName("Above the diff threshold a second order is allowed")
        void capOfTwoAboveThreshold() {
            SymbolState state = TestStates.btcState();
            List<ExchangeOrder> live = List.of(
                    liveStrategyOrder(LegLabel.A, OrderSide.BUY, "0xa1"),
                    liveStrategyOrder(LegLabel.A, OrderSide.BUY, "0xa2"));

            engine.process(
                    state, snapshots(snapshot(position("10", "100"), live), snapshot(position("-13", "100"), List.of())));

            assertThat(tracker.activeOrderCount(state, LegLabel.A)).isEqualTo(2);
            verify(gateway, never()).cancel(any(), anyString());
        }
    }

    @Nested
    @DisplayName("Imbalanced legs")
    class ImbalancedLegs {

        @Test
        @DisplayName("Smaller leg A is hedged with side and guard from the oldest lot of leg B")
        void hedgeFromOldestOpposingLot() {
            SymbolState state = TestStates.btcState();
            ledger.applyFill(state, LegLabel.B, OrderSide.SELL, bd("101"), bd("300"));

            engine.process(state, positions(position("10", "100"), position("-13", "100")));

            verify(placer).placeWithRetry(state, accountA, OrderSide.BUY, bd("101"), bd("1000"));
            verify(placer, never()).placeWithRetry(any(), eq(accountB), any(), any(), any());
        }

        @Test
        @DisplayName("Small drift caps the hedge at twice the gap")
        void smallDriftCappedAtTwiceGap() {
            SymbolState state = TestStates.btcState();
            ledger.applyFill(state, LegLabel.B, OrderSide.SELL, bd("101"), bd("10"));

            engine.process(state, positions(position("10", "100"), position("-10.1", "100")));

            verify(placer)
                    .placeWithRetry(
                            eq(state),
                            eq(accountA),
                            eq(OrderSide.BUY),
                            eq(bd("101")),
                            argThat(n -> n.compareTo(bd("20")) == 0));
        }

        @Test
        @DisplayName("Without lots the larger leg's direction and entry price decide the hedge")
        void fallbackToLargerLeg() {
            SymbolState state = TestStates.btcState();

            engine.process(state, positions(position("10", "100"), position("-13", "99")));

            verify(placer)
                    .placeWithRetry(
                            eq(state), eq(accountA), eq(OrderSide.BUY), argThat(g -> g.compareTo(bd("99")) == 0), any());
        }

        @Test
        @DisplayName("Open hedge covering the gap suppresses another order")
        void openHedgeCoversGap() {
            SymbolState state = TestStates.btcState();
            ExchangeOrder openHedge = ExchangeOrder.builder()
                    .orderId("0xa1")
                    .clientOrderId(idGenerator.next(LegLabel.A, OrderSide.BUY))
                    .instrument(BTC)
                    .side(OrderSide.BUY)
                    .limitPrice(bd("100"))
                    .size(bd("6"))
                    .status(ExchangeOrderStatus.OPEN)
                    .bookSize(bd("6"))
                    .build();

            // gap = 1300 - (1000 + 600 / 2) = 0
            engine.process(
                    state,
                    snapshots(
                            snapshot(position("10", "100"), List.of(openHedge)),
                            snapshot(position("-13", "100"), List.of())));

            verify(placer, never()).placeWithRetry(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("Hedge is clipped so the projected total stays under the max")
        void hedgeClippedByMaxTotal() {
            SymbolConfig config = TestStates.btcConfig().maxTotalPosition(bd("2800")).build();
            SymbolState state = new SymbolState(config);

            engine.process(state, positions(position("10", "100"), position("-13", "100")));

            // 1300 + |1000 + x| <= 2800  =>  x <= 500
            verify(placer)
                    .placeWithRetry(
                            eq(state),
                            eq(accountA),
                            eq(OrderSide.BUY),
                            any(),
                            argThat(n -> n.compareTo(bd("500")) == 0));
        }
    }

    @Nested
    @DisplayName("Decrease mode")
    class DecreaseMode {

        private final SymbolConfig config = TestStates.btcConfig()
                .positionMode(PositionMode.DECREASE)
                .tieBreakSide(OrderSide.BUY)
                .minTotalPosition(bd("500"))
                .build();

        @Test
        @DisplayName("A long and B short unwinds with A SELL")
        void longShortUnwinds() {
            assertThat(engine.decideBalancedSide(config, position("10", "100"), position("-10", "100")))
                    .contains(OrderSide.SELL);
        }

        @Test
        @DisplayName("A short and B long unwinds with A BUY")
        void shortLongUnwinds() {
            assertThat(engine.decideBalancedSide(config, position("-10", "100"), position("10", "100")))
                    .contains(OrderSide.BUY);
        }

        @Test
        @DisplayName("Both flat leaves nothing to unwind")
        void bothFlatNothing() {
            assertThat(engine.decideBalancedSide(config, PositionSnapshot.FLAT, PositionSnapshot.FLAT))
                    .isEmpty();
        }

        @Test
        @DisplayName("Same-signed inventory falls back to the opposite of the tie-break side and alerts")
        void sameSignedFallback() {
            assertThat(engine.decideBalancedSide(config, position("10", "100"), position("10", "100")))
                    .contains(OrderSide.SELL);
            verify(telegramNotifier)
                    .send(argThat(m -> m.startsWith("Decrease mode direction mismatch")), eq(AlertSeverity.WARNING));
        }

        @Test
        @DisplayName("Balanced legs at the min total place nothing")
        void minTotalBlocksUnwind() {
            SymbolState state = new SymbolState(config);

            engine.process(state, positions(position("2.5", "100"), position("-2.5", "100")));

            verify(placer, never()).placeWithRetry(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("Balanced legs above the min total unwind both legs")
        void unwindBothLegs() {
            SymbolState state = new SymbolState(config);

            engine.process(state, positions(position("10", "100"), position("-10", "100")));

            verify(placer).placeWithRetry(state, accountA, OrderSide.SELL, null, bd("1000"));
            verify(placer).placeWithRetry(state, accountB, OrderSide.BUY, null, bd("1000"));
        }
    }

    @Nested
    @DisplayName("Skips")
    class Skips {

        @Test
        @DisplayName("Symbol in cooldown is not processed")
        void cooldownSkips() {
            SymbolState state = TestStates.btcState();
            state.setCooldownUntil(clock.instant().plus(Duration.ofSeconds(10)));

            engine.process(state, positions(PositionSnapshot.FLAT, PositionSnapshot.FLAT));

            verify(placer, never()).placeWithRetry(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("Disabled symbol is not processed")
        void disabledSkips() {
            SymbolState state = new SymbolState(TestStates.btcConfig().enabled(false).build());

            engine.process(state, positions(PositionSnapshot.FLAT, PositionSnapshot.FLAT));

            verify(placer, never()).placeWithRetry(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("Missing positions on one leg skips the symbol for the cycle")
        void incompleteSnapshotSkips() {
            SymbolState state = TestStates.btcState();
            AccountSnapshot failed = AccountSnapshot.of(Optional.empty(), Optional.of(Map.of()), Optional.empty());

            engine.process(state, snapshots(snapshot(PositionSnapshot.FLAT, List.of()), failed));

            verify(placer, never()).placeWithRetry(any(), any(), any(), any(), any());
        }
    }

    @Nested
    @DisplayName("Bootstrap")
    class Bootstrap {

        @Test
        @DisplayName("Pre-existing positions become synthetic lots and steer the first hedge")
        void syntheticLotsSeeded() {
            SymbolState state = TestStates.btcState();
            Map<LegLabel, AccountSnapshot> snapshots = positions(position("10", "100"), position("-13", "98"));

            engine.bootstrap(state, snapshots);

            assertThat(state.getLots()).hasSize(2).allMatch(FillLot::isSynthetic);
            Optional<HedgeTarget> target =
                    engine.requiredHedge(state, LegLabel.B, position("10", "100"), position("-13", "98"));
            assertThat(target).hasValueSatisfying(t -> {
                assertThat(t.getSide()).isEqualTo(OrderSide.SELL);
                assertThat(t.getGuardPrice()).isEqualByComparingTo("100");
            });
        }
    }
}
