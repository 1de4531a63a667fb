package com.makerhedge.core.engine;

import com.makerhedge.config.HedgeProperties;
import com.makerhedge.domain.enums.LegLabel;
import com.makerhedge.domain.enums.OrderSide;
import com.makerhedge.domain.enums.PositionMode;
import com.makerhedge.domain.model.AccountSnapshot;
import com.makerhedge.domain.model.FillLot;
import com.makerhedge.domain.model.HedgeTarget;
import com.makerhedge.domain.model.SymbolConfig;
import com.makerhedge.domain.model.SymbolState;
import com.makerhedge.domain.vo.PositionSnapshot;
import com.makerhedge.exchange.HedgeAccounts;
import com.makerhedge.ledger.FillLotLedger;
import com.makerhedge.notification.AlertService;
import com.makerhedge.oms.ManagedOrderTracker;
import com.makerhedge.oms.PostOnlyOrderPlacer;
import com.makerhedge.risk.PositionBoundGuard;
import com.makerhedge.risk.UnhedgedExposureMonitor;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Per-symbol decision step of the hedge loop.
 *
 * <p>Each cycle the engine reconciles both legs' orders, then compares the absolute position
 * notional of A and B:
 * <ul>
 *   <li><b>Balanced</b> (|A| == |B|): seeds one standard order on each leg that is under its cap,
 *       in opposite directions, unless the total-position bound has been reached</li>
 *   <li><b>Imbalanced</b>: places a single hedge order on the smaller leg, its side and guard
 *       price taken from the oldest lot the other leg created</li>
 * </ul>
 *
 * <p>Each leg may hold one strategy order while the legs are within
 * {@code single-order-diff-threshold} of each other, two otherwise. Orders over the cap are
 * cancelled oldest first before any decision is made.
 *
 * <p>A symbol is skipped for the cycle when either leg's positions or open orders could not be
 * fetched: trading on a partial picture could double up an existing hedge.
 */
@Service
public class RebalancingEngine {

    private static final Logger log = LoggerFactory.getLogger(RebalancingEngine.class);

    private static final Duration BOUND_ALERT_COOLDOWN = Duration.ofSeconds(900);
    private static final Duration DIRECTION_FALLBACK_ALERT_COOLDOWN = Duration.ofSeconds(1800);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final ManagedOrderTracker orderTracker;
    private final PostOnlyOrderPlacer orderPlacer;
    private final FillLotLedger ledger;
    private final PositionBoundGuard boundGuard;
    private final UnhedgedExposureMonitor unhedgedExposureMonitor;
    private final AlertService alertService;
    private final HedgeAccounts accounts;
    private final HedgeProperties properties;
    private final Clock clock;

    public RebalancingEngine(
            ManagedOrderTracker orderTracker,
            PostOnlyOrderPlacer orderPlacer,
            FillLotLedger ledger,
            PositionBoundGuard boundGuard,
            UnhedgedExposureMonitor unhedgedExposureMonitor,
            AlertService alertService,
            HedgeAccounts accounts,
            HedgeProperties properties,
            Clock clock) {
        this.orderTracker = orderTracker;
        this.orderPlacer = orderPlacer;
        this.ledger = ledger;
        this.boundGuard = boundGuard;
        this.unhedgedExposureMonitor = unhedgedExposureMonitor;
        this.alertService = alertService;
        this.accounts = accounts;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Startup pass for one symbol: turns pre-existing positions into synthetic lots and adopts
     * strategy orders that are already resting.
     */
    public void bootstrap(SymbolState state, Map<LegLabel, AccountSnapshot> snapshots) {
        String symbol = state.getInstrument();
        for (LegLabel leg : LegLabel.values()) {
            AccountSnapshot snapshot = snapshots.get(leg);
            if (!snapshot.isPositionsAvailable()) {
                log.warn("[{}] positions for leg {} unavailable at bootstrap, no synthetic lot seeded", symbol, leg);
            }
            ledger.seedSyntheticLot(state, leg, snapshot.position(symbol));
            orderTracker.syncOrders(state, leg, snapshot.openOrders(symbol));
        }
    }

    public void process(SymbolState state, Map<LegLabel, AccountSnapshot> snapshots) {
        SymbolConfig config = state.getConfig();
        String symbol = state.getInstrument();
        if (!config.isEnabled() || state.isInCooldown(clock.instant())) {
            return;
        }
        AccountSnapshot snapshotA = snapshots.get(LegLabel.A);
        AccountSnapshot snapshotB = snapshots.get(LegLabel.B);
        if (!snapshotA.isComplete() || !snapshotB.isComplete()) {
            log.debug("[{}] incomplete account snapshot, skipping this cycle", symbol);
            return;
        }

        orderTracker.syncOrders(state, LegLabel.A, snapshotA.openOrders(symbol));
        orderTracker.syncOrders(state, LegLabel.B, snapshotB.openOrders(symbol));

        PositionSnapshot posA = snapshotA.position(symbol);
        PositionSnapshot posB = snapshotB.position(symbol);
        BigDecimal absA = posA.getAbsNotional();
        BigDecimal absB = posB.getAbsNotional();
        BigDecimal diff = absA.subtract(absB).abs();

        int perAccountCap = diff.compareTo(properties.getSingleOrderDiffThreshold()) < 0 ? 1 : 2;
        orderTracker.enforceAccountOrderCap(state, LegLabel.A, perAccountCap);
        orderTracker.enforceAccountOrderCap(state, LegLabel.B, perAccountCap);

        unhedgedExposureMonitor.check(state, absA, absB);

        BigDecimal total = absA.add(absB);
        boolean boundReached = checkTotalBound(config, total);

        if (absA.compareTo(absB) == 0) {
            if (!boundReached) {
                seedBalanced(state, posA, posB, perAccountCap);
            }
            return;
        }
        hedgeSmallerLeg(state, posA, posB, perAccountCap);
    }

    /**
     * Side for leg A when the legs are balanced; leg B takes the opposite. Empty when there is
     * nothing to do (DECREASE mode with both legs flat).
     */
    public Optional<OrderSide> decideBalancedSide(SymbolConfig config, PositionSnapshot posA, PositionSnapshot posB) {
        if (config.getPositionMode() == PositionMode.INCREASE) {
            return Optional.of(config.getTieBreakSide());
        }
        if (posA.getAbsNotional().signum() == 0 && posB.getAbsNotional().signum() == 0) {
            return Optional.empty();
        }
        if (posA.isLong() && posB.isShort()) {
            return Optional.of(OrderSide.SELL);
        }
        if (posA.isShort() && posB.isLong()) {
            return Optional.of(OrderSide.BUY);
        }
        if (!posA.isFlat() && !posB.isFlat() && posA.getSize().signum() == posB.getSize().signum()) {
            alertService.notify(
                    "Decrease mode direction mismatch " + config.getInstrument(),
                    "A.size=" + posA.getSize() + " B.size=" + posB.getSize() + ", fallback to configured baseline",
                    "decrease_direction_fallback:" + config.getInstrument(),
                    DIRECTION_FALLBACK_ALERT_COOLDOWN);
        }
        return Optional.of(config.getTieBreakSide().opposite());
    }

    /**
     * Side and guard price for a hedge on {@code targetLeg}: the reverse of the oldest lot the
     * other leg created, at that lot's price. Without such a lot, the larger leg's direction is
     * reversed and its entry price becomes the guard.
     */
    public Optional<HedgeTarget> requiredHedge(
            SymbolState state, LegLabel targetLeg, PositionSnapshot posA, PositionSnapshot posB) {
        Optional<FillLot> lot = ledger.oldestOpposingLot(state, targetLeg);
        if (lot.isPresent()) {
            return Optional.of(new HedgeTarget(lot.get().getSourceSide().opposite(), lot.get().getPrice()));
        }
        PositionSnapshot larger = posA.getAbsNotional().compareTo(posB.getAbsNotional()) >= 0 ? posA : posB;
        BigDecimal guard = larger.getEntryPrice().signum() > 0 ? larger.getEntryPrice() : null;
        if (larger.isLong()) {
            return Optional.of(new HedgeTarget(OrderSide.SELL, guard));
        }
        if (larger.isShort()) {
            return Optional.of(new HedgeTarget(OrderSide.BUY, guard));
        }
        return Optional.empty();
    }

    private boolean checkTotalBound(SymbolConfig config, BigDecimal total) {
        String symbol = config.getInstrument();
        if (config.getPositionMode() == PositionMode.INCREASE
                && total.compareTo(config.getMaxTotalPosition()) >= 0) {
            alertService.notify(
                    "Max total position exceeded " + symbol,
                    "mode=increase total=" + total + " max=" + config.getMaxTotalPosition(),
                    "max_total:" + symbol,
                    BOUND_ALERT_COOLDOWN);
            return true;
        }
        if (config.getPositionMode() == PositionMode.DECREASE
                && total.compareTo(config.getMinTotalPosition()) <= 0) {
            alertService.notify(
                    "Min total position reached " + symbol,
                    "mode=decrease total=" + total + " min=" + config.getMinTotalPosition(),
                    "min_total:" + symbol,
                    BOUND_ALERT_COOLDOWN);
            return true;
        }
        return false;
    }

    private void seedBalanced(SymbolState state, PositionSnapshot posA, PositionSnapshot posB, int perAccountCap) {
        Optional<OrderSide> sideA = decideBalancedSide(state.getConfig(), posA, posB);
        if (sideA.isEmpty()) {
            return;
        }
        BigDecimal notional = state.getConfig().getOrderNotional();
        if (orderTracker.activeOrderCount(state, LegLabel.A) < perAccountCap) {
            orderPlacer.placeWithRetry(state, accounts.get(LegLabel.A), sideA.get(), null, notional);
        }
        if (orderTracker.activeOrderCount(state, LegLabel.B) < perAccountCap) {
            orderPlacer.placeWithRetry(state, accounts.get(LegLabel.B), sideA.get().opposite(), null, notional);
        }
    }

    private void hedgeSmallerLeg(SymbolState state, PositionSnapshot posA, PositionSnapshot posB, int perAccountCap) {
        SymbolConfig config = state.getConfig();
        LegLabel smallLeg = posA.getAbsNotional().compareTo(posB.getAbsNotional()) < 0 ? LegLabel.A : LegLabel.B;
        PositionSnapshot small = smallLeg == LegLabel.A ? posA : posB;
        PositionSnapshot large = smallLeg == LegLabel.A ? posB : posA;

        Optional<HedgeTarget> target = requiredHedge(state, smallLeg, posA, posB);
        if (target.isEmpty()) {
            return;
        }
        OrderSide side = target.get().getSide();

        int activeSmallCount = orderTracker.activeOrderCount(state, smallLeg);
        BigDecimal hedgeOpen = orderTracker.activeHedgeNotional(state, smallLeg, side);
        BigDecimal gap = large.getAbsNotional()
                .subtract(small.getAbsNotional().add(hedgeOpen.divide(TWO)));
        if (gap.signum() <= 0) {
            return;
        }
        BigDecimal diff = large.getAbsNotional().subtract(small.getAbsNotional());
        if (diff.compareTo(config.getImbalanceLimit()) <= 0
                && hedgeOpen.signum() > 0
                && activeSmallCount >= perAccountCap) {
            return;
        }

        BigDecimal notional;
        if (diff.compareTo(properties.getSingleOrderDiffThreshold()) >= 0 && activeSmallCount < perAccountCap) {
            notional = config.getOrderNotional();
        } else {
            notional = config.getOrderNotional().min(gap.multiply(TWO));
        }
        if (notional.signum() <= 0) {
            return;
        }

        BigDecimal bound = config.getPositionMode() == PositionMode.INCREASE
                ? config.getMaxTotalPosition()
                : config.getMinTotalPosition();
        BigDecimal clipped = boundGuard.clipToTotalBound(
                side, notional, small.getSignedNotional(), large.getAbsNotional(), config.getPositionMode(), bound);
        if (clipped.signum() <= 0 || activeSmallCount >= perAccountCap) {
            return;
        }
        log.info(
                "[{}] hedging leg {} {} notional={} guard={} (|A|={} |B|={} gap={})",
                state.getInstrument(),
                smallLeg,
                side,
                clipped,
                target.get().getGuardPrice(),
                posA.getAbsNotional(),
                posB.getAbsNotional(),
                gap);
        orderPlacer.placeWithRetry(state, accounts.get(smallLeg), side, target.get().getGuardPrice(), clipped);
    }
}
