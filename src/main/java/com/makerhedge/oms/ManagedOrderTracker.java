package com.makerhedge.oms;

import com.makerhedge.config.HedgeProperties;
import com.makerhedge.domain.enums.CloseReason;
import com.makerhedge.domain.enums.ExchangeOrderStatus;
import com.makerhedge.domain.enums.LegLabel;
import com.makerhedge.domain.enums.OrderSide;
import com.makerhedge.domain.model.ManagedOrder;
import com.makerhedge.domain.model.SymbolState;
import com.makerhedge.domain.vo.DecimalMath;
import com.makerhedge.exchange.AccountRuntime;
import com.makerhedge.exchange.ExchangeGateway;
import com.makerhedge.exchange.ExchangeOrder;
import com.makerhedge.exchange.ExchangeResult;
import com.makerhedge.exchange.HedgeAccounts;
import com.makerhedge.ledger.FillLotLedger;
import com.makerhedge.notification.AlertService;
import com.makerhedge.observability.HedgeMetrics;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reconciles the local view of strategy orders with open-order snapshots and turns observed
 * fills into ledger entries.
 *
 * <p>Sync is at-least-once safe: running it again with the same snapshot changes nothing,
 * because each order remembers how much of its traded size has already been applied.
 *
 * <p>Orders that disappear from the open-order list are never assumed filled or cancelled.
 * The tracker looks each one up directly and only closes it once the exchange reports a
 * terminal status; a failed lookup leaves the order open until the next cycle. The one
 * exception is an order still carrying a placeholder id: it cannot be looked up, so it is
 * force-closed once the provisional window has passed.
 */
@Service
public class ManagedOrderTracker {

    private static final Logger log = LoggerFactory.getLogger(ManagedOrderTracker.class);

    private static final Duration FOREIGN_ORDER_ALERT_COOLDOWN = Duration.ofSeconds(3600);

    private final ExchangeGateway exchangeGateway;
    private final HedgeAccounts accounts;
    private final FillLotLedger ledger;
    private final ClientOrderIdGenerator clientOrderIdGenerator;
    private final AlertService alertService;
    private final HedgeMetrics metrics;
    private final HedgeProperties properties;
    private final Clock clock;

    public ManagedOrderTracker(
            ExchangeGateway exchangeGateway,
            HedgeAccounts accounts,
            FillLotLedger ledger,
            ClientOrderIdGenerator clientOrderIdGenerator,
            AlertService alertService,
            HedgeMetrics metrics,
            HedgeProperties properties,
            Clock clock) {
        this.exchangeGateway = exchangeGateway;
        this.accounts = accounts;
        this.ledger = ledger;
        this.clientOrderIdGenerator = clientOrderIdGenerator;
        this.alertService = alertService;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Brings one leg's managed orders for a symbol in line with the live open orders.
     *
     * @param liveOrders the leg's open orders for this symbol from the current snapshot
     */
    public void syncOrders(SymbolState state, LegLabel leg, List<ExchangeOrder> liveOrders) {
        Instant now = clock.instant();
        Set<String> liveIds = new HashSet<>();

        for (ExchangeOrder order : liveOrders) {
            String orderId = order.getOrderId();
            if (orderId == null || orderId.isEmpty()) {
                continue;
            }
            liveIds.add(orderId);

            if (!clientOrderIdGenerator.isStrategyOrder(order.getClientOrderId())) {
                onForeignOrder(state, leg, order);
                continue;
            }

            ManagedOrder managed = state.getManagedOrders().get(orderId);
            if (managed == null) {
                managed = promotePlaceholder(state, leg, order);
            }
            if (managed == null) {
                managed = adopt(state, leg, order, now);
            }
            refresh(managed, order, now);
            processFillDelta(state, managed, order);
        }

        for (ManagedOrder managed : new ArrayList<>(state.getManagedOrders().values())) {
            if (managed.getLeg() != leg || managed.isClosed()) {
                continue;
            }
            if (managed.hasPlaceholderId()) {
                expireProvisional(state, managed, now);
                continue;
            }
            if (liveIds.contains(managed.getOrderId())) {
                continue;
            }
            resolveVanishedOrder(state, managed);
        }

        evictClosed(state, leg, now);
    }

    /**
     * Pushes any newly traded size of an order into the ledger.
     *
     * <p>While the order is still resting with a partial fill, the delta is held back until
     * the partial-fill timeout has passed since the partial was first seen. Once released (or
     * once the order is terminal) the whole unapplied delta goes in as one fill at the average
     * fill price, falling back to the limit price.
     */
    public void processFillDelta(SymbolState state, ManagedOrder managed, ExchangeOrder order) {
        BigDecimal traded = order.getTradedSize() == null ? BigDecimal.ZERO : order.getTradedSize();
        if (traded.compareTo(managed.getAppliedTradedSize()) <= 0) {
            return;
        }
        ExchangeOrderStatus status = order.getStatus() == null ? ExchangeOrderStatus.OPEN : order.getStatus();
        BigDecimal bookSize = order.getBookSize() == null ? BigDecimal.ZERO : order.getBookSize();
        boolean partialOpen = status == ExchangeOrderStatus.OPEN
                && bookSize.signum() > 0
                && traded.compareTo(managed.getSize()) < 0;

        Instant now = clock.instant();
        if (partialOpen) {
            if (managed.getPartialSince() == null) {
                managed.setPartialSince(now);
                log.info(
                        "[{}] partial fill on {} order {}: traded={} of {}, holding for {}",
                        state.getInstrument(),
                        managed.getLeg(),
                        managed.getOrderId(),
                        traded,
                        managed.getSize(),
                        properties.getPartialFillTimeout());
            }
            if (Duration.between(managed.getPartialSince(), now).compareTo(properties.getPartialFillTimeout()) < 0) {
                return;
            }
        }

        BigDecimal deltaSize = traded.subtract(managed.getAppliedTradedSize());
        BigDecimal fillPrice = order.effectiveFillPrice();
        if (deltaSize.signum() > 0 && fillPrice.signum() > 0) {
            BigDecimal fillNotional = DecimalMath.toNotional(deltaSize, fillPrice);
            ledger.applyFill(state, managed.getLeg(), managed.getSide(), fillPrice, fillNotional);
            metrics.recordFill(managed.getLeg(), fillNotional);
            log.info(
                    "[{}] applied fill {} {} size={} notional={} @ {} (order {})",
                    state.getInstrument(),
                    managed.getLeg(),
                    managed.getSide(),
                    deltaSize,
                    fillNotional,
                    fillPrice,
                    managed.getOrderId());
        }
        managed.setAppliedTradedSize(traded);
        if (status.isTerminal()) {
            managed.closeOnTerminal(status, now);
        }
    }

    /**
     * Strategy orders that still count against the per-leg cap: not closed, no cancel pending, seen
     * live within the staleness window, or (never seen live) created within the unconfirmed window.
     */
    public List<ManagedOrder> activeStrategyOrders(SymbolState state) {
        Instant now = clock.instant();
        List<ManagedOrder> active = new ArrayList<>();
        for (ManagedOrder managed : state.getManagedOrders().values()) {
            if (!managed.isStrategyOwned() || managed.isClosed() || managed.isCancelRequested()) {
                continue;
            }
            if (managed.getLastSeenAt() != null) {
                if (Duration.between(managed.getLastSeenAt(), now).compareTo(properties.getActiveOrderStaleAfter())
                        > 0) {
                    continue;
                }
            } else if (Duration.between(managed.getCreatedAt(), now).compareTo(properties.getUnconfirmedOrderTtl())
                    > 0) {
                continue;
            }
            active.add(managed);
        }
        return active;
    }

    public List<ManagedOrder> activeStrategyOrders(SymbolState state, LegLabel leg) {
        return activeStrategyOrders(state).stream()
                .filter(m -> m.getLeg() == leg)
                .collect(Collectors.toList());
    }

    public int activeOrderCount(SymbolState state, LegLabel leg) {
        return activeStrategyOrders(state, leg).size();
    }

    /** Cancels the oldest active strategy orders of a leg until at most {@code cap} remain. */
    public void enforceAccountOrderCap(SymbolState state, LegLabel leg, int cap) {
        List<ManagedOrder> active = activeStrategyOrders(state, leg);
        if (active.size() <= cap) {
            return;
        }
        int overflow = active.size() - cap;
        List<ManagedOrder> toCancel = active.stream()
                .sorted(Comparator.comparing(ManagedOrder::getCreatedAt))
                .limit(overflow)
                .collect(Collectors.toList());
        for (ManagedOrder managed : toCancel) {
            if (cancel(managed, CloseReason.ORDER_CAP)) {
                log.info(
                        "[{}] cancelled extra strategy order over cap {}: leg={} order_id={}",
                        state.getInstrument(),
                        cap,
                        leg,
                        managed.getOrderId());
            } else {
                log.warn(
                        "[{}] failed to cancel extra strategy order over cap {}: leg={} order_id={}",
                        state.getInstrument(),
                        cap,
                        leg,
                        managed.getOrderId());
            }
        }
    }

    /** Notional of open strategy orders of a leg on one side. */
    public BigDecimal activeHedgeNotional(SymbolState state, LegLabel leg, OrderSide side) {
        return state.getManagedOrders().values().stream()
                .filter(m -> m.getLeg() == leg
                        && m.isStrategyOwned()
                        && !m.isClosed()
                        && !m.isCancelRequested()
                        && m.getSide() == side)
                .map(ManagedOrder::getNotional)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Cancels a managed order on the exchange. An acknowledged cancel only marks the order; it is
     * closed by a later sync once a status lookup has booked whatever traded before the cancel.
     * Placeholder orders cannot be looked up and are closed straight away.
     */
    public boolean cancel(ManagedOrder managed, CloseReason reason) {
        AccountRuntime account = accounts.get(managed.getLeg());
        boolean cancelled = exchangeGateway.cancel(account, managed.getOrderId());
        if (cancelled) {
            if (managed.hasPlaceholderId()) {
                managed.close(reason, clock.instant());
            } else {
                managed.requestCancel(reason);
            }
            metrics.recordOrderCancelled();
        }
        return cancelled;
    }

    private void onForeignOrder(SymbolState state, LegLabel leg, ExchangeOrder order) {
        if (state.getForeignOrderAlerted().add(leg)) {
            alertService.notify(
                    "Non-strategy order detected " + state.getInstrument(),
                    "account=" + leg + " order_id=" + order.getOrderId() + " preserved and ignored by strategy",
                    "non_strategy:" + state.getInstrument() + ":" + leg,
                    FOREIGN_ORDER_ALERT_COOLDOWN);
        }
    }

    /** Swaps a placeholder-keyed local order for the real id once it shows up live. */
    private ManagedOrder promotePlaceholder(SymbolState state, LegLabel leg, ExchangeOrder order) {
        String clientOrderId = order.getClientOrderId();
        if (clientOrderId == null || clientOrderId.isEmpty()) {
            return null;
        }
        for (ManagedOrder candidate : new ArrayList<>(state.getManagedOrders().values())) {
            if (candidate.getLeg() == leg
                    && clientOrderId.equals(candidate.getClientOrderId())
                    && candidate.hasPlaceholderId()) {
                String placeholder = candidate.getOrderId();
                state.rekey(placeholder, order.getOrderId());
                log.info(
                        "[{}] confirmed {} order {} -> {}",
                        state.getInstrument(),
                        leg,
                        placeholder,
                        order.getOrderId());
                return candidate;
            }
        }
        return null;
    }

    private ManagedOrder adopt(SymbolState state, LegLabel leg, ExchangeOrder order, Instant now) {
        ManagedOrder managed = ManagedOrder.builder()
                .orderId(order.getOrderId())
                .clientOrderId(order.getClientOrderId())
                .leg(leg)
                .instrument(state.getInstrument())
                .side(order.getSide())
                .price(order.getLimitPrice())
                .size(order.getSize())
                .notional(DecimalMath.toNotional(order.getSize(), order.getLimitPrice()))
                .createdAt(now)
                .strategyOwned(true)
                .build();
        state.register(managed);
        log.info(
                "[{}] adopted live strategy order {} leg={} {} {} @ {}",
                state.getInstrument(),
                order.getOrderId(),
                leg,
                order.getSide(),
                order.getSize(),
                order.getLimitPrice());
        return managed;
    }

    private void refresh(ManagedOrder managed, ExchangeOrder order, Instant now) {
        managed.setLastSeenAt(now);
        managed.setClosed(false);
        managed.setCloseReason(null);
        managed.setClosedAt(null);
        managed.setPendingCloseReason(null);
        managed.setSide(order.getSide());
        managed.setPrice(order.getLimitPrice());
        managed.setSize(order.getSize());
        managed.setNotional(DecimalMath.toNotional(order.getSize(), order.getLimitPrice()));
    }

    private void expireProvisional(SymbolState state, ManagedOrder managed, Instant now) {
        if (Duration.between(managed.getCreatedAt(), now).compareTo(properties.getProvisionalTimeout()) > 0) {
            managed.close(CloseReason.PROVISIONAL_TIMEOUT, now);
            log.warn(
                    "[{}] {} order {} (client id {}) never confirmed, closed as provisional timeout",
                    state.getInstrument(),
                    managed.getLeg(),
                    managed.getOrderId(),
                    managed.getClientOrderId());
        }
    }

    private void resolveVanishedOrder(SymbolState state, ManagedOrder managed) {
        ExchangeResult<ExchangeOrder> result = exchangeGateway.order(accounts.get(managed.getLeg()), managed.getOrderId());
        if (!result.isOk()) {
            log.debug(
                    "[{}] status lookup for {} failed, retrying next cycle: {}",
                    state.getInstrument(),
                    managed.getOrderId(),
                    result.getError());
            return;
        }
        ExchangeOrder order = result.getValue();
        processFillDelta(state, managed, order);
        ExchangeOrderStatus status = order.getStatus() == null ? ExchangeOrderStatus.OPEN : order.getStatus();
        if (status.isTerminal() && !managed.isClosed()) {
            managed.closeOnTerminal(status, clock.instant());
        }
        if (managed.isClosed()) {
            log.info(
                    "[{}] {} order {} closed: {}",
                    state.getInstrument(),
                    managed.getLeg(),
                    managed.getOrderId(),
                    managed.getCloseReason());
        }
    }

    /** Drops this leg's closed orders once they have been closed longer than the retention window. */
    private void evictClosed(SymbolState state, LegLabel leg, Instant now) {
        Instant cutoff = now.minus(properties.getClosedOrderRetention());
        int before = state.getManagedOrders().size();
        state.getManagedOrders()
                .values()
                .removeIf(m -> m.getLeg() == leg
                        && m.isClosed()
                        && m.getClosedAt() != null
                        && m.getClosedAt().isBefore(cutoff));
        int evicted = before - state.getManagedOrders().size();
        if (evicted > 0) {
            log.debug("[{}] dropped {} closed {} orders", state.getInstrument(), evicted, leg);
        }
    }
}
