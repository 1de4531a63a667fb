package com.makerhedge.simulator;

import com.makerhedge.domain.enums.ExchangeOrderStatus;
import com.makerhedge.domain.enums.OrderSide;
import com.makerhedge.domain.model.InstrumentSpec;
import com.makerhedge.domain.vo.AccountSummary;
import com.makerhedge.exchange.ExchangeError;
import com.makerhedge.exchange.ExchangeOrder;
import com.makerhedge.exchange.ExchangePosition;
import com.makerhedge.exchange.ExchangeResult;
import com.makerhedge.exchange.OrderBookLevels;
import com.makerhedge.exchange.PriceLevel;
import com.makerhedge.exchange.SignedOrder;
import com.makerhedge.exchange.UnsignedOrder;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory perpetuals exchange for paper trading and integration tests.
 *
 * <p>One instance is shared by both hedge accounts, so they quote against the same market.
 * Each instrument has an explicit best bid and ask; there is no depth and no other
 * participants. Matching rules:
 * <ul>
 *   <li>a post-only order that would cross the current quotes is rejected with a
 *       "would match" error, the way the real venue rejects it</li>
 *   <li>resting orders fill at their limit price when {@link #setQuotes} moves the market
 *       through them (BUY when ask &lt;= limit, SELL when bid &gt;= limit)</li>
 *   <li>{@link #fill} applies an explicit partial or full fill, for scripted scenarios</li>
 * </ul>
 *
 * <p>Positions use average entry price; equity is starting equity plus unrealized PnL at mid,
 * and maintenance margin is a flat rate of position notional.
 *
 * <p>All public methods are synchronized: the hedge loop and test drivers may call in
 * from different threads.
 */
public class SimulatedExchange {

    private static final Logger log = LoggerFactory.getLogger(SimulatedExchange.class);

    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal MAINTENANCE_MARGIN_RATE = new BigDecimal("0.01");
    private static final String PLACEHOLDER_ORDER_ID = "0x00";

    private final Clock clock;
    private final BigDecimal startingEquity;

    private final Map<String, Market> markets = new LinkedHashMap<>();
    private final Map<String, Map<String, SimPosition>> positionsByAccount = new LinkedHashMap<>();
    private final Map<String, SimOrder> orders = new LinkedHashMap<>();

    private long orderSequence = 0x1000000L;
    private boolean acknowledgeWithPlaceholder;

    public SimulatedExchange(Clock clock, BigDecimal startingEquity) {
        this.clock = clock;
        this.startingEquity = startingEquity;
    }

    // ========================
    // MARKET SETUP
    // ========================

    public synchronized void listInstrument(InstrumentSpec spec, BigDecimal bid, BigDecimal ask) {
        markets.put(spec.getInstrument(), new Market(spec, bid, ask));
        log.info("Simulator listed {} bid={} ask={}", spec.getInstrument(), bid, ask);
    }

    /** Moves the quotes and fills every resting order the new market trades through. */
    public synchronized void setQuotes(String instrument, BigDecimal bid, BigDecimal ask) {
        Market market = market(instrument);
        market.bid = bid;
        market.ask = ask;
        for (SimOrder order : new ArrayList<>(orders.values())) {
            if (!order.instrument.equals(instrument) || order.status.isTerminal()) {
                continue;
            }
            boolean crossed = order.side == OrderSide.BUY
                    ? ask.compareTo(order.limitPrice) <= 0
                    : bid.compareTo(order.limitPrice) >= 0;
            if (crossed) {
                applyFill(order, order.remaining());
            }
        }
    }

    /** Fills up to {@code size} of a resting order at its limit price. */
    public synchronized void fill(String orderId, BigDecimal size) {
        SimOrder order = orders.get(orderId);
        if (order == null || order.status.isTerminal()) {
            throw new IllegalArgumentException("No resting order " + orderId);
        }
        applyFill(order, size.min(order.remaining()));
    }

    /** When set, submissions are acknowledged with a placeholder id instead of the real one. */
    public synchronized void setAcknowledgeWithPlaceholder(boolean acknowledgeWithPlaceholder) {
        this.acknowledgeWithPlaceholder = acknowledgeWithPlaceholder;
    }

    /** Opens a position directly, as if it had been traded before the engine started. */
    public synchronized void seedPosition(String accountId, String instrument, BigDecimal size, BigDecimal entryPrice) {
        SimPosition position = position(accountId, instrument);
        position.size = size;
        position.entryPrice = entryPrice;
    }

    // ========================
    // ACCOUNT QUERIES
    // ========================

    synchronized ExchangeResult<List<ExchangePosition>> positions(String accountId) {
        List<ExchangePosition> result = new ArrayList<>();
        for (Map.Entry<String, SimPosition> entry : positionsByAccount.getOrDefault(accountId, Map.of()).entrySet()) {
            SimPosition position = entry.getValue();
            if (position.size.signum() == 0) {
                continue;
            }
            result.add(ExchangePosition.builder()
                    .instrument(entry.getKey())
                    .size(position.size)
                    .markPrice(market(entry.getKey()).mid())
                    .entryPrice(position.entryPrice)
                    .build());
        }
        return ExchangeResult.ok(result);
    }

    synchronized ExchangeResult<List<ExchangeOrder>> openOrders(String accountId) {
        return ExchangeResult.ok(orders.values().stream()
                .filter(o -> o.accountId.equals(accountId) && !o.status.isTerminal())
                .map(SimOrder::toExchangeOrder)
                .collect(Collectors.toList()));
    }

    synchronized ExchangeResult<ExchangeOrder> order(String accountId, String orderId) {
        SimOrder order = orders.get(orderId);
        if (order == null || !order.accountId.equals(accountId)) {
            return ExchangeResult.failure(ExchangeError.of("3000", 404, "Order not found"));
        }
        return ExchangeResult.ok(order.toExchangeOrder());
    }

    synchronized ExchangeResult<AccountSummary> accountSummary(String accountId) {
        BigDecimal unrealized = BigDecimal.ZERO;
        BigDecimal maintenance = BigDecimal.ZERO;
        for (Map.Entry<String, SimPosition> entry : positionsByAccount.getOrDefault(accountId, Map.of()).entrySet()) {
            SimPosition position = entry.getValue();
            BigDecimal mid = market(entry.getKey()).mid();
            unrealized = unrealized.add(mid.subtract(position.entryPrice).multiply(position.size));
            maintenance = maintenance.add(position.size.abs().multiply(mid).multiply(MAINTENANCE_MARGIN_RATE));
        }
        BigDecimal equity = startingEquity.add(unrealized);
        return ExchangeResult.ok(new AccountSummary(equity, maintenance, equity.subtract(maintenance)));
    }

    // ========================
    // MARKET DATA
    // ========================

    synchronized ExchangeResult<InstrumentSpec> instrument(String instrument) {
        Market market = markets.get(instrument);
        if (market == null) {
            return ExchangeResult.failure(ExchangeError.of("1004", 404, "Instrument not found: " + instrument));
        }
        return ExchangeResult.ok(market.spec);
    }

    synchronized ExchangeResult<List<String>> activeInstruments() {
        return ExchangeResult.ok(new ArrayList<>(markets.keySet()));
    }

    synchronized ExchangeResult<OrderBookLevels> orderBook(String instrument, int depth) {
        Market market = markets.get(instrument);
        if (market == null) {
            return ExchangeResult.failure(ExchangeError.of("1004", 404, "Instrument not found: " + instrument));
        }
        BigDecimal size = market.spec.getMinSize().multiply(BigDecimal.valueOf(Math.max(1, depth)));
        return ExchangeResult.ok(new OrderBookLevels(
                instrument,
                List.of(new PriceLevel(market.bid, size)),
                List.of(new PriceLevel(market.ask, size))));
    }

    // ========================
    // ORDER ENTRY
    // ========================

    synchronized ExchangeResult<ExchangeOrder> submit(String accountId, SignedOrder signed) {
        if (signed.getSignature() == null || signed.getSignature().isEmpty()) {
            return ExchangeResult.failure(ExchangeError.of("2000", 400, "Missing order signature"));
        }
        UnsignedOrder request = signed.getOrder();
        Market market = markets.get(request.getInstrument());
        if (market == null) {
            return ExchangeResult.failure(ExchangeError.of("1004", 400, "Instrument not found"));
        }
        if (request.getSize().compareTo(market.spec.getMinSize()) < 0) {
            return ExchangeResult.failure(ExchangeError.of("2062", 400, "Order size below minimum"));
        }
        boolean crosses = request.getSide() == OrderSide.BUY
                ? request.getLimitPrice().compareTo(market.ask) >= 0
                : request.getLimitPrice().compareTo(market.bid) <= 0;
        if (request.isPostOnly() && crosses) {
            return ExchangeResult.failure(
                    ExchangeError.of("2066", 400, "Post only order would match immediately as taker"));
        }

        String orderId = "0x" + Long.toHexString(++orderSequence);
        SimOrder order = new SimOrder(
                orderId,
                accountId,
                request.getClientOrderId(),
                request.getInstrument(),
                request.getSide(),
                request.getLimitPrice(),
                request.getSize(),
                clock.instant());
        orders.put(orderId, order);
        log.debug("Simulator accepted {} {} {} @ {} for {}", orderId, order.side, order.size, order.limitPrice, accountId);

        ExchangeOrder ack = order.toExchangeOrder();
        if (acknowledgeWithPlaceholder) {
            ack = ack.toBuilder().orderId(PLACEHOLDER_ORDER_ID).status(ExchangeOrderStatus.PENDING).build();
        }
        return ExchangeResult.ok(ack);
    }

    synchronized ExchangeResult<Void> cancel(String accountId, String orderId) {
        SimOrder order = orders.get(orderId);
        if (order == null || !order.accountId.equals(accountId)) {
            return ExchangeResult.failure(ExchangeError.of("3000", 404, "Order not found"));
        }
        if (order.status.isTerminal()) {
            return ExchangeResult.failure(ExchangeError.of("3001", 400, "Order already closed"));
        }
        order.status = ExchangeOrderStatus.CANCELLED;
        return ExchangeResult.ok(null);
    }

    /** Resting orders of an account, oldest first. Test and diagnostics helper. */
    public synchronized List<ExchangeOrder> restingOrders(String accountId) {
        return orders.values().stream()
                .filter(o -> o.accountId.equals(accountId) && !o.status.isTerminal())
                .sorted(Comparator.comparing((SimOrder o) -> o.createdAt))
                .map(SimOrder::toExchangeOrder)
                .collect(Collectors.toList());
    }

    public synchronized BigDecimal positionSize(String accountId, String instrument) {
        return position(accountId, instrument).size;
    }

    private void applyFill(SimOrder order, BigDecimal size) {
        if (size.signum() <= 0) {
            return;
        }
        order.filled = order.filled.add(size);
        order.avgFillPrice = order.limitPrice;
        order.status = order.remaining().signum() == 0 ? ExchangeOrderStatus.FILLED : ExchangeOrderStatus.OPEN;

        SimPosition position = position(order.accountId, order.instrument);
        BigDecimal signed = order.side == OrderSide.BUY ? size : size.negate();
        BigDecimal newSize = position.size.add(signed);
        if (position.size.signum() == 0 || position.size.signum() == signed.signum()) {
            BigDecimal cost = position.size.abs().multiply(position.entryPrice).add(size.multiply(order.limitPrice));
            position.entryPrice = cost.divide(newSize.abs(), 8, RoundingMode.HALF_UP);
        } else if (newSize.signum() != 0 && newSize.signum() != position.size.signum()) {
            position.entryPrice = order.limitPrice;
        } else if (newSize.signum() == 0) {
            position.entryPrice = BigDecimal.ZERO;
        }
        position.size = newSize;
        log.debug("Simulator fill {} {} {} @ {} -> position {}", order.orderId, order.side, size, order.limitPrice, newSize);
    }

    private Market market(String instrument) {
        Market market = markets.get(instrument);
        if (market == null) {
            throw new IllegalArgumentException("Unknown instrument " + instrument);
        }
        return market;
    }

    private SimPosition position(String accountId, String instrument) {
        return positionsByAccount
                .computeIfAbsent(accountId, k -> new LinkedHashMap<>())
                .computeIfAbsent(instrument, k -> new SimPosition());
    }

    private static final class Market {
        private final InstrumentSpec spec;
        private BigDecimal bid;
        private BigDecimal ask;

        private Market(InstrumentSpec spec, BigDecimal bid, BigDecimal ask) {
            this.spec = spec;
            this.bid = bid;
            this.ask = ask;
        }

        private BigDecimal mid() {
            return bid.add(ask).divide(TWO, 8, RoundingMode.HALF_UP);
        }
    }

    private static final class SimPosition {
        private BigDecimal size = BigDecimal.ZERO;
        private BigDecimal entryPrice = BigDecimal.ZERO;
    }

    private static final class SimOrder {
        private final String orderId;
        private final String accountId;
        private final String clientOrderId;
        private final String instrument;
        private final OrderSide side;
        private final BigDecimal limitPrice;
        private final BigDecimal size;
        private final Instant createdAt;
        private BigDecimal filled = BigDecimal.ZERO;
        private BigDecimal avgFillPrice;
        private ExchangeOrderStatus status = ExchangeOrderStatus.OPEN;

        private SimOrder(
                String orderId,
                String accountId,
                String clientOrderId,
                String instrument,
                OrderSide side,
                BigDecimal limitPrice,
                BigDecimal size,
                Instant createdAt) {
            this.orderId = orderId;
            this.accountId = accountId;
            this.clientOrderId = clientOrderId;
            this.instrument = instrument;
            this.side = side;
            this.limitPrice = limitPrice;
            this.size = size;
            this.createdAt = createdAt;
        }

        private BigDecimal remaining() {
            return size.subtract(filled);
        }

        private ExchangeOrder toExchangeOrder() {
            return ExchangeOrder.builder()
                    .orderId(orderId)
                    .clientOrderId(clientOrderId)
                    .instrument(instrument)
                    .side(side)
                    .limitPrice(limitPrice)
                    .size(size)
                    .status(status)
                    .tradedSize(filled)
                    .bookSize(status.isTerminal() ? BigDecimal.ZERO : remaining())
                    .avgFillPrice(avgFillPrice)
                    .createdAt(createdAt)
                    .build();
        }
    }
}
