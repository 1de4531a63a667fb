package com.makerhedge.exchange;

import com.makerhedge.config.HedgeProperties;
import com.makerhedge.domain.model.InstrumentSpec;
import com.makerhedge.domain.model.ManagedOrder;
import com.makerhedge.domain.vo.AccountSummary;
import com.makerhedge.domain.vo.BookTop;
import com.makerhedge.domain.vo.PositionSnapshot;
import com.makerhedge.notification.AlertService;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Normalizing facade over the per-account exchange clients.
 *
 * <p>Turns raw exchange payloads into the engine's snapshot types and turns failures into
 * throttled operator alerts plus an empty result. Callers never see exceptions from here:
 * <ul>
 *   <li>positions / open orders / summary failures alert per account (120s cooldown)</li>
 *   <li>order book failures alert per account and instrument (60s)</li>
 *   <li>instrument metadata failures alert per account and instrument (600s)</li>
 * </ul>
 */
@Component
public class ExchangeGateway {

    private static final Logger log = LoggerFactory.getLogger(ExchangeGateway.class);

    private static final Duration SNAPSHOT_ALERT_COOLDOWN = Duration.ofSeconds(120);
    private static final Duration BOOK_ALERT_COOLDOWN = Duration.ofSeconds(60);
    private static final Duration INSTRUMENT_ALERT_COOLDOWN = Duration.ofSeconds(600);

    private final AlertService alertService;
    private final HedgeProperties properties;

    public ExchangeGateway(AlertService alertService, HedgeProperties properties) {
        this.alertService = alertService;
        this.properties = properties;
    }

    /** Positions by instrument, or empty if the query failed. */
    public Optional<Map<String, PositionSnapshot>> positions(AccountRuntime account) {
        ExchangeResult<List<ExchangePosition>> result = account.call("positions", ExchangeClient::positions);
        if (!result.isOk()) {
            alertService.notify(
                    "Hedge positions failed " + account.getName(),
                    result.getError().toString(),
                    "positions:" + account.getName(),
                    SNAPSHOT_ALERT_COOLDOWN);
            return Optional.empty();
        }
        Map<String, PositionSnapshot> positions = new LinkedHashMap<>();
        for (ExchangePosition position : result.getValue()) {
            positions.put(
                    position.getInstrument(),
                    PositionSnapshot.of(
                            orZero(position.getSize()), orZero(position.getMarkPrice()), orZero(position.getEntryPrice())));
        }
        return Optional.of(positions);
    }

    /** Open orders grouped by instrument, or empty if the query failed. */
    public Optional<Map<String, List<ExchangeOrder>>> openOrders(AccountRuntime account) {
        ExchangeResult<List<ExchangeOrder>> result = account.call("open_orders", ExchangeClient::openOrders);
        if (!result.isOk()) {
            alertService.notify(
                    "Hedge open orders failed " + account.getName(),
                    result.getError().toString(),
                    "open_orders:" + account.getName(),
                    SNAPSHOT_ALERT_COOLDOWN);
            return Optional.empty();
        }
        Map<String, List<ExchangeOrder>> grouped = new LinkedHashMap<>();
        for (ExchangeOrder order : result.getValue()) {
            if (order.getInstrument() == null || order.getInstrument().isEmpty()) {
                continue;
            }
            grouped.computeIfAbsent(order.getInstrument(), k -> new ArrayList<>()).add(order);
        }
        return Optional.of(grouped);
    }

    public Optional<AccountSummary> accountSummary(AccountRuntime account) {
        ExchangeResult<AccountSummary> result = account.call("account_summary", ExchangeClient::accountSummary);
        if (!result.isOk()) {
            alertService.notify(
                    "Hedge account summary failed " + account.getName(),
                    result.getError().toString(),
                    "summary:" + account.getName(),
                    SNAPSHOT_ALERT_COOLDOWN);
            return Optional.empty();
        }
        return result.value();
    }

    /** Best bid and ask, or empty when the book could not be fetched or is one-sided. */
    public Optional<BookTop> bookTop(AccountRuntime account, String instrument) {
        ExchangeResult<OrderBookLevels> result =
                account.call("orderbook", c -> c.orderBook(instrument, properties.getOrderbookDepth()));
        if (!result.isOk()) {
            alertService.notify(
                    "Hedge orderbook failed " + instrument,
                    "account=" + account.getName() + " " + result.getError(),
                    "book:" + account.getName() + ":" + instrument,
                    BOOK_ALERT_COOLDOWN);
            return Optional.empty();
        }
        return result.getValue().top();
    }

    public Optional<InstrumentSpec> instrument(AccountRuntime account, String instrument) {
        ExchangeResult<InstrumentSpec> result = account.instrument(instrument);
        if (!result.isOk()) {
            alertService.notify(
                    "Hedge instrument lookup failed " + instrument,
                    "account=" + account.getName() + " " + result.getError(),
                    "instrument:" + account.getName() + ":" + instrument,
                    INSTRUMENT_ALERT_COOLDOWN);
            return Optional.empty();
        }
        return result.value();
    }

    public ExchangeResult<List<String>> activeInstruments(AccountRuntime account) {
        return account.call("all_instruments", ExchangeClient::activeInstruments);
    }

    public ExchangeResult<ExchangeOrder> order(AccountRuntime account, String orderId) {
        return account.call("get_order", c -> c.order(orderId));
    }

    /** Submits without the transient retry; see {@link AccountRuntime#submitOrder}. */
    public ExchangeResult<ExchangeOrder> submit(AccountRuntime account, SignedOrder order) {
        return account.submitOrder(order);
    }

    /**
     * Cancels an order. Placeholder ids have nothing to cancel and count as done; orders the
     * exchange reports as missing or already closed count as cancelled.
     */
    public boolean cancel(AccountRuntime account, String orderId) {
        if (orderId == null || orderId.isBlank()) {
            return false;
        }
        if (ManagedOrder.isPlaceholderId(orderId)) {
            return true;
        }
        ExchangeResult<Void> result = account.call("cancel_order", c -> c.cancelOrder(orderId));
        if (result.isOk()) {
            return true;
        }
        if (result.getError().isAlreadyClosed()) {
            log.debug("Cancel {} on {}: already closed ({})", orderId, account.getName(), result.getError());
            return true;
        }
        log.warn("Cancel order failed account={} order_id={} {}", account.getName(), orderId, result.getError());
        return false;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
