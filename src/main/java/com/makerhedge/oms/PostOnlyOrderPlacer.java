package com.makerhedge.oms;

import com.makerhedge.config.HedgeProperties;
import com.makerhedge.domain.enums.OrderSide;
import com.makerhedge.domain.model.InstrumentSpec;
import com.makerhedge.domain.model.ManagedOrder;
import com.makerhedge.domain.model.SymbolState;
import com.makerhedge.domain.vo.BookTop;
import com.makerhedge.domain.vo.DecimalMath;
import com.makerhedge.exception.SigningException;
import com.makerhedge.exchange.AccountRuntime;
import com.makerhedge.exchange.ExchangeError;
import com.makerhedge.exchange.ExchangeGateway;
import com.makerhedge.exchange.ExchangeOrder;
import com.makerhedge.exchange.ExchangeResult;
import com.makerhedge.exchange.SignedOrder;
import com.makerhedge.exchange.UnsignedOrder;
import com.makerhedge.notification.AlertService;
import com.makerhedge.observability.HedgeMetrics;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Places passive (post-only) limit orders, chasing the top of book on rejection.
 *
 * <p>Each attempt prices off a fresh book: SELL at the best ask (raised to the guard price if
 * the guard is higher), BUY at the best bid (lowered to the guard if lower). The price is then
 * rounded to the tick in the passive direction. The guard keeps a hedge from being placed at a
 * price worse than the inventory it is meant to offset.
 *
 * <p>Outcomes:
 * <ul>
 *   <li>accepted: the order is registered on the symbol immediately, before the exchange
 *       lists it as open</li>
 *   <li>post-only rejection: short delay, next attempt</li>
 *   <li>any other submission error: alert and give up</li>
 *   <li>attempts exhausted: the symbol enters cooldown and an alert fires</li>
 * </ul>
 */
@Service
public class PostOnlyOrderPlacer {

    private static final Logger log = LoggerFactory.getLogger(PostOnlyOrderPlacer.class);

    private static final Duration ORDER_FAILED_ALERT_COOLDOWN = Duration.ofSeconds(120);
    private static final Duration COOLDOWN_ALERT_COOLDOWN = Duration.ofSeconds(120);

    private final ExchangeGateway exchangeGateway;
    private final ClientOrderIdGenerator clientOrderIdGenerator;
    private final AlertService alertService;
    private final HedgeMetrics metrics;
    private final HedgeProperties properties;
    private final Clock clock;

    public PostOnlyOrderPlacer(
            ExchangeGateway exchangeGateway,
            ClientOrderIdGenerator clientOrderIdGenerator,
            AlertService alertService,
            HedgeMetrics metrics,
            HedgeProperties properties,
            Clock clock) {
        this.exchangeGateway = exchangeGateway;
        this.clientOrderIdGenerator = clientOrderIdGenerator;
        this.alertService = alertService;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Tries to rest one post-only order for {@code notional} on the given account.
     *
     * @param guardPrice price the order must not be worse than, or null to quote at top of book
     * @return true if an order was accepted and registered
     */
    public boolean placeWithRetry(
            SymbolState state, AccountRuntime account, OrderSide side, BigDecimal guardPrice, BigDecimal notional) {
        String symbol = state.getInstrument();
        Optional<InstrumentSpec> instrument = exchangeGateway.instrument(account, symbol);
        if (instrument.isEmpty()) {
            return false;
        }
        int maxAttempts = properties.getPostOnlyMaxRetry();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<BookTop> book = exchangeGateway.bookTop(account, symbol);
            if (book.isEmpty()) {
                if (!pause()) {
                    return false;
                }
                continue;
            }
            BigDecimal price = passivePrice(book.get(), side, guardPrice, instrument.get().getTickSize());
            if (price.signum() <= 0) {
                continue;
            }
            BigDecimal size = DecimalMath.sizeFromNotional(notional, price, instrument.get());
            if (size.signum() <= 0) {
                continue;
            }
            BigDecimal orderNotional = DecimalMath.toNotional(size, price);
            if (orderNotional.signum() <= 0) {
                continue;
            }

            String clientOrderId = clientOrderIdGenerator.next(account.getLeg(), side);
            Instant now = clock.instant();
            UnsignedOrder order = UnsignedOrder.builder()
                    .subAccountId(account.getCredentials().getAccountId())
                    .instrument(symbol)
                    .side(side)
                    .limitPrice(price)
                    .size(size)
                    .postOnly(true)
                    .reduceOnly(false)
                    .expiration(now.plus(properties.getOrderExpiry()))
                    .nonce(ThreadLocalRandom.current().nextLong(1, Integer.MAX_VALUE))
                    .clientOrderId(clientOrderId)
                    .createdAt(now)
                    .build();

            SignedOrder signed;
            try {
                signed = account.sign(order, instrument.get());
            } catch (SigningException e) {
                log.error("[{}] signing failed for {} {}", symbol, account.getLeg(), side, e);
                return fail(state, account, side, "sign_order_failed: " + e.getMessage());
            }

            ExchangeResult<ExchangeOrder> result = exchangeGateway.submit(account, signed);
            if (!result.isOk()) {
                ExchangeError error = result.getError();
                if (error.isPostOnlyViolation()) {
                    metrics.recordPostOnlyReject();
                    log.debug("[{}] post-only reject on attempt {}/{}: {}", symbol, attempt, maxAttempts, error);
                    if (!pause()) {
                        return false;
                    }
                    continue;
                }
                return fail(state, account, side, "create_order_failed " + error);
            }

            String orderId = result.getValue().getOrderId();
            if (orderId == null || orderId.isEmpty()) {
                log.warn("[{}] order accepted without an order id, retrying", symbol);
                continue;
            }
            if (ManagedOrder.isPlaceholderId(orderId)) {
                orderId = ManagedOrder.provisionalId(clientOrderId);
            }
            ManagedOrder managed = ManagedOrder.builder()
                    .orderId(orderId)
                    .clientOrderId(clientOrderId)
                    .leg(account.getLeg())
                    .instrument(symbol)
                    .side(side)
                    .price(price)
                    .size(size)
                    .notional(orderNotional)
                    .createdAt(now)
                    .strategyOwned(true)
                    .build();
            state.register(managed);
            metrics.recordOrderPlaced(account.getLeg());
            log.info(
                    "[{}] Placed {} {} {} USDT @ {} (order {})",
                    symbol,
                    account.getLeg(),
                    side,
                    orderNotional,
                    price,
                    orderId);
            return true;
        }

        state.setCooldownUntil(clock.instant().plus(properties.getPostOnlyCooldown()));
        metrics.recordCooldown();
        alertService.notify(
                "Hedge cooldown " + symbol,
                "post-only failed after " + maxAttempts + " retries, cooldown "
                        + properties.getPostOnlyCooldown().getSeconds() + "s",
                "cooldown:" + symbol,
                COOLDOWN_ALERT_COOLDOWN);
        return false;
    }

    /** Non-marketable price for the side, pushed to the guard and rounded to the tick. */
    static BigDecimal passivePrice(BookTop book, OrderSide side, BigDecimal guardPrice, BigDecimal tick) {
        BigDecimal raw;
        if (side == OrderSide.SELL) {
            raw = guardPrice == null ? book.getBestAsk() : book.getBestAsk().max(guardPrice);
        } else {
            raw = guardPrice == null ? book.getBestBid() : book.getBestBid().min(guardPrice);
        }
        return DecimalMath.quantizePrice(raw, tick, side);
    }

    private boolean fail(SymbolState state, AccountRuntime account, OrderSide side, String error) {
        metrics.recordOrderFailed();
        alertService.notify(
                "Hedge order failed " + state.getInstrument(),
                "account=" + account.getLeg() + " side=" + side + " error=" + error,
                "order_failed:" + state.getInstrument() + ":" + account.getLeg() + ":" + side,
                ORDER_FAILED_ALERT_COOLDOWN);
        return false;
    }

    /** Sleeps for the retry delay. Returns false if the thread was interrupted (stop requested). */
    private boolean pause() {
        Duration delay = properties.getPostOnlyRetryDelay();
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Order placement interrupted, abandoning remaining attempts");
            return false;
        }
    }
}
