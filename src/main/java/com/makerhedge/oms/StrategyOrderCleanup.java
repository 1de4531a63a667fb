package com.makerhedge.oms;

import com.makerhedge.config.HedgeProperties;
import com.makerhedge.exchange.AccountRuntime;
import com.makerhedge.exchange.ExchangeGateway;
import com.makerhedge.exchange.ExchangeOrder;
import com.makerhedge.exchange.HedgeAccounts;
import com.makerhedge.observability.HedgeMetrics;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Best-effort cancellation of strategy orders when the engine stops.
 *
 * <p>Works from a fresh open-order snapshot rather than local state, so orders placed by an
 * earlier run are cleaned up too. Per account and symbol the {@code stop-keep-strategy-orders}
 * most recent strategy orders are left resting; foreign orders are never touched.
 */
@Service
public class StrategyOrderCleanup {

    private static final Logger log = LoggerFactory.getLogger(StrategyOrderCleanup.class);

    private final ExchangeGateway exchangeGateway;
    private final HedgeAccounts accounts;
    private final ClientOrderIdGenerator clientOrderIdGenerator;
    private final HedgeMetrics metrics;
    private final HedgeProperties properties;

    public StrategyOrderCleanup(
            ExchangeGateway exchangeGateway,
            HedgeAccounts accounts,
            ClientOrderIdGenerator clientOrderIdGenerator,
            HedgeMetrics metrics,
            HedgeProperties properties) {
        this.exchangeGateway = exchangeGateway;
        this.accounts = accounts;
        this.clientOrderIdGenerator = clientOrderIdGenerator;
        this.metrics = metrics;
        this.properties = properties;
    }

    /**
     * Cancels strategy orders on both accounts, keeping the newest N per symbol.
     *
     * @return number of orders cancelled
     */
    public int cancelStrategyOrders() {
        if (!properties.isCancelOnStop()) {
            log.info("Skip stop cleanup because hedge.cancel-on-stop=false");
            return 0;
        }
        int keep = Math.max(0, properties.getStopKeepStrategyOrders());
        int candidates = 0;
        int cancelled = 0;

        for (AccountRuntime account : accounts.all()) {
            Optional<Map<String, List<ExchangeOrder>>> grouped = exchangeGateway.openOrders(account);
            if (grouped.isEmpty()) {
                log.warn("Stop cleanup skipped for {}: open orders unavailable", account.getName());
                continue;
            }
            for (Map.Entry<String, List<ExchangeOrder>> entry : grouped.get().entrySet()) {
                List<ExchangeOrder> toCancel = entry.getValue().stream()
                        .filter(o -> clientOrderIdGenerator.isStrategyOrder(o.getClientOrderId()))
                        .sorted(Comparator.comparing(
                                        (ExchangeOrder o) -> o.createdAt().orElse(Instant.EPOCH))
                                .reversed())
                        .skip(keep)
                        .collect(Collectors.toList());
                candidates += toCancel.size();
                for (ExchangeOrder order : toCancel) {
                    if (exchangeGateway.cancel(account, order.getOrderId())) {
                        cancelled++;
                        metrics.recordOrderCancelled();
                        log.info(
                                "Cancelled strategy order on stop account={} symbol={} order_id={}",
                                account.getLeg(),
                                entry.getKey(),
                                order.getOrderId());
                    }
                }
            }
        }

        log.info("Stop cleanup finished: cancelled={} candidate={} keep_per_symbol={}", cancelled, candidates, keep);
        return cancelled;
    }
}
