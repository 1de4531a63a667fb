package com.makerhedge.simulator;

import com.makerhedge.domain.model.InstrumentSpec;
import com.makerhedge.domain.vo.AccountSummary;
import com.makerhedge.exchange.ExchangeClient;
import com.makerhedge.exchange.ExchangeOrder;
import com.makerhedge.exchange.ExchangePosition;
import com.makerhedge.exchange.ExchangeResult;
import com.makerhedge.exchange.OrderBookLevels;
import com.makerhedge.exchange.SignedOrder;
import java.util.List;

/** {@link ExchangeClient} view of the {@link SimulatedExchange} for one sub-account. */
public class SimulatedExchangeClient implements ExchangeClient {

    private final SimulatedExchange exchange;
    private final String accountId;

    public SimulatedExchangeClient(SimulatedExchange exchange, String accountId) {
        this.exchange = exchange;
        this.accountId = accountId;
    }

    @Override
    public ExchangeResult<List<ExchangePosition>> positions() {
        return exchange.positions(accountId);
    }

    @Override
    public ExchangeResult<List<ExchangeOrder>> openOrders() {
        return exchange.openOrders(accountId);
    }

    @Override
    public ExchangeResult<ExchangeOrder> order(String orderId) {
        return exchange.order(accountId, orderId);
    }

    @Override
    public ExchangeResult<InstrumentSpec> instrument(String instrument) {
        return exchange.instrument(instrument);
    }

    @Override
    public ExchangeResult<List<String>> activeInstruments() {
        return exchange.activeInstruments();
    }

    @Override
    public ExchangeResult<OrderBookLevels> orderBook(String instrument, int depth) {
        return exchange.orderBook(instrument, depth);
    }

    @Override
    public ExchangeResult<AccountSummary> accountSummary() {
        return exchange.accountSummary(accountId);
    }

    @Override
    public ExchangeResult<ExchangeOrder> submitOrder(SignedOrder order) {
        return exchange.submit(accountId, order);
    }

    @Override
    public ExchangeResult<Void> cancelOrder(String orderId) {
        return exchange.cancel(accountId, orderId);
    }
}
