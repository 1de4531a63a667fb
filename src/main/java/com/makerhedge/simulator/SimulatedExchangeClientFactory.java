package com.makerhedge.simulator;

import com.makerhedge.exchange.AccountCredentials;
import com.makerhedge.exchange.ExchangeClient;
import com.makerhedge.exchange.ExchangeClientFactory;

public class SimulatedExchangeClientFactory implements ExchangeClientFactory {

    private final SimulatedExchange exchange;

    public SimulatedExchangeClientFactory(SimulatedExchange exchange) {
        this.exchange = exchange;
    }

    @Override
    public ExchangeClient create(AccountCredentials credentials) {
        return new SimulatedExchangeClient(exchange, credentials.getAccountId());
    }
}
