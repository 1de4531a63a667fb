package com.makerhedge.exchange;

import com.makerhedge.domain.model.InstrumentSpec;
import com.makerhedge.domain.vo.AccountSummary;
import java.util.List;

/**
 * Per-account exchange API. Every call returns an {@link ExchangeResult}; implementations
 * report API errors as values and may throw only for transport failures, which
 * {@link AccountRuntime} converts into network errors.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@code SimulatedExchangeClient}: in-memory paper trading</li>
 *   <li>an exchange adapter providing an {@link ExchangeClientFactory} bean for live trading</li>
 * </ul>
 */
public interface ExchangeClient {

    /** Perpetual positions of the account. */
    ExchangeResult<List<ExchangePosition>> positions();

    /** All open orders of the account across instruments. */
    ExchangeResult<List<ExchangeOrder>> openOrders();

    /** Looks up a single order, open or closed. */
    ExchangeResult<ExchangeOrder> order(String orderId);

    ExchangeResult<InstrumentSpec> instrument(String instrument);

    /** Names of all active instruments. */
    ExchangeResult<List<String>> activeInstruments();

    ExchangeResult<OrderBookLevels> orderBook(String instrument, int depth);

    ExchangeResult<AccountSummary> accountSummary();

    /**
     * Submits a signed order. The acknowledged order id may be a placeholder
     * ("0x00...") until the exchange assigns the real one.
     */
    ExchangeResult<ExchangeOrder> submitOrder(SignedOrder order);

    ExchangeResult<Void> cancelOrder(String orderId);
}
