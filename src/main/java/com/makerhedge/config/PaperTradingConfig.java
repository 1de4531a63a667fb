package com.makerhedge.config;

import com.makerhedge.domain.model.InstrumentSpec;
import com.makerhedge.exchange.ExchangeClientFactory;
import com.makerhedge.exchange.OrderSigner;
import com.makerhedge.simulator.PaperOrderSigner;
import com.makerhedge.simulator.SimulatedExchange;
import com.makerhedge.simulator.SimulatedExchangeClientFactory;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * PAPER mode: both legs trade against one in-memory {@link SimulatedExchange} seeded from
 * {@code hedge.paper.instruments}.
 */
@Configuration
@ConditionalOnProperty(name = "hedge.trading-mode", havingValue = "PAPER", matchIfMissing = true)
public class PaperTradingConfig {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    @Bean
    public SimulatedExchange simulatedExchange(HedgeProperties properties, Clock clock) {
        SimulatedExchange exchange = new SimulatedExchange(clock, properties.getPaper().getStartingEquity());
        for (HedgeProperties.PaperInstrument instrument : properties.getPaper().getInstruments()) {
            BigDecimal halfSpread = instrument.getSpread().divide(TWO);
            BigDecimal bid = instrument.getMidPrice().subtract(halfSpread)
                    .setScale(instrument.getTickSize().scale(), RoundingMode.FLOOR);
            BigDecimal ask = instrument.getMidPrice().add(halfSpread)
                    .setScale(instrument.getTickSize().scale(), RoundingMode.CEILING);
            exchange.listInstrument(
                    InstrumentSpec.builder()
                            .instrument(instrument.getInstrument())
                            .tickSize(instrument.getTickSize())
                            .sizeStep(BigDecimal.ONE.movePointLeft(instrument.getBaseDecimals()))
                            .minSize(instrument.getMinSize())
                            .build(),
                    bid,
                    ask);
        }
        return exchange;
    }

    @Bean
    public ExchangeClientFactory simulatedExchangeClientFactory(SimulatedExchange simulatedExchange) {
        return new SimulatedExchangeClientFactory(simulatedExchange);
    }

    @Bean
    public OrderSigner paperOrderSigner() {
        return new PaperOrderSigner();
    }
}
