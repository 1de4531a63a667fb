package com.makerhedge.config;

import com.makerhedge.domain.enums.LegLabel;
import com.makerhedge.exception.ConfigurationException;
import com.makerhedge.exception.ErrorCode;
import com.makerhedge.exception.ExchangeException;
import com.makerhedge.exchange.AccountCredentials;
import com.makerhedge.exchange.AccountRuntime;
import com.makerhedge.exchange.ExchangeClientFactory;
import com.makerhedge.exchange.HedgeAccounts;
import com.makerhedge.exchange.OrderSigner;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the two hedge legs: transient-error retry policy, then one {@link AccountRuntime} per
 * configured account. The client factory and signer come from whichever adapter is active
 * ({@link PaperTradingConfig} in PAPER mode); LIVE mode without an adapter fails at startup.
 */
@Configuration
public class ExchangeConfig {

    private static final Logger log = LoggerFactory.getLogger(ExchangeConfig.class);

    @Bean
    public RetryRegistry exchangeRetryRegistry(HedgeProperties properties) {
        HedgeProperties.Retry settings = properties.getRetry();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, settings.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.getInitialBackoff().toMillis(), settings.getMultiplier()))
                .retryOnException(e -> e instanceof ExchangeException
                        && ((ExchangeException) e).getError().isTransient())
                .build();
        return RetryRegistry.of(config);
    }

    @Bean
    public Retry exchangeRetry(RetryRegistry exchangeRetryRegistry) {
        Retry retry = exchangeRetryRegistry.retry("exchange");
        retry.getEventPublisher()
                .onRetry(event -> log.debug(
                        "Retrying exchange call, attempt {}: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));
        return retry;
    }

    @Bean
    public HedgeAccounts hedgeAccounts(
            HedgeProperties properties,
            ObjectProvider<ExchangeClientFactory> clientFactory,
            ObjectProvider<OrderSigner> orderSigner,
            Retry exchangeRetry) {
        List<HedgeProperties.Account> accounts = properties.getAccounts();
        if (accounts == null || accounts.size() < 2) {
            throw new ConfigurationException(
                    ErrorCode.MISSING_CREDENTIALS, "Dual hedge needs at least 2 accounts under hedge.accounts");
        }
        ExchangeClientFactory factory = clientFactory.getIfAvailable();
        OrderSigner signer = orderSigner.getIfAvailable();
        if (factory == null || signer == null) {
            throw new ConfigurationException(
                    "No exchange adapter for trading mode " + properties.getTradingMode()
                            + ": an ExchangeClientFactory and an OrderSigner bean are required");
        }
        AccountRuntime legA = runtime(LegLabel.A, accounts.get(0), factory, signer, exchangeRetry);
        AccountRuntime legB = runtime(LegLabel.B, accounts.get(1), factory, signer, exchangeRetry);
        log.info("Hedge legs: A={} B={} mode={}", legA.getName(), legB.getName(), properties.getTradingMode());
        return new HedgeAccounts(legA, legB);
    }

    static AccountCredentials credentials(LegLabel leg, HedgeProperties.Account account) {
        String name = isBlank(account.getName()) ? "account" + (leg.ordinal() + 1) : account.getName().trim();
        if (isBlank(account.getPrivateKey())) {
            throw new ConfigurationException(ErrorCode.MISSING_CREDENTIALS, name + " missing private key");
        }
        if (isBlank(account.getAccountId())) {
            throw new ConfigurationException(ErrorCode.MISSING_CREDENTIALS, name + " missing account id");
        }
        return AccountCredentials.builder()
                .name(name)
                .apiKey(account.getApiKey())
                .accountId(account.getAccountId().trim())
                .privateKey(account.getPrivateKey().trim())
                .env(account.getEnv())
                .build();
    }

    private static AccountRuntime runtime(
            LegLabel leg,
            HedgeProperties.Account account,
            ExchangeClientFactory factory,
            OrderSigner signer,
            Retry retry) {
        return new AccountRuntime(leg, credentials(leg, account), factory, signer, retry);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
