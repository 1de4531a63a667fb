package com.makerhedge.exchange;

import com.makerhedge.domain.enums.LegLabel;
import com.makerhedge.domain.model.InstrumentSpec;
import com.makerhedge.exception.ExchangeException;
import com.makerhedge.exception.SigningException;
import io.github.resilience4j.retry.Retry;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One hedge leg's connection to the exchange: credentials, the current client handle,
 * the order signer and a lazily filled instrument cache.
 *
 * <p>All exchange calls go through {@link #call}, which applies two policies:
 * <ul>
 *   <li>auth errors rebuild the client through the factory and retry the call once</li>
 *   <li>transient errors (rate limit, 5xx, transport) are retried by the Resilience4j
 *       {@link Retry} with exponential backoff</li>
 * </ul>
 * Nothing here throws to the caller; exhausted retries come back as a failed
 * {@link ExchangeResult}. Order submission is the exception to the retry policy, see
 * {@link #submitOrder}.
 */
public class AccountRuntime {

    private static final Logger log = LoggerFactory.getLogger(AccountRuntime.class);

    @Getter
    private final LegLabel leg;

    @Getter
    private final AccountCredentials credentials;

    private final ExchangeClientFactory clientFactory;
    private final OrderSigner signer;
    private final Retry retry;
    private final Map<String, InstrumentSpec> instruments = new ConcurrentHashMap<>();

    private volatile ExchangeClient client;

    public AccountRuntime(
            LegLabel leg,
            AccountCredentials credentials,
            ExchangeClientFactory clientFactory,
            OrderSigner signer,
            Retry retry) {
        this.leg = leg;
        this.credentials = credentials;
        this.clientFactory = clientFactory;
        this.signer = signer;
        this.retry = retry;
        this.client = clientFactory.create(credentials);
    }

    public String getName() {
        return credentials.getName();
    }

    /**
     * Runs one exchange call under the auth-refresh and transient-retry policies.
     *
     * @param operation short name used in logs
     */
    public <T> ExchangeResult<T> call(String operation, Function<ExchangeClient, ExchangeResult<T>> request) {
        Supplier<ExchangeResult<T>> attempt = () -> {
            ExchangeResult<T> result = invokeWithAuthRefresh(operation, request);
            if (!result.isOk() && result.getError().isTransient()) {
                throw new ExchangeException(result.getError());
            }
            return result;
        };
        try {
            return Retry.decorateSupplier(retry, attempt).get();
        } catch (ExchangeException e) {
            log.warn("{} {} failed after retries: {}", getName(), operation, e.getError());
            return ExchangeResult.failure(e.getError());
        }
    }

    /**
     * Submits a signed order once. A timed-out or 5xx submit may still have reached the exchange,
     * so transient failures are returned to the caller rather than retried. On an auth error the
     * client is rebuilt and the order is signed again before the single resubmit.
     */
    public ExchangeResult<ExchangeOrder> submitOrder(SignedOrder signed) {
        ExchangeResult<ExchangeOrder> result = invoke("create_order", c -> c.submitOrder(signed));
        if (result.isOk() || !result.getError().isAuthError()) {
            return result;
        }
        log.warn("{} create_order auth error ({}), re-authenticating", getName(), result.getError());
        rebuildClient();

        UnsignedOrder order = signed.getOrder();
        ExchangeResult<InstrumentSpec> instrument = instrument(order.getInstrument());
        if (!instrument.isOk()) {
            return ExchangeResult.failure(instrument.getError());
        }
        SignedOrder resigned;
        try {
            resigned = sign(order, instrument.getValue());
        } catch (SigningException e) {
            log.error("{} re-signing order {} failed", getName(), order.getClientOrderId(), e);
            return ExchangeResult.failure(
                    ExchangeError.of("sign_order_failed", ExchangeError.NO_STATUS, e.getMessage()));
        }
        return invoke("create_order", c -> c.submitOrder(resigned));
    }

    /** Instrument rules, served from the cache after the first successful lookup. */
    public ExchangeResult<InstrumentSpec> instrument(String instrument) {
        InstrumentSpec cached = instruments.get(instrument);
        if (cached != null) {
            return ExchangeResult.ok(cached);
        }
        ExchangeResult<InstrumentSpec> result = call("instrument", c -> c.instrument(instrument));
        if (result.isOk()) {
            instruments.put(instrument, result.getValue());
        }
        return result;
    }

    /** Signs an order with this account's key. */
    public SignedOrder sign(UnsignedOrder order, InstrumentSpec instrument) {
        return signer.sign(order, instrument, credentials);
    }

    /** Replaces the client handle with a freshly authenticated one. */
    public void rebuildClient() {
        log.info("Rebuilding exchange client for account {} (leg {})", getName(), leg);
        this.client = clientFactory.create(credentials);
    }

    private <T> ExchangeResult<T> invokeWithAuthRefresh(
            String operation, Function<ExchangeClient, ExchangeResult<T>> request) {
        ExchangeResult<T> result = invoke(operation, request);
        if (!result.isOk() && result.getError().isAuthError()) {
            log.warn("{} {} auth error ({}), re-authenticating", getName(), operation, result.getError());
            rebuildClient();
            result = invoke(operation, request);
        }
        return result;
    }

    private <T> ExchangeResult<T> invoke(String operation, Function<ExchangeClient, ExchangeResult<T>> request) {
        try {
            return request.apply(client);
        } catch (ExchangeException e) {
            return ExchangeResult.failure(e.getError());
        } catch (RuntimeException e) {
            log.debug("{} {} transport failure", getName(), operation, e);
            return ExchangeResult.failure(ExchangeError.network(e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }
}
