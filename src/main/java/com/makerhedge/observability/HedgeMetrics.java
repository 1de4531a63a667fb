package com.makerhedge.observability;

import com.makerhedge.domain.enums.LegLabel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer meters for the hedge engine.
 *
 * <ul>
 *   <li><b>hedge.orders.placed</b> (counter, tag leg): post-only orders accepted by the exchange</li>
 *   <li><b>hedge.orders.post_only_rejects</b> (counter): attempts rejected because they would cross</li>
 *   <li><b>hedge.orders.failed</b> (counter): submissions aborted with a non-retryable error</li>
 *   <li><b>hedge.orders.cancelled</b> (counter): strategy orders cancelled by cap enforcement or cleanup</li>
 *   <li><b>hedge.cooldowns</b> (counter): symbols put into placement cooldown</li>
 *   <li><b>hedge.fills.notional</b> (counter, tag leg): fill notional pushed into the lot ledger</li>
 *   <li><b>hedge.loop.errors</b> (counter): loop iterations that ended in an exception</li>
 *   <li><b>hedge.loop.latency</b> (timer): wall time of one loop iteration, sleep excluded</li>
 * </ul>
 */
@Service
public class HedgeMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter postOnlyRejectCounter;
    private final Counter orderFailedCounter;
    private final Counter orderCancelledCounter;
    private final Counter cooldownCounter;
    private final Counter loopErrorCounter;
    private final Timer loopLatencyTimer;

    public HedgeMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.postOnlyRejectCounter = Counter.builder("hedge.orders.post_only_rejects")
                .description("Order attempts rejected because they would have taken liquidity")
                .register(meterRegistry);

        this.orderFailedCounter = Counter.builder("hedge.orders.failed")
                .description("Order submissions aborted with a non-retryable error")
                .register(meterRegistry);

        this.orderCancelledCounter = Counter.builder("hedge.orders.cancelled")
                .description("Strategy orders cancelled by the engine")
                .register(meterRegistry);

        this.cooldownCounter = Counter.builder("hedge.cooldowns")
                .description("Symbols put into placement cooldown")
                .register(meterRegistry);

        this.loopErrorCounter = Counter.builder("hedge.loop.errors")
                .description("Loop iterations that failed with an exception")
                .register(meterRegistry);

        this.loopLatencyTimer = Timer.builder("hedge.loop.latency")
                .description("Duration of one hedge loop iteration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
    }

    public void recordOrderPlaced(LegLabel leg) {
        meterRegistry.counter("hedge.orders.placed", "leg", leg.name()).increment();
    }

    public void recordPostOnlyReject() {
        postOnlyRejectCounter.increment();
    }

    public void recordOrderFailed() {
        orderFailedCounter.increment();
    }

    public void recordOrderCancelled() {
        orderCancelledCounter.increment();
    }

    public void recordCooldown() {
        cooldownCounter.increment();
    }

    public void recordFill(LegLabel leg, BigDecimal notional) {
        meterRegistry.counter("hedge.fills.notional", "leg", leg.name()).increment(notional.doubleValue());
    }

    public void recordLoopError() {
        loopErrorCounter.increment();
    }

    public void recordLoopLatency(Duration elapsed) {
        loopLatencyTimer.record(elapsed);
    }
}
