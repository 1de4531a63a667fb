package com.makerhedge.core.engine;

import com.makerhedge.config.HedgeProperties;
import com.makerhedge.domain.enums.LegLabel;
import com.makerhedge.domain.model.AccountSnapshot;
import com.makerhedge.domain.model.SymbolState;
import com.makerhedge.notification.AlertService;
import com.makerhedge.observability.HedgeMetrics;
import com.makerhedge.oms.StrategyOrderCleanup;
import com.makerhedge.risk.UnhedgedExposureMonitor;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Drives the hedge engine on a dedicated non-daemon thread.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #start()} logs the effective parameters and launches the {@code hedge-loop} thread</li>
 *   <li>The thread bootstraps every enabled symbol, then repeats: collect snapshots, process each
 *       symbol, send the daily stuck digest, sleep for the loop interval</li>
 *   <li>{@link #stop()} (JVM shutdown) or the optional maximum runtime ends the loop; the thread
 *       then cancels strategy orders before exiting</li>
 * </ol>
 *
 * <p>Runs in a high phase so it stops before the beans it calls are torn down.
 */
@Service
public class HedgeLoopRunner implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(HedgeLoopRunner.class);

    private static final Duration LOOP_ERROR_ALERT_COOLDOWN = Duration.ofSeconds(120);
    private static final Duration STOP_JOIN_TIMEOUT = Duration.ofSeconds(30);

    private final SymbolStateRegistry symbolStateRegistry;
    private final SnapshotCollector snapshotCollector;
    private final RebalancingEngine rebalancingEngine;
    private final UnhedgedExposureMonitor unhedgedExposureMonitor;
    private final StrategyOrderCleanup strategyOrderCleanup;
    private final AlertService alertService;
    private final HedgeMetrics metrics;
    private final HedgeProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean stopRequested;
    private volatile CountDownLatch stopSignal = new CountDownLatch(1);
    private Thread loopThread;

    public HedgeLoopRunner(
            SymbolStateRegistry symbolStateRegistry,
            SnapshotCollector snapshotCollector,
            RebalancingEngine rebalancingEngine,
            UnhedgedExposureMonitor unhedgedExposureMonitor,
            StrategyOrderCleanup strategyOrderCleanup,
            AlertService alertService,
            HedgeMetrics metrics,
            HedgeProperties properties,
            Clock clock) {
        this.symbolStateRegistry = symbolStateRegistry;
        this.snapshotCollector = snapshotCollector;
        this.rebalancingEngine = rebalancingEngine;
        this.unhedgedExposureMonitor = unhedgedExposureMonitor;
        this.strategyOrderCleanup = strategyOrderCleanup;
        this.alertService = alertService;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (running.get()) {
            return;
        }
        stopRequested = false;
        stopSignal = new CountDownLatch(1);
        logBanner();
        loopThread = new Thread(this::runLoop, "hedge-loop");
        loopThread.setDaemon(false);
        running.set(true);
        loopThread.start();
    }

    @Override
    public void stop() {
        Thread thread;
        synchronized (this) {
            thread = loopThread;
        }
        requestStop();
        if (thread == null || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(STOP_JOIN_TIMEOUT.toMillis());
            if (thread.isAlive()) {
                log.warn("Hedge loop did not finish within {}", STOP_JOIN_TIMEOUT);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the hedge loop to stop");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isAutoStart();
    }

    /** Asks the loop to exit after the current iteration and wakes it if it is sleeping. */
    public void requestStop() {
        if (!stopRequested) {
            log.info("Stopping hedge engine...");
        }
        stopRequested = true;
        stopSignal.countDown();
    }

    public void bootstrap() {
        Map<LegLabel, AccountSnapshot> snapshots = snapshotCollector.collect();
        int count = 0;
        for (SymbolState state : symbolStateRegistry.enabled()) {
            rebalancingEngine.bootstrap(state, snapshots);
            count++;
        }
        log.info("Bootstrap completed for {} symbols", count);
    }

    /** One polling pass over every enabled symbol followed by the daily digest check. */
    public void runIteration() {
        Instant started = clock.instant();
        Map<LegLabel, AccountSnapshot> snapshots = snapshotCollector.collect();
        for (SymbolState state : symbolStateRegistry.enabled()) {
            try {
                rebalancingEngine.process(state, snapshots);
            } catch (RuntimeException e) {
                onLoopError(state.getInstrument(), e);
            }
        }
        unhedgedExposureMonitor.sendDailyDigest(symbolStateRegistry.all());
        metrics.recordLoopLatency(Duration.between(started, clock.instant()));
    }

    private void runLoop() {
        Instant startedAt = clock.instant();
        log.info("Hedge engine started");
        try {
            bootstrap();
            while (!stopRequested) {
                if (maxRuntimeReached(startedAt)) {
                    log.info("Reached max runtime {}, stopping hedge engine...", properties.getMaxRuntime());
                    break;
                }
                try {
                    runIteration();
                } catch (RuntimeException e) {
                    onLoopError(null, e);
                }
                if (stopSignal.await(properties.getLoopInterval().toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Hedge loop interrupted");
        } catch (RuntimeException e) {
            log.error("Hedge engine failed during bootstrap", e);
            alertService.notify(
                    "Hedge bootstrap failed", String.valueOf(e.getMessage()), "main_loop_error", LOOP_ERROR_ALERT_COOLDOWN);
        } finally {
            cleanupOnExit();
            running.set(false);
            log.info("Hedge engine stopped");
        }
    }

    private boolean maxRuntimeReached(Instant startedAt) {
        Duration maxRuntime = properties.getMaxRuntime();
        if (maxRuntime.isZero() || maxRuntime.isNegative()) {
            return false;
        }
        return Duration.between(startedAt, clock.instant()).compareTo(maxRuntime) >= 0;
    }

    private void onLoopError(String instrument, RuntimeException e) {
        metrics.recordLoopError();
        String message = instrument == null ? String.valueOf(e.getMessage()) : instrument + ": " + e.getMessage();
        alertService.notify("Hedge loop error", message, "main_loop_error", LOOP_ERROR_ALERT_COOLDOWN);
        log.error("Main loop error: {}", message, e);
    }

    private void cleanupOnExit() {
        try {
            int cancelled = strategyOrderCleanup.cancelStrategyOrders();
            if (cancelled > 0) {
                log.info("Cancelled {} strategy orders on exit", cancelled);
            }
        } catch (RuntimeException e) {
            log.error("Failed to cancel strategy orders on exit", e);
        }
    }

    private void logBanner() {
        log.info(
                "Symbols={}, loop={}, book_depth={}, per_account_cap_when_diff<{}=>1, post_only_retry={}, "
                        + "cooldown={}, partial_timeout={}, stuck={}h, mmr={}, mode={}",
                symbolStateRegistry.describe(),
                properties.getLoopInterval(),
                properties.getOrderbookDepth(),
                properties.getSingleOrderDiffThreshold(),
                properties.getPostOnlyMaxRetry(),
                properties.getPostOnlyCooldown(),
                properties.getPartialFillTimeout(),
                properties.getStuckHours(),
                properties.getMmrAlertThreshold(),
                properties.getTradingMode());
    }
}
