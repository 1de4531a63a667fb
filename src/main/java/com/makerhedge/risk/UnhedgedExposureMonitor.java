package com.makerhedge.risk;

import com.makerhedge.config.HedgeProperties;
import com.makerhedge.domain.enums.AlertSeverity;
import com.makerhedge.domain.model.SymbolState;
import com.makerhedge.notification.AlertService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tracks how long each symbol has been unhedged (|A| != |B|).
 *
 * <p>A symbol that stays unhedged for {@code stuck-hours} raises one CRITICAL alert; the flag
 * resets as soon as the legs are equal again. Separately, once per calendar day in the report
 * zone, a digest lists every symbol that is currently stuck.
 */
@Component
public class UnhedgedExposureMonitor {

    private static final Logger log = LoggerFactory.getLogger(UnhedgedExposureMonitor.class);

    private static final Duration STUCK_ALERT_COOLDOWN = Duration.ofSeconds(3600);

    private final AlertService alertService;
    private final HedgeProperties properties;
    private final Clock clock;

    public UnhedgedExposureMonitor(AlertService alertService, HedgeProperties properties, Clock clock) {
        this.alertService = alertService;
        this.properties = properties;
        this.clock = clock;
    }

    /** Updates the unhedged timer for one symbol and fires the stuck alert when it expires. */
    public void check(SymbolState state, BigDecimal absA, BigDecimal absB) {
        Instant now = clock.instant();
        if (absA.compareTo(absB) == 0) {
            state.setUnhedgedSince(null);
            state.setStuckAlertSent(false);
            return;
        }
        if (state.getUnhedgedSince() == null) {
            state.setUnhedgedSince(now);
            return;
        }
        if (!state.isStuckAlertSent()
                && Duration.between(state.getUnhedgedSince(), now).compareTo(properties.getStuckAfter()) >= 0) {
            state.setStuckAlertSent(true);
            alertService.notify(
                    AlertSeverity.CRITICAL,
                    "Unhedged > " + properties.getStuckHours() + "h " + state.getInstrument(),
                    "abs_a=" + absA + " abs_b=" + absB + " since=" + state.getUnhedgedSince(),
                    "stuck:" + state.getInstrument(),
                    STUCK_ALERT_COOLDOWN);
        }
    }

    /**
     * Sends the daily stuck digest if it has not gone out today and at least one symbol is stuck.
     *
     * @return true if a digest was sent
     */
    public boolean sendDailyDigest(Collection<SymbolState> states) {
        LocalDate today = LocalDate.ofInstant(clock.instant(), properties.getReportZone());
        if (alertService.isDailyReportSent(today)) {
            return false;
        }
        Instant now = clock.instant();
        List<String> lines = new ArrayList<>();
        for (SymbolState state : states) {
            if (state.getUnhedgedSince() == null) {
                continue;
            }
            Duration unhedged = Duration.between(state.getUnhedgedSince(), now);
            if (unhedged.compareTo(properties.getStuckAfter()) < 0) {
                continue;
            }
            double hours = unhedged.toSeconds() / 3600.0;
            lines.add(String.format(Locale.ROOT, "%s: unhedged %.2fh", state.getInstrument(), hours));
        }
        if (lines.isEmpty()) {
            return false;
        }
        String body = String.join("\n", lines);
        alertService.send(AlertSeverity.WARNING, "Daily stuck hedge report:", body);
        alertService.markDailyReportSent(today);
        log.info("Daily stuck hedge report sent for {}: {} symbol(s)", today, lines.size());
        return true;
    }
}
