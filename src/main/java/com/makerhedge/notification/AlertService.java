package com.makerhedge.notification;

import com.makerhedge.domain.enums.AlertSeverity;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Deduplicating front door for operator alerts.
 *
 * <p>Each alert carries a key naming the condition it reports. An alert is delivered only if
 * no alert with the same key was delivered within its cooldown; suppressed alerts are dropped
 * silently. Delivered alerts are logged at WARN and handed to {@link TelegramNotifier}, which
 * sends asynchronously, so {@code notify} never blocks on the network.
 *
 * <p>Also remembers the last calendar day a daily digest was sent. All state is in memory
 * and starts empty on every run.
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private static final Duration DEFAULT_COOLDOWN = Duration.ofMinutes(5);

    private final TelegramNotifier telegramNotifier;
    private final Clock clock;

    private final Map<String, Instant> lastSentByKey = new ConcurrentHashMap<>();
    private final AtomicReference<LocalDate> lastDailyReportDay = new AtomicReference<>();

    public AlertService(TelegramNotifier telegramNotifier, Clock clock) {
        this.telegramNotifier = telegramNotifier;
        this.clock = clock;
    }

    /** Raises a WARNING alert. */
    public boolean notify(String title, String message, String key, Duration cooldown) {
        return notify(AlertSeverity.WARNING, title, message, key, cooldown);
    }

    public boolean notify(String title, String message, String key) {
        return notify(AlertSeverity.WARNING, title, message, key, DEFAULT_COOLDOWN);
    }

    /**
     * Delivers the alert unless the same key fired within {@code cooldown}.
     *
     * @return true if the alert was delivered, false if suppressed
     */
    public boolean notify(AlertSeverity severity, String title, String message, String key, Duration cooldown) {
        Instant now = clock.instant();
        boolean[] accepted = {false};
        lastSentByKey.compute(key, (k, last) -> {
            if (last != null && Duration.between(last, now).compareTo(cooldown) < 0) {
                return last;
            }
            accepted[0] = true;
            return now;
        });
        if (!accepted[0]) {
            log.debug("Alert {} suppressed by cooldown", key);
            return false;
        }

        Alert alert = Alert.builder()
                .key(key)
                .severity(severity)
                .title(title)
                .message(message)
                .cooldown(cooldown)
                .timestamp(now)
                .build();
        deliver(alert);
        return true;
    }

    /** Sends without deduplication. Used for digests that are already gated by day. */
    public void send(AlertSeverity severity, String title, String message) {
        deliver(Alert.builder()
                .severity(severity)
                .title(title)
                .message(message)
                .timestamp(clock.instant())
                .build());
    }

    /** True once the daily digest for {@code day} has gone out. */
    public boolean isDailyReportSent(LocalDate day) {
        return day.equals(lastDailyReportDay.get());
    }

    public void markDailyReportSent(LocalDate day) {
        lastDailyReportDay.set(day);
    }

    private void deliver(Alert alert) {
        log.warn("{} | {}", alert.getTitle(), alert.getMessage());
        telegramNotifier.send(alert.render(), alert.getSeverity());
    }
}
