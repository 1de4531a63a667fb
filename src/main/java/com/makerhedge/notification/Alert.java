package com.makerhedge.notification;

import com.makerhedge.domain.enums.AlertSeverity;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * An operator alert raised by the hedge engine.
 *
 * <p>{@code key} identifies the condition for deduplication (for example
 * {@code max_total:BTC_USDT_Perp}); the same key is delivered at most once per {@code cooldown}.
 */
@Data
@Builder
public class Alert {

    private String key;
    private AlertSeverity severity;
    private String title;
    private String message;
    private Duration cooldown;
    private Instant timestamp;

    /** Text sent to the chat: title on the first line, details below. */
    public String render() {
        return message == null || message.isEmpty() ? title : title + "\n" + message;
    }
}
