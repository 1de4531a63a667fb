package com.makerhedge.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.makerhedge.domain.enums.AlertSeverity;
import com.makerhedge.notification.TelegramConfig;
import com.makerhedge.notification.TelegramNotifier;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Unit tests for TelegramNotifier.
 *
 * <p>Verifies: disabled or unconfigured relay skips send, CRITICAL bypasses the rate limiter,
 * the rate limiter queues when exhausted, relay failures are dropped.
 */
class TelegramNotifierTest {

    private TelegramConfig telegramConfig;
    private RestTemplate restTemplate;
    private TelegramNotifier telegramNotifier;

    @BeforeEach
    void setUp() {
        telegramConfig = new TelegramConfig();
        restTemplate = mock(RestTemplate.class);
        telegramNotifier = new TelegramNotifier(telegramConfig, restTemplate);
    }

    private void enable() {
        telegramConfig.setEnabled(true);
        telegramConfig.setApiKey("relay-key");
        telegramConfig.setChatId("12345");
    }

    @Test
    void send_disabled_doesNothing() {
        telegramConfig.setEnabled(false);

        telegramNotifier.send("test message", AlertSeverity.INFO);

        assertThat(telegramNotifier.getQueueSize()).isEqualTo(0);
        verify(restTemplate, never()).postForEntity(any(String.class), any(), eq(String.class));
    }

    @Test
    void send_enabledWithoutChatId_doesNothing() {
        telegramConfig.setEnabled(true);
        telegramConfig.setApiKey("relay-key");

        telegramNotifier.send("test message", AlertSeverity.WARNING);

        verify(restTemplate, never()).postForEntity(any(String.class), any(), eq(String.class));
    }

    @Test
    void send_enabled_postsChatIdMessageAndApiKey() {
        enable();

        telegramNotifier.send("Max total position exceeded", AlertSeverity.CRITICAL);

        verify(restTemplate)
                .postForEntity(
                        eq("http://localhost:3000/send-message"),
                        argThat((HttpEntity<Map<String, Object>> request) -> "12345"
                                        .equals(request.getBody().get("chatId"))
                                && "Max total position exceeded".equals(request.getBody().get("message"))
                                && "relay-key".equals(request.getHeaders().getFirst("X-API-Key"))),
                        eq(String.class));
    }

    @Test
    void send_enabled_critical_bypassesRateLimiter() {
        enable();
        int permitsBefore = telegramNotifier.getAvailablePermits();

        telegramNotifier.send("Critical alert", AlertSeverity.CRITICAL);

        assertThat(telegramNotifier.getAvailablePermits()).isEqualTo(permitsBefore);
        assertThat(telegramNotifier.getQueueSize()).isEqualTo(0);
    }

    @Test
    void send_enabled_warning_consumesPermit() {
        enable();
        int permitsBefore = telegramNotifier.getAvailablePermits();

        telegramNotifier.send("Warning alert", AlertSeverity.WARNING);

        assertThat(telegramNotifier.getAvailablePermits()).isEqualTo(permitsBefore - 1);
    }

    @Test
    void rateLimiter_exhausted_queuesMessage() {
        enable();
        telegramNotifier.drainPermits();

        telegramNotifier.send("queued msg", AlertSeverity.INFO);

        assertThat(telegramNotifier.getQueueSize()).isEqualTo(1);
        verify(restTemplate, never()).postForEntity(any(String.class), any(), eq(String.class));
    }

    @Test
    void relayFailure_isDropped() {
        enable();
        when(restTemplate.postForEntity(any(String.class), any(), eq(String.class)))
                .thenThrow(new ResourceAccessException("connection refused"));

        telegramNotifier.send("Critical alert", AlertSeverity.CRITICAL);

        assertThat(telegramNotifier.getQueueSize()).isEqualTo(0);
    }
}
