package com.makerhedge.notification;

import com.makerhedge.domain.enums.AlertSeverity;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Sends alert text to the local Telegram relay with rate limiting.
 *
 * <p>The relay accepts {@code {"chatId": ..., "message": ...}} with an {@code X-API-Key}
 * header and forwards it to the bot. A semaphore limits throughput to the configured
 * messages per minute; overflow goes to a priority queue so that CRITICAL messages are
 * sent first once permits free up.
 *
 * <p>CRITICAL alerts bypass the rate limiter queue and send immediately. Delivery runs on
 * the {@code alertExecutor} pool so a slow relay never stalls the hedge loop. Failures are
 * logged and dropped.
 */
@Component
public class TelegramNotifier {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);

    private final TelegramConfig telegramConfig;
    private final RestTemplate restTemplate;
    private final Semaphore rateLimiter;

    // Messages that could not be sent immediately, CRITICAL first
    private final BlockingQueue<TelegramMessage> messageQueue = new PriorityBlockingQueue<>(
            100, Comparator.comparingInt(m -> m.getSeverity().ordinal()));

    @Autowired
    public TelegramNotifier(TelegramConfig telegramConfig) {
        this(telegramConfig, new RestTemplate());
    }

    public TelegramNotifier(TelegramConfig telegramConfig, RestTemplate restTemplate) {
        this.telegramConfig = telegramConfig;
        this.restTemplate = restTemplate;
        this.rateLimiter = new Semaphore(Math.max(1, telegramConfig.getMaxMessagesPerMinute()));
    }

    /**
     * Send a message via the relay.
     * CRITICAL messages bypass the rate limiter; others are rate-limited.
     */
    @Async("alertExecutor")
    public void send(String message, AlertSeverity severity) {
        if (!telegramConfig.isEnabled()) {
            log.debug("Telegram notifications disabled");
            return;
        }
        if (!telegramConfig.isConfigured()) {
            log.debug("Telegram relay not configured (chat id / api key missing), dropping message");
            return;
        }

        TelegramMessage telegramMessage = TelegramMessage.builder()
                .text(message)
                .severity(severity)
                .timestamp(System.currentTimeMillis())
                .build();

        if (severity == AlertSeverity.CRITICAL) {
            sendMessage(telegramMessage);
            return;
        }

        if (rateLimiter.tryAcquire()) {
            sendMessage(telegramMessage);
            scheduleRateLimiterRelease();
        } else {
            messageQueue.offer(telegramMessage);
            log.warn("Telegram rate limit reached, message queued. Queue size: {}", messageQueue.size());
        }
    }

    /**
     * Processes queued messages. Called every second to drain the queue
     * as rate limiter permits become available.
     */
    @Scheduled(fixedRate = 1000)
    public void processQueue() {
        while (!messageQueue.isEmpty() && rateLimiter.tryAcquire()) {
            TelegramMessage message = messageQueue.poll();
            if (message != null) {
                sendMessage(message);
                scheduleRateLimiterRelease();
            } else {
                rateLimiter.release();
            }
        }
    }

    private void sendMessage(TelegramMessage message) {
        Map<String, Object> payload = Map.of("chatId", telegramConfig.getChatId(), "message", message.getText());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-API-Key", telegramConfig.getApiKey());
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(payload, headers);

        try {
            restTemplate.postForEntity(telegramConfig.getEndpoint(), request, String.class);
            log.debug("Telegram message sent successfully");
        } catch (RestClientException e) {
            log.error("Failed to send Telegram message: {}", e.getMessage());
        }
    }

    private void scheduleRateLimiterRelease() {
        long releaseDelayMs = 60_000L / Math.max(1, telegramConfig.getMaxMessagesPerMinute());
        CompletableFuture.delayedExecutor(releaseDelayMs, TimeUnit.MILLISECONDS).execute(rateLimiter::release);
    }

    /** Visible for testing: returns current queue size. */
    public int getQueueSize() {
        return messageQueue.size();
    }

    /** Visible for testing: returns available rate limiter permits. */
    public int getAvailablePermits() {
        return rateLimiter.availablePermits();
    }

    /** Visible for testing: drains all available permits so the next send is queued. */
    public void drainPermits() {
        rateLimiter.drainPermits();
    }
}
