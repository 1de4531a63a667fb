package com.makerhedge.notification;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for the Telegram relay that forwards alert text to the operators' chat.
 *
 * <p>Reads from application.yml:
 * <pre>
 * notifications.telegram.enabled=${TELEGRAM_ENABLED:false}
 * notifications.telegram.endpoint=http://localhost:3000/send-message
 * notifications.telegram.api-key=${API_KEY:}
 * notifications.telegram.chat-id=${CHAT_ID:}
 * notifications.telegram.max-messages-per-minute=60
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "notifications.telegram")
public class TelegramConfig {

    private boolean enabled = false;
    private String endpoint = "http://localhost:3000/send-message";
    private String apiKey;
    private String chatId;
    private int maxMessagesPerMinute = 60;

    public boolean isConfigured() {
        return chatId != null && !chatId.isBlank() && apiKey != null && !apiKey.isBlank();
    }
}
