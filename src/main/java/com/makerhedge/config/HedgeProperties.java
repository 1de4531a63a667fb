package com.makerhedge.config;

import com.makerhedge.domain.enums.TradingMode;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Engine-wide settings, bound from the {@code hedge.*} section of application.yml.
 *
 * <p>Defaults:
 * <ul>
 *   <li>loopInterval: 2s between polling iterations</li>
 *   <li>postOnlyMaxRetry: 5 pricing attempts before a symbol enters cooldown</li>
 *   <li>postOnlyCooldown: 300s</li>
 *   <li>partialFillTimeout: 1800s before a resting partial fill is booked</li>
 *   <li>singleOrderDiffThreshold: 20 USDT; below it each leg keeps at most one order</li>
 *   <li>mmrAlertThreshold: 0.70 maintenance margin / equity</li>
 * </ul>
 */
@Data
@Component
@ConfigurationProperties(prefix = "hedge")
public class HedgeProperties {

    private TradingMode tradingMode = TradingMode.PAPER;

    /** Start the hedge loop with the application context. */
    private boolean autoStart = true;

    /** JSON array of per-symbol settings. Relative paths resolve against the working directory. */
    private String symbolsFile = "config/hedge_symbols.json";

    private Duration loopInterval = Duration.ofSeconds(2);
    private int postOnlyMaxRetry = 5;
    private Duration postOnlyCooldown = Duration.ofSeconds(300);
    private Duration postOnlyRetryDelay = Duration.ofMillis(200);
    private Duration partialFillTimeout = Duration.ofSeconds(1800);

    /** How long an order acknowledged with a placeholder id may stay unconfirmed. */
    private Duration provisionalTimeout = Duration.ofSeconds(60);

    /** Orders unseen in open-order snapshots for longer than this stop counting as active. */
    private Duration activeOrderStaleAfter = Duration.ofSeconds(3600);

    /** Orders never seen live stop counting as active this long after creation. */
    private Duration unconfirmedOrderTtl = Duration.ofSeconds(600);

    /** How long closed orders stay tracked before they are dropped. */
    private Duration closedOrderRetention = Duration.ofSeconds(600);

    private Duration orderExpiry = Duration.ofMinutes(15);
    private int stuckHours = 6;
    private BigDecimal mmrAlertThreshold = new BigDecimal("0.70");
    private int orderbookDepth = 10;
    private BigDecimal singleOrderDiffThreshold = new BigDecimal("20");
    private boolean cancelOnStop = true;
    private int stopKeepStrategyOrders = 0;

    /** Zero means run until stopped. */
    private Duration maxRuntime = Duration.ZERO;

    /** Time zone whose calendar day gates the daily stuck digest. */
    private ZoneId reportZone = ZoneId.of("Asia/Shanghai");

    /** Trading accounts; the first two become legs A and B. */
    private List<Account> accounts = new ArrayList<>();

    private Retry retry = new Retry();
    private Paper paper = new Paper();

    public Duration getStuckAfter() {
        return Duration.ofHours(stuckHours);
    }

    @Data
    public static class Account {
        private String name;
        private String apiKey;
        private String accountId;
        private String privateKey;
        private String env = "prod";

        @Override
        public String toString() {
            return "Account(name=" + name + ", accountId=" + accountId + ", env=" + env + ")";
        }
    }

    /** Backoff for transient exchange errors (rate limit, 5xx, network). */
    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private double multiplier = 2.0;
    }

    /** In-memory market used when {@code tradingMode} is PAPER. */
    @Data
    public static class Paper {
        private BigDecimal startingEquity = new BigDecimal("10000");
        private List<PaperInstrument> instruments = new ArrayList<>();
    }

    @Data
    public static class PaperInstrument {
        private String instrument;
        private BigDecimal midPrice = new BigDecimal("100");
        private BigDecimal spread = new BigDecimal("0.1");
        private BigDecimal tickSize = new BigDecimal("0.01");
        private int baseDecimals = 6;
        private BigDecimal minSize = new BigDecimal("0.001");
    }
}
