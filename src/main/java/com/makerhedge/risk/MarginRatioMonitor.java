package com.makerhedge.risk;

import com.makerhedge.config.HedgeProperties;
import com.makerhedge.domain.enums.AlertSeverity;
import com.makerhedge.domain.vo.AccountSummary;
import com.makerhedge.notification.AlertService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Alerts when an account's maintenance margin reaches the configured share of its equity. */
@Component
public class MarginRatioMonitor {

    private static final Duration ALERT_COOLDOWN = Duration.ofSeconds(1800);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final AlertService alertService;
    private final HedgeProperties properties;

    public MarginRatioMonitor(AlertService alertService, HedgeProperties properties) {
        this.alertService = alertService;
        this.properties = properties;
    }

    /**
     * Checks one account's summary. Missing summaries and non-positive equity are skipped.
     *
     * @return true if the ratio is at or above the threshold
     */
    public boolean check(String accountName, Optional<AccountSummary> summary) {
        Optional<BigDecimal> ratio = summary.flatMap(AccountSummary::maintenanceMarginRatio);
        if (ratio.isEmpty() || ratio.get().compareTo(properties.getMmrAlertThreshold()) < 0) {
            return false;
        }
        AccountSummary s = summary.get();
        alertService.notify(
                AlertSeverity.CRITICAL,
                accountName + " MMR ALERT " + percent(ratio.get()),
                "maintenance_margin=" + s.getMaintenanceMargin() + " equity=" + s.getEquity() + " threshold="
                        + percent(properties.getMmrAlertThreshold()),
                "mmr:" + accountName,
                ALERT_COOLDOWN);
        return true;
    }

    private static String percent(BigDecimal ratio) {
        return ratio.multiply(HUNDRED).setScale(2, RoundingMode.HALF_UP).toPlainString() + "%";
    }
}
