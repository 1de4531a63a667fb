package com.makerhedge.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.makerhedge.config.HedgeProperties;
import com.makerhedge.domain.enums.AlertSeverity;
import com.makerhedge.domain.vo.AccountSummary;
import com.makerhedge.notification.AlertService;
import com.makerhedge.risk.MarginRatioMonitor;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MarginRatioMonitorTest {

    private AlertService alertService;
    private MarginRatioMonitor monitor;

    @BeforeEach
    void setUp() {
        alertService = mock(AlertService.class);
        monitor = new MarginRatioMonitor(alertService, new HedgeProperties());
    }

    private static Optional<AccountSummary> summary(String equity, String maintenanceMargin) {
        return Optional.of(new AccountSummary(new BigDecimal(equity), new BigDecimal(maintenanceMargin), BigDecimal.ZERO));
    }

    @Test
    @DisplayName("Ratio at the threshold raises a critical alert keyed by account")
    void alertsAtThreshold() {
        assertThat(monitor.check("account1", summary("1000", "700"))).isTrue();

        verify(alertService)
                .notify(
                        eq(AlertSeverity.CRITICAL),
                        eq("account1 MMR ALERT 70.00%"),
                        anyString(),
                        eq("mmr:account1"),
                        any(Duration.class));
    }

    @Test
    @DisplayName("Ratio below the threshold is quiet")
    void quietBelowThreshold() {
        assertThat(monitor.check("account1", summary("1000", "699.99"))).isFalse();

        verify(alertService, never()).notify(any(), anyString(), anyString(), anyString(), any());
    }

    @Test
    @DisplayName("Missing summary or zero equity is skipped")
    void skipsWithoutEquity() {
        assertThat(monitor.check("account1", Optional.empty())).isFalse();
        assertThat(monitor.check("account1", summary("0", "10"))).isFalse();
    }
}
