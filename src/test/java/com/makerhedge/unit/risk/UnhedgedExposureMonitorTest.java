package com.makerhedge.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.makerhedge.config.HedgeProperties;
import com.makerhedge.domain.enums.AlertSeverity;
import com.makerhedge.domain.model.SymbolState;
import com.makerhedge.notification.AlertService;
import com.makerhedge.notification.TelegramNotifier;
import com.makerhedge.risk.UnhedgedExposureMonitor;
import com.makerhedge.support.MutableClock;
import com.makerhedge.support.TestStates;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class UnhedgedExposureMonitorTest {

    private static final BigDecimal A = new BigDecimal("1000");
    private static final BigDecimal B = new BigDecimal("1300");

    private MutableClock clock;
    private TelegramNotifier telegramNotifier;
    private UnhedgedExposureMonitor monitor;
    private SymbolState state;

    @BeforeEach
    void setUp() {
        // 01:00 UTC is 09:00 in the default report zone
        clock = MutableClock.startingAt("2026-01-05T01:00:00Z");
        telegramNotifier = mock(TelegramNotifier.class);
        monitor = new UnhedgedExposureMonitor(new AlertService(telegramNotifier, clock), new HedgeProperties(), clock);
        state = TestStates.btcState();
    }

    @Nested
    @DisplayName("Stuck alert")
    class StuckAlert {

        @Test
        @DisplayName("Starts the timer on the first unhedged observation")
        void startsTimer() {
            monitor.check(state, A, B);

            assertThat(state.getUnhedgedSince()).isEqualTo(clock.instant());
            verifyNoInteractions(telegramNotifier);
        }

        @Test
        @DisplayName("Fires once after six hours unhedged")
        void firesOnceAfterStuckHours() {
            monitor.check(state, A, B);
            clock.advance(Duration.ofHours(6));
            monitor.check(state, A, B);
            clock.advance(Duration.ofHours(2));
            monitor.check(state, A, B);

            assertThat(state.isStuckAlertSent()).isTrue();
            verify(telegramNotifier, times(1))
                    .send(argThat(m -> m.startsWith("Unhedged > 6h")), eq(AlertSeverity.CRITICAL));
        }

        @Test
        @DisplayName("Balanced legs reset the timer and the flag")
        void balancedResets() {
            monitor.check(state, A, B);
            clock.advance(Duration.ofHours(7));
            monitor.check(state, A, B);

            monitor.check(state, B, B);

            assertThat(state.getUnhedgedSince()).isNull();
            assertThat(state.isStuckAlertSent()).isFalse();
        }
    }

    @Nested
    @DisplayName("Daily digest")
    class DailyDigest {

        @Test
        @DisplayName("Lists stuck symbols and goes out once per day")
        void sentOncePerDay() {
            state.setUnhedgedSince(clock.instant().minus(Duration.ofHours(7)));

            assertThat(monitor.sendDailyDigest(List.of(state))).isTrue();
            assertThat(monitor.sendDailyDigest(List.of(state))).isFalse();

            verify(telegramNotifier)
                    .send(
                            argThat(m -> m.startsWith("Daily stuck hedge report:")
                                    && m.contains("BTC_USDT_Perp: unhedged 7.00h")),
                            eq(AlertSeverity.WARNING));
        }

        @Test
        @DisplayName("Nothing is sent when no symbol is stuck")
        void nothingStuck() {
            state.setUnhedgedSince(clock.instant().minus(Duration.ofHours(1)));

            assertThat(monitor.sendDailyDigest(List.of(state))).isFalse();
            verify(telegramNotifier, never()).send(argThat(m -> true), eq(AlertSeverity.WARNING));
        }
    }
}
