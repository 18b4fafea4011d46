package com.jay.tradeledger.layer1_clock;

import com.jay.tradeledger.config.LedgerConfig;
import com.jay.tradeledger.model.TradingDayWindow;
import com.jay.tradeledger.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TradingWindowClockTest {

    // 2024-01-08 is a Monday
    private static final LocalDate MONDAY = LocalDate.of(2024, 1, 8);
    private static final LocalDate SATURDAY = LocalDate.of(2024, 1, 6);

    private final LedgerConfig config = new LedgerConfig(new MockEnvironment(), "ledger.yaml");
    private final TradingWindowClock clock = new TradingWindowClock(config, MutableClock.at(MONDAY.atTime(12, 0)));

    @Test
    void syncAllowedBeforeSessionStartOnWeekday() {
        assertThat(clock.maySyncNow(MONDAY.atTime(8, 59, 59))).isTrue();
        assertThat(clock.maySyncNow(MONDAY.atTime(9, 0, 0))).isFalse();
    }

    @Test
    void syncBlockedUntilFourPm() {
        assertThat(clock.maySyncNow(MONDAY.atTime(15, 59, 59))).isFalse();
        assertThat(clock.maySyncNow(MONDAY.atTime(16, 0, 0))).isTrue();
        assertThat(clock.maySyncNow(MONDAY.atTime(23, 30))).isTrue();
    }

    @Test
    void weekendSyncOnlyBeforeSessionStart() {
        assertThat(clock.maySyncNow(SATURDAY.atTime(8, 30))).isTrue();
        assertThat(clock.maySyncNow(SATURDAY.atTime(9, 0))).isFalse();
        assertThat(clock.maySyncNow(SATURDAY.atTime(20, 0))).isFalse();
    }

    @Test
    void configuredHolidayBehavesLikeWeekend() {
        LedgerConfig holidayConfig = new LedgerConfig(new MockEnvironment(), "ledger.yaml");
        holidayConfig.market().setHolidays(List.of("2024-01-26"));
        TradingWindowClock holidayClock = new TradingWindowClock(holidayConfig, MutableClock.at(MONDAY.atTime(12, 0)));

        assertThat(holidayClock.isBusinessDay(LocalDate.of(2024, 1, 26))).isFalse();
        assertThat(holidayClock.maySyncNow(LocalDateTime.of(2024, 1, 26, 18, 0))).isFalse();
    }

    @Test
    void tradingDayStartsAtNine() {
        TradingDayWindow window = clock.tradingDayWindow(MONDAY.atTime(10, 15));

        assertThat(window.start()).isEqualTo(MONDAY.atTime(9, 0));
        assertThat(window.end()).isEqualTo(MONDAY.plusDays(1).atTime(9, 0));
    }

    @Test
    void earlyMondayBelongsToFriday() {
        TradingDayWindow window = clock.tradingDayWindow(MONDAY.atTime(7, 0));

        assertThat(window.start()).isEqualTo(LocalDate.of(2024, 1, 5).atTime(9, 0));
        assertThat(window.end()).isEqualTo(MONDAY.atTime(9, 0));
        assertThat(window.contains(MONDAY.atTime(8, 59))).isTrue();
        assertThat(window.contains(MONDAY.atTime(9, 0))).isFalse();
    }

    @Test
    void yesterdaysSignalExpiresAtThreeThirty() {
        LocalDateTime yesterday = MONDAY.minusDays(1).atTime(18, 0);

        assertThat(clock.isExpiredByMarketClose(yesterday, MONDAY.atTime(15, 29))).isFalse();
        assertThat(clock.isExpiredByMarketClose(yesterday, MONDAY.atTime(15, 30))).isTrue();
        assertThat(clock.isExpiredByMarketClose(MONDAY.minusDays(2).atTime(18, 0), MONDAY.atTime(8, 0))).isTrue();
        assertThat(clock.isExpiredByMarketClose(MONDAY.atTime(7, 0), MONDAY.atTime(20, 0))).isFalse();
    }

    @Test
    void nowIsMarketLocalTime() {
        assertThat(clock.now()).isEqualTo(MONDAY.atTime(12, 0));
    }
}
