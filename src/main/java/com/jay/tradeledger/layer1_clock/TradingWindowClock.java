package com.jay.tradeledger.layer1_clock;

import com.jay.tradeledger.config.LedgerConfig;
import com.jay.tradeledger.model.TradingDayWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Layer 1: Trading Window Clock.
 * Pure wall-clock rules, evaluated in the market's time zone:
 *
 *   Trading day : 09:00 to next 09:00; before 09:00 belongs to the previous business day
 *   Sync gate   : no signal sync on business days between 09:00 and 16:00 (market hours);
 *                 on weekends/holidays only before 09:00
 *   Expiry      : a signal from yesterday expires at today's 15:30, older ones are expired
 */
@Component
@RequiredArgsConstructor
public class TradingWindowClock {

    private final LedgerConfig config;
    private final Clock clock;

    public LocalDateTime now() {
        return LocalDateTime.now(clock.withZone(ZoneId.of(config.market().getZone())));
    }

    public TradingDayWindow tradingDayWindow() {
        return tradingDayWindow(now());
    }

    public TradingDayWindow tradingDayWindow(LocalDateTime now) {
        LocalTime sessionStart = config.market().sessionStartTime();
        LocalDate today = now.toLocalDate();

        if (now.toLocalTime().isBefore(sessionStart)) {
            LocalDate tradingDay = today.minusDays(1);
            while (!isBusinessDay(tradingDay)) {
                tradingDay = tradingDay.minusDays(1);
            }
            return new TradingDayWindow(tradingDay.atTime(sessionStart), today.atTime(sessionStart));
        }
        return new TradingDayWindow(today.atTime(sessionStart), today.plusDays(1).atTime(sessionStart));
    }

    public boolean maySyncNow() {
        return maySyncNow(now());
    }

    public boolean maySyncNow(LocalDateTime now) {
        LocalTime time = now.toLocalTime();
        LocalTime sessionStart = config.market().sessionStartTime();

        if (!isBusinessDay(now.toLocalDate())) {
            // Before 09:00 still belongs to the previous trading day
            return time.isBefore(sessionStart);
        }
        boolean marketHours = !time.isBefore(sessionStart)
            && time.isBefore(config.market().syncBlackoutEndTime());
        return !marketHours;
    }

    public boolean isExpiredByMarketClose(LocalDateTime signalTs) {
        return isExpiredByMarketClose(signalTs, now());
    }

    public boolean isExpiredByMarketClose(LocalDateTime signalTs, LocalDateTime now) {
        LocalDate signalDate = signalTs.toLocalDate();
        LocalDate today = now.toLocalDate();

        if (!signalDate.isAfter(today.minusDays(2))) return true;
        return signalDate.equals(today.minusDays(1))
            && !now.isBefore(today.atTime(config.market().signalExpiryCutoffTime()));
    }

    public boolean isBusinessDay(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) return false;
        return !config.market().holidayDates().contains(date);
    }
}
