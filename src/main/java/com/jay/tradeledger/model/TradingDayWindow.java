package com.jay.tradeledger.model;

import java.time.LocalDateTime;

/** Half-open interval [start, end) of one trading day. */
public record TradingDayWindow(LocalDateTime start, LocalDateTime end) {

    public boolean contains(LocalDateTime ts) {
        return !ts.isBefore(start) && ts.isBefore(end);
    }
}
