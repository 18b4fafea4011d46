package com.jay.tradeledger.model;

/** Counters of one batch of broker order callbacks. */
public record OrderUpdateSummary(int applied, int unchanged, int illegal, int skipped) {
}
