package com.jay.tradeledger.model;

/**
 * Counters of one premarket adjustment run.
 * {@code total} counts the pending orders examined; the remaining fields partition it.
 */
public record AdjustmentResult(int total, int adjusted, int cancelled, int unchanged,
                               int priceUnavailable, int failed) {
}
