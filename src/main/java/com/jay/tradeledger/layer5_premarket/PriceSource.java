package com.jay.tradeledger.layer5_premarket;

import java.util.Optional;

/** Premarket reference price (LTP) per symbol, supplied by the market-data side. */
@FunctionalInterface
public interface PriceSource {

    /** Empty when no quote is available. Implementations may also throw on transport errors. */
    Optional<Double> priceOf(String symbol);
}
