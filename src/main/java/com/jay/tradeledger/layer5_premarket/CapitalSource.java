package com.jay.tradeledger.layer5_premarket;

import com.jay.tradeledger.entity.TradeOrder;

/** Capital to deploy on a pending order. */
@FunctionalInterface
public interface CapitalSource {

    double capitalFor(TradeOrder order);
}
