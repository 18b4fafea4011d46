package com.jay.tradeledger.model;

import com.jay.tradeledger.model.enums.EntryType;
import com.jay.tradeledger.model.enums.OrderSide;
import lombok.Builder;

/** A brokerage order about to be placed for one user. */
@Builder
public record PlacementRequest(
    Long userId,
    String symbol,
    OrderSide side,
    int quantity,
    Double price,
    EntryType entryType,
    OrderMetadata metadata,
    String brokerOrderId
) {}
