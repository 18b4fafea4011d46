package com.jay.tradeledger.model.enums;

import java.util.EnumSet;
import java.util.Set;

public enum OrderStatus {
    PENDING,        // placement attempted, awaiting execution (AMO)
    ONGOING,        // executed, holding
    FAILED,
    RETRY_PENDING,
    REJECTED,       // broker-side rejection
    CLOSED;         // cancelled before execution

    private static final Set<OrderStatus> AWAITING_EXECUTION = EnumSet.of(PENDING, RETRY_PENDING);

    public boolean isAwaitingExecution() {
        return AWAITING_EXECUTION.contains(this);
    }
}
