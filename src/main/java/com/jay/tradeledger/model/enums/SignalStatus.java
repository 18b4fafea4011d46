package com.jay.tradeledger.model.enums;

public enum SignalStatus {
    ACTIVE,
    REJECTED,
    EXPIRED,
    TRADED
}
