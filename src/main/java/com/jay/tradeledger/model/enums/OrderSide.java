package com.jay.tradeledger.model.enums;

public enum OrderSide {
    BUY,
    SELL
}
