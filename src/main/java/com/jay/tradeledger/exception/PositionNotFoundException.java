package com.jay.tradeledger.exception;

public class PositionNotFoundException extends LedgerException {
    public PositionNotFoundException(Long userId, String symbol) {
        super("No open position for user " + userId + " in " + symbol);
    }
}
