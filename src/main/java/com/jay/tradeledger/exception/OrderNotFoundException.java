package com.jay.tradeledger.exception;

public class OrderNotFoundException extends LedgerException {
    public OrderNotFoundException(String message) {
        super(message);
    }
}
