package com.jay.tradeledger.exception;

public class InvalidOrderMetadataException extends LedgerException {
    public InvalidOrderMetadataException(String message) {
        super(message);
    }
}
