package com.jay.tradeledger.exception;

/**
 * The storage transaction of a ledger operation rolled back. Nothing was applied;
 * the caller may re-invoke the operation on its next tick.
 */
public class LedgerStorageException extends LedgerException {
    public LedgerStorageException(String operation, Throwable cause) {
        super(operation + " rolled back: " + cause.getMessage(), cause);
    }

    public boolean isRetriable() {
        return true;
    }
}
