package com.jay.tradeledger.model;

public record ReconcileResult(int inserted, int updated, int skipped, int expired) {

    public static ReconcileResult gated(int batchSize) {
        return new ReconcileResult(0, 0, batchSize, 0);
    }
}
