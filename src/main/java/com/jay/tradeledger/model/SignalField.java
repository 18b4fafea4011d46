package com.jay.tradeledger.model;

import java.util.List;

/** Alias table for the signal payloads produced by the analysis pipeline. */
public enum SignalField implements AliasedField {
    SYMBOL("symbol"),
    TICKER("ticker"),
    VERDICT("final_verdict", "verdict", "ml_verdict"),
    BASE_VERDICT("verdict"),
    FINAL_VERDICT("final_verdict");

    private final List<String> aliases;

    SignalField(String... aliases) {
        this.aliases = List.of(aliases);
    }

    @Override
    public List<String> aliases() {
        return aliases;
    }
}
