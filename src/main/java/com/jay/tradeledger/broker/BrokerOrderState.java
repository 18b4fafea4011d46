package com.jay.tradeledger.broker;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** Order state as reported by the broker, normalised from free-form status text. */
public enum BrokerOrderState {
    EXECUTED,
    PARTIALLY_FILLED,
    OPEN,
    REJECTED,
    CANCELLED,
    FAILED,
    UNKNOWN;

    // Checked in order: "partially filled" must win over "filled"
    private static final Map<String, BrokerOrderState> KEYWORDS = new LinkedHashMap<>();
    static {
        KEYWORDS.put("partial", PARTIALLY_FILLED);
        KEYWORDS.put("complete", EXECUTED);
        KEYWORDS.put("executed", EXECUTED);
        KEYWORDS.put("filled", EXECUTED);
        KEYWORDS.put("traded", EXECUTED);
        KEYWORDS.put("rejected", REJECTED);
        KEYWORDS.put("cancel", CANCELLED);
        KEYWORDS.put("failed", FAILED);
        KEYWORDS.put("error", FAILED);
        KEYWORDS.put("pending", OPEN);
        KEYWORDS.put("open", OPEN);
        KEYWORDS.put("received", OPEN);
        KEYWORDS.put("trigger", OPEN);
    }

    public static BrokerOrderState parse(String status) {
        if (status == null || status.isBlank()) return UNKNOWN;
        String normalised = status.trim().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, BrokerOrderState> entry : KEYWORDS.entrySet()) {
            if (normalised.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return UNKNOWN;
    }
}
