package com.jay.tradeledger.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One recommendation as delivered by the analysis pipeline: a symbol (or ticker),
 * a verdict and an open set of indicator attributes carried through unchanged.
 */
public final class SignalPayload {

    private static final Set<String> COLUMN_KEYS = Set.of("symbol", "ticker", "verdict", "final_verdict");

    private final Map<String, Object> attributes;

    public SignalPayload(Map<String, ?> attributes) {
        this.attributes = attributes == null ? Map.of() : new LinkedHashMap<>(attributes);
    }

    public static SignalPayload of(Map<String, ?> attributes) {
        return new SignalPayload(attributes);
    }

    /** Upper-cased symbol; a ticker has its exchange suffix stripped. */
    public Optional<String> symbol(Collection<String> tickerSuffixes) {
        Optional<String> symbol = FieldAliases.firstText(attributes, SignalField.SYMBOL);
        if (symbol.isPresent()) {
            return symbol.map(s -> s.toUpperCase(Locale.ROOT));
        }
        return FieldAliases.firstText(attributes, SignalField.TICKER)
            .map(t -> stripSuffix(t.toUpperCase(Locale.ROOT), tickerSuffixes))
            .filter(s -> !s.isBlank());
    }

    /** First non-blank of final_verdict, verdict, ml_verdict; lower-cased. */
    public Optional<String> verdict() {
        return FieldAliases.firstText(attributes, SignalField.VERDICT).map(v -> v.toLowerCase(Locale.ROOT));
    }

    public Optional<String> rawVerdict() {
        return FieldAliases.firstText(attributes, SignalField.BASE_VERDICT);
    }

    public Optional<String> rawFinalVerdict() {
        return FieldAliases.firstText(attributes, SignalField.FINAL_VERDICT);
    }

    /** Everything except the keys stored in dedicated columns. */
    public Map<String, Object> indicators() {
        Map<String, Object> indicators = new LinkedHashMap<>(attributes);
        indicators.keySet().removeAll(COLUMN_KEYS);
        return indicators;
    }

    private static String stripSuffix(String ticker, Collection<String> suffixes) {
        for (String suffix : suffixes) {
            String upper = suffix.toUpperCase(Locale.ROOT);
            if (ticker.endsWith(upper)) {
                return ticker.substring(0, ticker.length() - upper.length());
            }
        }
        return ticker;
    }

    @Override
    public String toString() {
        return "SignalPayload" + attributes;
    }
}
