package com.jay.tradeledger.model;

import java.util.Map;
import java.util.Optional;

/**
 * First-match lookup over an {@link AliasedField} alias table.
 * Null values and blank strings count as absent.
 */
public final class FieldAliases {

    private FieldAliases() {}

    public static Optional<Object> first(Map<String, ?> source, AliasedField field) {
        if (source == null) return Optional.empty();
        for (String key : field.aliases()) {
            Object value = source.get(key);
            if (value == null) continue;
            if (value instanceof String s && s.isBlank()) continue;
            return Optional.of(value);
        }
        return Optional.empty();
    }

    public static Optional<String> firstText(Map<String, ?> source, AliasedField field) {
        return first(source, field).map(v -> v.toString().trim());
    }

    /** Numbers pass through; numeric strings are parsed; anything else is absent. */
    public static Optional<Double> firstDouble(Map<String, ?> source, AliasedField field) {
        return first(source, field).flatMap(FieldAliases::toDouble);
    }

    private static Optional<Double> toDouble(Object value) {
        if (value instanceof Number n) return Optional.of(n.doubleValue());
        try {
            return Optional.of(Double.parseDouble(value.toString().trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
