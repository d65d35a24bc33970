package com.tradeexecutor.domain.enums;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Comparison applied between an indicator value and a condition's comparison value.
 *
 * <p>Control-plane payloads use several spellings ({@code gt}, {@code greater_than},
 * {@code >}); {@link #fromWire(String)} accepts all of them.
 */
public enum ConditionOperator {
    GREATER_THAN,
    LESS_THAN,
    EQUALS,
    GREATER_OR_EQUAL,
    LESS_OR_EQUAL,
    CROSSES_ABOVE,
    CROSSES_BELOW;

    private static final Map<String, ConditionOperator> ALIASES = Map.ofEntries(
            Map.entry("GT", GREATER_THAN),
            Map.entry(">", GREATER_THAN),
            Map.entry("LT", LESS_THAN),
            Map.entry("<", LESS_THAN),
            Map.entry("EQ", EQUALS),
            Map.entry("EQUAL", EQUALS),
            Map.entry("=", EQUALS),
            Map.entry("==", EQUALS),
            Map.entry("GTE", GREATER_OR_EQUAL),
            Map.entry(">=", GREATER_OR_EQUAL),
            Map.entry("GREATER_THAN_OR_EQUAL", GREATER_OR_EQUAL),
            Map.entry("LTE", LESS_OR_EQUAL),
            Map.entry("<=", LESS_OR_EQUAL),
            Map.entry("LESS_THAN_OR_EQUAL", LESS_OR_EQUAL),
            Map.entry("BREAKS_ABOVE", CROSSES_ABOVE),
            Map.entry("BREAKS_BELOW", CROSSES_BELOW));

    public static Optional<ConditionOperator> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().replace(' ', '_').toUpperCase(Locale.ROOT);
        ConditionOperator alias = ALIASES.get(normalized);
        if (alias != null) {
            return Optional.of(alias);
        }
        try {
            return Optional.of(valueOf(normalized));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
