package com.guardrail.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Threat counts over the monitor's recorded events. Both maps iterate in enum order.
 */
public record ThreatSummary(int totalEvents, int totalThreats, Map<Category, Integer> byCategory,
        Map<Severity, Integer> bySeverity) {

    public ThreatSummary {
        byCategory = Collections.unmodifiableMap(copyOf(Category.class, byCategory));
        bySeverity = Collections.unmodifiableMap(copyOf(Severity.class, bySeverity));
    }

    private static <K extends Enum<K>> EnumMap<K, Integer> copyOf(Class<K> type, Map<K, Integer> counts) {
        EnumMap<K, Integer> copy = new EnumMap<>(type);
        copy.putAll(counts);
        return copy;
    }
}
