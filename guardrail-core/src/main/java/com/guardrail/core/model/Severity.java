package com.guardrail.core.model;

import java.util.Locale;

/**
 * Severity of a single detection rule. Declared in ascending order so that
 * {@link #compareTo} follows LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL.
 */
public enum Severity {

    /** Weak signal on its own. */
    LOW,

    /** Suspicious, worth a closer look. */
    MEDIUM,

    /** Likely malicious. */
    HIGH,

    /** Destructive or clearly hostile. */
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    public static Severity fromName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity must not be blank");
        }
        try {
            return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: " + value, e);
        }
    }
}
