package com.guardrail.core.model;

import java.util.Locale;

/**
 * Attack taxonomies a detection rule can belong to.
 */
public enum Category {

    PROMPT_INJECTION,
    JAILBREAK,
    CONTEXT_MANIPULATION,
    TOOL_MISUSE,
    SQL_INJECTION,
    COMMAND_INJECTION,
    FILE_MANIPULATION,
    NETWORK_EXPLOIT,
    DATA_EXFILTRATION;

    /** Wire name, e.g. {@code sql_injection}. */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts either the wire name or the enum constant name, case-insensitively.
     */
    public static Category fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Category must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Category.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown category: " + value, e);
        }
    }

    @Override
    public String toString() {
        return id();
    }
}
