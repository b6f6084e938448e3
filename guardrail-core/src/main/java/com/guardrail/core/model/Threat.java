package com.guardrail.core.model;

import com.guardrail.core.rules.Rule;

import java.util.Objects;

/**
 * One rule that matched a scanned text.
 */
public class Threat {

    private final String id;
    private final Category category;
    private final Severity severity;
    private final String description;
    private final String pattern;

    public Threat(String id, Category category, Severity severity, String description, String pattern) {
        this.id = id;
        this.category = category;
        this.severity = severity;
        this.description = description;
        this.pattern = pattern;
    }

    public static Threat from(Rule rule) {
        return new Threat(rule.getId(), rule.getCategory(), rule.getSeverity(),
                rule.getDescription(), rule.getPattern().pattern());
    }

    public String getId() {
        return id;
    }

    public Category getCategory() {
        return category;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    public String getPattern() {
        return pattern;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Threat other))
            return false;
        return id.equals(other.id) && category == other.category && severity == other.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, category, severity);
    }

    @Override
    public String toString() {
        return "Threat{" +
                "id='" + id + '\'' +
                ", category=" + category +
                ", severity=" + severity +
                ", description='" + description + '\'' +
                '}';
    }
}
