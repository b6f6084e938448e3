package com.guardrail.core.model;

/**
 * Result of a single executed security test (one payload, or one whole chain).
 */
public class AttackResult {

    private final String attackName;
    private final String payload;
    private final String response;
    private final boolean vulnerable;
    private final Severity severity;
    private final String description;

    public AttackResult(String attackName, String payload, String response,
            boolean vulnerable, Severity severity, String description) {
        this.attackName = attackName;
        this.payload = payload;
        this.response = response;
        this.vulnerable = vulnerable;
        this.severity = severity;
        this.description = description;
    }

    public String getAttackName() {
        return attackName;
    }

    public String getPayload() {
        return payload;
    }

    public String getResponse() {
        return response;
    }

    public boolean isVulnerable() {
        return vulnerable;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return "AttackResult{" +
                "attack='" + attackName + '\'' +
                ", vulnerable=" + vulnerable +
                ", severity=" + severity +
                '}';
    }
}
