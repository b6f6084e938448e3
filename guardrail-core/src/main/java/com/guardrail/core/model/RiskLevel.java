package com.guardrail.core.model;

import java.util.Locale;

/**
 * Score bands produced by the risk scorer. Each band is inclusive on its upper
 * bound.
 */
public enum RiskLevel {

    /** 0-30. Safe, allow automatically. */
    LOW(30, "ALLOW - Low risk, safe to proceed"),

    /** 31-60. Flag for human review. */
    MEDIUM(60, "REVIEW - Moderate risk, human review recommended"),

    /** 61-80. Block, an operator may override. */
    HIGH(80, "BLOCK - High risk, block with manual override option"),

    /** 81-100. Always block. */
    CRITICAL(100, "BLOCK - Critical risk, always block");

    private final int upperBound;
    private final String recommendation;

    RiskLevel(int upperBound, String recommendation) {
        this.upperBound = upperBound;
        this.recommendation = recommendation;
    }

    public int getUpperBound() {
        return upperBound;
    }

    public String getRecommendation() {
        return recommendation;
    }

    public boolean requiresReview() {
        return this == MEDIUM || this == HIGH;
    }

    public boolean isAtLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }

    /**
     * Maps a clamped score to its band.
     */
    public static RiskLevel fromScore(int score) {
        for (RiskLevel level : values()) {
            if (score <= level.upperBound) {
                return level;
            }
        }
        return CRITICAL;
    }

    public static RiskLevel fromName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Risk level must not be blank");
        }
        try {
            return RiskLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown risk level: " + value, e);
        }
    }
}
