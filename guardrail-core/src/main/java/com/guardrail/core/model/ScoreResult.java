package com.guardrail.core.model;

import java.util.List;

/**
 * Outcome of scoring a single text: the clamped score, its band, and the audit
 * trail that produced it.
 */
public class ScoreResult {

    private final int score;
    private final RiskLevel level;
    private final List<Threat> threats;
    private final List<String> reasons;

    public ScoreResult(int score, RiskLevel level, List<Threat> threats, List<String> reasons) {
        this.score = score;
        this.level = level;
        this.threats = threats != null ? List.copyOf(threats) : List.of();
        this.reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }

    /** Score for input that was never inspected. */
    public static ScoreResult empty() {
        return new ScoreResult(0, RiskLevel.LOW, List.of(), List.of());
    }

    public int getScore() {
        return score;
    }

    public RiskLevel getLevel() {
        return level;
    }

    public List<Threat> getThreats() {
        return threats;
    }

    public List<String> getReasons() {
        return reasons;
    }

    public String getRecommendation() {
        return level.getRecommendation();
    }

    public boolean isRequiresReview() {
        return level.requiresReview();
    }

    public boolean hasThreats() {
        return !threats.isEmpty();
    }

    @Override
    public String toString() {
        return "ScoreResult{" +
                "score=" + score +
                ", level=" + level +
                ", threats=" + threats.size() +
                ", reasons=" + reasons +
                '}';
    }
}
