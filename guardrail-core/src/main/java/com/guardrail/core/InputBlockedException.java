package com.guardrail.core;

import com.guardrail.core.model.MonitorStage;
import com.guardrail.core.model.RiskLevel;
import com.guardrail.core.model.ScoreResult;

/**
 * Thrown by {@link GuardrailEngine#enforce} when an input must not reach the
 * agent.
 */
public class InputBlockedException extends RuntimeException {

    private final int score;
    private final RiskLevel level;
    private final String recommendation;
    private final MonitorStage stage;

    public InputBlockedException(MonitorStage stage, ScoreResult result) {
        super("Blocked " + result.getLevel() + " risk input at " + stage
                + " (score " + result.getScore() + "): " + result.getRecommendation());
        this.score = result.getScore();
        this.level = result.getLevel();
        this.recommendation = result.getRecommendation();
        this.stage = stage;
    }

    public int getScore() {
        return score;
    }

    public RiskLevel getLevel() {
        return level;
    }

    public String getRecommendation() {
        return recommendation;
    }

    public MonitorStage getStage() {
        return stage;
    }
}
