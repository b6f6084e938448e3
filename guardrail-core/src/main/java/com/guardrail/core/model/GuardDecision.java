package com.guardrail.core.model;

import com.guardrail.core.review.ReviewItem;

import java.util.Optional;

/**
 * What the monitor decided for one intercepted input.
 */
public class GuardDecision {

    private final GuardAction action;
    private final MonitorStage stage;
    private final ScoreResult score;
    private final ReviewItem reviewItem;

    public GuardDecision(GuardAction action, MonitorStage stage, ScoreResult score, ReviewItem reviewItem) {
        this.action = action;
        this.stage = stage;
        this.score = score;
        this.reviewItem = reviewItem;
    }

    /** Decision for input that was never inspected. */
    public static GuardDecision passThrough(MonitorStage stage) {
        return new GuardDecision(GuardAction.ALLOW, stage, ScoreResult.empty(), null);
    }

    public GuardAction getAction() {
        return action;
    }

    public MonitorStage getStage() {
        return stage;
    }

    public ScoreResult getScore() {
        return score;
    }

    /** The queued item, when the input was sent to review. */
    public Optional<ReviewItem> getReviewItem() {
        return Optional.ofNullable(reviewItem);
    }

    public boolean isBlocked() {
        return action == GuardAction.BLOCK;
    }

    @Override
    public String toString() {
        return "GuardDecision{" +
                "action=" + action +
                ", stage=" + stage +
                ", score=" + score.getScore() +
                ", level=" + score.getLevel() +
                '}';
    }
}
