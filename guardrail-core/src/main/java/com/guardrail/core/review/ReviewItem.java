package com.guardrail.core.review;

import com.guardrail.core.model.RiskLevel;
import com.guardrail.core.model.ScoreResult;
import com.guardrail.core.model.Threat;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One flagged input awaiting (or having received) human adjudication.
 * Everything except the status is fixed at creation.
 */
public class ReviewItem {

    private final long id;
    private final String text;
    private final int score;
    private final RiskLevel level;
    private final List<Threat> threats;
    private final List<String> reasons;
    private final Map<String, String> metadata;
    private final Instant createdAt;
    private volatile ReviewStatus status;

    ReviewItem(long id, String text, ScoreResult result, Map<String, String> metadata, Instant createdAt) {
        this.id = id;
        this.text = text;
        this.score = result.getScore();
        this.level = result.getLevel();
        this.threats = result.getThreats();
        this.reasons = result.getReasons();
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        this.createdAt = createdAt;
        this.status = ReviewStatus.PENDING;
    }

    /** Stable identifier, unaffected by later appends. */
    public long getId() {
        return id;
    }

    public String getText() {
        return text;
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

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    void setStatus(ReviewStatus status) {
        this.status = status;
    }

    @Override
    public String toString() {
        return "ReviewItem{" +
                "id=" + id +
                ", level=" + level +
                ", score=" + score +
                ", status=" + status +
                '}';
    }
}
