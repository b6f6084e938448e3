package com.guardrail.core.scoring;

import com.guardrail.core.config.GuardrailProperties.ScoringProperties;
import com.guardrail.core.detect.ThreatDetector;
import com.guardrail.core.model.RiskLevel;
import com.guardrail.core.model.ScoreResult;
import com.guardrail.core.model.Severity;
import com.guardrail.core.model.Threat;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns detector hits and keyword heuristics into a bounded 0-100 score.
 *
 * <p>
 * The steps always run in the same order so the reasons list is reproducible:
 * </p>
 * <ol>
 * <li>severity points for every detected threat, one reason per threat</li>
 * <li>aggravating keywords, one combined reason</li>
 * <li>mitigating phrases, one combined reason, never below zero</li>
 * <li>clamp to [0, 100] and map to a {@link RiskLevel}</li>
 * </ol>
 */
public class RiskScorer {

    static final int MIN_SCORE = 0;
    static final int MAX_SCORE = 100;

    private final ThreatDetector detector;
    private final ScoringProperties weights;
    private final List<String> aggravatingKeywords;
    private final List<String> mitigatingPhrases;

    public RiskScorer(ThreatDetector detector, ScoringProperties weights) {
        this.detector = detector;
        this.weights = weights;
        this.aggravatingKeywords = normalize(weights.getAggravatingKeywords());
        this.mitigatingPhrases = normalize(weights.getMitigatingPhrases());
    }

    public ScoreResult score(String text) {
        List<Threat> threats = detector.scan(text);
        List<String> reasons = new ArrayList<>();
        int score = 0;

        for (Threat threat : threats) {
            int points = pointsFor(threat.getSeverity());
            score += points;
            reasons.add("+" + points + ": " + threat.getDescription());
        }

        String lower = text != null ? text.toLowerCase(Locale.ROOT) : "";

        List<String> aggravating = findPresent(lower, aggravatingKeywords);
        if (!aggravating.isEmpty()) {
            int bonus = aggravating.size() * weights.getAggravatingWeight();
            score += bonus;
            reasons.add("+" + bonus + ": Malicious keywords: " + String.join(", ", aggravating));
        }

        List<String> mitigating = findPresent(lower, mitigatingPhrases);
        if (!mitigating.isEmpty()) {
            int reduction = mitigating.size() * weights.getMitigatingWeight();
            score = Math.max(MIN_SCORE, score - reduction);
            reasons.add("-" + reduction + ": Legitimate intent: " + String.join(", ", mitigating));
        }

        score = Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
        return new ScoreResult(score, RiskLevel.fromScore(score), threats, reasons);
    }

    /** HIGH and CRITICAL results should not be forwarded. */
    public boolean shouldBlock(ScoreResult result) {
        return result.getLevel().isAtLeast(RiskLevel.HIGH);
    }

    public boolean requiresHumanReview(ScoreResult result) {
        return result.isRequiresReview();
    }

    public ThreatDetector getDetector() {
        return detector;
    }

    int pointsFor(Severity severity) {
        return switch (severity) {
            case CRITICAL -> weights.getCriticalPoints();
            case HIGH -> weights.getHighPoints();
            case MEDIUM -> weights.getMediumPoints();
            case LOW -> weights.getLowPoints();
        };
    }

    private static List<String> findPresent(String lower, List<String> candidates) {
        List<String> found = new ArrayList<>();
        for (String candidate : candidates) {
            if (lower.contains(candidate)) {
                found.add(candidate);
            }
        }
        return found;
    }

    // Lower-cased and deduplicated, so "distinct matches" is just the list size.
    private static List<String> normalize(List<String> keywords) {
        List<String> normalized = new ArrayList<>();
        if (keywords == null) {
            return normalized;
        }
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            String lower = keyword.toLowerCase(Locale.ROOT);
            if (!normalized.contains(lower)) {
                normalized.add(lower);
            }
        }
        return List.copyOf(normalized);
    }
}
