package com.guardrail.core.model;

import java.time.Instant;
import java.util.List;

/**
 * One intercepted input that matched at least one rule.
 *
 * @param text    the input, cut to {@link #MAX_TEXT_LENGTH} characters
 * @param context tool name or input key, may be null
 */
public record GuardEvent(MonitorStage stage, String text, String context, List<Threat> threats, int score,
        Instant timestamp) {

    public static final int MAX_TEXT_LENGTH = 100;

    public GuardEvent {
        threats = List.copyOf(threats);
    }

    public static GuardEvent of(MonitorStage stage, String text, String context, ScoreResult result) {
        String truncated = text.length() > MAX_TEXT_LENGTH ? text.substring(0, MAX_TEXT_LENGTH) : text;
        return new GuardEvent(stage, truncated, context, result.getThreats(), result.getScore(), Instant.now());
    }

    public int threatCount() {
        return threats.size();
    }
}
