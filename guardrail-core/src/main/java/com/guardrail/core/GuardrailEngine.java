package com.guardrail.core;

import com.guardrail.core.config.GuardrailProperties;
import com.guardrail.core.model.Category;
import com.guardrail.core.model.GuardAction;
import com.guardrail.core.model.GuardDecision;
import com.guardrail.core.model.GuardEvent;
import com.guardrail.core.model.MonitorStage;
import com.guardrail.core.model.RiskLevel;
import com.guardrail.core.model.ScoreResult;
import com.guardrail.core.model.Severity;
import com.guardrail.core.model.Threat;
import com.guardrail.core.model.ThreatSummary;
import com.guardrail.core.review.ReviewItem;
import com.guardrail.core.review.ReviewQueue;
import com.guardrail.core.scoring.RiskScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The calling point a host uses before handing text to an agent.
 * Every prompt, tool argument and chain input goes through the scorer, and the
 * result decides whether it passes, waits for review, or is stopped.
 */
public class GuardrailEngine {

    private static final Logger log = LoggerFactory.getLogger(GuardrailEngine.class);

    /** Metadata key naming the tool or input key an event came from. */
    public static final String CONTEXT_KEY = "context";
    public static final String STAGE_KEY = "stage";

    private final RiskScorer scorer;
    private final ReviewQueue reviewQueue;
    private final GuardrailProperties properties;
    private final RiskLevel blockLevel;

    private final List<GuardEvent> events = new CopyOnWriteArrayList<>();

    public GuardrailEngine(RiskScorer scorer, ReviewQueue reviewQueue, GuardrailProperties properties) {
        this.scorer = scorer;
        this.reviewQueue = reviewQueue;
        this.properties = properties;
        this.blockLevel = RiskLevel.fromName(properties.getBlockLevel());
        log.info("[Guardrail] Engine started in {} mode, blocking at {} and above",
                properties.getMode(), blockLevel);
    }

    /**
     * Score one input and decide what happens to it. Never throws for risky
     * input; see {@link #enforce} for that.
     */
    public GuardDecision inspect(MonitorStage stage, String text, Map<String, String> metadata) {
        if (!properties.isEnabled() || text == null || text.isEmpty()) {
            return GuardDecision.passThrough(stage);
        }

        ScoreResult result = scorer.score(text);
        String context = metadata != null ? metadata.get(CONTEXT_KEY) : null;

        if (result.hasThreats()) {
            events.add(GuardEvent.of(stage, text, context, result));
            for (Threat threat : result.getThreats()) {
                log.warn("[Guardrail] Threat detected at {}: {} - {}",
                        stage, threat.getCategory(), threat.getDescription());
            }
        }

        ReviewItem reviewItem = null;
        if (result.isRequiresReview() && result.getScore() >= properties.getReviewThreshold()) {
            reviewItem = reviewQueue.add(text, result, withStage(metadata, stage));
        }

        GuardAction action;
        if (result.getLevel().isAtLeast(blockLevel)) {
            if (properties.isActiveMode()) {
                log.warn("[Guardrail] BLOCKED at {}: score={} level={}", stage, result.getScore(), result.getLevel());
                action = GuardAction.BLOCK;
            } else {
                // Monitoring only, the caller still gets the input through
                log.warn("[Guardrail] WOULD HAVE BLOCKED at {}: score={} level={}",
                        stage, result.getScore(), result.getLevel());
                action = GuardAction.LOG;
            }
        } else if (reviewItem != null) {
            action = GuardAction.REVIEW;
        } else if (result.hasThreats()) {
            action = GuardAction.LOG;
        } else {
            action = GuardAction.ALLOW;
        }

        return new GuardDecision(action, stage, result, reviewItem);
    }

    /**
     * Same as {@link #inspect}, but throws when the decision is BLOCK.
     *
     * @throws InputBlockedException if the input must not reach the agent
     */
    public GuardDecision enforce(MonitorStage stage, String text, Map<String, String> metadata) {
        GuardDecision decision = inspect(stage, text, metadata);
        if (decision.isBlocked()) {
            throw new InputBlockedException(stage, decision.getScore());
        }
        return decision;
    }

    public void onPrompts(List<String> prompts) {
        for (String prompt : prompts) {
            enforce(MonitorStage.PROMPT, prompt, Map.of());
        }
    }

    public void onToolInput(String toolName, String input) {
        enforce(MonitorStage.TOOL_INPUT, input, contextOf(toolName != null ? toolName : "unknown"));
    }

    /** Only string values are inspected. */
    public void onChainInputs(Map<String, Object> inputs) {
        for (Map.Entry<String, Object> entry : inputs.entrySet()) {
            if (entry.getValue() instanceof String value) {
                enforce(MonitorStage.CHAIN_INPUT, value, contextOf(entry.getKey()));
            }
        }
    }

    public List<GuardEvent> getEvents() {
        return List.copyOf(events);
    }

    public void clearEvents() {
        events.clear();
    }

    public ThreatSummary getThreatSummary() {
        List<GuardEvent> snapshot = getEvents();
        Map<Category, Integer> byCategory = new EnumMap<>(Category.class);
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        int totalThreats = 0;

        for (GuardEvent event : snapshot) {
            totalThreats += event.threatCount();
            for (Threat threat : event.threats()) {
                byCategory.merge(threat.getCategory(), 1, Integer::sum);
                bySeverity.merge(threat.getSeverity(), 1, Integer::sum);
            }
        }
        return new ThreatSummary(snapshot.size(), totalThreats, byCategory, bySeverity);
    }

    public ReviewQueue getReviewQueue() {
        return reviewQueue;
    }

    private static Map<String, String> contextOf(String context) {
        return Map.of(CONTEXT_KEY, context);
    }

    private static Map<String, String> withStage(Map<String, String> metadata, MonitorStage stage) {
        Map<String, String> copy = new HashMap<>();
        if (metadata != null) {
            copy.putAll(metadata);
        }
        copy.putIfAbsent(STAGE_KEY, stage.name());
        return copy;
    }
}
