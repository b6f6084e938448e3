package com.guardrail.core.detect;

import com.guardrail.core.model.Threat;
import com.guardrail.core.rules.PatternRegistry;
import com.guardrail.core.rules.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Matches text against every rule in the {@link PatternRegistry}.
 *
 * <p>
 * Matching is exhaustive: each rule is evaluated independently against the full
 * text and the result keeps registry order. A rule that fails while matching is
 * logged and counted as a non-match so the rest of the scan still runs.
 * The detector holds no mutable state and is safe to share between threads.
 * </p>
 */
public class ThreatDetector {

    private static final Logger log = LoggerFactory.getLogger(ThreatDetector.class);

    private final PatternRegistry registry;

    public ThreatDetector(PatternRegistry registry) {
        this.registry = registry;
    }

    /**
     * Scan text for security threats.
     *
     * @param text input to scan, may be {@code null}
     * @return matching rules as threats, empty for null or empty input
     */
    public List<Threat> scan(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Threat> threats = new ArrayList<>();
        for (Rule rule : registry.getRules()) {
            if (matches(rule, text)) {
                threats.add(Threat.from(rule));
            }
        }
        return threats;
    }

    public PatternRegistry getRegistry() {
        return registry;
    }

    private boolean matches(Rule rule, String text) {
        try {
            return rule.matches(text);
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("[Guardrail] Rule '{}' failed while matching ({}), treating as no match",
                    rule.getId(), e.getClass().getSimpleName());
            return false;
        }
    }
}
