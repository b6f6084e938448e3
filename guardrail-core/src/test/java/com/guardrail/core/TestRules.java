package com.guardrail.core;

import com.guardrail.core.config.GuardrailProperties.ScoringProperties;
import com.guardrail.core.detect.ThreatDetector;
import com.guardrail.core.model.Category;
import com.guardrail.core.model.Severity;
import com.guardrail.core.rules.PatternRegistry;
import com.guardrail.core.rules.RuleDefinition;
import com.guardrail.core.rules.RulePack;
import com.guardrail.core.scoring.RiskScorer;

import java.util.List;

/**
 * Small rule set with one rule per severity, shared by the core tests.
 */
public final class TestRules {

    public static final RulePack PACK = pack("test", 100,
            new RuleDefinition("T-CRIT", Category.SQL_INJECTION, "drop\\s+table", Severity.CRITICAL,
                    "Table drop"),
            new RuleDefinition("T-HIGH", Category.PROMPT_INJECTION, "\\bignore\\s+(all|previous)\\b", Severity.HIGH,
                    "Instruction override"),
            new RuleDefinition("T-MED", Category.JAILBREAK, "\\bpretend\\b", Severity.MEDIUM,
                    "Persona switch"),
            new RuleDefinition("T-LOW", Category.JAILBREAK, "\\bhypothetically\\b", Severity.LOW,
                    "Hypothetical framing"));

    private TestRules() {
    }

    public static RulePack pack(String id, int order, RuleDefinition... rules) {
        List<RuleDefinition> definitions = List.of(rules);
        return new RulePack() {
            @Override
            public String getId() {
                return id;
            }

            @Override
            public String getName() {
                return id;
            }

            @Override
            public int getOrder() {
                return order;
            }

            @Override
            public List<RuleDefinition> getRules() {
                return definitions;
            }
        };
    }

    public static PatternRegistry registry() {
        return PatternRegistry.load(List.of(PACK));
    }

    public static RiskScorer scorer() {
        return new RiskScorer(new ThreatDetector(registry()), new ScoringProperties());
    }
}
