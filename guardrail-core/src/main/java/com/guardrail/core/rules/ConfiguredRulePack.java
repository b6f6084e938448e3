package com.guardrail.core.rules;

import com.guardrail.core.config.GuardrailProperties;
import com.guardrail.core.config.GuardrailProperties.CustomRuleProperties;
import com.guardrail.core.model.Category;
import com.guardrail.core.model.Severity;

import java.util.ArrayList;
import java.util.List;

/**
 * Rules declared under {@code guardrail.custom-rules}. They are evaluated after
 * every built-in pack.
 */
public class ConfiguredRulePack implements RulePack {

    public static final String ID = "custom-rules";

    private final List<RuleDefinition> rules;

    public ConfiguredRulePack(GuardrailProperties properties) {
        this.rules = toDefinitions(properties.getCustomRules());
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Custom Rules";
    }

    @Override
    public int getOrder() {
        return 1000;
    }

    @Override
    public List<RuleDefinition> getRules() {
        return rules;
    }

    private static List<RuleDefinition> toDefinitions(List<CustomRuleProperties> customRules) {
        List<RuleDefinition> definitions = new ArrayList<>();
        if (customRules == null) {
            return definitions;
        }
        for (CustomRuleProperties custom : customRules) {
            try {
                definitions.add(new RuleDefinition(
                        custom.getId(),
                        Category.fromId(custom.getCategory()),
                        custom.getPattern(),
                        Severity.fromName(custom.getSeverity()),
                        custom.getDescription() != null ? custom.getDescription() : "Custom rule " + custom.getId(),
                        custom.getFramework() != null ? custom.getFramework() : ""));
            } catch (IllegalArgumentException e) {
                throw new RuleConfigurationException(
                        "Custom rule '" + custom.getId() + "' is invalid: " + e.getMessage(), e);
            }
        }
        return List.copyOf(definitions);
    }
}
