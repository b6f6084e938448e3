package com.guardrail.core.rules;

import com.guardrail.core.config.GuardrailProperties;

import java.util.List;

/**
 * The plugin interface every rule module implements. A pack contributes an
 * ordered list of rule definitions for one or more attack categories.
 *
 * <p>
 * Packs are discovered automatically via Spring's component scanning.
 * Simply annotate your implementation with {@code @Component}.
 * </p>
 */
public interface RulePack {

    /**
     * Unique identifier for this pack. Used in configuration keys:
     * {@code guardrail.modules.{id}.enabled}
     */
    String getId();

    /**
     * Human-readable name for logging and reports.
     */
    String getName();

    /**
     * Position of this pack's rules in the registry. Lower values come first.
     * Built-in packs use 100 (prompt-injection) and 200 (tool-misuse).
     */
    default int getOrder() {
        return 500;
    }

    /**
     * The rule definitions, in the order they should be evaluated and reported.
     */
    List<RuleDefinition> getRules();

    /**
     * Whether this pack is enabled. Checked against configuration.
     */
    default boolean isEnabled(GuardrailProperties properties) {
        return properties.isModuleEnabled(getId());
    }
}
