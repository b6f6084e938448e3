package com.guardrail.core.rules;

import com.guardrail.core.model.Category;
import com.guardrail.core.model.Severity;

/**
 * Uncompiled rule as declared by a {@link RulePack}. Compilation happens once,
 * when the {@link PatternRegistry} is loaded.
 *
 * @param framework taxonomy references (OWASP, CWE), may be empty
 */
public record RuleDefinition(String id, Category category, String pattern, Severity severity,
        String description, String framework) {

    public RuleDefinition(String id, Category category, String pattern, Severity severity, String description) {
        this(id, category, pattern, severity, description, "");
    }
}
