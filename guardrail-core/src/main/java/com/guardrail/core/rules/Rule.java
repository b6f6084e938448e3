package com.guardrail.core.rules;

import com.guardrail.core.model.Category;
import com.guardrail.core.model.Severity;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A compiled detection rule. Patterns are always case-insensitive and are
 * evaluated with {@link java.util.regex.Matcher#find()}, never as a full match.
 */
public final class Rule {

    private final String id;
    private final Category category;
    private final Pattern pattern;
    private final Severity severity;
    private final String description;
    private final String framework;

    private Rule(String id, Category category, Pattern pattern, Severity severity,
            String description, String framework) {
        this.id = id;
        this.category = category;
        this.pattern = pattern;
        this.severity = severity;
        this.description = description;
        this.framework = framework;
    }

    /**
     * Compiles a definition.
     *
     * @throws RuleConfigurationException if a field is missing or the pattern does
     *                                    not compile
     */
    public static Rule compile(RuleDefinition definition) {
        if (definition.id() == null || definition.id().isBlank()) {
            throw new RuleConfigurationException("Rule id must not be blank: " + definition);
        }
        if (definition.category() == null || definition.severity() == null) {
            throw new RuleConfigurationException(
                    "Rule " + definition.id() + " must declare a category and a severity");
        }
        if (definition.pattern() == null || definition.pattern().isEmpty()) {
            throw new RuleConfigurationException("Rule " + definition.id() + " has an empty pattern");
        }
        try {
            Pattern compiled = Pattern.compile(definition.pattern(),
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            return new Rule(definition.id(), definition.category(), compiled, definition.severity(),
                    definition.description() != null ? definition.description() : "",
                    definition.framework() != null ? definition.framework() : "");
        } catch (PatternSyntaxException e) {
            throw new RuleConfigurationException(
                    "Rule " + definition.id() + " has an invalid pattern: " + e.getDescription(), e);
        }
    }

    public boolean matches(String text) {
        return pattern.matcher(text).find();
    }

    public String getId() {
        return id;
    }

    public Category getCategory() {
        return category;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    public String getFramework() {
        return framework;
    }

    @Override
    public String toString() {
        return "Rule{" + id + ", " + category + ", " + severity + '}';
    }
}
