package com.guardrail.core.chain;

import java.util.List;

/**
 * All-of keyword conjunction checked against a whole chain. Each keyword alone
 * is ordinary; all of them together in one conversation are not.
 *
 * @param keywords lower-case substrings that must all be present
 */
public record ChainPattern(String name, List<String> keywords) {

    public ChainPattern {
        if (keywords == null || keywords.isEmpty()) {
            throw new IllegalArgumentException("Chain pattern '" + name + "' needs at least one keyword");
        }
        keywords = List.copyOf(keywords);
    }

    boolean matches(String lowerCombined) {
        return keywords.stream().allMatch(lowerCombined::contains);
    }
}
