package com.guardrail.core.review;

/**
 * Counts of review items by status. The three status counts always add up to
 * {@code total}.
 */
public record ReviewSummary(int total, int pending, int approved, int rejected) {
}
