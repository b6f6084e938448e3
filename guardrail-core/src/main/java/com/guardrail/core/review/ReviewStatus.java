package com.guardrail.core.review;

/**
 * Lifecycle of a review item. A later operator decision replaces an earlier one.
 */
public enum ReviewStatus {

    /** Waiting for an operator. */
    PENDING,

    /** Operator marked it a false positive. */
    APPROVED,

    /** Operator confirmed it malicious. */
    REJECTED
}
