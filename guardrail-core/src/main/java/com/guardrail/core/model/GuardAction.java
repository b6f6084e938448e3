package com.guardrail.core.model;

public enum GuardAction {
    /** Nothing found. */
    ALLOW,
    /** Something found, input passes but is logged. */
    LOG,
    /** Input passes and waits in the review queue. */
    REVIEW,
    /** Input must not reach the agent. */
    BLOCK
}
