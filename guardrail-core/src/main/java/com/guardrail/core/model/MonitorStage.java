package com.guardrail.core.model;

/**
 * Where in an agent's run a text was intercepted.
 */
public enum MonitorStage {
    /** Prompt about to be sent to the model. */
    PROMPT,
    /** Argument about to be handed to a tool. */
    TOOL_INPUT,
    /** Input value of a chain or workflow step. */
    CHAIN_INPUT
}
