package com.guardrail.core.simulation;

/**
 * Stand-in for the agent under test. Given the agent's system prompt and one
 * user input, produce the text the agent would reply with.
 *
 * <p>
 * The default implementation is a deterministic keyword table. A deployment that
 * talks to a live agent supplies its own bean.
 * </p>
 */
@FunctionalInterface
public interface ResponseSimulator {

    String respond(String agentPrompt, String userInput);
}
