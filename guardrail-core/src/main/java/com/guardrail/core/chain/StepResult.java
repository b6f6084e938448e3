package com.guardrail.core.chain;

import com.guardrail.core.model.ScoreResult;

/**
 * Outcome of one step of a chain.
 *
 * @param responseRisk risk score of the simulated response
 */
public record StepResult(String step, String simulatedResponse, ScoreResult responseRisk, boolean vulnerable) {
}
