package com.guardrail.core.chain;

import java.util.List;

/**
 * Outcome of a whole chain. The chain is vulnerable when any step is, or when
 * any whole-chain pattern matched.
 */
public class ChainResult {

    private final AttackChain chain;
    private final List<StepResult> steps;
    private final List<String> matchedPatterns;

    public ChainResult(AttackChain chain, List<StepResult> steps, List<String> matchedPatterns) {
        this.chain = chain;
        this.steps = List.copyOf(steps);
        this.matchedPatterns = List.copyOf(matchedPatterns);
    }

    public AttackChain getChain() {
        return chain;
    }

    public List<StepResult> getSteps() {
        return steps;
    }

    /** Names of the whole-chain conjunctions that fired. */
    public List<String> getMatchedPatterns() {
        return matchedPatterns;
    }

    public long getVulnerableStepCount() {
        return steps.stream().filter(StepResult::vulnerable).count();
    }

    public boolean isPatternDetected() {
        return !matchedPatterns.isEmpty();
    }

    public boolean isChainVulnerable() {
        return getVulnerableStepCount() > 0 || isPatternDetected();
    }

    @Override
    public String toString() {
        return "ChainResult{" +
                "chain='" + chain.getName() + '\'' +
                ", vulnerableSteps=" + getVulnerableStepCount() + "/" + steps.size() +
                ", patterns=" + matchedPatterns +
                '}';
    }
}
