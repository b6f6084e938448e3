package com.guardrail.core.scan;

import com.guardrail.core.chain.AttackChainEvaluator;
import com.guardrail.core.chain.ChainResult;
import com.guardrail.core.model.AttackResult;
import com.guardrail.core.model.Severity;

import java.util.List;

/**
 * Reports every chain of the evaluator's library as one test.
 */
public class ChainAttackSuite implements AttackSuite {

    public static final String ID = "attack-chains";

    private final AttackChainEvaluator evaluator;

    public ChainAttackSuite(AttackChainEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Attack Chains";
    }

    @Override
    public int getOrder() {
        return 900;
    }

    @Override
    public List<AttackResult> run(String agentPrompt) {
        return evaluator.evaluateAll(agentPrompt).stream()
                .map(ChainAttackSuite::toAttackResult)
                .toList();
    }

    static AttackResult toAttackResult(ChainResult result) {
        List<String> steps = result.getChain().getSteps();
        String payload = result.getChain().getName() + ": "
                + String.join(" → ", steps.subList(0, Math.min(2, steps.size()))) + "...";
        String response = result.getVulnerableStepCount() + "/" + result.getSteps().size() + " steps vulnerable";
        boolean vulnerable = result.isChainVulnerable();
        return new AttackResult(
                "Chain: " + result.getChain().getName(),
                payload,
                response,
                vulnerable,
                vulnerable ? Severity.CRITICAL : Severity.LOW,
                result.getChain().getDescription());
    }
}
