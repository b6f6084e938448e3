package com.guardrail.core.chain;

import com.guardrail.core.model.ScoreResult;
import com.guardrail.core.scoring.RiskScorer;
import com.guardrail.core.simulation.CompromiseIndicators;
import com.guardrail.core.simulation.ResponseSimulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs attack chains against an agent prompt.
 *
 * <p>
 * Two independent checks are OR-ed together:
 * </p>
 * <ol>
 * <li>per step: the simulated response shows a compromise indicator, or the
 * scorer would block it</li>
 * <li>whole chain: the lower-cased, space-joined steps satisfy one of the
 * library's keyword conjunctions. This catches decomposed attacks where no
 * single step looks dangerous.</li>
 * </ol>
 */
public class AttackChainEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AttackChainEvaluator.class);

    private final AttackChainLibrary library;
    private final ResponseSimulator simulator;
    private final CompromiseIndicators indicators;
    private final RiskScorer scorer;

    public AttackChainEvaluator(AttackChainLibrary library, ResponseSimulator simulator,
            CompromiseIndicators indicators, RiskScorer scorer) {
        this.library = library;
        this.simulator = simulator;
        this.indicators = indicators;
        this.scorer = scorer;
    }

    public List<ChainResult> evaluateAll(String agentPrompt) {
        List<ChainResult> results = new ArrayList<>();
        for (AttackChain chain : library.getChains()) {
            results.add(evaluate(chain, agentPrompt));
        }
        return results;
    }

    public ChainResult evaluate(AttackChain chain, String agentPrompt) {
        List<StepResult> steps = new ArrayList<>();
        for (String step : chain.getSteps()) {
            String response = simulator.respond(agentPrompt, step);
            ScoreResult responseRisk = scorer.score(response);
            boolean vulnerable = indicators.isCompromised(response, agentPrompt)
                    || scorer.shouldBlock(responseRisk);
            steps.add(new StepResult(step, response, responseRisk, vulnerable));
        }

        List<String> matched = matchPatterns(chain.getSteps());
        ChainResult result = new ChainResult(chain, steps, matched);

        if (result.isChainVulnerable()) {
            log.warn("[Guardrail] Chain '{}' VULNERABLE: {}/{} steps, patterns={}",
                    chain.getName(), result.getVulnerableStepCount(), steps.size(), matched);
        } else {
            log.debug("[Guardrail] Chain '{}' held", chain.getName());
        }
        return result;
    }

    /**
     * Names of the conjunctions satisfied by the combined steps.
     */
    public List<String> matchPatterns(List<String> steps) {
        String combined = String.join(" ", steps).toLowerCase(Locale.ROOT);
        List<String> matched = new ArrayList<>();
        for (ChainPattern pattern : library.getPatterns()) {
            if (pattern.matches(combined)) {
                matched.add(pattern.name());
            }
        }
        return matched;
    }

    public AttackChainLibrary getLibrary() {
        return library;
    }
}
