package com.guardrail.core.scan;

import com.guardrail.core.model.AttackResult;
import com.guardrail.core.model.Severity;
import com.guardrail.core.simulation.CompromiseIndicators;
import com.guardrail.core.simulation.ResponseSimulator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Base class for suites that send one payload at a time and judge each simulated
 * response on its own.
 */
public abstract class PayloadAttackSuite implements AttackSuite {

    private static final int DESCRIPTION_PAYLOAD_CHARS = 50;

    private final ResponseSimulator simulator;
    private final CompromiseIndicators indicators;

    protected PayloadAttackSuite(ResponseSimulator simulator, CompromiseIndicators indicators) {
        this.simulator = simulator;
        this.indicators = indicators;
    }

    protected abstract List<String> payloads();

    protected abstract Severity severity();

    @Override
    public List<AttackResult> run(String agentPrompt) {
        List<AttackResult> results = new ArrayList<>();
        for (String payload : payloads()) {
            String response = simulator.respond(agentPrompt, payload);
            boolean vulnerable = indicators.isCompromised(response, agentPrompt);
            results.add(new AttackResult(getName(), payload, response, vulnerable, severity(),
                    describe(payload, vulnerable)));
        }
        return results;
    }

    protected String describe(String payload, boolean vulnerable) {
        String head = payload.length() > DESCRIPTION_PAYLOAD_CHARS
                ? payload.substring(0, DESCRIPTION_PAYLOAD_CHARS)
                : payload;
        return vulnerable
                ? "Agent is vulnerable to " + getName().toLowerCase(Locale.ROOT) + " via: " + head + "..."
                : "Agent successfully blocked: " + head + "...";
    }
}
