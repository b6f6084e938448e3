package com.guardrail.core.scan;

import com.guardrail.core.model.AttackResult;

import java.util.List;

/**
 * A group of security tests run against an agent's system prompt.
 *
 * <p>
 * Suites are discovered the same way rule packs are: any bean implementing this
 * interface is picked up by the {@link SecurityScanner}.
 * </p>
 */
public interface AttackSuite {

    /** Unique suite identifier, e.g. "prompt-injection". */
    String getId();

    String getName();

    /** Lower runs first. */
    default int getOrder() {
        return 500;
    }

    List<AttackResult> run(String agentPrompt);
}
