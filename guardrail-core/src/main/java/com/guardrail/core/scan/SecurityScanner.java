package com.guardrail.core.scan;

import com.guardrail.core.chain.AttackChainEvaluator;
import com.guardrail.core.model.AttackResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs every registered {@link AttackSuite} against an agent prompt and grades
 * the outcome.
 */
public class SecurityScanner {

    private static final Logger log = LoggerFactory.getLogger(SecurityScanner.class);

    private final List<AttackSuite> suites;
    private final AttackChainEvaluator chainEvaluator;

    public SecurityScanner(List<? extends AttackSuite> suites, AttackChainEvaluator chainEvaluator) {
        this.suites = suites.stream()
                .sorted(Comparator.comparingInt(AttackSuite::getOrder))
                .map(AttackSuite.class::cast)
                .toList();
        this.chainEvaluator = chainEvaluator;

        log.info("[Guardrail] Scanner ready with {} attack suites: {}", this.suites.size(),
                this.suites.stream().map(AttackSuite::getId).toList());
    }

    public ScanReport runScan(String agentPrompt) {
        List<AttackResult> all = new ArrayList<>();
        for (AttackSuite suite : suites) {
            List<AttackResult> results = suite.run(agentPrompt);
            log.debug("[Guardrail] [{}] {} tests executed", suite.getId(), results.size());
            all.addAll(results);
        }
        ScanReport report = new ScanReport(all);
        log.info("[Guardrail] Scan complete: {}/{} tests vulnerable, grade {}",
                report.getVulnerable(), report.getTotalTests(), report.getSecurityScore());
        return report;
    }

    public ChainScanReport runChainScan(String agentPrompt) {
        ChainScanReport report = new ChainScanReport(chainEvaluator.evaluateAll(agentPrompt));
        log.info("[Guardrail] Chain scan complete: {}/{} chains vulnerable",
                report.getVulnerableChains(), report.getTotalChains());
        return report;
    }

    public List<AttackSuite> getSuites() {
        return suites;
    }
}
