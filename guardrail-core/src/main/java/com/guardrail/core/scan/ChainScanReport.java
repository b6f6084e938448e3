package com.guardrail.core.scan;

import com.guardrail.core.chain.ChainResult;

import java.util.List;

public class ChainScanReport {

    private final List<ChainResult> results;
    private final List<ChainResult> chainFindings;

    public ChainScanReport(List<ChainResult> results) {
        this.results = List.copyOf(results);
        this.chainFindings = this.results.stream().filter(ChainResult::isChainVulnerable).toList();
    }

    public int getTotalChains() {
        return results.size();
    }

    public int getVulnerableChains() {
        return chainFindings.size();
    }

    public int getSafeChains() {
        return results.size() - chainFindings.size();
    }

    public List<ChainResult> getChainFindings() {
        return chainFindings;
    }

    public List<ChainResult> getResults() {
        return results;
    }
}
