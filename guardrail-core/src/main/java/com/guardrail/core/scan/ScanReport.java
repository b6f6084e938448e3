package com.guardrail.core.scan;

import com.guardrail.core.model.AttackResult;

import java.util.List;

/**
 * Aggregate of one full scan.
 */
public class ScanReport {

    private final List<AttackResult> allResults;
    private final List<AttackResult> findings;
    private final SecurityGrade grade;

    public ScanReport(List<AttackResult> allResults) {
        this.allResults = List.copyOf(allResults);
        this.findings = this.allResults.stream().filter(AttackResult::isVulnerable).toList();
        this.grade = SecurityGrade.of(findings.size(), this.allResults.size());
    }

    public int getTotalTests() {
        return allResults.size();
    }

    public int getVulnerable() {
        return findings.size();
    }

    public int getSafe() {
        return allResults.size() - findings.size();
    }

    public SecurityGrade getGrade() {
        return grade;
    }

    /** Grade label, e.g. "B (Good)". */
    public String getSecurityScore() {
        return grade.getLabel();
    }

    public List<AttackResult> getFindings() {
        return findings;
    }

    public List<AttackResult> getAllResults() {
        return allResults;
    }

    @Override
    public String toString() {
        return "ScanReport{" +
                "total=" + getTotalTests() +
                ", vulnerable=" + getVulnerable() +
                ", score='" + getSecurityScore() + '\'' +
                '}';
    }
}
