package com.guardrail.autoconfigure;

import com.guardrail.core.GuardrailEngine;
import com.guardrail.core.chain.AttackChainEvaluator;
import com.guardrail.core.chain.AttackChainLibrary;
import com.guardrail.core.config.GuardrailProperties;
import com.guardrail.core.detect.ThreatDetector;
import com.guardrail.core.review.InMemoryReviewQueue;
import com.guardrail.core.review.ReviewQueue;
import com.guardrail.core.rules.ConfiguredRulePack;
import com.guardrail.core.rules.PatternRegistry;
import com.guardrail.core.rules.RulePack;
import com.guardrail.core.scan.AttackSuite;
import com.guardrail.core.scan.ChainAttackSuite;
import com.guardrail.core.scan.SecurityScanner;
import com.guardrail.core.scoring.RiskScorer;
import com.guardrail.core.simulation.CompromiseIndicators;
import com.guardrail.core.simulation.KeywordResponseSimulator;
import com.guardrail.core.simulation.ResponseSimulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;

import java.util.List;

/**
 * Auto-configuration for Guardrail.
 * Activated when {@code guardrail.enabled=true} (default).
 */
@AutoConfiguration
@ConditionalOnProperty(name = "guardrail.enabled", havingValue = "true", matchIfMissing = true)
@ComponentScan(basePackages = "com.guardrail.module")
public class GuardrailAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GuardrailAutoConfiguration.class);

    @Bean
    @ConfigurationProperties(prefix = "guardrail")
    public GuardrailProperties guardrailProperties() {
        return new GuardrailProperties();
    }

    @Bean
    public ConfiguredRulePack configuredRulePack(GuardrailProperties properties) {
        return new ConfiguredRulePack(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public PatternRegistry patternRegistry(List<RulePack> packs, GuardrailProperties properties) {
        List<RulePack> enabled = packs.stream()
                .filter(pack -> {
                    boolean on = pack.isEnabled(properties);
                    if (!on) {
                        log.info("[Guardrail] [{}] Rule pack disabled by configuration", pack.getId());
                    }
                    return on;
                })
                .toList();
        return PatternRegistry.load(enabled);
    }

    @Bean
    @ConditionalOnMissingBean
    public ThreatDetector threatDetector(PatternRegistry registry) {
        return new ThreatDetector(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public RiskScorer riskScorer(ThreatDetector detector, GuardrailProperties properties) {
        return new RiskScorer(detector, properties.getScoring());
    }

    @Bean
    @ConditionalOnMissingBean
    public ReviewQueue reviewQueue() {
        // TODO: persistent ReviewQueue backed by a JDBC table for multi-instance deployments
        log.info("[Guardrail] Using InMemoryReviewQueue");
        return new InMemoryReviewQueue();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResponseSimulator responseSimulator() {
        return KeywordResponseSimulator.defaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public CompromiseIndicators compromiseIndicators() {
        return CompromiseIndicators.defaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public AttackChainLibrary attackChainLibrary() {
        return AttackChainLibrary.defaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public AttackChainEvaluator attackChainEvaluator(AttackChainLibrary library, ResponseSimulator simulator,
            CompromiseIndicators indicators, RiskScorer scorer) {
        return new AttackChainEvaluator(library, simulator, indicators, scorer);
    }

    @Bean
    public ChainAttackSuite chainAttackSuite(AttackChainEvaluator evaluator) {
        return new ChainAttackSuite(evaluator);
    }

    @Bean
    @ConditionalOnMissingBean
    public SecurityScanner securityScanner(List<AttackSuite> suites, AttackChainEvaluator evaluator) {
        return new SecurityScanner(suites, evaluator);
    }

    @Bean
    @ConditionalOnMissingBean
    public GuardrailEngine guardrailEngine(RiskScorer scorer, ReviewQueue reviewQueue,
            GuardrailProperties properties) {
        return new GuardrailEngine(scorer, reviewQueue, properties);
    }
}
