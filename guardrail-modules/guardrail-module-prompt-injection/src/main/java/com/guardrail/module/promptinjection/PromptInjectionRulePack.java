package com.guardrail.module.promptinjection;

import com.guardrail.core.model.Category;
import com.guardrail.core.model.Severity;
import com.guardrail.core.rules.RuleDefinition;
import com.guardrail.core.rules.RulePack;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rules for attacks on the agent's instructions themselves.
 *
 * We cover three families:
 * 1. Prompt injection (PI): overriding, replacing or leaking the system prompt
 * 2. Jailbreaks (JB): talking the agent out of its safety rules
 * 3. Context manipulation (CM): forged system messages, session resets and
 * instructions smuggled inside quoted content
 */
@Component
public class PromptInjectionRulePack implements RulePack {

    public static final String ID = "prompt-injection";

    private static final String LLM01 = "OWASP-LLM01";

    private static final List<RuleDefinition> RULES = List.of(
            // Instruction override and prompt leakage
            new RuleDefinition("PI-001", Category.PROMPT_INJECTION,
                    "\\b(ignore|disregard|forget|override)\\s+(all|any|every(thing)?|previous|prior|above|earlier|your"
                            + "|instructions?|directives?|rules|guidelines)\\b",
                    Severity.HIGH, "Instruction override attempt", LLM01),
            new RuleDefinition("PI-002", Category.PROMPT_INJECTION,
                    "\\byou\\s+are\\s+(now|no\\s+longer)\\b",
                    Severity.HIGH, "Role reassignment attempt", LLM01),
            new RuleDefinition("PI-003", Category.PROMPT_INJECTION,
                    "\\b(pretend\\s+(to\\s+be|you\\s+are)|act\\s+as\\s+(if\\s+you\\s+(are|were)\\s+)?(a|an)|roleplay\\s+as)\\b",
                    Severity.MEDIUM, "Persona manipulation", LLM01),
            new RuleDefinition("PI-004", Category.PROMPT_INJECTION,
                    "\\b(reveal|show|print|display|repeat|tell\\s+me|output|leak)\\b.{0,40}"
                            + "\\b(system\\s+prompt|(initial|hidden|original)\\s+instructions)",
                    Severity.CRITICAL, "System prompt extraction attempt", LLM01 + ", OWASP-LLM06"),
            new RuleDefinition("PI-005", Category.PROMPT_INJECTION,
                    "\\bwhat\\s+(were|are)\\s+you\\s+(instructed|told|programmed)\\s+to\\b",
                    Severity.HIGH, "Instruction probing", LLM01),
            new RuleDefinition("PI-006", Category.PROMPT_INJECTION,
                    "\\b(new|updated|revised)\\s+(system\\s+)?(instructions|directives|rules)\\s*(:|follow)",
                    Severity.HIGH, "Injected replacement instructions", LLM01),
            new RuleDefinition("PI-007", Category.PROMPT_INJECTION,
                    "(\\[/?INST\\]|<<\\s*/?SYS\\s*>>|<\\|im_start\\|>|</?system>)",
                    Severity.MEDIUM, "Model prompt delimiter injection", LLM01),

            // Jailbreaks
            new RuleDefinition("JB-001", Category.JAILBREAK,
                    "\\b(developer|god|debug|admin|sudo)\\s+mode\\b",
                    Severity.HIGH, "Privileged mode activation", LLM01),
            new RuleDefinition("JB-002", Category.JAILBREAK,
                    "\\b(do\\s+anything\\s+now|jailbreak(ed|ing)?)\\b",
                    Severity.CRITICAL, "Known jailbreak persona", LLM01),
            new RuleDefinition("JB-003", Category.JAILBREAK,
                    "\\b(rules|restrictions|guidelines|policies)\\s+(don'?t|do\\s+not|no\\s+longer)\\s+apply\\b",
                    Severity.HIGH, "Claim that rules do not apply", LLM01),
            new RuleDefinition("JB-004", Category.JAILBREAK,
                    "\\b(bypass|disable|circumvent|turn\\s+off|ignore)\\s+(your\\s+|all\\s+|the\\s+)?"
                            + "(safety|content|ethical|security)\\s+(guidelines|filters?|rules|restrictions|protocols|measures)",
                    Severity.HIGH, "Safety bypass request", LLM01),
            new RuleDefinition("JB-005", Category.JAILBREAK,
                    "\\b(for\\s+(educational|research|academic)\\s+purposes|hypothetically"
                            + "|in\\s+a\\s+hypothetical\\s+scenario)\\b",
                    Severity.MEDIUM, "Hypothetical or educational framing", LLM01),
            new RuleDefinition("JB-006", Category.JAILBREAK,
                    "\\b(no|without|free\\s+of)\\s+(any\\s+)?(restrictions|limitations|limits|filters|censorship)\\b",
                    Severity.HIGH, "Request to drop restrictions", LLM01),
            new RuleDefinition("JB-007", Category.JAILBREAK,
                    "\\b(this\\s+is\\s+(just\\s+)?a\\s+test\\s+environment|sandbox\\s+mode)\\b",
                    Severity.MEDIUM, "Fake test environment claim", LLM01),

            // Context manipulation
            new RuleDefinition("CM-001", Category.CONTEXT_MANIPULATION,
                    "-{2,}\\s*system\\s+(override|update|message|notice)",
                    Severity.HIGH, "Forged system message delimiter", LLM01),
            new RuleDefinition("CM-002", Category.CONTEXT_MANIPULATION,
                    "\\b(end\\s+of\\s+(the\\s+)?conversation|new\\s+session\\s*:)",
                    Severity.HIGH, "Conversation reset injection", LLM01),
            new RuleDefinition("CM-003", Category.CONTEXT_MANIPULATION,
                    "<!--.{0,200}?\\b(agent|assistant|ai|system)\\s+(instruction|directive|command)",
                    Severity.MEDIUM, "Instruction hidden in markup comment", LLM01),
            new RuleDefinition("CM-004", Category.CONTEXT_MANIPULATION,
                    "\\[(simulated\\s+)?(email|web\\s+page\\s+content|document|tool\\s+output|search\\s+results?)\\]",
                    Severity.MEDIUM, "Indirect injection through embedded content", LLM01),
            new RuleDefinition("CM-005", Category.CONTEXT_MANIPULATION,
                    "\\b(message|instructions?|notice)\\s+from\\s+(the\\s+)?(system|administrator|admin|developer)s?\\b",
                    Severity.HIGH, "Impersonated authority message", LLM01),
            new RuleDefinition("CM-006", Category.CONTEXT_MANIPULATION,
                    "\\b(forget|erase|wipe|clear)\\s+(your|all)\\s+(memory|context|previous\\s+conversation)",
                    Severity.MEDIUM, "Memory wipe request", LLM01));

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Prompt Injection";
    }

    @Override
    public int getOrder() {
        return 100;
    }

    @Override
    public List<RuleDefinition> getRules() {
        return RULES;
    }
}
