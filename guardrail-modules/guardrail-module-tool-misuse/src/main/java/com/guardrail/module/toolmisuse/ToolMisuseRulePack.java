package com.guardrail.module.toolmisuse;

import com.guardrail.core.model.Category;
import com.guardrail.core.model.Severity;
import com.guardrail.core.rules.RuleDefinition;
import com.guardrail.core.rules.RulePack;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rules for inputs that try to turn the agent's tools against the system it
 * runs in: injected SQL and shell commands, file system and network abuse, and
 * requests that move data or money out.
 */
@Component
public class ToolMisuseRulePack implements RulePack {

    public static final String ID = "tool-misuse";

    private static final String SQL = "OWASP-LLM02, OWASP-A03, CWE-89";
    private static final String CMD = "OWASP-LLM07, OWASP-A03, CWE-77";
    private static final String FILE = "OWASP-LLM07, OWASP-A01, CWE-22";
    private static final String NET = "OWASP-LLM07, CWE-918";
    private static final String AGENCY = "OWASP-LLM08";

    private static final List<RuleDefinition> RULES = List.of(
            // Tool abuse through natural language
            new RuleDefinition("TU-001", Category.TOOL_MISUSE,
                    "\\buse\\s+(your|the)\\s+\\w+\\s+tool\\s+to\\b.{0,60}\\b(passwords?|credentials?|secrets?|tokens?)",
                    Severity.HIGH, "Tool directed at credential lookup", AGENCY),
            new RuleDefinition("TU-002", Category.TOOL_MISUSE,
                    "\\b(execute|run)(\\s+(this\\s+)?(command|shell|script|code))?\\s*:",
                    Severity.CRITICAL, "Direct command execution request", AGENCY + ", CWE-77"),
            new RuleDefinition("TU-003", Category.TOOL_MISUSE,
                    "\\b(delete|remove|wipe|drop)\\s+all\\s+(the\\s+)?(users|records|data|accounts|files|customers)\\b",
                    Severity.HIGH, "Bulk deletion request", AGENCY),
            new RuleDefinition("TU-004", Category.TOOL_MISUSE,
                    "\\btransfer\\s+\\$?\\d[\\d,.]*\\s+(dollars\\s+)?to\\s+(account|wallet)",
                    Severity.HIGH, "Funds transfer request", AGENCY),
            new RuleDefinition("TU-005", Category.TOOL_MISUSE,
                    "\\b(grant|give)\\s+(me|us|this\\s+user)\\s+(full\\s+)?(admin|root|superuser)\\s+(access|privileges|rights)",
                    Severity.MEDIUM, "Privilege escalation request", AGENCY),
            new RuleDefinition("TU-006", Category.TOOL_MISUSE,
                    "\\bcreate\\s+(a\\s+)?(new\\s+|test\\s+)?(admin|root|superuser)\\s+(account|user)",
                    Severity.HIGH, "Privileged account creation", AGENCY),

            // SQL injection
            new RuleDefinition("TM-001", Category.SQL_INJECTION,
                    "(delete|drop)\\s+(from|table)\\s+\\w+",
                    Severity.CRITICAL, "SQL DELETE/DROP command detected", SQL),
            new RuleDefinition("TM-002", Category.SQL_INJECTION,
                    ";\\s*(drop|delete|truncate)\\s+(table|database)",
                    Severity.CRITICAL, "SQL injection with destructive command", SQL),
            new RuleDefinition("TM-003", Category.SQL_INJECTION,
                    "(union|or)\\s+\\d+\\s*=\\s*\\d+",
                    Severity.HIGH, "SQL injection union/boolean attack", SQL),
            new RuleDefinition("TM-004", Category.SQL_INJECTION,
                    "--\\s*$",
                    Severity.MEDIUM, "SQL comment injection", SQL),
            new RuleDefinition("TM-005", Category.SQL_INJECTION,
                    ";\\s*exec\\s*\\(",
                    Severity.CRITICAL, "SQL stored procedure execution attempt", SQL),

            // Command injection
            new RuleDefinition("TM-006", Category.COMMAND_INJECTION,
                    ";\\s*(rm|del|format|mkfs)\\s",
                    Severity.CRITICAL, "Destructive shell command injection", CMD),
            new RuleDefinition("TM-007", Category.COMMAND_INJECTION,
                    "\\|\\s*(curl|wget|nc|netcat)",
                    Severity.CRITICAL, "Network tool injection for exfiltration", CMD),
            new RuleDefinition("TM-008", Category.COMMAND_INJECTION,
                    "`[^`]+`",
                    Severity.HIGH, "Backtick command substitution", CMD),
            new RuleDefinition("TM-009", Category.COMMAND_INJECTION,
                    "\\$\\([^)]+\\)",
                    Severity.HIGH, "Command substitution syntax", "OWASP-LLM07, OWASP-A03, CWE-94"),
            new RuleDefinition("TM-010", Category.COMMAND_INJECTION,
                    "&&\\s*(rm|del|dd|format)",
                    Severity.CRITICAL, "Chained destructive command", CMD),
            new RuleDefinition("TM-021", Category.COMMAND_INJECTION,
                    "\\brm\\s+-(rf?|fr)\\s+/",
                    Severity.CRITICAL, "Recursive delete from the file system root", CMD),

            // File system manipulation
            new RuleDefinition("TM-011", Category.FILE_MANIPULATION,
                    "(read|open|cat)\\s+/etc/(passwd|shadow|hosts)",
                    Severity.CRITICAL, "System file access attempt", FILE),
            new RuleDefinition("TM-012", Category.FILE_MANIPULATION,
                    "(delete|remove|unlink)\\s+.{0,50}\\.(log|conf|config|env)",
                    Severity.HIGH, "Critical file deletion attempt", FILE),
            new RuleDefinition("TM-013", Category.FILE_MANIPULATION,
                    "\\.\\./\\.\\.",
                    Severity.HIGH, "Path traversal attempt", FILE),
            new RuleDefinition("TM-014", Category.FILE_MANIPULATION,
                    "(write|modify|chmod)\\s+.{0,50}(/bin|/sbin|/usr/bin)",
                    Severity.CRITICAL, "System binary modification attempt", FILE),
            new RuleDefinition("TM-015", Category.FILE_MANIPULATION,
                    "(upload|write)\\s+.{0,50}\\.(exe|sh|bat|ps1)",
                    Severity.HIGH, "Executable file upload attempt", "OWASP-LLM07, OWASP-A01, CWE-434"),

            // Network exploitation
            new RuleDefinition("TM-016", Category.NETWORK_EXPLOIT,
                    "(scan|nmap|probe)\\s+(all\\s+)?(ports?|network|hosts?)",
                    Severity.HIGH, "Network scanning attempt", NET),
            new RuleDefinition("TM-017", Category.NETWORK_EXPLOIT,
                    "(connect|bind|listen)\\s+(to|on)\\s+(port|socket)",
                    Severity.HIGH, "Network socket manipulation", NET),
            new RuleDefinition("TM-018", Category.NETWORK_EXPLOIT,
                    "(reverse|bind)\\s+shell",
                    Severity.CRITICAL, "Reverse/bind shell attempt", "OWASP-LLM07, CWE-77"),
            new RuleDefinition("TM-019", Category.NETWORK_EXPLOIT,
                    "(exfiltrate|send|post)\\s+to\\s+\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}",
                    Severity.CRITICAL, "Data exfiltration to IP address", "OWASP-LLM06, CWE-918"),
            new RuleDefinition("TM-020", Category.NETWORK_EXPLOIT,
                    "(proxy|tunnel|forward)\\s+(through|via)",
                    Severity.MEDIUM, "Network tunneling attempt", NET),

            // Data exfiltration
            new RuleDefinition("DE-001", Category.DATA_EXFILTRATION,
                    "\\b(send|upload|forward|post|exfiltrate)\\s+(all\\s+)?(the\\s+)?(user|customer|company|sensitive|private)"
                            + "\\s+(data|records|information)\\s+to\\b",
                    Severity.CRITICAL, "Bulk data sent to an outside party", "OWASP-LLM06"),
            new RuleDefinition("DE-002", Category.DATA_EXFILTRATION,
                    "\\b(reveal|show|list|print|dump|give\\s+me)\\b.{0,30}"
                            + "\\b(passwords?|credentials|secrets|api\\s+keys?|access\\s+tokens?|private\\s+keys?)\\b",
                    Severity.HIGH, "Secret disclosure request", "OWASP-LLM06"),
            new RuleDefinition("DE-003", Category.DATA_EXFILTRATION,
                    "\\bemail\\s+(all|every|the)\\s+.{0,30}?\\b(data|secrets?|records|files|credentials|passwords?)\\b",
                    Severity.HIGH, "Data sent out by email", "OWASP-LLM06"));

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Tool Misuse";
    }

    @Override
    public int getOrder() {
        return 200;
    }

    @Override
    public List<RuleDefinition> getRules() {
        return RULES;
    }
}
