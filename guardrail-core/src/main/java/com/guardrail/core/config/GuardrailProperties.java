package com.guardrail.core.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Core configuration properties for Guardrail.
 * These map directly to the `guardrail.*` properties in your application.yml.
 */
public class GuardrailProperties {

    private boolean enabled = true;
    private String mode = "MONITOR"; // MONITOR or ACTIVE
    private int reviewThreshold = 31;
    private String blockLevel = "HIGH";

    private ScoringProperties scoring = new ScoringProperties();
    private Map<String, ModuleProperties> modules = new HashMap<>();
    private List<CustomRuleProperties> customRules = new ArrayList<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public boolean isActiveMode() {
        return "ACTIVE".equalsIgnoreCase(mode);
    }

    public boolean isMonitorMode() {
        return "MONITOR".equalsIgnoreCase(mode);
    }

    /** Minimum score at which a MEDIUM or HIGH input is queued for review. */
    public int getReviewThreshold() {
        return reviewThreshold;
    }

    public void setReviewThreshold(int reviewThreshold) {
        this.reviewThreshold = reviewThreshold;
    }

    /** Lowest risk level that blocks in ACTIVE mode. */
    public String getBlockLevel() {
        return blockLevel;
    }

    public void setBlockLevel(String blockLevel) {
        this.blockLevel = blockLevel;
    }

    public ScoringProperties getScoring() {
        return scoring;
    }

    public void setScoring(ScoringProperties scoring) {
        this.scoring = scoring;
    }

    public Map<String, ModuleProperties> getModules() {
        return modules;
    }

    public void setModules(Map<String, ModuleProperties> modules) {
        this.modules = modules;
    }

    public List<CustomRuleProperties> getCustomRules() {
        return customRules;
    }

    public void setCustomRules(List<CustomRuleProperties> customRules) {
        this.customRules = customRules;
    }

    /**
     * Useful for checking if a specific rule pack is turned on.
     * Note: packs are enabled by default unless explicitly disabled.
     */
    public boolean isModuleEnabled(String moduleId) {
        ModuleProperties props = modules.get(moduleId);
        if (props == null)
            return true;
        return props.isEnabled();
    }

    /**
     * Scoring weights and keyword lists. The defaults are tuning knobs, not
     * structural guarantees.
     */
    public static class ScoringProperties {
        private int criticalPoints = 60;
        private int highPoints = 40;
        private int mediumPoints = 20;
        private int lowPoints = 10;
        private int aggravatingWeight = 11;
        private int mitigatingWeight = 15;

        private List<String> aggravatingKeywords = new ArrayList<>(List.of(
                "email", "send", "execute", "delete", "drop", "reveal",
                "exfiltrate", "steal", "hack", "bypass", "exploit",
                "secret", "password", "credential", "token", "key"));

        private List<String> mitigatingPhrases = new ArrayList<>(List.of(
                "start fresh", "reset", "clear history", "begin again",
                "new session", "start over", "clear context"));

        public int getCriticalPoints() {
            return criticalPoints;
        }

        public void setCriticalPoints(int criticalPoints) {
            this.criticalPoints = criticalPoints;
        }

        public int getHighPoints() {
            return highPoints;
        }

        public void setHighPoints(int highPoints) {
            this.highPoints = highPoints;
        }

        public int getMediumPoints() {
            return mediumPoints;
        }

        public void setMediumPoints(int mediumPoints) {
            this.mediumPoints = mediumPoints;
        }

        public int getLowPoints() {
            return lowPoints;
        }

        public void setLowPoints(int lowPoints) {
            this.lowPoints = lowPoints;
        }

        public int getAggravatingWeight() {
            return aggravatingWeight;
        }

        public void setAggravatingWeight(int aggravatingWeight) {
            this.aggravatingWeight = aggravatingWeight;
        }

        public int getMitigatingWeight() {
            return mitigatingWeight;
        }

        public void setMitigatingWeight(int mitigatingWeight) {
            this.mitigatingWeight = mitigatingWeight;
        }

        public List<String> getAggravatingKeywords() {
            return aggravatingKeywords;
        }

        public void setAggravatingKeywords(List<String> aggravatingKeywords) {
            this.aggravatingKeywords = aggravatingKeywords;
        }

        public List<String> getMitigatingPhrases() {
            return mitigatingPhrases;
        }

        public void setMitigatingPhrases(List<String> mitigatingPhrases) {
            this.mitigatingPhrases = mitigatingPhrases;
        }
    }

    public static class ModuleProperties {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    /**
     * A rule declared in configuration rather than in a rule module.
     */
    public static class CustomRuleProperties {
        private String id;
        private String category;
        private String pattern;
        private String severity = "MEDIUM";
        private String description;
        private String framework;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getCategory() {
            return category;
        }

        public void setCategory(String category) {
            this.category = category;
        }

        public String getPattern() {
            return pattern;
        }

        public void setPattern(String pattern) {
            this.pattern = pattern;
        }

        public String getSeverity() {
            return severity;
        }

        public void setSeverity(String severity) {
            this.severity = severity;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getFramework() {
            return framework;
        }

        public void setFramework(String framework) {
            this.framework = framework;
        }
    }
}
