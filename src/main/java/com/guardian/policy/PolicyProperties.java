package com.guardian.policy;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binding target for {@code guardian.policy.*}. These mutable beans only
 * carry raw configuration; {@link PolicyConfiguration} turns them into
 * immutable, validated {@link Rule}s.
 */
@ConfigurationProperties(prefix = "guardian.policy")
public class PolicyProperties {

    /** Jurisdiction used when a request carries no known tag. */
    private String defaultJurisdiction = "UK";

    /** Aggregate risk at or above which a request is deferred. */
    private double deferThreshold = 0.45;

    /** Aggregate risk at or above which a request is halted. */
    private double haltThreshold = 0.70;

    /** Upper bound on prompt and output length, in characters. */
    private int maxTextLength = 8000;

    private List<JurisdictionDefinition> jurisdictions = new ArrayList<>();

    private List<RuleDefinition> rules = new ArrayList<>();

    public String getDefaultJurisdiction() {
        return defaultJurisdiction;
    }

    public void setDefaultJurisdiction(String defaultJurisdiction) {
        this.defaultJurisdiction = defaultJurisdiction;
    }

    public double getDeferThreshold() {
        return deferThreshold;
    }

    public void setDeferThreshold(double deferThreshold) {
        this.deferThreshold = deferThreshold;
    }

    public double getHaltThreshold() {
        return haltThreshold;
    }

    public void setHaltThreshold(double haltThreshold) {
        this.haltThreshold = haltThreshold;
    }

    public int getMaxTextLength() {
        return maxTextLength;
    }

    public void setMaxTextLength(int maxTextLength) {
        this.maxTextLength = maxTextLength;
    }

    public List<JurisdictionDefinition> getJurisdictions() {
        return jurisdictions;
    }

    public void setJurisdictions(List<JurisdictionDefinition> jurisdictions) {
        this.jurisdictions = jurisdictions;
    }

    public List<RuleDefinition> getRules() {
        return rules;
    }

    public void setRules(List<RuleDefinition> rules) {
        this.rules = rules;
    }

    public static class JurisdictionDefinition {

        private String code;
        private String name;
        private String fallback;

        public String getCode() {
            return code;
        }

        public void setCode(String code) {
            this.code = code;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getFallback() {
            return fallback;
        }

        public void setFallback(String fallback) {
            this.fallback = fallback;
        }
    }

    public static class RuleDefinition {

        private String id;
        private String category;
        private double severity;
        private List<String> phases = new ArrayList<>(List.of("pre"));
        private List<String> jurisdictions = new ArrayList<>();
        private boolean hardBlock;
        private boolean irreversible;
        private List<String> keywords = new ArrayList<>();
        private List<String> patterns = new ArrayList<>();
        private Map<String, String> context = new LinkedHashMap<>();

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

        public double getSeverity() {
            return severity;
        }

        public void setSeverity(double severity) {
            this.severity = severity;
        }

        public List<String> getPhases() {
            return phases;
        }

        public void setPhases(List<String> phases) {
            this.phases = phases;
        }

        public List<String> getJurisdictions() {
            return jurisdictions;
        }

        public void setJurisdictions(List<String> jurisdictions) {
            this.jurisdictions = jurisdictions;
        }

        public boolean isHardBlock() {
            return hardBlock;
        }

        public void setHardBlock(boolean hardBlock) {
            this.hardBlock = hardBlock;
        }

        public boolean isIrreversible() {
            return irreversible;
        }

        public void setIrreversible(boolean irreversible) {
            this.irreversible = irreversible;
        }

        public List<String> getKeywords() {
            return keywords;
        }

        public void setKeywords(List<String> keywords) {
            this.keywords = keywords;
        }

        public List<String> getPatterns() {
            return patterns;
        }

        public void setPatterns(List<String> patterns) {
            this.patterns = patterns;
        }

        public Map<String, String> getContext() {
            return context;
        }

        public void setContext(Map<String, String> context) {
            this.context = context;
        }
    }
}
