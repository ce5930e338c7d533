package com.guardian.policy;

import com.guardian.contract.Phase;
import com.guardian.contract.RequestValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

@Configuration
@EnableConfigurationProperties(PolicyProperties.class)
public class PolicyConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PolicyConfiguration.class);

    /**
     * Builds the engine from {@code guardian.policy.*}. Any malformed entry
     * raises {@link ConfigException} and aborts startup.
     */
    @Bean
    public PolicyEngine policyEngine(PolicyProperties properties) {
        RuleSet ruleSet = toRuleSet(properties.getRules());
        JurisdictionResolver resolver = new JurisdictionResolver(
            toJurisdictions(properties.getJurisdictions()),
            properties.getDefaultJurisdiction());
        Thresholds thresholds = new Thresholds(properties.getDeferThreshold(), properties.getHaltThreshold());

        PolicyEngine engine = new PolicyEngine(ruleSet, resolver, thresholds,
            new SaturatingRiskAggregator(), new RequestValidator(properties.getMaxTextLength()));
        log.info("Policy engine ready: {} rules, jurisdictions={}, default={}, defer>={}, halt>={}",
            ruleSet.size(), resolver.knownCodes(), resolver.defaultCode(),
            thresholds.defer(), thresholds.halt());
        return engine;
    }

    static RuleSet toRuleSet(List<PolicyProperties.RuleDefinition> definitions) {
        List<Rule> rules = new ArrayList<>();
        if (definitions != null) {
            for (PolicyProperties.RuleDefinition def : definitions) {
                rules.add(toRule(def));
            }
        }
        return new RuleSet(rules);
    }

    static Rule toRule(PolicyProperties.RuleDefinition def) {
        String id = def.getId();
        Set<Phase> phases = EnumSet.noneOf(Phase.class);
        if (def.getPhases() != null) {
            for (String raw : def.getPhases()) {
                try {
                    phases.add(Phase.fromValue(raw));
                } catch (IllegalArgumentException ex) {
                    throw new ConfigException("rule " + id + ": " + ex.getMessage(), ex);
                }
            }
        }
        TreeSet<String> jurisdictions = new TreeSet<>();
        if (def.getJurisdictions() != null) {
            for (String code : def.getJurisdictions()) {
                if (code == null || code.isBlank()) {
                    throw new ConfigException("rule " + id + ": jurisdiction codes must be non-empty");
                }
                jurisdictions.add(code.trim().toUpperCase(Locale.ROOT));
            }
        }
        RulePredicate predicate;
        try {
            predicate = RulePredicate.of(def.getKeywords(), def.getPatterns(), def.getContext());
        } catch (ConfigException ex) {
            throw new ConfigException("rule " + id + ": " + ex.getMessage(), ex);
        }
        return new Rule(id, def.getCategory(), def.getSeverity(), phases, jurisdictions,
            def.isHardBlock(), def.isIrreversible(), predicate);
    }

    static List<Jurisdiction> toJurisdictions(List<PolicyProperties.JurisdictionDefinition> definitions) {
        List<Jurisdiction> out = new ArrayList<>();
        if (definitions != null) {
            for (PolicyProperties.JurisdictionDefinition def : definitions) {
                out.add(new Jurisdiction(def.getCode(), def.getName(), def.getFallback()));
            }
        }
        return out;
    }
}
