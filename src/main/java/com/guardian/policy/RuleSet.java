package com.guardian.policy;

import com.guardian.contract.Phase;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable rule collection kept in ascending id order, which is the
 * evaluation order.
 */
public final class RuleSet {

    private final List<Rule> rules;

    public RuleSet(List<Rule> rules) {
        if (rules == null) {
            throw new ConfigException("rule list is required");
        }
        Set<String> ids = new HashSet<>();
        for (Rule rule : rules) {
            if (!ids.add(rule.id())) {
                throw new ConfigException("duplicate rule id: " + rule.id());
            }
        }
        List<Rule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparing(Rule::id));
        this.rules = List.copyOf(sorted);
    }

    public List<Rule> rules() {
        return rules;
    }

    public List<Rule> applicable(Phase phase, List<String> jurisdictionChain) {
        List<Rule> out = new ArrayList<>();
        for (Rule rule : rules) {
            if (rule.appliesTo(phase, jurisdictionChain)) {
                out.add(rule);
            }
        }
        return out;
    }

    /** Every jurisdiction code named by some rule. */
    public Set<String> referencedJurisdictions() {
        Set<String> codes = new HashSet<>();
        for (Rule rule : rules) {
            codes.addAll(rule.jurisdictions());
        }
        return codes;
    }

    /** Copy with one rule replaced, used to explore severity changes. */
    public RuleSet replace(Rule replacement) {
        List<Rule> copy = new ArrayList<>();
        boolean found = false;
        for (Rule rule : rules) {
            if (rule.id().equals(replacement.id())) {
                copy.add(replacement);
                found = true;
            } else {
                copy.add(rule);
            }
        }
        if (!found) {
            throw new IllegalArgumentException("unknown rule id: " + replacement.id());
        }
        return new RuleSet(copy);
    }

    public int size() {
        return rules.size();
    }
}
