package com.guardian.policy;

import com.guardian.contract.Phase;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A single policy rule. Rules are plain data; the {@link PolicyEngine} is the
 * only interpreter.
 *
 * @param id unique identifier, also the evaluation order key
 * @param category e.g. "minor-safety", "manipulation"
 * @param severity weight in [0,1] fed to the risk aggregator
 * @param phases phases in which the rule is evaluated
 * @param jurisdictions applicability set; empty means every jurisdiction
 * @param hardBlock halt unconditionally when the rule fires
 * @param irreversible in the post phase, marks the output as not reversible
 * @param predicate what the rule looks for
 */
public record Rule(
    String id,
    String category,
    double severity,
    Set<Phase> phases,
    SortedSet<String> jurisdictions,
    boolean hardBlock,
    boolean irreversible,
    RulePredicate predicate
) {

    public Rule {
        if (id == null || id.isBlank()) {
            throw new ConfigException("rule id is required");
        }
        if (category == null || category.isBlank()) {
            throw new ConfigException("rule " + id + ": category is required");
        }
        if (Double.isNaN(severity) || severity < 0.0 || severity > 1.0) {
            throw new ConfigException("rule " + id + ": severity must be within [0,1]");
        }
        if (phases == null || phases.isEmpty()) {
            throw new ConfigException("rule " + id + ": at least one phase is required");
        }
        if (predicate == null) {
            throw new ConfigException("rule " + id + ": predicate is required");
        }
        phases = Collections.unmodifiableSet(EnumSet.copyOf(phases));
        jurisdictions = jurisdictions == null
            ? Collections.emptySortedSet()
            : Collections.unmodifiableSortedSet(new TreeSet<>(jurisdictions));
    }

    /**
     * Whether the rule is in force for a phase and a jurisdiction chain.
     */
    public boolean appliesTo(Phase phase, Iterable<String> jurisdictionChain) {
        if (!phases.contains(phase)) {
            return false;
        }
        if (jurisdictions.isEmpty()) {
            return true;
        }
        for (String code : jurisdictionChain) {
            if (jurisdictions.contains(code)) {
                return true;
            }
        }
        return false;
    }

    /** Copy with a different severity, everything else unchanged. */
    public Rule withSeverity(double newSeverity) {
        return new Rule(id, category, newSeverity, phases, jurisdictions, hardBlock, irreversible, predicate);
    }
}
