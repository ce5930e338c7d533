package com.guardian.policy;

import com.guardian.contract.GuardRequest;
import com.guardian.contract.Phase;
import com.guardian.contract.RequestValidator;
import com.guardian.contract.Scores;
import com.guardian.contract.VerdictStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic policy evaluator.
 *
 * <p>Evaluates every rule applicable to the phase and resolved jurisdiction
 * in ascending id order, aggregates the severities of the rules that fired and
 * maps the result to a verdict:</p>
 * <ol>
 *   <li>any fired hard-block rule: halt, naming the lowest-id such rule</li>
 *   <li>risk &gt;= halt threshold: halt</li>
 *   <li>risk &gt;= defer threshold: defer</li>
 *   <li>otherwise pass</li>
 * </ol>
 *
 * <p>The engine holds no mutable state and performs no I/O or logging; the
 * same request and rule set always yield an equal verdict.</p>
 */
public class PolicyEngine {

    static final String PRE_PASS_RATIONALE = "Request cleared by Guardian precheck.";
    static final String POST_PASS_RATIONALE = "Output is reversible and suitable for delivery.";
    static final String REVERSIBLE_CONTEXT_KEY = "reversible";

    private final RuleSet ruleSet;
    private final JurisdictionResolver jurisdictions;
    private final Thresholds thresholds;
    private final RiskAggregator aggregator;
    private final RequestValidator validator;

    public PolicyEngine(RuleSet ruleSet,
                        JurisdictionResolver jurisdictions,
                        Thresholds thresholds,
                        RiskAggregator aggregator,
                        RequestValidator validator) {
        this.ruleSet = ruleSet;
        this.jurisdictions = jurisdictions;
        this.thresholds = thresholds;
        this.aggregator = aggregator;
        this.validator = validator;

        for (String code : ruleSet.referencedJurisdictions()) {
            if (!jurisdictions.knownCodes().contains(code)) {
                throw new ConfigException("rule references unknown jurisdiction: " + code);
            }
        }
    }

    public Verdict evaluate(GuardRequest request, Phase phase) {
        validator.validate(request, phase);

        String jurisdiction = jurisdictions.resolve(request.jurisdiction());
        List<String> chain = jurisdictions.chainFor(jurisdiction);

        List<Rule> fired = new ArrayList<>();
        for (Rule rule : ruleSet.applicable(phase, chain)) {
            if (rule.predicate().matches(request.text(), request.context())) {
                fired.add(rule);
            }
        }
        List<String> firedIds = fired.stream().map(Rule::id).toList();
        double risk = Scores.round(aggregator.aggregate(fired));

        boolean reversible = true;
        String irreversibleReason = null;
        if (phase == Phase.POST) {
            for (Rule rule : fired) {
                if (rule.irreversible()) {
                    reversible = false;
                    irreversibleReason = "rule '" + rule.id() + "'";
                    break;
                }
            }
            if (reversible && declaresIrreversible(request)) {
                reversible = false;
                irreversibleReason = "context reversible=false";
            }
        }

        Rule hardBlock = fired.stream().filter(Rule::hardBlock).findFirst().orElse(null);
        if (hardBlock != null) {
            return new Verdict(VerdictStatus.HALT, risk,
                "Guardian halt: hard-block rule '" + hardBlock.id() + "' (" + hardBlock.category() + ") matched.",
                firedIds, phase, jurisdiction, reversible);
        }
        if (risk >= thresholds.halt()) {
            return new Verdict(VerdictStatus.HALT, risk,
                thresholdRationale("halt", risk, thresholds.halt(), firedIds),
                firedIds, phase, jurisdiction, reversible);
        }
        if (risk >= thresholds.defer()) {
            return new Verdict(VerdictStatus.DEFER, risk,
                thresholdRationale("defer", risk, thresholds.defer(), firedIds),
                firedIds, phase, jurisdiction, reversible);
        }

        String rationale;
        if (phase == Phase.PRE) {
            rationale = PRE_PASS_RATIONALE;
        } else if (reversible) {
            rationale = POST_PASS_RATIONALE;
        } else {
            rationale = "Output withheld: not reversible (" + irreversibleReason + ").";
        }
        return new Verdict(VerdictStatus.PASS, risk, rationale, firedIds, phase, jurisdiction, reversible);
    }

    public Thresholds thresholds() {
        return thresholds;
    }

    public RuleSet ruleSet() {
        return ruleSet;
    }

    public String aggregatorId() {
        return aggregator.aggregatorId();
    }

    private static boolean declaresIrreversible(GuardRequest request) {
        Object flag = request.context().get(REVERSIBLE_CONTEXT_KEY);
        if (flag instanceof Boolean b) {
            return !b;
        }
        return flag != null && "false".equalsIgnoreCase(String.valueOf(flag).trim());
    }

    private static String thresholdRationale(String action, double risk, double threshold, List<String> firedIds) {
        return "Guardian " + action + ": aggregate risk " + format(risk) + " >= " + format(threshold)
            + " from rules [" + String.join(", ", firedIds) + "].";
    }

    private static String format(double value) {
        return Scores.toDecimal(value).stripTrailingZeros().toPlainString();
    }
}
