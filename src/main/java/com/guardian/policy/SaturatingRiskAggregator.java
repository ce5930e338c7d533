package com.guardian.policy;

import com.guardian.contract.Scores;

import java.util.List;

/**
 * Probabilistic saturating sum: {@code 1 - prod(1 - severity)}. Treats each
 * fired rule as an independent chance of harm, so two 0.5 rules give 0.75 and
 * no number of rules can exceed 1.0. A fired hard-block rule pins the result
 * to 1.0.
 */
public class SaturatingRiskAggregator implements RiskAggregator {

    @Override
    public String aggregatorId() {
        return "saturating-sum-v1";
    }

    @Override
    public double aggregate(List<Rule> fired) {
        if (fired.isEmpty()) {
            return 0.0;
        }
        double survival = 1.0;
        for (Rule rule : fired) {
            if (rule.hardBlock()) {
                return 1.0;
            }
            survival *= 1.0 - rule.severity();
        }
        return Scores.round(1.0 - survival);
    }
}
