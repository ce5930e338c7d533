package com.guardian.policy;

import java.util.List;

/**
 * Combines the severities of fired rules into one aggregate risk.
 * Implementations must be deterministic, return a value in [0,1] and be
 * monotone: raising any input severity never lowers the result.
 */
public interface RiskAggregator {

    /** Identifier recorded alongside verdicts, e.g. "saturating-sum-v1". */
    String aggregatorId();

    double aggregate(List<Rule> fired);
}
