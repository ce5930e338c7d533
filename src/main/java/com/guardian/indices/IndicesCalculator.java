package com.guardian.indices;

import com.guardian.contract.Phase;
import com.guardian.contract.Scores;
import com.guardian.policy.ConfigException;
import com.guardian.policy.Verdict;

/**
 * Pure functions from a verdict to its numeric summaries.
 *
 * <ul>
 *   <li>Protection index (pre): the baseline when nothing fired, otherwise
 *       {@code 1 - risk} bounded below by the floor and above by the
 *       baseline.</li>
 *   <li>Moral health index (post): {@code 1 - risk} when the output is
 *       reversible, otherwise 0.</li>
 * </ul>
 */
public class IndicesCalculator {

    private final double baseline;
    private final double floor;

    public IndicesCalculator(double baseline, double floor) {
        if (Double.isNaN(baseline) || baseline < 0.0 || baseline > 1.0) {
            throw new ConfigException("protection baseline must be within [0,1]");
        }
        if (Double.isNaN(floor) || floor < 0.0 || floor > baseline) {
            throw new ConfigException("protection floor must be within [0, baseline]");
        }
        this.baseline = baseline;
        this.floor = floor;
    }

    public Indices indicesFor(Verdict verdict) {
        return verdict.phase() == Phase.PRE
            ? Indices.protection(protectionIndex(verdict))
            : Indices.moralHealth(moralHealthIndex(verdict));
    }

    public double protectionIndex(Verdict verdict) {
        requirePhase(verdict, Phase.PRE);
        if (verdict.firedRules().isEmpty()) {
            return Scores.round(baseline);
        }
        double raw = 1.0 - verdict.risk();
        return Scores.round(Math.min(baseline, Math.max(floor, raw)));
    }

    public double moralHealthIndex(Verdict verdict) {
        requirePhase(verdict, Phase.POST);
        if (!verdict.reversible()) {
            return 0.0;
        }
        return Scores.round(1.0 - verdict.risk());
    }

    private static void requirePhase(Verdict verdict, Phase expected) {
        if (verdict.phase() != expected) {
            throw new IllegalArgumentException(
                "index requires a " + expected.getValue() + " verdict, got " + verdict.phase().getValue());
        }
    }
}
