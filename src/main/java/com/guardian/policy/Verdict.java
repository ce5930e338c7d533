package com.guardian.policy;

import com.guardian.contract.Phase;
import com.guardian.contract.VerdictStatus;

import java.util.List;

/**
 * Outcome of one engine call. Immutable.
 *
 * @param status pass, halt or defer
 * @param risk aggregate risk in [0,1], four decimals
 * @param rationale non-empty explanation; rule specific whenever status is not pass
 * @param firedRules ids of the rules that fired, ascending
 * @param phase phase that produced the verdict
 * @param jurisdiction resolved jurisdiction code
 * @param reversible whether the evaluated output can be withdrawn without residual harm; always true for pre
 */
public record Verdict(
    VerdictStatus status,
    double risk,
    String rationale,
    List<String> firedRules,
    Phase phase,
    String jurisdiction,
    boolean reversible
) {

    public Verdict {
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        if (rationale == null || rationale.isBlank()) {
            throw new IllegalArgumentException("rationale is required");
        }
        firedRules = firedRules == null ? List.of() : List.copyOf(firedRules);
    }

    public boolean passed() {
        return status == VerdictStatus.PASS;
    }

    /** True when the evaluated text may be released to the caller. */
    public boolean deliverable() {
        return passed() && reversible;
    }

    /**
     * Verdict used when the generation backend never answered in time. It is
     * never a pass.
     */
    public static Verdict generationTimeout(String jurisdiction, String detail) {
        return new Verdict(VerdictStatus.DEFER, 0.0,
            "Guardian defer: generation backend did not respond in time (" + detail + ").",
            List.of(), Phase.POST, jurisdiction, true);
    }

    /**
     * Verdict for backend output that cannot be evaluated, for example because
     * it exceeds the text length limit. The output is withheld.
     */
    public static Verdict unacceptableOutput(String jurisdiction, String detail) {
        return new Verdict(VerdictStatus.HALT, 1.0,
            "Guardian halt: generated output rejected (" + detail + ").",
            List.of(), Phase.POST, jurisdiction, false);
    }
}
