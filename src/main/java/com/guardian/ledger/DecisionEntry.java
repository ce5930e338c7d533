package com.guardian.ledger;

import com.guardian.contract.Phase;
import com.guardian.contract.VerdictStatus;
import com.guardian.indices.Indices;
import com.guardian.policy.Verdict;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * The content of a decision before the ledger assigns its sequence number and
 * links it into the chain.
 */
public record DecisionEntry(
    Operation operation,
    Phase phase,
    String requestHash,
    VerdictStatus status,
    double risk,
    List<String> firedRules,
    String jurisdiction,
    boolean reversible,
    Double protectionIndex,
    Double moralHealthIndex,
    String rationale,
    Instant timestamp
) {

    public DecisionEntry {
        if (operation == null || phase == null || status == null) {
            throw new IllegalArgumentException("operation, phase and status are required");
        }
        if (requestHash == null || requestHash.isBlank()) {
            throw new IllegalArgumentException("request hash is required");
        }
        if (rationale == null || rationale.isBlank()) {
            throw new IllegalArgumentException("rationale is required");
        }
        firedRules = firedRules == null ? List.of() : List.copyOf(firedRules);
        timestamp = (timestamp == null ? Instant.now() : timestamp).truncatedTo(ChronoUnit.MILLIS);
    }

    public static DecisionEntry of(Operation operation, String requestHash, Verdict verdict,
                                   Indices indices, Instant timestamp) {
        return new DecisionEntry(
            operation,
            verdict.phase(),
            requestHash,
            verdict.status(),
            verdict.risk(),
            verdict.firedRules(),
            verdict.jurisdiction(),
            verdict.reversible(),
            indices == null ? null : indices.protectionIndex(),
            indices == null ? null : indices.moralHealthIndex(),
            verdict.rationale(),
            timestamp);
    }

    DecisionRecord link(long sequence, String previousHash) {
        return new DecisionRecord(sequence, operation, phase, requestHash, status, risk, firedRules,
            jurisdiction, reversible, protectionIndex, moralHealthIndex, rationale, timestamp,
            previousHash, null);
    }
}
