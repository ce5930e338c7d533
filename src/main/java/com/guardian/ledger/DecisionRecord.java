package com.guardian.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.guardian.contract.Phase;
import com.guardian.contract.VerdictStatus;

import java.time.Instant;
import java.util.List;

/**
 * One immutable, chained ledger entry. {@code hash} is null only while the
 * record is being sealed inside the ledger.
 */
public record DecisionRecord(
    @JsonProperty("sequence") long sequence,
    @JsonProperty("operation") Operation operation,
    @JsonProperty("phase") Phase phase,
    @JsonProperty("request_hash") String requestHash,
    @JsonProperty("status") VerdictStatus status,
    @JsonProperty("risk") double risk,
    @JsonProperty("fired_rules") List<String> firedRules,
    @JsonProperty("jurisdiction") String jurisdiction,
    @JsonProperty("reversible") boolean reversible,
    @JsonProperty("protection_index") Double protectionIndex,
    @JsonProperty("mhi") Double moralHealthIndex,
    @JsonProperty("rationale") String rationale,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("previous_hash") String previousHash,
    @JsonProperty("hash") String hash
) {

    public DecisionRecord {
        firedRules = firedRules == null ? List.of() : List.copyOf(firedRules);
    }

    DecisionRecord withHash(String newHash) {
        return new DecisionRecord(sequence, operation, phase, requestHash, status, risk, firedRules,
            jurisdiction, reversible, protectionIndex, moralHealthIndex, rationale, timestamp,
            previousHash, newHash);
    }
}
