package com.guardian.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.guardian.contract.VerdictStatus;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerifyResult(
    @JsonProperty("reversible") boolean reversible,
    @JsonProperty("blocked") boolean blocked,
    @JsonProperty("rationale") String rationale,
    @JsonProperty("mhi") double mhi,
    @JsonProperty("output_hash") String outputHash,
    @JsonProperty("status") VerdictStatus status,
    @JsonProperty("fired_rules") List<String> firedRules,
    @JsonProperty("sequence_number") long sequenceNumber
) {
}
