package com.guardian.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.guardian.contract.VerdictStatus;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CheckResult(
    @JsonProperty("status") VerdictStatus status,
    @JsonProperty("risk") double risk,
    @JsonProperty("rationale") String rationale,
    @JsonProperty("protection_index") double protectionIndex,
    @JsonProperty("fired_rules") List<String> firedRules,
    @JsonProperty("sequence_number") long sequenceNumber
) {
}
