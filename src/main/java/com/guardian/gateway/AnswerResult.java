package com.guardian.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.guardian.contract.VerdictStatus;

/**
 * Outcome of a guarded answer. {@code safeOutput} is present only when the
 * post check passed and the output is reversible; it is serialised as an
 * explicit null otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnswerResult(
    @JsonProperty("blocked") boolean blocked,
    @JsonProperty("safe_output") @JsonInclude(JsonInclude.Include.ALWAYS) String safeOutput,
    @JsonProperty("rationale") String rationale,
    @JsonProperty("mhi") Double mhi,
    @JsonProperty("status") VerdictStatus status,
    @JsonProperty("sequence_number") long sequenceNumber
) {

    static AnswerResult blocked(VerdictStatus status, String rationale, Double mhi, long sequenceNumber) {
        return new AnswerResult(true, null, rationale, mhi, status, sequenceNumber);
    }
}
