package com.guardian.indices;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User-facing summaries of a verdict. The protection index belongs to the pre
 * phase and the moral health index to the post phase; the other is null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Indices(
    @JsonProperty("protection_index") Double protectionIndex,
    @JsonProperty("mhi") Double moralHealthIndex
) {

    public static Indices protection(double value) {
        return new Indices(value, null);
    }

    public static Indices moralHealth(double value) {
        return new Indices(null, value);
    }
}
