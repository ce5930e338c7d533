package com.guardian.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Body of {@code POST /verify}. When no explicit jurisdiction is given, a
 * string {@code jurisdiction} entry in {@code meta} is used.
 */
public record VerifyRequest(
    @JsonProperty("output") String output,
    @JsonProperty("meta") Map<String, Object> meta,
    @JsonProperty("jurisdiction") String jurisdiction
) {

    String effectiveJurisdiction() {
        if (jurisdiction != null) {
            return jurisdiction;
        }
        return meta != null && meta.get("jurisdiction") instanceof String s ? s : null;
    }
}
