package com.guardian.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.guardian.contract.GuardRequest;

import java.util.Map;

/**
 * Body of {@code POST /check} and {@code POST /answer}.
 */
public record PromptRequest(
    @JsonProperty("prompt") String prompt,
    @JsonProperty("context") Map<String, Object> context,
    @JsonProperty("jurisdiction") String jurisdiction
) {

    GuardRequest toGuardRequest() {
        return GuardRequest.of(prompt, context, jurisdiction);
    }
}
