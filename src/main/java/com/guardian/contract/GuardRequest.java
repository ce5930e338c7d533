package com.guardian.contract;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single unit of text to be judged: a prompt in the pre phase, a generated
 * output in the post phase. The context map is opaque to the gate and is only
 * consulted by rule predicates.
 *
 * @param text the prompt or output under evaluation
 * @param context caller supplied key/value pairs, never null
 * @param jurisdiction requested jurisdiction tag, may be null to use the configured default
 * @param timestamp when the request entered the gate; recorded, never evaluated
 */
public record GuardRequest(
    String text,
    Map<String, Object> context,
    String jurisdiction,
    Instant timestamp
) {

    public GuardRequest {
        context = context == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static GuardRequest of(String text, Map<String, Object> context, String jurisdiction) {
        return new GuardRequest(text, context, jurisdiction, Instant.now());
    }
}
