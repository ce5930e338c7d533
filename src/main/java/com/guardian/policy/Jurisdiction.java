package com.guardian.policy;

import java.util.Locale;

/**
 * A configured jurisdiction. {@code fallback} names the parent whose rules
 * also apply, or is null for a root.
 */
public record Jurisdiction(String code, String name, String fallback) {

    public Jurisdiction {
        if (code == null || code.isBlank()) {
            throw new ConfigException("jurisdiction code is required");
        }
        code = code.trim().toUpperCase(Locale.ROOT);
        name = name == null || name.isBlank() ? code : name;
        fallback = fallback == null || fallback.isBlank()
            ? null
            : fallback.trim().toUpperCase(Locale.ROOT);
    }
}
