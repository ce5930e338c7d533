package com.guardian.policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Resolves a requested jurisdiction tag to the ordered chain of codes whose
 * rules apply: the jurisdiction itself followed by its fallback ancestors.
 * Chains are computed once at construction.
 */
public final class JurisdictionResolver {

    private final String defaultCode;
    private final Map<String, List<String>> chains;

    public JurisdictionResolver(List<Jurisdiction> jurisdictions, String defaultCode) {
        if (jurisdictions == null || jurisdictions.isEmpty()) {
            throw new ConfigException("at least one jurisdiction must be configured");
        }
        Map<String, Jurisdiction> byCode = new TreeMap<>();
        for (Jurisdiction j : jurisdictions) {
            if (byCode.put(j.code(), j) != null) {
                throw new ConfigException("duplicate jurisdiction code: " + j.code());
            }
        }
        for (Jurisdiction j : byCode.values()) {
            if (j.fallback() != null && !byCode.containsKey(j.fallback())) {
                throw new ConfigException(
                    "jurisdiction " + j.code() + " falls back to unknown jurisdiction " + j.fallback());
            }
        }

        Map<String, List<String>> resolved = new TreeMap<>();
        for (String code : byCode.keySet()) {
            resolved.put(code, buildChain(code, byCode));
        }
        this.chains = Collections.unmodifiableMap(resolved);

        String normalizedDefault = normalize(defaultCode);
        if (normalizedDefault == null || !chains.containsKey(normalizedDefault)) {
            throw new ConfigException("default jurisdiction is not configured: " + defaultCode);
        }
        this.defaultCode = normalizedDefault;
    }

    /**
     * Returns the chain for the requested tag. Blank or unknown tags resolve
     * to the default jurisdiction.
     */
    public List<String> chainFor(String requested) {
        return chains.get(resolve(requested));
    }

    public String resolve(String requested) {
        String code = normalize(requested);
        return code != null && chains.containsKey(code) ? code : defaultCode;
    }

    public String defaultCode() {
        return defaultCode;
    }

    public Set<String> knownCodes() {
        return chains.keySet();
    }

    private static List<String> buildChain(String start, Map<String, Jurisdiction> byCode) {
        Set<String> seen = new LinkedHashSet<>();
        String current = start;
        while (current != null) {
            if (!seen.add(current)) {
                throw new ConfigException("cyclic jurisdiction fallback: "
                    + String.join(" -> ", seen) + " -> " + current);
            }
            current = byCode.get(current).fallback();
        }
        return List.copyOf(new ArrayList<>(seen));
    }

    private static String normalize(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
