package com.guardian.policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Tagged predicate data interpreted by the engine. A predicate fires when its
 * text matchers hit (or it has none) and every required context entry is
 * present with the expected value.
 *
 * <p>Keywords are literal phrases matched case-insensitively on word
 * boundaries, so {@code kill} does not match {@code skill}.</p>
 */
public final class RulePredicate {

    private final List<String> keywords;
    private final List<String> patterns;
    private final Map<String, String> requiredContext;
    private final List<Pattern> compiled;

    private RulePredicate(List<String> keywords, List<String> patterns, Map<String, String> requiredContext) {
        this.keywords = keywords;
        this.patterns = patterns;
        this.requiredContext = requiredContext;
        this.compiled = compile(keywords, patterns);
    }

    public static RulePredicate of(List<String> keywords, List<String> patterns, Map<String, String> requiredContext) {
        List<String> kw = normalize(keywords);
        List<String> px = normalize(patterns);
        Map<String, String> ctx = requiredContext == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(requiredContext));
        if (kw.isEmpty() && px.isEmpty() && ctx.isEmpty()) {
            throw new ConfigException("predicate must declare keywords, patterns or required context");
        }
        return new RulePredicate(kw, px, ctx);
    }

    public boolean matches(String text, Map<String, Object> context) {
        for (Map.Entry<String, String> required : requiredContext.entrySet()) {
            Object actual = context.get(required.getKey());
            if (actual == null || !required.getValue().equalsIgnoreCase(String.valueOf(actual))) {
                return false;
            }
        }
        if (compiled.isEmpty()) {
            return true;
        }
        for (Pattern pattern : compiled) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    public List<String> keywords() {
        return keywords;
    }

    public List<String> patterns() {
        return patterns;
    }

    public Map<String, String> requiredContext() {
        return requiredContext;
    }

    private static List<String> normalize(List<String> values) {
        if (values == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String value : values) {
            if (value == null || value.isBlank()) {
                throw new ConfigException("predicate entries must be non-empty strings");
            }
            out.add(value.trim());
        }
        return List.copyOf(out);
    }

    private static List<Pattern> compile(List<String> keywords, List<String> patterns) {
        int flags = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        List<Pattern> out = new ArrayList<>();
        for (String keyword : keywords) {
            out.add(Pattern.compile(
                "(?<![\\p{L}\\p{N}])" + Pattern.quote(keyword) + "(?![\\p{L}\\p{N}])", flags));
        }
        for (String raw : patterns) {
            try {
                out.add(Pattern.compile(raw, flags));
            } catch (PatternSyntaxException ex) {
                throw new ConfigException("invalid rule pattern: " + raw, ex);
            }
        }
        return List.copyOf(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RulePredicate other)) {
            return false;
        }
        return keywords.equals(other.keywords)
            && patterns.equals(other.patterns)
            && requiredContext.equals(other.requiredContext);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keywords, patterns, requiredContext);
    }

    @Override
    public String toString() {
        return "RulePredicate{keywords=" + keywords + ", patterns=" + patterns
            + ", requiredContext=" + requiredContext + '}';
    }
}
