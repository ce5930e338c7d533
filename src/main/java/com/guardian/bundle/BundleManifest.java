package com.guardian.bundle;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Sidecar manifest of a bundle archive: a few {@code # key value} directives
 * followed by one {@code <sha256-hex>  <path>} line per archive entry.
 *
 * <pre>
 * # guardian-bundle v1
 * # record-count 2
 * # first-sequence 1
 * # anchor-hash 0000...0000
 * # archive-sha256 9f2c...
 * 5d41...  records/record-000000000001.json
 * 7c21...  records/record-000000000002.json
 * </pre>
 */
public record BundleManifest(
    long recordCount,
    long firstSequence,
    String anchorHash,
    String archiveDigest,
    SortedMap<String, String> entries
) {

    public static final String HEADER = "# guardian-bundle v1";

    public BundleManifest {
        entries = Collections.unmodifiableSortedMap(new TreeMap<>(entries == null ? Map.of() : entries));
    }

    public String render() {
        StringBuilder out = new StringBuilder();
        out.append(HEADER).append('\n');
        out.append("# record-count ").append(recordCount).append('\n');
        out.append("# first-sequence ").append(firstSequence).append('\n');
        out.append("# anchor-hash ").append(anchorHash).append('\n');
        if (archiveDigest != null) {
            out.append("# archive-sha256 ").append(archiveDigest).append('\n');
        }
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            out.append(entry.getValue()).append("  ").append(entry.getKey()).append('\n');
        }
        return out.toString();
    }

    public byte[] toBytes() {
        return render().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Parses a manifest.
     *
     * @throws IllegalArgumentException if the text is not a well-formed manifest
     */
    public static BundleManifest parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("manifest is empty");
        }
        String[] lines = text.split("\\r?\\n");
        if (!HEADER.equals(lines[0].trim())) {
            throw new IllegalArgumentException("manifest header missing or unsupported: " + lines[0]);
        }
        Long recordCount = null;
        Long firstSequence = null;
        String anchorHash = null;
        String archiveDigest = null;
        SortedMap<String, String> entries = new TreeMap<>();

        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith("#")) {
                String[] parts = line.substring(1).trim().split("\\s+", 2);
                if (parts.length != 2) {
                    throw new IllegalArgumentException("malformed directive on line " + (i + 1));
                }
                switch (parts[0]) {
                    case "record-count" -> recordCount = parseLong(parts[1], "record-count");
                    case "first-sequence" -> firstSequence = parseLong(parts[1], "first-sequence");
                    case "anchor-hash" -> anchorHash = parts[1].trim();
                    case "archive-sha256" -> archiveDigest = parts[1].trim();
                    default -> throw new IllegalArgumentException("unknown directive: " + parts[0]);
                }
                continue;
            }
            String[] parts = line.split("\\s+", 2);
            if (parts.length != 2 || !parts[0].matches("[0-9a-f]{64}")) {
                throw new IllegalArgumentException("malformed entry on line " + (i + 1));
            }
            if (entries.put(parts[1].trim(), parts[0]) != null) {
                throw new IllegalArgumentException("duplicate manifest path: " + parts[1].trim());
            }
        }
        if (recordCount == null || firstSequence == null || anchorHash == null) {
            throw new IllegalArgumentException("manifest must declare record-count, first-sequence and anchor-hash");
        }
        return new BundleManifest(recordCount, firstSequence, anchorHash, archiveDigest, entries);
    }

    private static long parseLong(String raw, String directive) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(directive + " must be an integer: " + raw);
        }
    }
}
