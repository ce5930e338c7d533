package com.guardian.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.guardian.contract.GuardRequest;
import com.guardian.contract.Phase;
import com.guardian.contract.Scores;
import com.guardian.contract.VerdictStatus;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical encoding of ledger records and the hash chain built on it.
 *
 * <p>Canonical form: a JSON object whose keys are sorted lexicographically at
 * every depth, written without insignificant whitespace in UTF-8. Scores are
 * strings with exactly four decimals, timestamps are ISO-8601 UTC strings and
 * sequence numbers are integers, so the encoding survives a parse and
 * re-serialise cycle in any JSON implementation.</p>
 *
 * <pre>
 * record_hash = sha256( canonical(record without "hash") || previous_hash )
 * </pre>
 *
 * <p>Instances are thread-safe.</p>
 */
public final class RecordCodec {

    public static final String GENESIS_HASH = "0".repeat(64);
    public static final String HASH_FIELD = "hash";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper mapper = JsonMapper.builder()
        .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
        .build();

    /** Tree of the record without its own hash. */
    public ObjectNode toUnsealedTree(DecisionRecord record) {
        ObjectNode node = NODES.objectNode();
        node.put("sequence", record.sequence());
        node.put("operation", record.operation().getValue());
        node.put("phase", record.phase().getValue());
        node.put("request_hash", record.requestHash());
        node.put("status", record.status().getValue());
        node.put("risk", score(record.risk()));
        ArrayNode fired = node.putArray("fired_rules");
        record.firedRules().forEach(fired::add);
        node.put("jurisdiction", record.jurisdiction());
        node.put("reversible", record.reversible());
        putScore(node, "protection_index", record.protectionIndex());
        putScore(node, "mhi", record.moralHealthIndex());
        node.put("rationale", record.rationale());
        node.put("timestamp", record.timestamp().toString());
        node.put("previous_hash", record.previousHash());
        return node;
    }

    /** Bytes written to an evidence file: the canonical record including its hash. */
    public byte[] toFileBytes(DecisionRecord record) {
        if (record.hash() == null) {
            throw new IllegalArgumentException("record " + record.sequence() + " is not sealed");
        }
        ObjectNode node = toUnsealedTree(record);
        node.put(HASH_FIELD, record.hash());
        return canonicalBytes(node);
    }

    public JsonNode parse(byte[] bytes) throws IOException {
        JsonNode node = mapper.readTree(bytes);
        if (node == null || !node.isObject()) {
            throw new IOException("record is not a JSON object");
        }
        return node;
    }

    /**
     * Decodes evidence file bytes. Only the exact canonical encoding of a
     * sealed record is accepted: reordered keys, extra whitespace, unknown
     * fields or re-typed values are rejected even when they parse to the same
     * content.
     */
    public DecisionRecord decode(byte[] bytes) throws IOException {
        JsonNode tree = parse(bytes);
        if (!tree.hasNonNull(HASH_FIELD)) {
            throw new IOException("record carries no hash");
        }
        DecisionRecord record;
        byte[] canonical;
        try {
            record = fromTree(tree);
            canonical = toFileBytes(record);
        } catch (RuntimeException ex) {
            throw new IOException("record fields are malformed: " + ex.getMessage(), ex);
        }
        if (!Arrays.equals(bytes, canonical)) {
            throw new IOException("record bytes are not in canonical form");
        }
        return record;
    }

    public DecisionRecord fromTree(JsonNode node) {
        List<String> fired = new ArrayList<>();
        node.path("fired_rules").forEach(n -> fired.add(n.asText()));
        return new DecisionRecord(
            node.path("sequence").asLong(),
            Operation.fromValue(text(node, "operation")),
            Phase.fromValue(text(node, "phase")),
            text(node, "request_hash"),
            VerdictStatus.fromValue(text(node, "status")),
            Double.parseDouble(text(node, "risk")),
            fired,
            text(node, "jurisdiction"),
            node.path("reversible").asBoolean(),
            optionalScore(node, "protection_index"),
            optionalScore(node, "mhi"),
            text(node, "rationale"),
            Instant.parse(text(node, "timestamp")),
            text(node, "previous_hash"),
            text(node, HASH_FIELD));
    }

    public String hash(DecisionRecord unsealed) {
        return chainHash(toUnsealedTree(unsealed), unsealed.previousHash());
    }

    /**
     * Recomputes a record hash from a parsed tree. Any {@code hash} field in
     * the tree is ignored.
     */
    public String chainHash(JsonNode recordTree, String previousHash) {
        ObjectNode copy = ((ObjectNode) recordTree).deepCopy();
        copy.remove(HASH_FIELD);
        byte[] body = canonicalBytes(copy);
        byte[] link = (previousHash == null ? "" : previousHash).getBytes(StandardCharsets.UTF_8);
        MessageDigest digest = sha256();
        digest.update(body);
        digest.update(link);
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Digest identifying a request: prompt or output text, sorted context,
     * requested jurisdiction and phase. The timestamp is excluded so identical
     * requests share a hash.
     */
    public String requestHash(GuardRequest request, Phase phase) {
        ObjectNode node = NODES.objectNode();
        node.put("phase", phase.getValue());
        node.put("text", request.text());
        node.set("context", mapper.valueToTree(new TreeMap<>(request.context())));
        if (request.jurisdiction() == null) {
            node.putNull("jurisdiction");
        } else {
            node.put("jurisdiction", request.jurisdiction());
        }
        return sha256Hex(canonicalBytes(node));
    }

    public byte[] canonicalBytes(JsonNode node) {
        try {
            return mapper.writeValueAsBytes(sorted(node));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("canonical serialisation failed", ex);
        }
    }

    public static String sha256Hex(byte[] bytes) {
        return HexFormat.of().formatHex(sha256().digest(bytes));
    }

    private static JsonNode sorted(JsonNode node) {
        if (node.isObject()) {
            TreeMap<String, JsonNode> fields = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> field = it.next();
                fields.put(field.getKey(), sorted(field.getValue()));
            }
            ObjectNode out = NODES.objectNode();
            fields.forEach(out::set);
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = NODES.arrayNode();
            node.forEach(element -> out.add(sorted(element)));
            return out;
        }
        return node;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static String score(double value) {
        return Scores.toDecimal(value).toPlainString();
    }

    private static void putScore(ObjectNode node, String field, Double value) {
        if (value == null) {
            node.putNull(field);
        } else {
            node.put(field, score(value));
        }
    }

    private static Double optionalScore(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : Double.parseDouble(value.asText());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
