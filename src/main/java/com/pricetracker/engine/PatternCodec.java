package com.pricetracker.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the JSON records patterns and extraction results are persisted as.
 * <p>
 * Pattern record:
 * <pre>
 * { "domain": "...",
 *   "fields": { "price": { "primary": Selector, "fallbacks": [Selector, ...] } },
 *   "total_attempts": 0, "successful_attempts": 0, "success_rate": 0.0 }
 * Selector = { "type", "expression", "attribute"?, "confidence", "source"? }
 * </pre>
 * Records written by the older pattern generator ({@code store_domain}, {@code patterns}, {@code selector},
 * short type names) are read as well. A missing confidence means 1.0 on a primary and 0.5 on a fallback.
 *
 * @author Price Tracker Team
 * @since 1.0
 */
public final class PatternCodec {
    private PatternCodec() {}

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final double DEFAULT_PRIMARY_CONFIDENCE = 1.0;
    static final double DEFAULT_FALLBACK_CONFIDENCE = 0.5;

    /**
     * Parses a pattern record.
     * @param json pattern JSON
     * @return the pattern
     * @throws IOException if the JSON is malformed or describes an invalid pattern
     */
    public static Pattern readPattern(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json == null ? "" : json);
        if (root == null || !root.isObject()) {
            throw new IOException("Pattern record must be a JSON object");
        }
        try {
            String domain = text(root, "domain", "store_domain");
            if (domain == null) {
                throw new IOException("Pattern record has no domain");
            }
            JsonNode fieldsNode = root.has("fields") ? root.get("fields") : root.get("patterns");
            Map<String, FieldPattern> fields = readFields(fieldsNode);
            int total = root.path("total_attempts").asInt(0);
            int successful = root.path("successful_attempts").asInt(0);
            // success_rate is written for readers of the record; the pattern derives it from the counters
            return new Pattern(domain, fields, total, successful, PatternStats.rate(successful, total));
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid pattern record: " + e.getMessage(), e);
        }
    }

    /**
     * Parses the {@code fields} object of a pattern record.
     * @throws IOException if a field or selector is malformed
     */
    public static Map<String, FieldPattern> readFields(JsonNode fieldsNode) throws IOException {
        Map<String, FieldPattern> fields = new LinkedHashMap<>();
        if (fieldsNode == null || fieldsNode.isNull() || fieldsNode.isMissingNode()) {
            return fields;
        }
        if (!fieldsNode.isObject()) {
            throw new IOException("Pattern fields must be a JSON object");
        }
        Iterator<Map.Entry<String, JsonNode>> it = fieldsNode.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode primaryNode = entry.getValue().get("primary");
            if (primaryNode == null || !primaryNode.isObject()) {
                throw new IOException("Field '" + entry.getKey() + "' has no primary selector");
            }
            Selector primary = readSelector(primaryNode, DEFAULT_PRIMARY_CONFIDENCE);
            List<Selector> fallbacks = new ArrayList<>();
            JsonNode fallbackNodes = entry.getValue().path("fallbacks");
            if (fallbackNodes.isArray()) {
                for (JsonNode node : fallbackNodes) {
                    fallbacks.add(readSelector(node, DEFAULT_FALLBACK_CONFIDENCE));
                }
            }
            fields.put(entry.getKey(), new FieldPattern(primary, fallbacks));
        }
        return fields;
    }

    public static Map<String, FieldPattern> readFields(String fieldsJson) throws IOException {
        return readFields(MAPPER.readTree(fieldsJson == null ? "{}" : fieldsJson));
    }

    private static Selector readSelector(JsonNode node, double defaultConfidence) throws IOException {
        String expression = text(node, "expression", "selector");
        if (expression == null) {
            throw new IOException("Selector has no expression: " + node);
        }
        double confidence = node.has("confidence") ? node.get("confidence").asDouble() : defaultConfidence;
        try {
            return new Selector(
                SelectorType.fromWireName(text(node, "type")),
                expression,
                text(node, "attribute"),
                confidence,
                text(node, "source")
            );
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid selector " + node + ": " + e.getMessage(), e);
        }
    }

    /**
     * Serializes a pattern to its record form.
     */
    public static String writePattern(Pattern pattern) throws IOException {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("domain", pattern.domain());
        root.set("fields", fieldsNode(pattern.fields()));
        root.put("total_attempts", pattern.totalAttempts());
        root.put("successful_attempts", pattern.successfulAttempts());
        root.put("success_rate", pattern.successRate());
        return MAPPER.writeValueAsString(root);
    }

    public static String writeFields(Map<String, FieldPattern> fields) throws IOException {
        return MAPPER.writeValueAsString(fieldsNode(fields));
    }

    private static ObjectNode fieldsNode(Map<String, FieldPattern> fields) {
        ObjectNode node = MAPPER.createObjectNode();
        for (Map.Entry<String, FieldPattern> entry : fields.entrySet()) {
            ObjectNode fieldNode = node.putObject(entry.getKey());
            fieldNode.set("primary", selectorNode(entry.getValue().primary()));
            ArrayNode fallbacks = fieldNode.putArray("fallbacks");
            for (Selector s : entry.getValue().fallbacks()) fallbacks.add(selectorNode(s));
        }
        return node;
    }

    private static ObjectNode selectorNode(Selector selector) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", selector.type().wireName());
        node.put("expression", selector.expression());
        if (selector.attribute() != null) node.put("attribute", selector.attribute());
        node.put("confidence", selector.confidence());
        if (selector.source() != null) node.put("source", selector.source());
        return node;
    }

    /**
     * Serializes an extraction result (fields, errors, warnings).
     */
    public static String writeExtraction(ExtractionResult extraction) throws IOException {
        ObjectNode root = MAPPER.createObjectNode();
        ObjectNode fields = root.putObject("fields");
        for (Map.Entry<String, ExtractedField> entry : extraction.fields().entrySet()) {
            ExtractedField f = entry.getValue();
            ObjectNode node = fields.putObject(entry.getKey());
            if (f.value() == null) node.putNull("value"); else node.put("value", f.value());
            if (f.method() == null) node.putNull("method"); else node.put("method", f.method().wireName());
            node.put("confidence", f.confidence());
            node.put("selector_index", f.selectorIndex());
        }
        ArrayNode errors = root.putArray("errors");
        extraction.errors().forEach(errors::add);
        ArrayNode warnings = root.putArray("warnings");
        extraction.warnings().forEach(warnings::add);
        return MAPPER.writeValueAsString(root);
    }

    /**
     * Parses an extraction result written by {@link #writeExtraction(ExtractionResult)}.
     * @throws IOException if the JSON is malformed
     */
    public static ExtractionResult readExtraction(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json == null ? "" : json);
        if (root == null || !root.isObject()) {
            throw new IOException("Extraction record must be a JSON object");
        }
        try {
            Map<String, ExtractedField> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = root.path("fields").fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                JsonNode node = entry.getValue();
                String value = text(node, "value");
                String method = text(node, "method");
                fields.put(entry.getKey(), new ExtractedField(
                    value,
                    method == null ? null : SelectorType.fromWireName(method),
                    node.path("confidence").asDouble(0.0),
                    node.path("selector_index").asInt(value == null ? -1 : 0)
                ));
            }
            List<String> errors = new ArrayList<>();
            root.path("errors").forEach(n -> errors.add(n.asText()));
            List<String> warnings = new ArrayList<>();
            root.path("warnings").forEach(n -> warnings.add(n.asText()));
            return new ExtractionResult(fields, errors, warnings);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid extraction record: " + e.getMessage(), e);
        }
    }

    private static String text(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) return value.asText();
        }
        return null;
    }
}
