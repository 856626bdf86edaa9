package com.esports.dashboard.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds deterministic cache keys of the form {@code dashboard:<prefix>:<16 hex chars>}.
 *
 * Parameters are converted to a JSON tree and canonicalized before hashing so
 * that logically equal filter objects share a key:
 * - object keys sorted
 * - null, missing, blank strings and empty arrays dropped
 * - array elements sorted (booleans, then numbers, then strings, then anything else)
 * - booleans and numbers never collapse into each other
 *
 * The hash is the first 16 hex characters of SHA-256 over the canonical JSON.
 */
@Component
public class CacheKeyBuilder {

    public static final String NAMESPACE = "dashboard";

    private static final int HASH_LENGTH = 16;

    private static final Comparator<JsonNode> ELEMENT_ORDER = Comparator
            .comparingInt(CacheKeyBuilder::typeRank)
            .thenComparing(CacheKeyBuilder::compareSameType);

    private final ObjectMapper mapper;

    public CacheKeyBuilder(ObjectMapper objectMapper) {
        // ISO strings for dates; timestamp arrays would be reordered by the array sort
        this.mapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String build(String prefix, Object params) {
        JsonNode canonical = canonicalize(mapper.valueToTree(params));
        if (canonical == null) {
            canonical = JsonNodeFactory.instance.objectNode();
        }

        try {
            String json = mapper.writeValueAsString(canonical);
            return NAMESPACE + ":" + prefix + ":" + sha256Prefix(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize cache key parameters", e);
        }
    }

    /**
     * Glob matching every key under a prefix, for pattern invalidation.
     */
    public static String pattern(String prefix) {
        return NAMESPACE + ":" + prefix + ":*";
    }

    /**
     * Canonical copy of the node, or null when the node carries no value.
     */
    static JsonNode canonicalize(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }

        if (node.isTextual()) {
            return node.asText().isBlank() ? null : node;
        }

        if (node.isObject()) {
            Map<String, JsonNode> sorted = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = canonicalize(field.getValue());
                if (value != null) {
                    sorted.put(field.getKey(), value);
                }
            }
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            sorted.forEach(result::set);
            return result;
        }

        if (node.isArray()) {
            List<JsonNode> elements = new ArrayList<>();
            for (JsonNode element : node) {
                JsonNode value = canonicalize(element);
                if (value != null) {
                    elements.add(value);
                }
            }
            if (elements.isEmpty()) {
                return null;
            }
            elements.sort(ELEMENT_ORDER);
            ArrayNode result = JsonNodeFactory.instance.arrayNode();
            elements.forEach(result::add);
            return result;
        }

        return node;
    }

    private static int typeRank(JsonNode node) {
        if (node.isBoolean()) {
            return 0;
        }
        if (node.isNumber()) {
            return 1;
        }
        if (node.isTextual()) {
            return 2;
        }
        return 3;
    }

    private static int compareSameType(JsonNode a, JsonNode b) {
        if (a.isBoolean()) {
            return Boolean.compare(a.booleanValue(), b.booleanValue());
        }
        if (a.isNumber()) {
            int byValue = a.decimalValue().compareTo(b.decimalValue());
            return byValue != 0 ? byValue : a.toString().compareTo(b.toString());
        }
        if (a.isTextual()) {
            return a.textValue().compareTo(b.textValue());
        }
        return a.toString().compareTo(b.toString());
    }

    private static String sha256Prefix(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
