package com.repairline.core.idempotency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;

/**
 * SHA-256 digests for idempotency keys and request payloads.
 */
public final class KeyHashing {

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper();

    private KeyHashing() {
    }

    /**
     * Lowercase hex SHA-256 of the UTF-8 bytes of the value. Always 64 characters.
     */
    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String hashKey(String logicalKey) {
        return sha256Hex(logicalKey);
    }

    /**
     * Hash of the canonical JSON form of a payload: object keys sorted recursively,
     * so field order never changes the hash.
     *
     * @return null when the payload is null or JSON null
     */
    public static String hashPayload(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return null;
        }
        try {
            return sha256Hex(CANONICAL_MAPPER.writeValueAsString(canonicalize(payload)));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable", e);
        }
    }

    static JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            ObjectNode sorted = CANONICAL_MAPPER.createObjectNode();
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);
            for (String name : names) {
                sorted.set(name, canonicalize(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = CANONICAL_MAPPER.createArrayNode();
            node.forEach(element -> array.add(canonicalize(element)));
            return array;
        }
        return node;
    }
}
