package com.stellarcast.channel;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Canonical encoding of {@link Destination} and the job ids derived from it.
 * <p>
 * The encoding is compact JSON with properties and map entries sorted by key,
 * so equal destinations always produce identical bytes regardless of how they
 * were built.
 */
public final class TargetCodec {

    private TargetCodec() {
    }

    /** Namespace for per-destination delivery jobs in the shared scheduler. */
    public static final String JOB_ID_PREFIX = "send_task_";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .disable(MapperFeature.SORT_CREATOR_PROPERTIES_FIRST)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public static byte[] serialize(Destination destination) {
        try {
            return MAPPER.writeValueAsBytes(destination);
        } catch (IOException e) {
            throw new IllegalStateException("Destination is not serializable: " + destination, e);
        }
    }

    /**
     * @throws DestinationDecodeException on malformed input
     */
    public static Destination deserialize(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new DestinationDecodeException("empty destination");
        }
        try {
            return fromTree(MAPPER.readTree(bytes));
        } catch (IOException e) {
            throw new DestinationDecodeException("malformed destination: " + e.getMessage(), e);
        }
    }

    /**
     * Canonical tree form, for embedding in larger JSON documents.
     */
    public static JsonNode toTree(Destination destination) {
        try {
            return MAPPER.readTree(serialize(destination));
        } catch (IOException e) {
            throw new IllegalStateException("Destination is not serializable: " + destination, e);
        }
    }

    /**
     * @throws DestinationDecodeException if the node is not a destination object
     */
    public static Destination fromTree(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new DestinationDecodeException("destination must be a JSON object");
        }
        try {
            return MAPPER.treeToValue(node, Destination.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new DestinationDecodeException("malformed destination: " + e.getMessage(), e);
        }
    }

    /**
     * Deterministic scheduler job id for a destination.
     */
    public static String jobId(Destination destination) {
        return JOB_ID_PREFIX + md5Hex(serialize(destination));
    }

    static String md5Hex(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    /**
     * Canonical encoding as a string, usable as a map key.
     */
    public static String toCanonicalString(Destination destination) {
        return new String(serialize(destination), StandardCharsets.UTF_8);
    }
}
