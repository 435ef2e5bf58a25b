package com.eventedge.hypepipe.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Cache key = SHA-256 over the capability name and the input serialized with map
 * entries sorted by key at every depth, so key insertion order never matters.
 */
public final class CacheKeys {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private CacheKeys() {}

    public static String of(String capability, Map<String, Object> input) {
        String canonicalInput = canonicalJson(input);
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            sha.update(capability.getBytes(StandardCharsets.UTF_8));
            sha.update((byte) 0);
            sha.update(canonicalInput.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(sha.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String canonicalJson(Map<String, Object> input) {
        try {
            return CANONICAL.writeValueAsString(input != null ? input : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Capability input is not serializable", e);
        }
    }
}
