package com.payoutengine.gateway;

import com.payoutengine.credentials.Layer;
import com.payoutengine.signing.CanonicalJson;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Cache keys have the form {@code layer:method:sha256(canonical params)}.
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    public static String of(Layer layer, String method, Map<String, Object> params) {
        String canonical = CanonicalJson.write(params == null ? Map.of() : params);
        return prefix(layer, method) + sha256(canonical);
    }

    public static String prefix(Layer layer, String method) {
        return layer.wireName() + ":" + method + ":";
    }

    private static String sha256(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available in this JVM", e);
        }
    }
}
