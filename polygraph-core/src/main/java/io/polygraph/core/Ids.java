package io.polygraph.core;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic identifier derivation.
 */
public final class Ids {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int VALUE_HASH_CHARS = 8;

    private Ids() {}

    /**
     * {@code "Carbon Dioxide"} becomes {@code "carbon_dioxide"}.
     */
    public static String nodeId(String baseName) {
        if (baseName == null) throw new GraphException.InvalidName("base name must not be null");
        String id = underscored(baseName.trim().toLowerCase(Locale.ROOT));
        if (id.isEmpty()) throw new GraphException.InvalidName("base name must not be empty");
        return id;
    }

    /**
     * {@code rel_<source>_<name>_<target>_<h>}, where {@code h} hashes the raw triple. Node ids and
     * underscored names both contain {@code _}, so the readable part alone is ambiguous.
     */
    public static String relationId(String sourceId, String name, String targetId) {
        String label = name.trim();
        return "rel_" + sourceId + "_" + underscored(label) + "_" + targetId + "_"
                + partsHash(sourceId, label, targetId);
    }

    /**
     * {@code attr_<source>_<name>_<h>}, where {@code h} hashes source id, raw name and value.
     */
    public static String attributeId(String sourceId, String name, String value) {
        String label = name.trim();
        return "attr_" + sourceId + "_" + underscored(label) + "_" + partsHash(sourceId, label, String.valueOf(value));
    }

    public static String morphId(String nodeId, long seq) {
        if (seq < 0) throw new IllegalArgumentException("seq must be >= 0");
        return nodeId + "_morph_" + seq;
    }

    /**
     * First characters of the SHA-256 of the value's UTF-8 bytes, in lower-case hex.
     */
    public static String valueHash(String value) {
        return sha256Hex(String.valueOf(value)).substring(0, VALUE_HASH_CHARS);
    }

    static String partsHash(String... parts) {
        return sha256Hex(String.join("\u0000", parts)).substring(0, VALUE_HASH_CHARS);
    }

    public static String sha256Hex(String text) {
        return HexFormat.of().formatHex(sha256(text.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Replaces whitespace runs with a single underscore, as identifiers used in ids and expressions.
     */
    public static String underscored(String text) {
        return WHITESPACE.matcher(text).replaceAll("_");
    }

    private static byte[] sha256(byte[] bytes) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
