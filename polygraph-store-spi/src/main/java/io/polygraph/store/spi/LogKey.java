package io.polygraph.store.spi;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * Public identity of a replicated log: 32 bytes, rendered as lower-case hex.
 *
 * <p>The {@link #discoveryKey()} is what peers announce and look up; it can be shared without
 * handing out the key needed to read the log.
 */
public record LogKey(String hex) {
    private static final int KEY_BYTES = 32;
    private static final String DISCOVERY_NAMESPACE = "polygraph:discovery:";
    private static final SecureRandom RANDOM = new SecureRandom();

    public LogKey {
        Objects.requireNonNull(hex, "hex");
        hex = hex.trim().toLowerCase(Locale.ROOT);
        if (hex.length() != KEY_BYTES * 2) {
            throw new IllegalArgumentException("log key must be " + KEY_BYTES * 2 + " hex characters");
        }
        HexFormat.of().parseHex(hex);
    }

    public static LogKey random() {
        byte[] bytes = new byte[KEY_BYTES];
        RANDOM.nextBytes(bytes);
        return new LogKey(HexFormat.of().formatHex(bytes));
    }

    public static LogKey parse(String hex) {
        return new LogKey(hex);
    }

    public String discoveryKey() {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest((DISCOVERY_NAMESPACE + hex).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Last six characters, for log lines.
     */
    public String shortForm() {
        return hex.substring(hex.length() - 6);
    }

    @Override
    public String toString() {
        return hex;
    }
}
