package io.polygraph.replication;

/**
 * Fixed-width base-36 rendering of non-negative longs, so offsets sort as strings.
 */
final class LexiLong {
    private static final int WIDTH = 13;

    private LexiLong() {}

    static String encode(long value) {
        if (value < 0) throw new IllegalArgumentException("value must be >= 0");
        String s = Long.toUnsignedString(value, 36);
        if (s.length() > WIDTH) throw new IllegalArgumentException("value too large");
        return "0".repeat(WIDTH - s.length()) + s;
    }

    static long decode(String token) {
        if (token == null || token.isEmpty()) throw new IllegalArgumentException("offset token must not be empty");
        if (token.length() > WIDTH) throw new IllegalArgumentException("offset token too long: " + token);
        long value;
        try {
            value = Long.parseUnsignedLong(token, 36);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid offset token: " + token, e);
        }
        if (value < 0) throw new IllegalArgumentException("offset out of range: " + token);
        return value;
    }
}
