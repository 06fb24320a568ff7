package io.polygraph.store.spi;

/**
 * Raised when an entity or log entry cannot be encoded or decoded.
 */
public class GraphCodecException extends RuntimeException {
    public GraphCodecException(String message) {
        super(message);
    }

    public GraphCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
