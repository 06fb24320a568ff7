package io.polygraph.replication;

/**
 * Log replication protocol constants (paths, query keys, header names and well-known values).
 *
 * <p>A served log is addressed by its discovery topic. Reads additionally present the log key,
 * so knowing a topic is enough to find peers but not to read the entries.
 */
public final class LogProtocol {
    private LogProtocol() {}

    public static final String LOGS_PATH = "/logs/";

    // Query parameter keys
    public static final String Q_OFFSET = "offset";
    public static final String Q_MAX = "max";
    public static final String Q_LIVE = "live";

    // live modes
    public static final String LIVE_LONG_POLL = "long-poll";

    // Response headers
    public static final String H_LOG_LENGTH = "Log-Length";
    public static final String H_LOG_NEXT_OFFSET = "Log-Next-Offset";
    public static final String H_LOG_UP_TO_DATE = "Log-Up-To-Date";

    // Request headers
    public static final String H_LOG_KEY = "Log-Key";
    public static final String H_PEER_ID = "Peer-Id";
    public static final String H_PEER_ADDRESS = "Peer-Address";

    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_CACHE_CONTROL = "Cache-Control";
    public static final String H_ERROR = "X-Error";

    /** Canonical boolean textual value used by the protocol for true. */
    public static final String BOOL_TRUE = "true";

    public static String logPath(String topic) {
        return LOGS_PATH + topic;
    }
}
