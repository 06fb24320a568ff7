package io.polygraph.core;

/**
 * Base class for graph model and store errors.
 *
 * <p>Validation failures are raised before any write reaches the store, so a caller that catches
 * one of these can assume the initiating entity was not persisted.
 */
public abstract class GraphException extends RuntimeException {

    protected GraphException(String message) {
        super(message);
    }

    protected GraphException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when an update or morph operation references a node that does not exist.
     */
    public static class NotFound extends GraphException {
        private final String id;

        public NotFound(String id) {
            super("Node with ID " + id + " not found.");
            this.id = id;
        }

        public String id() {
            return id;
        }
    }

    /**
     * Raised when a relation references one or both nonexistent nodes.
     */
    public static class MissingEndpoint extends GraphException {
        private final String sourceId;
        private final String targetId;

        public MissingEndpoint(String sourceId, String targetId) {
            super("One or both nodes in the relation do not exist: " + sourceId + " -> " + targetId);
            this.sourceId = sourceId;
            this.targetId = targetId;
        }

        public String sourceId() {
            return sourceId;
        }

        public String targetId() {
            return targetId;
        }
    }

    /**
     * Raised when an attribute or function references a nonexistent source node.
     */
    public static class MissingSource extends GraphException {
        private final String sourceId;

        public MissingSource(String sourceId) {
            super("Source node " + sourceId + " not found.");
            this.sourceId = sourceId;
        }

        public String sourceId() {
            return sourceId;
        }
    }

    /**
     * Raised when a base name or label is empty or derives an empty identifier.
     */
    public static class InvalidName extends GraphException {
        public InvalidName(String message) {
            super(message);
        }
    }

    /**
     * Raised when a morph id or name does not resolve on the given node.
     */
    public static class MorphNotFound extends GraphException {
        public MorphNotFound(String nodeId, String morph) {
            super("Node " + nodeId + " has no morph " + morph);
        }
    }

    /**
     * Raised when a function expression cannot be parsed or evaluated.
     */
    public static class InvalidExpression extends GraphException {
        public InvalidExpression(String message) {
            super(message);
        }

        public InvalidExpression(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised on writes against a store that replicates someone else's log.
     */
    public static class ReadOnlyReplica extends GraphException {
        public ReadOnlyReplica(String logKey) {
            super("Log " + logKey + " is a read-only replica");
        }
    }

    /**
     * Raised when peer discovery or log transfer fails. Not retried by the replication layer.
     */
    public static class Transport extends GraphException {
        public Transport(String message) {
            super(message);
        }

        public Transport(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
