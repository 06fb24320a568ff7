package io.polygraph.replication;

/**
 * How a swarm participates in a topic.
 *
 * @param server announce the topic so others connect to us
 * @param client look the topic up and connect to those who announced it
 */
public record JoinMode(boolean server, boolean client) {
    public static final JoinMode BOTH = new JoinMode(true, true);
    public static final JoinMode SERVER_ONLY = new JoinMode(true, false);
    public static final JoinMode CLIENT_ONLY = new JoinMode(false, true);

    public JoinMode {
        if (!server && !client) {
            throw new IllegalArgumentException("join mode must enable server or client");
        }
    }
}
