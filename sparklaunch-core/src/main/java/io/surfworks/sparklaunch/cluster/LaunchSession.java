package io.surfworks.sparklaunch.cluster;

import java.util.Optional;

/**
 * Caller-owned session state: the optional id of the cluster commands act on.
 *
 * <p>Immutable. Commands that change the binding return a new session; the
 * caller decides whether to keep it. Never written to disk.
 *
 * @param boundClusterId id of the bound cluster (may be null)
 */
public record LaunchSession(String boundClusterId) {

    public LaunchSession {
        if (boundClusterId != null && boundClusterId.isBlank()) {
            boundClusterId = null;
        }
    }

    /**
     * Returns a session with no bound cluster.
     */
    public static LaunchSession empty() {
        return new LaunchSession(null);
    }

    /**
     * Returns the bound cluster id, if any.
     */
    public Optional<String> boundCluster() {
        return Optional.ofNullable(boundClusterId);
    }

    /**
     * Returns true if a cluster is bound.
     */
    public boolean isBound() {
        return boundClusterId != null;
    }

    /**
     * Returns a session bound to the given cluster.
     */
    public LaunchSession bind(String clusterId) {
        return new LaunchSession(clusterId);
    }

    /**
     * Returns a session with no bound cluster.
     */
    public LaunchSession unbind() {
        return empty();
    }
}
