package io.surfworks.sparklaunch.provider;

import java.util.Objects;

/**
 * A cluster as last reported by the provider.
 *
 * <p>Handles are snapshots: they are re-fetched on every query and never
 * cached beyond a single operation.
 *
 * @param id     provider-assigned cluster id, e.g. "j-2AXXXXXXGAPLF"
 * @param name   cluster name
 * @param status lifecycle status string, e.g. "WAITING" or "TERMINATED"
 */
public record ClusterHandle(String id, String name, String status) {

    public ClusterHandle {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(status, "status cannot be null");

        if (id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
    }

    /**
     * Returns true if the cluster is running, starting, waiting or bootstrapping.
     */
    public boolean isActive() {
        return ClusterStates.isActivated(status);
    }
}
