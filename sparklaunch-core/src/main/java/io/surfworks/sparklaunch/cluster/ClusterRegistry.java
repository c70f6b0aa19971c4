package io.surfworks.sparklaunch.cluster;

import io.surfworks.sparklaunch.provider.ClusterHandle;
import io.surfworks.sparklaunch.provider.ClusterProvider;
import io.surfworks.sparklaunch.provider.ClusterStates;
import io.surfworks.sparklaunch.provider.ProviderException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only queries for active clusters.
 *
 * <p>Every call goes to the provider; nothing is cached between calls.
 * Results are filtered to the activated states even if the provider returns
 * more than was asked for.
 */
public final class ClusterRegistry {

    private final ClusterProvider provider;

    public ClusterRegistry(ClusterProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider cannot be null");
    }

    /**
     * Lists active clusters keyed by id, in provider listing order.
     *
     * @throws ProviderException if the provider call fails
     */
    public Map<String, ClusterHandle> listActive() throws ProviderException {
        Map<String, ClusterHandle> active = new LinkedHashMap<>();
        for (ClusterHandle cluster : provider.listClusters(ClusterStates.ACTIVATED)) {
            if (cluster.isActive()) {
                active.putIfAbsent(cluster.id(), cluster);
            }
        }
        return Collections.unmodifiableMap(active);
    }

    /**
     * Finds the first active cluster, in provider listing order, with exactly this name.
     *
     * <p>When several active clusters share the name, whichever the provider
     * lists first wins. That order is not guaranteed to be stable.
     *
     * @param name cluster name to match
     * @return the matching cluster, or empty if no active cluster has that name
     * @throws ProviderException if the provider call fails
     */
    public Optional<ClusterHandle> findByName(String name) throws ProviderException {
        Objects.requireNonNull(name, "name cannot be null");
        for (ClusterHandle cluster : provider.listClusters(ClusterStates.ACTIVATED)) {
            if (cluster.isActive() && name.equals(cluster.name())) {
                return Optional.of(cluster);
            }
        }
        return Optional.empty();
    }
}
