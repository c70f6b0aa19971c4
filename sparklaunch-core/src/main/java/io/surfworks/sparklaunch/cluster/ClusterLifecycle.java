package io.surfworks.sparklaunch.cluster;

import io.surfworks.sparklaunch.provider.ClusterHandle;
import io.surfworks.sparklaunch.provider.ClusterProvider;
import io.surfworks.sparklaunch.provider.ProviderException;
import io.surfworks.sparklaunch.request.ClusterCreationSpec;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Create, bind, terminate and list commands for long-lived clusters.
 *
 * <p>Commands take the caller's {@link LaunchSession} and return the session
 * the caller should continue with. Missing clusters are reported in the log
 * and never raised.
 */
public final class ClusterLifecycle {

    private static final Logger LOG = Logger.getLogger(ClusterLifecycle.class.getName());

    private final ClusterProvider provider;
    private final ClusterRegistry registry;
    private final ClusterCreationSpec template;

    /**
     * @param provider provider to issue calls against
     * @param template creation request for long-lived clusters
     */
    public ClusterLifecycle(ClusterProvider provider, ClusterCreationSpec template) {
        this.provider = Objects.requireNonNull(provider, "provider cannot be null");
        this.template = Objects.requireNonNull(template, "template cannot be null");
        this.registry = new ClusterRegistry(provider);
    }

    /**
     * Creates a long-lived cluster from the template and binds the session to it.
     */
    public LaunchSession createCluster(LaunchSession session) throws ProviderException {
        String clusterId = provider.createCluster(template);
        LOG.info("Your new cluster's id is " + clusterId + ", you may check its status on the AWS console.");
        return session.bind(clusterId);
    }

    /**
     * Binds the session to an active cluster.
     *
     * @return the bound session, or {@code session} unchanged if no active cluster has that id
     */
    public LaunchSession bindCluster(LaunchSession session, String clusterId) throws ProviderException {
        Objects.requireNonNull(clusterId, "clusterId cannot be null");
        if (!registry.listActive().containsKey(clusterId)) {
            LOG.info("No active cluster with id " + clusterId + ".");
            return session;
        }
        LOG.info("Bound to cluster " + clusterId + ".");
        return session.bind(clusterId);
    }

    /**
     * Terminates the bound cluster and unbinds the session.
     *
     * @return the unbound session; {@code session} unchanged if nothing was bound
     */
    public LaunchSession terminateCluster(LaunchSession session) throws ProviderException {
        Optional<String> bound = session.boundCluster();
        if (bound.isEmpty()) {
            LOG.info("No cluster is bound, please specify the cluster you want to terminate using bind-cluster first.");
            return session;
        }
        provider.terminateCluster(bound.get());
        LOG.info("Cluster with id " + bound.get() + " is terminating, please check the AWS console for further information.");
        return session.unbind();
    }

    /**
     * Lists active clusters and logs one line per cluster.
     */
    public Collection<ClusterHandle> listClusters() throws ProviderException {
        Map<String, ClusterHandle> clusters = registry.listActive();
        if (clusters.isEmpty()) {
            LOG.info("No active cluster found.");
        } else {
            LOG.info(clusters.size() + " active clusters found:");
            for (ClusterHandle cluster : clusters.values()) {
                LOG.info("Id: " + cluster.id() + " | Name: " + cluster.name());
            }
        }
        return clusters.values();
    }

    /**
     * Resolves the cluster a monitor should watch: the bound cluster if any,
     * otherwise the active cluster named {@code clusterName}.
     */
    public Optional<String> findMonitorTarget(LaunchSession session, String clusterName) throws ProviderException {
        if (session.isBound()) {
            return session.boundCluster();
        }
        Optional<ClusterHandle> cluster = registry.findByName(clusterName);
        if (cluster.isEmpty()) {
            LOG.info("The cluster with name " + clusterName + " does not exist.");
            return Optional.empty();
        }
        LOG.info("Found cluster " + cluster.get().id() + ", start monitoring.");
        return Optional.of(cluster.get().id());
    }
}
