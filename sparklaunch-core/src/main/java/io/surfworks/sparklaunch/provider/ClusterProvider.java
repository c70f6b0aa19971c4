package io.surfworks.sparklaunch.provider;

import io.surfworks.sparklaunch.request.ClusterCreationSpec;
import io.surfworks.sparklaunch.request.StepSpec;

import java.util.List;
import java.util.Set;

/**
 * Service Provider Interface for cluster orchestration services.
 * Implementations translate the neutral request types into provider API calls.
 *
 * <p>Providers are responsible for:
 * <ul>
 *   <li>Listing and describing clusters</li>
 *   <li>Creating clusters and adding steps to them</li>
 *   <li>Reporting step statuses</li>
 *   <li>Terminating clusters</li>
 * </ul>
 *
 * <p>Every call is a single request/response; implementations do not retry
 * beyond what their SDK already does.
 */
public interface ClusterProvider extends AutoCloseable {

    /**
     * Returns the name of this provider (e.g. "emr").
     */
    String name();

    /**
     * Lists clusters whose status is one of {@code states}, in provider order.
     *
     * @param states cluster statuses to include
     * @return matching clusters, in the order the provider returned them
     * @throws ProviderException if the call fails
     */
    List<ClusterHandle> listClusters(Set<String> states) throws ProviderException;

    /**
     * Fetches the current state of a cluster.
     *
     * @param clusterId provider-assigned cluster id
     * @return fresh snapshot of the cluster
     * @throws ProviderException if the call fails
     */
    ClusterHandle describeCluster(String clusterId) throws ProviderException;

    /**
     * Creates a cluster.
     *
     * @param spec creation request, including any steps to run
     * @return id of the new cluster
     * @throws ProviderException if the call fails
     */
    String createCluster(ClusterCreationSpec spec) throws ProviderException;

    /**
     * Adds steps to an existing cluster.
     *
     * @param clusterId provider-assigned cluster id
     * @param steps     steps to append
     * @throws ProviderException if the call fails
     */
    void addSteps(String clusterId, List<StepSpec> steps) throws ProviderException;

    /**
     * Lists every step of a cluster.
     *
     * @param clusterId provider-assigned cluster id
     * @return step snapshots
     * @throws ProviderException if the call fails
     */
    List<StepHandle> listSteps(String clusterId) throws ProviderException;

    /**
     * Requests termination of a cluster.
     *
     * @param clusterId provider-assigned cluster id
     * @throws ProviderException if the call fails
     */
    void terminateCluster(String clusterId) throws ProviderException;

    /**
     * Closes this provider and releases any client resources.
     */
    @Override
    void close();
}
