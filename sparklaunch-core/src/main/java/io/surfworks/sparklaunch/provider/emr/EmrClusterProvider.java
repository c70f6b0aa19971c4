package io.surfworks.sparklaunch.provider.emr;

import com.amazonaws.AmazonClientException;
import com.amazonaws.services.elasticmapreduce.AmazonElasticMapReduce;
import com.amazonaws.services.elasticmapreduce.AmazonElasticMapReduceClientBuilder;
import com.amazonaws.services.elasticmapreduce.model.AddJobFlowStepsRequest;
import com.amazonaws.services.elasticmapreduce.model.Cluster;
import com.amazonaws.services.elasticmapreduce.model.ClusterSummary;
import com.amazonaws.services.elasticmapreduce.model.DescribeClusterRequest;
import com.amazonaws.services.elasticmapreduce.model.ListClustersRequest;
import com.amazonaws.services.elasticmapreduce.model.ListClustersResult;
import com.amazonaws.services.elasticmapreduce.model.ListStepsRequest;
import com.amazonaws.services.elasticmapreduce.model.ListStepsResult;
import com.amazonaws.services.elasticmapreduce.model.RunJobFlowResult;
import com.amazonaws.services.elasticmapreduce.model.StepSummary;
import com.amazonaws.services.elasticmapreduce.model.TerminateJobFlowsRequest;
import io.surfworks.sparklaunch.provider.ClusterHandle;
import io.surfworks.sparklaunch.provider.ClusterProvider;
import io.surfworks.sparklaunch.provider.ProviderException;
import io.surfworks.sparklaunch.provider.StepHandle;
import io.surfworks.sparklaunch.request.ClusterCreationSpec;
import io.surfworks.sparklaunch.request.StepSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Cluster provider backed by Amazon EMR.
 *
 * <p>Uses the AWS SDK's default credential chain; the region comes from the
 * configuration or, when absent, from the SDK's default region chain.
 * SDK client exceptions are wrapped in {@link ProviderException} with their
 * message unchanged.
 */
public final class EmrClusterProvider implements ClusterProvider {

    private static final Logger LOG = Logger.getLogger(EmrClusterProvider.class.getName());

    private final AmazonElasticMapReduce emr;
    private volatile boolean closed;

    /**
     * Creates a provider around an existing EMR client.
     */
    public EmrClusterProvider(AmazonElasticMapReduce emr) {
        this.emr = emr;
        this.closed = false;
    }

    /**
     * Creates a provider with a new EMR client for the given region.
     *
     * @param region AWS region, or null for the SDK default region chain
     */
    public static EmrClusterProvider forRegion(String region) {
        AmazonElasticMapReduceClientBuilder builder = AmazonElasticMapReduceClientBuilder.standard();
        if (region != null && !region.isBlank()) {
            builder.withRegion(region);
        }
        return new EmrClusterProvider(builder.build());
    }

    @Override
    public String name() {
        return "emr";
    }

    @Override
    public List<ClusterHandle> listClusters(Set<String> states) throws ProviderException {
        ensureOpen();

        try {
            List<ClusterHandle> clusters = new ArrayList<>();
            String marker = null;
            do {
                ListClustersResult result = emr.listClusters(new ListClustersRequest()
                        .withClusterStates(states)
                        .withMarker(marker));
                for (ClusterSummary summary : result.getClusters()) {
                    clusters.add(new ClusterHandle(
                            summary.getId(),
                            summary.getName(),
                            summary.getStatus().getState()));
                }
                marker = result.getMarker();
            } while (marker != null);
            return clusters;

        } catch (AmazonClientException e) {
            throw new ProviderException(e.getMessage(), e);
        }
    }

    @Override
    public ClusterHandle describeCluster(String clusterId) throws ProviderException {
        ensureOpen();

        try {
            Cluster cluster = emr.describeCluster(new DescribeClusterRequest().withClusterId(clusterId))
                    .getCluster();
            return new ClusterHandle(cluster.getId(), cluster.getName(), cluster.getStatus().getState());

        } catch (AmazonClientException e) {
            throw new ProviderException(e.getMessage(), e);
        }
    }

    @Override
    public String createCluster(ClusterCreationSpec spec) throws ProviderException {
        ensureOpen();

        try {
            RunJobFlowResult result = emr.runJobFlow(EmrRequests.runJobFlow(spec));
            LOG.fine("RunJobFlow accepted for " + spec.name() + ": " + result.getJobFlowId());
            return result.getJobFlowId();

        } catch (AmazonClientException e) {
            throw new ProviderException(e.getMessage(), e);
        }
    }

    @Override
    public void addSteps(String clusterId, List<StepSpec> steps) throws ProviderException {
        ensureOpen();

        try {
            emr.addJobFlowSteps(new AddJobFlowStepsRequest()
                    .withJobFlowId(clusterId)
                    .withSteps(EmrRequests.steps(steps)));

        } catch (AmazonClientException e) {
            throw new ProviderException(e.getMessage(), e);
        }
    }

    @Override
    public List<StepHandle> listSteps(String clusterId) throws ProviderException {
        ensureOpen();

        try {
            List<StepHandle> steps = new ArrayList<>();
            String marker = null;
            do {
                ListStepsResult result = emr.listSteps(new ListStepsRequest()
                        .withClusterId(clusterId)
                        .withMarker(marker));
                for (StepSummary summary : result.getSteps()) {
                    steps.add(new StepHandle(
                            summary.getId(),
                            summary.getName(),
                            summary.getStatus().getState()));
                }
                marker = result.getMarker();
            } while (marker != null);
            return steps;

        } catch (AmazonClientException e) {
            throw new ProviderException(e.getMessage(), e);
        }
    }

    @Override
    public void terminateCluster(String clusterId) throws ProviderException {
        ensureOpen();

        try {
            emr.terminateJobFlows(new TerminateJobFlowsRequest().withJobFlowIds(clusterId));

        } catch (AmazonClientException e) {
            throw new ProviderException(e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            emr.shutdown();
        }
    }

    private void ensureOpen() throws ProviderException {
        if (closed) {
            throw new ProviderException("Provider is closed");
        }
    }
}
