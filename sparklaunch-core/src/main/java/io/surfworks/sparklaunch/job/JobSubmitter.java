package io.surfworks.sparklaunch.job;

import io.surfworks.sparklaunch.cluster.ClusterRegistry;
import io.surfworks.sparklaunch.provider.ClusterHandle;
import io.surfworks.sparklaunch.provider.ClusterProvider;
import io.surfworks.sparklaunch.provider.ProviderException;
import io.surfworks.sparklaunch.request.ClusterCreationSpec;
import io.surfworks.sparklaunch.request.StepSpec;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Submits a Spark job either to an active named cluster or to a new ephemeral one.
 *
 * <p>Each submission issues exactly one mutating provider call: AddSteps when
 * an active cluster with the target name exists, CreateCluster otherwise. The
 * created cluster has keep-alive disabled and terminates itself once its steps
 * have finished, whether they succeeded or not.
 *
 * <p>Concurrent submissions for the same name are not coordinated: two callers
 * may each create a cluster.
 */
public final class JobSubmitter {

    private static final Logger LOG = Logger.getLogger(JobSubmitter.class.getName());

    private final ClusterProvider provider;
    private final ClusterRegistry registry;
    private final ClusterCreationSpec template;

    /**
     * @param provider provider to issue calls against
     * @param template creation request used when no active cluster matches
     */
    public JobSubmitter(ClusterProvider provider, ClusterCreationSpec template) {
        this.provider = Objects.requireNonNull(provider, "provider cannot be null");
        this.template = Objects.requireNonNull(template, "template cannot be null");
        this.registry = new ClusterRegistry(provider);
    }

    /**
     * Submits a job.
     *
     * @param targetClusterName name of the cluster to attach to
     * @param mainClass         entry-point class
     * @param args              positional arguments for the job
     * @param submitConfs       {@code --conf} entries, emitted in iteration order
     * @param artifactLocation  location of the uploaded job jar
     * @return the cluster that now owns the step
     * @throws ProviderException if a provider call fails
     */
    public SubmitResult submit(
            String targetClusterName,
            String mainClass,
            List<String> args,
            Map<String, String> submitConfs,
            String artifactLocation) throws ProviderException {
        return submit(targetClusterName, SparkSubmitCommand.step(mainClass, args, submitConfs, artifactLocation));
    }

    /**
     * Submits an already built step.
     *
     * @param targetClusterName name of the cluster to attach to
     * @param step              step to run, usually from {@link SparkSubmitCommand#step}
     * @return the cluster that now owns the step
     * @throws ProviderException if a provider call fails
     */
    public SubmitResult submit(String targetClusterName, StepSpec step) throws ProviderException {
        Objects.requireNonNull(targetClusterName, "targetClusterName cannot be null");
        Objects.requireNonNull(step, "step cannot be null");

        Optional<ClusterHandle> cluster = registry.findByName(targetClusterName);

        if (cluster.isPresent()) {
            String clusterId = cluster.get().id();
            provider.addSteps(clusterId, List.of(step));
            LOG.info("Your job is added to the cluster with id " + clusterId
                    + ", you may check its status on the AWS console.");
            return new SubmitResult(clusterId, false, step);
        }

        String clusterId = provider.createCluster(template.ephemeral(step));
        LOG.info("Your new cluster's id is " + clusterId + ", you may check its status on the AWS console.");
        return new SubmitResult(clusterId, true, step);
    }
}
