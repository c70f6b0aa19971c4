package io.surfworks.sparklaunch.request;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything needed to create a cluster.
 *
 * @param name           cluster name
 * @param releaseLabel   release label, e.g. "emr-5.11.0"
 * @param applications   applications to install, e.g. "Spark"
 * @param serviceRole    IAM role assumed by the service
 * @param instanceRole   IAM instance profile of the EC2 nodes
 * @param logUri         S3 folder for cluster logs (may be null)
 * @param configurations provider-side configuration entries
 * @param instances      instance layout and networking
 * @param steps          steps to run once the cluster is up
 */
public record ClusterCreationSpec(
        String name,
        String releaseLabel,
        List<String> applications,
        String serviceRole,
        String instanceRole,
        String logUri,
        List<EmrConfig> configurations,
        InstancesConfig instances,
        List<StepSpec> steps
) {

    public ClusterCreationSpec {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(releaseLabel, "releaseLabel cannot be null");
        Objects.requireNonNull(applications, "applications cannot be null");
        Objects.requireNonNull(serviceRole, "serviceRole cannot be null");
        Objects.requireNonNull(instanceRole, "instanceRole cannot be null");
        Objects.requireNonNull(instances, "instances cannot be null");

        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        if (releaseLabel.isBlank()) {
            throw new IllegalArgumentException("releaseLabel cannot be blank");
        }
        if (applications.isEmpty()) {
            throw new IllegalArgumentException("applications cannot be empty");
        }

        applications = List.copyOf(applications);
        configurations = configurations == null ? List.of() : List.copyOf(configurations);
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /**
     * Returns a copy with different instances config.
     */
    public ClusterCreationSpec withInstances(InstancesConfig newInstances) {
        return new ClusterCreationSpec(name, releaseLabel, applications, serviceRole,
                instanceRole, logUri, configurations, newInstances, steps);
    }

    /**
     * Returns a copy with the step appended after the existing steps.
     */
    public ClusterCreationSpec withStep(StepSpec step) {
        List<StepSpec> appended = new ArrayList<>(steps);
        appended.add(step);
        return new ClusterCreationSpec(name, releaseLabel, applications, serviceRole,
                instanceRole, logUri, configurations, instances, appended);
    }

    /**
     * Returns the job-scoped variant of this spec: the step is appended and the
     * cluster shuts itself down once all steps have finished.
     */
    public ClusterCreationSpec ephemeral(StepSpec step) {
        return withStep(step).withInstances(instances.withKeepJobFlowAliveWhenNoSteps(false));
    }
}
