package io.surfworks.sparklaunch.request;

import java.util.List;
import java.util.Objects;

/**
 * Instance layout and networking of a cluster.
 *
 * @param subnetId                    EC2 subnet (may be null)
 * @param keyName                     EC2 key pair name (may be null)
 * @param additionalSecurityGroupIds  extra security groups for master and slave nodes
 * @param instanceGroups              MASTER group, optionally followed by a CORE group
 * @param keepJobFlowAliveWhenNoSteps false for clusters that should terminate after their steps
 */
public record InstancesConfig(
        String subnetId,
        String keyName,
        List<String> additionalSecurityGroupIds,
        List<InstanceGroupSpec> instanceGroups,
        boolean keepJobFlowAliveWhenNoSteps
) {

    public InstancesConfig {
        Objects.requireNonNull(instanceGroups, "instanceGroups cannot be null");

        long masters = instanceGroups.stream()
                .filter(g -> g.role() == InstanceRole.MASTER)
                .count();
        if (masters != 1) {
            throw new IllegalArgumentException("exactly one MASTER group is required, got " + masters);
        }

        additionalSecurityGroupIds = additionalSecurityGroupIds == null ?
                List.of() : List.copyOf(additionalSecurityGroupIds);
        instanceGroups = List.copyOf(instanceGroups);
    }

    /**
     * Returns a copy with the keep-alive flag replaced.
     */
    public InstancesConfig withKeepJobFlowAliveWhenNoSteps(boolean keepAlive) {
        return new InstancesConfig(subnetId, keyName, additionalSecurityGroupIds, instanceGroups, keepAlive);
    }

    /**
     * Returns the total number of instances across all groups.
     */
    public int totalInstanceCount() {
        return instanceGroups.stream().mapToInt(InstanceGroupSpec::instanceCount).sum();
    }
}
