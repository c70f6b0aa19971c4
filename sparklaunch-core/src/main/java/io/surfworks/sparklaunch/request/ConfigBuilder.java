package io.surfworks.sparklaunch.request;

import io.surfworks.sparklaunch.config.LaunchConfig;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Translates declarative settings into cluster request structures.
 *
 * <p>Every method is a pure function: no I/O, no provider calls, the same
 * inputs always produce equal outputs. Invalid settings are rejected with
 * {@link IllegalArgumentException} before anything reaches the provider.
 */
public final class ConfigBuilder {

    private ConfigBuilder() {
    }

    /**
     * Builds the instance groups for a cluster of {@code instanceCount} nodes.
     *
     * <p>One MASTER instance is always present; the remaining
     * {@code instanceCount - 1} nodes form the CORE group, which is omitted when
     * empty. A bid price puts every group on the spot market.
     *
     * @param instanceCount total number of instances, master included
     * @param instanceType  EC2 instance type of every node
     * @param bidPrice      spot bid price (null = on-demand)
     * @return MASTER group, optionally followed by a CORE group
     */
    public static List<InstanceGroupSpec> buildInstanceGroups(int instanceCount, String instanceType, Double bidPrice) {
        Objects.requireNonNull(instanceType, "instanceType cannot be null");
        if (instanceCount < 1) {
            throw new IllegalArgumentException("instanceCount must be at least 1, got " + instanceCount);
        }
        if (instanceType.isBlank()) {
            throw new IllegalArgumentException("instanceType cannot be blank");
        }

        Market market = bidPrice == null ? Market.ON_DEMAND : Market.SPOT;
        String bid = bidPrice == null ? null : formatBidPrice(bidPrice);

        List<InstanceGroupSpec> groups = new ArrayList<>(2);
        groups.add(new InstanceGroupSpec(InstanceRole.MASTER, instanceType, 1, market, bid));

        int coreCount = instanceCount - 1;
        if (coreCount > 0) {
            groups.add(new InstanceGroupSpec(InstanceRole.CORE, instanceType, coreCount, market, bid));
        }
        return List.copyOf(groups);
    }

    /**
     * Builds the instances config of a long-lived cluster.
     *
     * @param subnetId         EC2 subnet (may be null)
     * @param keyName          EC2 key pair (may be null)
     * @param securityGroupIds additional security groups (may be empty)
     * @param groups           instance groups from {@link #buildInstanceGroups}
     */
    public static InstancesConfig buildInstancesConfig(
            String subnetId,
            String keyName,
            List<String> securityGroupIds,
            List<InstanceGroupSpec> groups) {
        return new InstancesConfig(
                blankToNull(subnetId),
                blankToNull(keyName),
                securityGroupIds,
                groups,
                true
        );
    }

    /**
     * Builds the cluster-creation request.
     */
    public static ClusterCreationSpec buildCreationRequest(
            String name,
            String releaseLabel,
            List<String> applications,
            String serviceRole,
            String instanceRole,
            String logUri,
            List<EmrConfig> providerConfigs,
            InstancesConfig instancesConfig) {
        requireText(serviceRole, "serviceRole");
        requireText(instanceRole, "instanceRole");

        return new ClusterCreationSpec(
                name,
                releaseLabel,
                applications,
                serviceRole,
                instanceRole,
                blankToNull(logUri),
                providerConfigs,
                instancesConfig,
                List.of()
        );
    }

    /**
     * Builds the long-lived cluster template from the loaded configuration.
     */
    public static ClusterCreationSpec fromConfig(LaunchConfig config) {
        List<InstanceGroupSpec> groups = buildInstanceGroups(
                config.instanceCount(), config.instanceType(), config.instanceBidPrice());
        InstancesConfig instances = buildInstancesConfig(
                config.subnetId(), config.instanceKeyName(), config.securityGroupIds(), groups);
        return buildCreationRequest(
                config.clusterName(),
                config.emrRelease(),
                config.emrApplications(),
                config.emrServiceRole(),
                config.instanceRole(),
                config.s3LogUri(),
                config.emrConfigs(),
                instances
        );
    }

    /**
     * Formats a bid price as a plain decimal string ("0.5" or "2", never "5.0E-1").
     */
    static String formatBidPrice(double bidPrice) {
        if (!Double.isFinite(bidPrice) || bidPrice <= 0) {
            throw new IllegalArgumentException("bidPrice must be a positive number, got " + bidPrice);
        }
        return BigDecimal.valueOf(bidPrice).stripTrailingZeros().toPlainString();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static void requireText(String value, String field) {
        Objects.requireNonNull(value, field + " cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " cannot be blank");
        }
    }
}
