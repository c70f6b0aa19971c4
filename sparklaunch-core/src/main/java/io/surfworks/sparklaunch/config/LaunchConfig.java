package io.surfworks.sparklaunch.config;

import io.surfworks.sparklaunch.request.EmrConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for sparklaunch.
 *
 * <p>Configuration is loaded in order of precedence:
 * <ol>
 *   <li>CLI arguments (highest priority)</li>
 *   <li>Config file ({@code ~/.config/sparklaunch/launch.json})</li>
 *   <li>Defaults (lowest priority)</li>
 * </ol>
 *
 * @param clusterName            name of the cluster jobs are submitted to
 * @param awsRegion              AWS region (null = SDK default region chain)
 * @param emrRelease             EMR release label
 * @param emrServiceRole         IAM service role of the cluster
 * @param emrApplications        applications installed on the cluster
 * @param emrConfigs             EMR configuration entries
 * @param subnetId               EC2 subnet (may be null)
 * @param securityGroupIds       additional security groups for master and slave nodes
 * @param instanceCount          total number of instances, master included
 * @param instanceType           EC2 instance type of every node
 * @param instanceBidPrice       spot bid price (null = on-demand)
 * @param instanceRole           IAM instance profile of the nodes
 * @param instanceKeyName        EC2 key pair name (may be null)
 * @param s3JarFolder            S3 folder the job jar is uploaded to (may be null until submitting)
 * @param s3LogUri               S3 folder for EMR logs (may be null)
 * @param s3ServerSideEncryption request SSE-S3 encryption for uploaded jars
 * @param timeout                monitor timeout before the cluster is force-terminated
 * @param submitConfs            {@code --conf} entries passed to spark-submit
 */
public record LaunchConfig(
        String clusterName,
        String awsRegion,
        String emrRelease,
        String emrServiceRole,
        List<String> emrApplications,
        List<EmrConfig> emrConfigs,
        String subnetId,
        List<String> securityGroupIds,
        int instanceCount,
        String instanceType,
        Double instanceBidPrice,
        String instanceRole,
        String instanceKeyName,
        String s3JarFolder,
        String s3LogUri,
        boolean s3ServerSideEncryption,
        Duration timeout,
        Map<String, String> submitConfs
) {

    /** Default cluster name when none is configured */
    public static final String DEFAULT_CLUSTER_NAME = "sparklaunch";

    public static final String DEFAULT_EMR_RELEASE = "emr-5.11.0";

    public static final String DEFAULT_SERVICE_ROLE = "EMR_DefaultRole";

    public static final String DEFAULT_INSTANCE_ROLE = "EMR_EC2_DefaultRole";

    public static final String DEFAULT_INSTANCE_TYPE = "m3.xlarge";

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(90);

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "sparklaunch"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "launch.json";

    public LaunchConfig {
        Objects.requireNonNull(clusterName, "clusterName cannot be null");
        Objects.requireNonNull(emrRelease, "emrRelease cannot be null");
        Objects.requireNonNull(emrServiceRole, "emrServiceRole cannot be null");
        Objects.requireNonNull(instanceType, "instanceType cannot be null");
        Objects.requireNonNull(instanceRole, "instanceRole cannot be null");

        if (clusterName.isBlank()) {
            throw new IllegalArgumentException("clusterName cannot be blank");
        }
        if (instanceCount < 1) {
            throw new IllegalArgumentException("instanceCount must be at least 1, got " + instanceCount);
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }

        emrApplications = emrApplications == null ? List.of("Spark") : List.copyOf(emrApplications);
        emrConfigs = emrConfigs == null ? List.of() : List.copyOf(emrConfigs);
        securityGroupIds = securityGroupIds == null ? List.of() : List.copyOf(securityGroupIds);
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        submitConfs = submitConfs == null ?
                Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(submitConfs));
    }

    /**
     * Returns the default configuration.
     */
    public static LaunchConfig defaults() {
        return builder().build();
    }

    /**
     * Returns the config file path.
     */
    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    /**
     * Creates a builder populated with the defaults.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder populated with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .clusterName(clusterName)
                .awsRegion(awsRegion)
                .emrRelease(emrRelease)
                .emrServiceRole(emrServiceRole)
                .emrApplications(emrApplications)
                .emrConfigs(emrConfigs)
                .subnetId(subnetId)
                .securityGroupIds(securityGroupIds)
                .instanceCount(instanceCount)
                .instanceType(instanceType)
                .instanceBidPrice(instanceBidPrice)
                .instanceRole(instanceRole)
                .instanceKeyName(instanceKeyName)
                .s3JarFolder(s3JarFolder)
                .s3LogUri(s3LogUri)
                .s3ServerSideEncryption(s3ServerSideEncryption)
                .timeout(timeout)
                .submitConfs(submitConfs);
    }

    /**
     * Returns a new config with the specified cluster name.
     */
    public LaunchConfig withClusterName(String name) {
        return toBuilder().clusterName(name).build();
    }

    /**
     * Returns a new config with the specified region.
     */
    public LaunchConfig withRegion(String region) {
        return toBuilder().awsRegion(region).build();
    }

    /**
     * Returns a new config with the specified S3 jar folder.
     */
    public LaunchConfig withJarFolder(String folder) {
        return toBuilder().s3JarFolder(folder).build();
    }

    /**
     * Builder for LaunchConfig.
     */
    public static class Builder {
        private String clusterName = DEFAULT_CLUSTER_NAME;
        private String awsRegion;
        private String emrRelease = DEFAULT_EMR_RELEASE;
        private String emrServiceRole = DEFAULT_SERVICE_ROLE;
        private List<String> emrApplications = List.of("Spark");
        private List<EmrConfig> emrConfigs = List.of();
        private String subnetId;
        private List<String> securityGroupIds = List.of();
        private int instanceCount = 1;
        private String instanceType = DEFAULT_INSTANCE_TYPE;
        private Double instanceBidPrice;
        private String instanceRole = DEFAULT_INSTANCE_ROLE;
        private String instanceKeyName;
        private String s3JarFolder;
        private String s3LogUri;
        private boolean s3ServerSideEncryption;
        private Duration timeout = DEFAULT_TIMEOUT;
        private Map<String, String> submitConfs = Map.of();

        public Builder clusterName(String clusterName) {
            this.clusterName = clusterName;
            return this;
        }

        public Builder awsRegion(String awsRegion) {
            this.awsRegion = awsRegion;
            return this;
        }

        public Builder emrRelease(String emrRelease) {
            this.emrRelease = emrRelease;
            return this;
        }

        public Builder emrServiceRole(String emrServiceRole) {
            this.emrServiceRole = emrServiceRole;
            return this;
        }

        public Builder emrApplications(List<String> emrApplications) {
            this.emrApplications = emrApplications;
            return this;
        }

        public Builder emrConfigs(List<EmrConfig> emrConfigs) {
            this.emrConfigs = emrConfigs;
            return this;
        }

        public Builder subnetId(String subnetId) {
            this.subnetId = subnetId;
            return this;
        }

        public Builder securityGroupIds(List<String> securityGroupIds) {
            this.securityGroupIds = securityGroupIds;
            return this;
        }

        public Builder instanceCount(int instanceCount) {
            this.instanceCount = instanceCount;
            return this;
        }

        public Builder instanceType(String instanceType) {
            this.instanceType = instanceType;
            return this;
        }

        public Builder instanceBidPrice(Double instanceBidPrice) {
            this.instanceBidPrice = instanceBidPrice;
            return this;
        }

        public Builder instanceRole(String instanceRole) {
            this.instanceRole = instanceRole;
            return this;
        }

        public Builder instanceKeyName(String instanceKeyName) {
            this.instanceKeyName = instanceKeyName;
            return this;
        }

        public Builder s3JarFolder(String s3JarFolder) {
            this.s3JarFolder = s3JarFolder;
            return this;
        }

        public Builder s3LogUri(String s3LogUri) {
            this.s3LogUri = s3LogUri;
            return this;
        }

        public Builder s3ServerSideEncryption(boolean s3ServerSideEncryption) {
            this.s3ServerSideEncryption = s3ServerSideEncryption;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder submitConfs(Map<String, String> submitConfs) {
            this.submitConfs = submitConfs;
            return this;
        }

        public LaunchConfig build() {
            return new LaunchConfig(
                    clusterName, awsRegion, emrRelease, emrServiceRole, emrApplications,
                    emrConfigs, subnetId, securityGroupIds, instanceCount, instanceType,
                    instanceBidPrice, instanceRole, instanceKeyName, s3JarFolder, s3LogUri,
                    s3ServerSideEncryption, timeout, submitConfs
            );
        }
    }
}
