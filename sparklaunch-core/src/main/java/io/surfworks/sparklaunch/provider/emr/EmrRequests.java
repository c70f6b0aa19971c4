package io.surfworks.sparklaunch.provider.emr;

import com.amazonaws.services.elasticmapreduce.model.Application;
import com.amazonaws.services.elasticmapreduce.model.Configuration;
import com.amazonaws.services.elasticmapreduce.model.HadoopJarStepConfig;
import com.amazonaws.services.elasticmapreduce.model.InstanceGroupConfig;
import com.amazonaws.services.elasticmapreduce.model.InstanceRoleType;
import com.amazonaws.services.elasticmapreduce.model.JobFlowInstancesConfig;
import com.amazonaws.services.elasticmapreduce.model.MarketType;
import com.amazonaws.services.elasticmapreduce.model.RunJobFlowRequest;
import com.amazonaws.services.elasticmapreduce.model.StepConfig;
import io.surfworks.sparklaunch.request.ClusterCreationSpec;
import io.surfworks.sparklaunch.request.EmrConfig;
import io.surfworks.sparklaunch.request.InstanceGroupSpec;
import io.surfworks.sparklaunch.request.InstancesConfig;
import io.surfworks.sparklaunch.request.StepSpec;

import java.util.HashMap;
import java.util.List;

/**
 * Maps the neutral request types onto AWS SDK request objects.
 *
 * <p>Optional fields are only set when present, so the SDK never serializes an
 * empty subnet, key name, security group list, log URI or configuration list.
 */
final class EmrRequests {

    private EmrRequests() {
    }

    static RunJobFlowRequest runJobFlow(ClusterCreationSpec spec) {
        RunJobFlowRequest request = new RunJobFlowRequest()
                .withName(spec.name())
                .withReleaseLabel(spec.releaseLabel())
                .withApplications(spec.applications().stream()
                        .map(app -> new Application().withName(app))
                        .toList())
                .withServiceRole(spec.serviceRole())
                .withJobFlowRole(spec.instanceRole())
                .withInstances(instances(spec.instances()));

        if (spec.logUri() != null) {
            request.setLogUri(spec.logUri());
        }
        if (!spec.configurations().isEmpty()) {
            request.setConfigurations(configurations(spec.configurations()));
        }
        if (!spec.steps().isEmpty()) {
            request.setSteps(steps(spec.steps()));
        }
        return request;
    }

    static JobFlowInstancesConfig instances(InstancesConfig config) {
        JobFlowInstancesConfig instances = new JobFlowInstancesConfig();

        if (config.subnetId() != null) {
            instances.setEc2SubnetId(config.subnetId());
        }
        if (config.keyName() != null) {
            instances.setEc2KeyName(config.keyName());
        }
        if (!config.additionalSecurityGroupIds().isEmpty()) {
            instances.setAdditionalMasterSecurityGroups(config.additionalSecurityGroupIds());
            instances.setAdditionalSlaveSecurityGroups(config.additionalSecurityGroupIds());
        }

        return instances
                .withInstanceGroups(config.instanceGroups().stream()
                        .map(EmrRequests::instanceGroup)
                        .toList())
                .withKeepJobFlowAliveWhenNoSteps(config.keepJobFlowAliveWhenNoSteps());
    }

    static InstanceGroupConfig instanceGroup(InstanceGroupSpec group) {
        InstanceGroupConfig config = new InstanceGroupConfig()
                .withInstanceRole(InstanceRoleType.valueOf(group.role().name()))
                .withInstanceType(group.instanceType())
                .withInstanceCount(group.instanceCount())
                .withMarket(MarketType.valueOf(group.market().name()));

        if (group.isSpot()) {
            config.setBidPrice(group.bidPrice());
        }
        return config;
    }

    static List<Configuration> configurations(List<EmrConfig> configs) {
        return configs.stream().map(EmrRequests::configuration).toList();
    }

    static Configuration configuration(EmrConfig config) {
        Configuration configuration = new Configuration().withClassification(config.classification());
        if (!config.properties().isEmpty()) {
            configuration.setProperties(new HashMap<>(config.properties()));
        }
        if (!config.configurations().isEmpty()) {
            configuration.setConfigurations(configurations(config.configurations()));
        }
        return configuration;
    }

    static List<StepConfig> steps(List<StepSpec> steps) {
        return steps.stream().map(EmrRequests::step).toList();
    }

    static StepConfig step(StepSpec step) {
        return new StepConfig()
                .withName(step.name())
                .withActionOnFailure(step.actionOnFailure().name())
                .withHadoopJarStep(new HadoopJarStepConfig()
                        .withJar(step.jar())
                        .withArgs(step.args()));
    }
}
