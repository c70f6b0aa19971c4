package io.surfworks.sparklaunch.job;

import io.surfworks.sparklaunch.request.StepSpec;

import java.util.Objects;

/**
 * Outcome of a job submission.
 *
 * @param clusterId      id of the cluster that now owns the step
 * @param createdCluster true if an ephemeral cluster was created for the job
 * @param step           the submitted step
 */
public record SubmitResult(String clusterId, boolean createdCluster, StepSpec step) {

    public SubmitResult {
        Objects.requireNonNull(clusterId, "clusterId cannot be null");
        Objects.requireNonNull(step, "step cannot be null");
    }
}
