package io.surfworks.sparklaunch.monitor;

import io.surfworks.sparklaunch.provider.StepHandle;

import java.util.List;
import java.util.Objects;

/**
 * Result of monitoring a cluster.
 *
 * @param clusterId     cluster that was watched
 * @param outcome       how monitoring ended
 * @param clusterStatus last status reported for the cluster (null if cancelled before the first poll)
 * @param failedSteps   steps that did not complete (only for ABNORMAL_TERMINATION)
 * @param polls         number of status checks performed
 */
public record MonitorResult(
        String clusterId,
        MonitorOutcome outcome,
        String clusterStatus,
        List<StepHandle> failedSteps,
        int polls
) {

    public MonitorResult {
        Objects.requireNonNull(clusterId, "clusterId cannot be null");
        Objects.requireNonNull(outcome, "outcome cannot be null");

        failedSteps = failedSteps == null ? List.of() : List.copyOf(failedSteps);
    }

    /**
     * Returns true if every step completed.
     */
    public boolean isSuccess() {
        return outcome == MonitorOutcome.SUCCESS;
    }

    /**
     * Returns a human-readable summary of the outcome.
     */
    public String message() {
        return switch (outcome) {
            case SUCCESS -> "Cluster terminated without error.";
            case TIMEOUT -> "Timeout. Cluster terminated.";
            case ABNORMAL_TERMINATION -> "Cluster terminated with abnormal step.";
            case CANCELLED -> "Monitoring cancelled, cluster left in state " + clusterStatus + ".";
        };
    }

    /**
     * Returns this result, or throws if the outcome is fatal.
     *
     * @throws MonitorException on TIMEOUT or ABNORMAL_TERMINATION
     */
    public MonitorResult orThrow() throws MonitorException {
        if (outcome.isFatal()) {
            throw new MonitorException(this);
        }
        return this;
    }
}
