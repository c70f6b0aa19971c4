package io.surfworks.sparklaunch.provider;

import java.util.Objects;

/**
 * A step as last reported by the provider.
 *
 * @param id     provider-assigned step id (may be null for providers without step ids)
 * @param name   step name
 * @param status step status string, e.g. "COMPLETED" or "FAILED"
 */
public record StepHandle(String id, String name, String status) {

    public StepHandle {
        Objects.requireNonNull(status, "status cannot be null");
    }

    /**
     * Returns true if the step completed successfully.
     */
    public boolean isCompleted() {
        return ClusterStates.STEP_COMPLETED.equals(status);
    }
}
