package io.surfworks.sparklaunch.provider;

import java.util.Set;

/**
 * Status vocabulary shared by every provider.
 */
public final class ClusterStates {

    /** Cluster statuses that count as "still running or starting" */
    public static final Set<String> ACTIVATED = Set.of("RUNNING", "STARTING", "WAITING", "BOOTSTRAPPING");

    /** The only step status that counts as success */
    public static final String STEP_COMPLETED = "COMPLETED";

    private ClusterStates() {
    }

    /**
     * Returns true if the cluster status is in the activated set.
     */
    public static boolean isActivated(String state) {
        return state != null && ACTIVATED.contains(state);
    }
}
