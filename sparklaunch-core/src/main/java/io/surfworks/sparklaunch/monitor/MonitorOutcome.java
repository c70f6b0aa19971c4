package io.surfworks.sparklaunch.monitor;

/**
 * How a monitor invocation ended.
 */
public enum MonitorOutcome {
    /** Cluster terminated on its own and every step completed */
    SUCCESS,

    /** Deadline passed while the cluster was still active; the cluster was terminated */
    TIMEOUT,

    /** Cluster terminated on its own but at least one step did not complete */
    ABNORMAL_TERMINATION,

    /** The caller cancelled the monitor; the cluster was left alone */
    CANCELLED;

    /**
     * Returns true if this outcome should stop the calling process with an error.
     */
    public boolean isFatal() {
        return this == TIMEOUT || this == ABNORMAL_TERMINATION;
    }
}
