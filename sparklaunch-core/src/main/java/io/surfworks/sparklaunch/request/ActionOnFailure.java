package io.surfworks.sparklaunch.request;

/**
 * What the cluster does when a step fails.
 */
public enum ActionOnFailure {
    /** Keep the cluster and the remaining steps running */
    CONTINUE,

    /** Cancel pending steps and wait */
    CANCEL_AND_WAIT,

    /** Shut the cluster down */
    TERMINATE_CLUSTER
}
