package io.surfworks.sparklaunch.request;

/**
 * Role of an instance group within a cluster.
 */
public enum InstanceRole {
    /** The single coordinator node */
    MASTER,

    /** Worker nodes running HDFS and executors */
    CORE
}
